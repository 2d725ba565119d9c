package com.flagship.savings_circle.notification;

import com.flagship.savings_circle.payout.PayoutResult;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a pool moves to its next round, or completes.
 *
 * nextRecipient fields are null when the pool completed.
 */
@Value
public class RoundAdvancedEvent implements PoolNotification {

    public static final String EVENT_TYPE = "RoundAdvanced";

    UUID eventId;
    UUID poolId;
    int previousRound;
    int currentRound;
    boolean poolCompleted;
    UUID nextRecipientId;
    String nextRecipientName;
    LocalDate nextScheduledDate;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RoundAdvancedEvent from(PayoutResult result, UUID nextRecipientId, String nextRecipientName,
                                          LocalDate nextScheduledDate) {
        return new RoundAdvancedEvent(
            UUID.randomUUID(),
            result.getPool().getId(),
            result.getTransaction().getRound(),
            result.getNextRound(),
            result.isComplete(),
            nextRecipientId,
            nextRecipientName,
            nextScheduledDate,
            Instant.now()
        );
    }
}
