package com.flagship.savings_circle.notification;

import com.flagship.savings_circle.payout.PayoutTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a round's payout transaction is created.
 */
@Value
public class PayoutIssuedEvent implements PoolNotification {

    public static final String EVENT_TYPE = "PayoutIssued";

    UUID eventId;
    UUID poolId;
    UUID transactionId;
    int round;
    UUID recipientMemberId;
    String recipientName;
    BigDecimal amount;
    boolean earlyPayout;
    String reason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PayoutIssuedEvent from(PayoutTransaction transaction) {
        return new PayoutIssuedEvent(
            UUID.randomUUID(),
            transaction.getPoolId(),
            transaction.getId(),
            transaction.getRound(),
            transaction.getRecipientMemberId(),
            transaction.getRecipientName(),
            transaction.getAmount(),
            transaction.isWasEarlyPayout(),
            transaction.getReason(),
            transaction.getIssuedAt()
        );
    }
}
