package com.flagship.savings_circle.payout;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Immutable record of an issued payout.
 *
 * Exactly one exists per (pool, round); its existence is what closes the
 * round. The recipient's id and name are copied in so that a later roster
 * reorder or removal does not rewrite history.
 */
@Value
public class PayoutTransaction {
    UUID id;
    UUID poolId;
    int round;
    UUID recipientMemberId;
    String recipientName;
    BigDecimal amount;
    LocalDate scheduledDate;
    Instant issuedAt;
    boolean wasEarlyPayout;
    String reason;

    public static PayoutTransaction issue(UUID poolId, int round, UUID recipientMemberId, String recipientName,
                                          BigDecimal amount, LocalDate scheduledDate,
                                          boolean early, String reason) {
        return new PayoutTransaction(
            UUID.randomUUID(),
            poolId,
            round,
            recipientMemberId,
            recipientName,
            amount,
            scheduledDate,
            Instant.now(),
            early,
            reason
        );
    }
}
