package com.flagship.savings_circle.payout;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for an issued payout.
 *
 * Every column is insert-only. The unique constraint on (pool_id, round)
 * is the database-level guarantee that a round is never paid twice, even
 * if two writers get past the application checks.
 */
@Entity
@Table(
    name = "payout_transactions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_payout_transactions_pool_round", columnNames = {"pool_id", "round"})
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayoutTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "pool_id", nullable = false, updatable = false)
    private UUID poolId;

    @Column(nullable = false, updatable = false)
    private int round;

    @Column(name = "recipient_member_id", nullable = false, updatable = false)
    private UUID recipientMemberId;

    @Column(name = "recipient_name", nullable = false, updatable = false, length = 200)
    private String recipientName;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "scheduled_date", updatable = false)
    private LocalDate scheduledDate;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @Column(name = "was_early_payout", nullable = false, updatable = false)
    private boolean wasEarlyPayout;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String reason;

    public static PayoutTransactionEntity fromDomain(PayoutTransaction transaction) {
        return new PayoutTransactionEntity(
            transaction.getId(),
            transaction.getPoolId(),
            transaction.getRound(),
            transaction.getRecipientMemberId(),
            transaction.getRecipientName(),
            transaction.getAmount(),
            transaction.getScheduledDate(),
            transaction.getIssuedAt(),
            transaction.isWasEarlyPayout(),
            transaction.getReason()
        );
    }

    public PayoutTransaction toDomain() {
        return new PayoutTransaction(id, poolId, round, recipientMemberId, recipientName, amount,
            scheduledDate, issuedAt, wasEarlyPayout, reason);
    }
}
