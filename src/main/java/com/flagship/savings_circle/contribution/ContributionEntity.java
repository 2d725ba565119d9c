package com.flagship.savings_circle.contribution;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for a contribution attestation.
 *
 * The state variant is flattened into a status column plus the nullable
 * columns that only one variant uses. The unique constraint on
 * (pool_id, member_id, round) backs the one-record-per-member-per-round rule.
 */
@Entity
@Table(
    name = "contributions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_contributions_pool_member_round", columnNames = {"pool_id", "member_id", "round"})
    },
    indexes = {
        @Index(name = "idx_contributions_pool_round", columnList = "pool_id, round")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContributionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "pool_id", nullable = false, updatable = false)
    private UUID poolId;

    @Column(name = "member_id", nullable = false, updatable = false)
    private UUID memberId;

    @Column(nullable = false, updatable = false)
    private int round;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ContributionStatus status;

    @Column(length = 50)
    private String method;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "transaction_id", length = 100)
    private String transactionId;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ContributionEntity fromDomain(Contribution contribution) {
        ContributionEntity entity = new ContributionEntity();
        entity.id = contribution.getId();
        entity.poolId = contribution.getPoolId();
        entity.memberId = contribution.getMemberId();
        entity.round = contribution.getRound();
        entity.updateFromDomain(contribution);
        return entity;
    }

    public Contribution toDomain() {
        ContributionState state = switch (status) {
            case PENDING -> new ContributionState.Pending();
            case CONFIRMED -> new ContributionState.Confirmed(confirmedAt, method);
            case FAILED -> new ContributionState.Failed(failureReason);
        };
        return new Contribution(id, poolId, memberId, round, state, transactionId, updatedAt);
    }

    public void updateFromDomain(Contribution contribution) {
        this.status = contribution.getStatus();
        this.method = contribution.getMethod();
        this.confirmedAt = contribution.getConfirmedAt();
        this.failureReason = contribution.getFailureReason();
        this.transactionId = contribution.getTransactionId();
        this.updatedAt = contribution.getUpdatedAt() != null ? contribution.getUpdatedAt() : Instant.now();
    }
}
