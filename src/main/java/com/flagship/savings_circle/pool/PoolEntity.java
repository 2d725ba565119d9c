package com.flagship.savings_circle.pool;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for a pool.
 *
 * The version column is the optimistic concurrency counter of the whole
 * pool aggregate: every write to the pool, its contributions or its payouts
 * bumps it, so two overlapping writers cannot both commit.
 */
@Entity
@Table(
    name = "pools",
    indexes = {
        @Index(name = "idx_pools_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PoolEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "contribution_amount", nullable = false, updatable = false)
    private int contributionAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private PayoutFrequency frequency;

    @Column(name = "total_rounds", nullable = false, updatable = false)
    private int totalRounds;

    @Column(name = "current_round", nullable = false)
    private int currentRound;

    @Column(name = "max_members", nullable = false, updatable = false)
    private int maxMembers;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PoolStatus status;

    // Null until first persisted, which is how Spring Data tells a new pool apart.
    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public static PoolEntity fromDomain(Pool pool) {
        return new PoolEntity(
            pool.getId(),
            pool.getName(),
            pool.getContributionAmount(),
            pool.getFrequency(),
            pool.getTotalRounds(),
            pool.getCurrentRound(),
            pool.getMaxMembers(),
            pool.getStartDate(),
            pool.getStatus(),
            null, // managed by @Version
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Pool toDomain() {
        return new Pool(
            id,
            name,
            contributionAmount,
            frequency,
            totalRounds,
            currentRound,
            maxMembers,
            startDate,
            status,
            version == null ? 0L : version,
            createdAt,
            updatedAt
        );
    }

    /**
     * Only round progression and status change after creation.
     */
    public void updateFromDomain(Pool pool) {
        if (!this.id.equals(pool.getId())) {
            throw new IllegalArgumentException(
                "Cannot update pool " + this.id + " from domain object of pool " + pool.getId());
        }
        this.currentRound = pool.getCurrentRound();
        this.status = pool.getStatus();
    }
}
