package com.flagship.savings_circle.pool;

import com.flagship.savings_circle.engine.exception.StateException;
import com.flagship.savings_circle.engine.exception.ValidationException;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Pool domain object.
 *
 * Immutable: every transition returns a new instance. The version is the
 * optimistic concurrency counter of the persisted row and is carried
 * through unchanged; the persistence layer bumps it.
 */
@Value
public class Pool {

    public static final int MIN_CONTRIBUTION = 1;
    public static final int MAX_CONTRIBUTION = 20;
    public static final int DEFAULT_MAX_MEMBERS = 10;
    public static final int MIN_MEMBERS = 2;
    public static final int MAX_MEMBERS = 50;

    UUID id;
    String name;
    int contributionAmount;
    PayoutFrequency frequency;
    int totalRounds;
    int currentRound;
    int maxMembers;
    LocalDate startDate;
    PoolStatus status;
    long version;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE pool positioned at round 1.
     *
     * @throws ValidationException if the amount, capacity or round count is out of range
     */
    public static Pool create(UUID id, String name, int contributionAmount, PayoutFrequency frequency,
                              int totalRounds, int maxMembers, LocalDate startDate) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Pool name is required");
        }
        if (contributionAmount < MIN_CONTRIBUTION || contributionAmount > MAX_CONTRIBUTION) {
            throw new ValidationException(String.format(
                "Contribution amount must be between %d and %d, got %d",
                MIN_CONTRIBUTION, MAX_CONTRIBUTION, contributionAmount));
        }
        if (frequency == null) {
            throw new ValidationException("Payout frequency is required");
        }
        if (maxMembers < MIN_MEMBERS || maxMembers > MAX_MEMBERS) {
            throw new ValidationException(String.format(
                "Maximum members must be between %d and %d, got %d", MIN_MEMBERS, MAX_MEMBERS, maxMembers));
        }
        if (totalRounds < 1) {
            throw new ValidationException("Total rounds must be positive, got " + totalRounds);
        }
        Instant now = Instant.now();
        return new Pool(
            id,
            name.trim(),
            contributionAmount,
            frequency,
            totalRounds,
            1,
            maxMembers,
            startDate,
            PoolStatus.ACTIVE,
            0L,
            now,
            now
        );
    }

    public boolean isActive() {
        return status == PoolStatus.ACTIVE;
    }

    /**
     * True once every round has been paid out.
     */
    public boolean isFinished() {
        return currentRound > totalRounds;
    }

    /**
     * Moves to the next round. The pool completes when the new round
     * would be past the last one.
     *
     * @throws StateException if the pool is not active
     */
    public Pool advanceRound() {
        requireActive();
        int next = currentRound + 1;
        PoolStatus nextStatus = next > totalRounds ? PoolStatus.COMPLETED : PoolStatus.ACTIVE;
        return new Pool(id, name, contributionAmount, frequency, totalRounds, next, maxMembers,
            startDate, nextStatus, version, createdAt, Instant.now());
    }

    /**
     * @throws StateException if the pool is already completed or cancelled
     */
    public Pool cancel() {
        if (status != PoolStatus.ACTIVE) {
            throw new StateException(String.format(
                "Cannot cancel pool in %s status. Only ACTIVE pools can be cancelled.", status));
        }
        return new Pool(id, name, contributionAmount, frequency, totalRounds, currentRound, maxMembers,
            startDate, PoolStatus.CANCELLED, version, createdAt, Instant.now());
    }

    /**
     * @throws StateException if the pool is not active
     */
    public void requireActive() {
        if (status != PoolStatus.ACTIVE) {
            throw new StateException("Pool is not active (status " + status + ")");
        }
    }
}
