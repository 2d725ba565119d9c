package com.flagship.savings_circle.round;

import com.flagship.savings_circle.engine.exception.StateException;
import com.flagship.savings_circle.engine.exception.ValidationException;
import com.flagship.savings_circle.pool.Pool;
import com.flagship.savings_circle.pool.PoolStatus;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.Roster;

import java.time.LocalDate;

/**
 * Round progression and recipient derivation for one pool snapshot.
 *
 * States: NOT_STARTED (fewer than two active members), IN_PROGRESS(r)
 * and COMPLETED. The tracker is a read-only view over the pool and its
 * roster; {@link #advance()} returns the next pool rather than mutating.
 */
public final class RoundTracker {

    public static final int MIN_MEMBERS_TO_START = 2;

    private final Pool pool;
    private final Roster roster;

    public RoundTracker(Pool pool, Roster roster) {
        this.pool = pool;
        this.roster = roster;
    }

    public Pool pool() {
        return pool;
    }

    public Roster roster() {
        return roster;
    }

    public int currentRound() {
        return pool.getCurrentRound();
    }

    public int totalRounds() {
        return pool.getTotalRounds();
    }

    public RoundState state() {
        if (pool.isFinished() || pool.getStatus() == PoolStatus.COMPLETED) {
            return RoundState.COMPLETED;
        }
        if (roster.memberCount() < MIN_MEMBERS_TO_START) {
            return RoundState.NOT_STARTED;
        }
        return RoundState.IN_PROGRESS;
    }

    public boolean isInProgress() {
        return state() == RoundState.IN_PROGRESS;
    }

    /**
     * Member due to receive the payout of round {@code round}: the member at
     * position ((round - 1) mod memberCount) + 1. Rounds beyond the roster
     * size wrap around to the start of the rotation.
     *
     * @throws ValidationException if the round is outside 1..totalRounds
     * @throws StateException if the roster has no active members
     */
    public Member recipient(int round) {
        if (round < 1 || round > pool.getTotalRounds()) {
            throw new ValidationException(String.format(
                "Round %d is outside 1..%d", round, pool.getTotalRounds()));
        }
        if (roster.isEmpty()) {
            throw new StateException("Pool has no active members");
        }
        int position = ((round - 1) % roster.memberCount()) + 1;
        return roster.memberAt(position);
    }

    /**
     * Recipient of the round in progress.
     *
     * @throws StateException if no round is in progress
     */
    public Member currentRecipient() {
        if (!isInProgress()) {
            throw new StateException("No round is in progress (state " + state() + ")");
        }
        return recipient(pool.getCurrentRound());
    }

    /**
     * Scheduled payout date of a round, counted from the pool's start date.
     * Early payouts do not move it.
     */
    public LocalDate scheduledDate(int round) {
        if (pool.getStartDate() == null) {
            return null;
        }
        return pool.getFrequency().advance(pool.getStartDate(), round - 1);
    }

    /**
     * Whether the given round is the last one of the pool.
     */
    public boolean isFinalRound(int round) {
        return round >= pool.getTotalRounds();
    }

    /**
     * Pool after the current round's payout has been issued.
     * Only the payout engine calls this.
     */
    public Pool advance() {
        if (!isInProgress()) {
            throw new StateException("Cannot advance round while pool is " + state());
        }
        return pool.advanceRound();
    }
}
