package com.flagship.savings_circle.contribution;

import com.flagship.savings_circle.engine.exception.DuplicateActionException;
import com.flagship.savings_circle.engine.exception.StateException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Contribution attestation of one member for one round.
 *
 * Transitions:
 * <pre>
 *   PENDING   -> CONFIRMED (confirm)   -> PENDING (undo)
 *   PENDING   -> FAILED    (reject)
 *   CONFIRMED -> FAILED    (reject)
 *   FAILED    -> CONFIRMED (confirm)
 * </pre>
 */
@Value
public class Contribution {
    UUID id;
    UUID poolId;
    UUID memberId;
    int round;
    ContributionState state;
    String transactionId;
    Instant updatedAt;

    public static Contribution pending(UUID poolId, UUID memberId, int round) {
        return new Contribution(
            UUID.randomUUID(),
            poolId,
            memberId,
            round,
            new ContributionState.Pending(),
            null,
            Instant.now()
        );
    }

    public ContributionStatus getStatus() {
        return state.status();
    }

    public boolean isConfirmed() {
        return state.status() == ContributionStatus.CONFIRMED;
    }

    /**
     * @throws DuplicateActionException if already confirmed
     */
    public Contribution confirm(String method, String externalTransactionId, Instant at) {
        if (isConfirmed()) {
            throw new DuplicateActionException("You have already contributed for this round");
        }
        return new Contribution(id, poolId, memberId, round,
            new ContributionState.Confirmed(at, method), externalTransactionId, at);
    }

    /**
     * @throws StateException if the contribution is not confirmed
     */
    public Contribution undo() {
        if (!isConfirmed()) {
            throw new StateException(String.format(
                "Cannot undo contribution in %s status. Only CONFIRMED contributions can be undone.",
                state.status()));
        }
        return new Contribution(id, poolId, memberId, round,
            new ContributionState.Pending(), null, Instant.now());
    }

    /**
     * @throws StateException if the contribution is already failed
     */
    public Contribution reject(String reason) {
        if (state.status() == ContributionStatus.FAILED) {
            throw new StateException("Contribution is already marked as failed");
        }
        return new Contribution(id, poolId, memberId, round,
            new ContributionState.Failed(reason), transactionId, Instant.now());
    }

    /**
     * Confirmation time, or null when the contribution is not confirmed.
     */
    public Instant getConfirmedAt() {
        return state instanceof ContributionState.Confirmed confirmed ? confirmed.confirmedAt() : null;
    }

    public String getMethod() {
        return state instanceof ContributionState.Confirmed confirmed ? confirmed.method() : null;
    }

    public String getFailureReason() {
        return state instanceof ContributionState.Failed failed ? failed.reason() : null;
    }
}
