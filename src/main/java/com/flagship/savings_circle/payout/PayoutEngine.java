package com.flagship.savings_circle.payout;

import com.flagship.savings_circle.contribution.Contribution;
import com.flagship.savings_circle.contribution.ContributionLedger;
import com.flagship.savings_circle.engine.exception.DuplicateActionException;
import com.flagship.savings_circle.engine.exception.StateException;
import com.flagship.savings_circle.pool.Pool;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.MemberStatus;
import com.flagship.savings_circle.roster.Roster;
import com.flagship.savings_circle.round.RoundState;
import com.flagship.savings_circle.round.RoundTracker;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes and issues payouts for one pool.
 *
 * Key rules:
 * - At most one transaction per round; a second attempt is a duplicate, not a no-op
 * - Only the current round of an ACTIVE pool can be paid, and only once complete
 * - The amount counts every active member, the recipient included
 *
 * Issuing a payout advances the round tracker, closes the round in the
 * ledger and opens the next round's pending contributions.
 */
public final class PayoutEngine {

    private final ContributionLedger ledger;
    private final Map<Integer, PayoutTransaction> issued = new HashMap<>();
    private RoundTracker tracker;

    public PayoutEngine(RoundTracker tracker, ContributionLedger ledger, Collection<PayoutTransaction> existing) {
        this.tracker = tracker;
        this.ledger = ledger;
        existing.forEach(tx -> issued.put(tx.getRound(), tx));
    }

    public RoundTracker tracker() {
        return tracker;
    }

    /**
     * contributionAmount x memberCount.
     */
    public BigDecimal computePayoutAmount() {
        Pool pool = tracker.pool();
        return BigDecimal.valueOf(pool.getContributionAmount())
            .multiply(BigDecimal.valueOf(tracker.roster().memberCount()));
    }

    public Optional<PayoutTransaction> findTransaction(int round) {
        return Optional.ofNullable(issued.get(round));
    }

    public boolean isPaid(int round) {
        return issued.containsKey(round);
    }

    /**
     * Issues the regular payout of a round.
     *
     * @throws DuplicateActionException if the round was already paid
     * @throws StateException if the pool is not active, the round is not current, or contributions are missing
     */
    public PayoutResult issuePayout(int round) {
        return issue(round, false, null);
    }

    /**
     * Issues a payout flagged as early, with an optional audit reason.
     * Eligibility rules are the same as for a regular payout.
     */
    public PayoutResult issueEarlyPayout(int round, String reason) {
        String auditReason = reason == null || reason.isBlank() ? null : reason.trim();
        return issue(round, true, auditReason);
    }

    private PayoutResult issue(int round, boolean early, String reason) {
        if (issued.containsKey(round)) {
            throw new DuplicateActionException("Payout has already been processed for round " + round);
        }
        Pool pool = tracker.pool();
        pool.requireActive();
        if (tracker.state() == RoundState.NOT_STARTED) {
            throw new StateException(String.format(
                "Pool has not started: at least %d members are required", RoundTracker.MIN_MEMBERS_TO_START));
        }
        if (round != tracker.currentRound()) {
            throw new StateException(String.format(
                "Round %d is not the current round (current round is %d)", round, tracker.currentRound()));
        }
        if (!ledger.isComplete(round)) {
            throw new StateException("Not all contributions have been received");
        }

        Member recipient = tracker.recipient(round);
        PayoutTransaction transaction = PayoutTransaction.issue(
            pool.getId(),
            round,
            recipient.getId(),
            recipient.getName(),
            computePayoutAmount(),
            tracker.scheduledDate(round),
            early,
            reason
        );

        Pool advanced = tracker.advance();
        Roster roster = tracker.roster().withStatus(recipient.getId(), MemberStatus.COMPLETED);
        RoundTracker next = new RoundTracker(advanced, roster);
        if (next.isInProgress()) {
            roster = roster.markCurrent(next.recipient(advanced.getCurrentRound()).getId());
            next = new RoundTracker(advanced, roster);
        }

        issued.put(round, transaction);
        ledger.closeRound(round, next);
        this.tracker = next;

        List<Contribution> opened = next.isInProgress()
            ? ledger.openRound(advanced.getCurrentRound())
            : List.of();

        return new PayoutResult(
            transaction,
            recipient,
            advanced,
            roster,
            advanced.getCurrentRound(),
            advanced.isFinished(),
            opened
        );
    }
}
