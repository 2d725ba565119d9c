package com.flagship.savings_circle.payout;

import com.flagship.savings_circle.contribution.ContributionLedger;
import com.flagship.savings_circle.engine.exception.StateException;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.MemberSummary;
import com.flagship.savings_circle.round.RoundState;
import com.flagship.savings_circle.round.RoundTracker;

import java.util.List;

/**
 * Decides whether the current round may be paid out ahead of its scheduled
 * date, and triggers that payout.
 *
 * An early payout is allowed when the pool is active, the round has not
 * been paid, and every non-recipient member has confirmed. The schedule
 * of later rounds is not shifted.
 */
public final class EarlyPayoutEvaluator {

    private final PayoutEngine payoutEngine;
    private final ContributionLedger ledger;

    public EarlyPayoutEvaluator(PayoutEngine payoutEngine, ContributionLedger ledger) {
        this.payoutEngine = payoutEngine;
        this.ledger = ledger;
    }

    public EarlyPayoutStatus checkStatus() {
        RoundTracker tracker = payoutEngine.tracker();
        int round = tracker.currentRound();

        EarlyPayoutStatus.EarlyPayoutStatusBuilder status = EarlyPayoutStatus.builder()
            .currentRound(round)
            .totalRounds(tracker.totalRounds());

        if (!tracker.pool().isActive() || tracker.state() == RoundState.COMPLETED) {
            return status.allowed(false).reason(EarlyPayoutStatus.POOL_NOT_ACTIVE).build();
        }
        if (tracker.state() == RoundState.NOT_STARTED) {
            return status.allowed(false).reason(EarlyPayoutStatus.POOL_NOT_STARTED).build();
        }

        Member recipient = tracker.recipient(round);
        status.recipient(MemberSummary.from(recipient))
            .payoutAmount(payoutEngine.computePayoutAmount())
            .scheduledDate(tracker.scheduledDate(round));

        if (payoutEngine.isPaid(round)) {
            return status.allowed(false).reason(EarlyPayoutStatus.ALREADY_PAID).build();
        }

        List<Member> missing = ledger.missing(round);
        if (!missing.isEmpty()) {
            return status.allowed(false)
                .reason(EarlyPayoutStatus.CONTRIBUTIONS_MISSING)
                .missingContributions(missing.stream().map(MemberSummary::from).toList())
                .build();
        }

        return status.allowed(true).build();
    }

    /**
     * Re-checks eligibility and issues the current round's payout as an early payout.
     *
     * @param reason optional free-text reason stored on the transaction for audit
     * @throws StateException carrying the eligibility reason when not allowed
     */
    public PayoutResult initiateEarlyPayout(String reason) {
        EarlyPayoutStatus status = checkStatus();
        if (!status.isAllowed()) {
            throw new StateException(status.getReason());
        }
        return payoutEngine.issueEarlyPayout(status.getCurrentRound(), reason);
    }
}
