package com.flagship.savings_circle.engine;

import com.flagship.savings_circle.contribution.Contribution;
import com.flagship.savings_circle.contribution.ContributionLedger;
import com.flagship.savings_circle.payout.EarlyPayoutEvaluator;
import com.flagship.savings_circle.payout.PayoutEngine;
import com.flagship.savings_circle.payout.PayoutTransaction;
import com.flagship.savings_circle.pool.Pool;
import com.flagship.savings_circle.roster.Roster;
import com.flagship.savings_circle.round.RoundTracker;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One pool with everything the rotation rules need: roster, contribution
 * ledger and issued payouts, wired into the domain components.
 *
 * An aggregate is loaded for a single unit of work and discarded after it.
 */
public final class PoolAggregate {

    private final Pool pool;
    private final Roster roster;
    private final List<PayoutTransaction> payouts;
    private final RoundTracker tracker;
    private final ContributionLedger ledger;
    private final PayoutEngine payoutEngine;
    private final EarlyPayoutEvaluator earlyPayoutEvaluator;

    public PoolAggregate(Pool pool, Roster roster, List<Contribution> contributions, List<PayoutTransaction> payouts) {
        this.pool = pool;
        this.roster = roster;
        this.payouts = List.copyOf(payouts);

        Set<Integer> closedRounds = payouts.stream()
            .map(PayoutTransaction::getRound)
            .collect(Collectors.toSet());

        this.tracker = new RoundTracker(pool, roster);
        this.ledger = new ContributionLedger(tracker, contributions, closedRounds);
        this.payoutEngine = new PayoutEngine(tracker, ledger, payouts);
        this.earlyPayoutEvaluator = new EarlyPayoutEvaluator(payoutEngine, ledger);
    }

    /**
     * Rebuilds the aggregate around a changed roster, keeping the pool, its
     * contributions and its payouts. Unsaved ledger changes are carried over
     * as plain records and are not reported as changes again.
     */
    public PoolAggregate withRoster(Roster changed) {
        return new PoolAggregate(pool, changed, ledger.all(), payouts);
    }

    public Pool pool() {
        return pool;
    }

    public Roster roster() {
        return roster;
    }

    /**
     * Payouts issued before this aggregate was loaded, ordered by round.
     */
    public List<PayoutTransaction> payouts() {
        return payouts;
    }

    public RoundTracker tracker() {
        return tracker;
    }

    public ContributionLedger ledger() {
        return ledger;
    }

    public PayoutEngine payoutEngine() {
        return payoutEngine;
    }

    public EarlyPayoutEvaluator earlyPayoutEvaluator() {
        return earlyPayoutEvaluator;
    }
}
