package com.flagship.savings_circle.payout;

import com.flagship.savings_circle.contribution.Contribution;
import com.flagship.savings_circle.pool.Pool;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.Roster;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a successful payout: the transaction plus the state the pool
 * moved to.
 */
@Value
public class PayoutResult {
    PayoutTransaction transaction;
    Member recipient;
    Pool pool;
    Roster roster;
    int nextRound;
    boolean complete;
    List<Contribution> openedContributions;
}
