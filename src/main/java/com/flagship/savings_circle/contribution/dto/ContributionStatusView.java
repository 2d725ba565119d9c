package com.flagship.savings_circle.contribution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.contribution.ContributionLedger;
import com.flagship.savings_circle.contribution.ContributionStatus;
import com.flagship.savings_circle.pool.PoolStatus;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.MemberSummary;
import com.flagship.savings_circle.round.RoundState;
import com.flagship.savings_circle.round.RoundTracker;
import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Contribution status of a pool's current round.
 *
 * Before the pool starts (fewer than two members) there is no recipient
 * and every line is a pending contribution.
 */
@Value
public class ContributionStatusView {

    @JsonProperty("pool_id")
    UUID poolId;

    @JsonProperty("pool_status")
    PoolStatus poolStatus;

    @JsonProperty("round_state")
    RoundState roundState;

    @JsonProperty("current_round")
    int currentRound;

    @JsonProperty("total_rounds")
    int totalRounds;

    @JsonProperty("contribution_amount")
    int contributionAmount;

    @JsonProperty("scheduled_date")
    LocalDate scheduledDate;

    @JsonProperty("recipient")
    MemberSummary recipient;

    @JsonProperty("contributions")
    List<ContributionLine> contributions;

    @JsonProperty("confirmed_count")
    int confirmedCount;

    @JsonProperty("expected_count")
    int expectedCount;

    @JsonProperty("all_contributions_received")
    boolean allContributionsReceived;

    public static ContributionStatusView of(RoundTracker tracker, ContributionLedger ledger) {
        int round = tracker.currentRound();
        int amount = tracker.pool().getContributionAmount();
        boolean inProgress = tracker.isInProgress();
        Member recipient = inProgress ? tracker.recipient(round) : null;

        List<ContributionLine> lines = new ArrayList<>();
        for (Member member : tracker.roster().activeMembers()) {
            if (recipient != null && recipient.getId().equals(member.getId())) {
                lines.add(ContributionLine.forRecipient(member));
            } else {
                lines.add(ContributionLine.forContributor(member, ledger.find(member.getId(), round).orElse(null), amount));
            }
        }

        int confirmed = (int) lines.stream()
                .filter(line -> line.getStatus() == ContributionStatus.CONFIRMED)
                .count();
        int expected = recipient == null ? lines.size() : lines.size() - 1;

        return new ContributionStatusView(
                tracker.pool().getId(),
                tracker.pool().getStatus(),
                tracker.state(),
                round,
                tracker.totalRounds(),
                amount,
                inProgress ? tracker.scheduledDate(round) : null,
                recipient == null ? null : MemberSummary.from(recipient),
                List.copyOf(lines),
                confirmed,
                expected,
                inProgress && ledger.isComplete(round)
        );
    }
}
