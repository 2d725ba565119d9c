package com.flagship.savings_circle.contribution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.contribution.Contribution;
import com.flagship.savings_circle.contribution.ContributionStatus;
import com.flagship.savings_circle.roster.Member;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One member's line in the contribution status of a round.
 *
 * The recipient has no contribution to make: hasContributed and status
 * are null on its line.
 */
@Value
public class ContributionLine {

    @JsonProperty("member_id")
    UUID memberId;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("position")
    int position;

    @JsonProperty("is_recipient")
    boolean recipient;

    @JsonProperty("has_contributed")
    Boolean hasContributed;

    @JsonProperty("status")
    ContributionStatus status;

    @JsonProperty("method")
    String method;

    @JsonProperty("confirmed_at")
    Instant confirmedAt;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("amount")
    int amount;

    public static ContributionLine forRecipient(Member member) {
        return new ContributionLine(member.getId(), member.getName(), member.getEmail(), member.getPosition(),
                true, null, null, null, null, null, null, 0);
    }

    /**
     * @param contribution the member's record for the round, null when none exists yet
     */
    public static ContributionLine forContributor(Member member, Contribution contribution, int amount) {
        if (contribution == null) {
            return new ContributionLine(member.getId(), member.getName(), member.getEmail(), member.getPosition(),
                    false, false, ContributionStatus.PENDING, null, null, null, null, amount);
        }
        return new ContributionLine(
                member.getId(),
                member.getName(),
                member.getEmail(),
                member.getPosition(),
                false,
                contribution.isConfirmed(),
                contribution.getStatus(),
                contribution.getMethod(),
                contribution.getConfirmedAt(),
                contribution.getTransactionId(),
                contribution.getFailureReason(),
                amount
        );
    }
}
