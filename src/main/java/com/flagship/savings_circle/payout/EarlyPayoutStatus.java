package com.flagship.savings_circle.payout;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.roster.MemberSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Whether the current round can be paid out right now, and if not, why.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EarlyPayoutStatus {

    public static final String POOL_NOT_ACTIVE = "Pool is not active";
    public static final String POOL_NOT_STARTED = "The pool needs at least two members before payouts can begin";
    public static final String ALREADY_PAID = "Payout has already been processed for this round";
    public static final String CONTRIBUTIONS_MISSING = "Not all contributions have been received";

    @JsonProperty("allowed")
    boolean allowed;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("missing_contributions")
    List<MemberSummary> missingContributions;

    @JsonProperty("recipient")
    MemberSummary recipient;

    @JsonProperty("payout_amount")
    BigDecimal payoutAmount;

    @JsonProperty("scheduled_date")
    LocalDate scheduledDate;

    @JsonProperty("current_round")
    int currentRound;

    @JsonProperty("total_rounds")
    int totalRounds;
}
