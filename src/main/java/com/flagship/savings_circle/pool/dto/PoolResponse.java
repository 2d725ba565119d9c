package com.flagship.savings_circle.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.engine.PoolAggregate;
import com.flagship.savings_circle.pool.PayoutFrequency;
import com.flagship.savings_circle.pool.Pool;
import com.flagship.savings_circle.pool.PoolStatus;
import com.flagship.savings_circle.round.RoundState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A pool with its active roster in payout order.
 */
@Value
@Builder
public class PoolResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("contribution_amount")
    int contributionAmount;

    @JsonProperty("frequency")
    PayoutFrequency frequency;

    @JsonProperty("total_rounds")
    int totalRounds;

    @JsonProperty("current_round")
    int currentRound;

    @JsonProperty("round_state")
    RoundState roundState;

    @JsonProperty("max_members")
    int maxMembers;

    @JsonProperty("member_count")
    int memberCount;

    @JsonProperty("payout_amount")
    BigDecimal payoutAmount;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("status")
    PoolStatus status;

    @JsonProperty("members")
    List<MemberView> members;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PoolResponse from(PoolAggregate aggregate) {
        Pool pool = aggregate.pool();
        return PoolResponse.builder()
            .id(pool.getId())
            .name(pool.getName())
            .contributionAmount(pool.getContributionAmount())
            .frequency(pool.getFrequency())
            .totalRounds(pool.getTotalRounds())
            .currentRound(pool.getCurrentRound())
            .roundState(aggregate.tracker().state())
            .maxMembers(pool.getMaxMembers())
            .memberCount(aggregate.roster().memberCount())
            .payoutAmount(aggregate.payoutEngine().computePayoutAmount())
            .startDate(pool.getStartDate())
            .status(pool.getStatus())
            .members(aggregate.roster().activeMembers().stream().map(MemberView::from).toList())
            .createdAt(pool.getCreatedAt())
            .updatedAt(pool.getUpdatedAt())
            .build();
    }
}
