package com.flagship.savings_circle.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * New payout order: every active member id, first recipient first.
 */
@Value
public class ReorderMembersRequest {

    @NotEmpty(message = "member_ids must list every active member")
    @JsonProperty("member_ids")
    List<UUID> memberIds;
}
