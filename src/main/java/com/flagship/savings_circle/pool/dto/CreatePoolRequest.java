package com.flagship.savings_circle.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.pool.PayoutFrequency;
import com.flagship.savings_circle.pool.Pool;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Request to create a pool. The creator becomes its admin at position 1.
 *
 * total_rounds defaults to max_members, start_date to today.
 */
@Value
public class CreatePoolRequest {

    @NotBlank(message = "Pool name is required")
    @Size(max = 200, message = "Pool name must be at most 200 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Contribution amount is required")
    @Min(value = Pool.MIN_CONTRIBUTION, message = "Contribution amount must be at least 1")
    @Max(value = Pool.MAX_CONTRIBUTION, message = "Contribution amount must be at most 20")
    @JsonProperty("contribution_amount")
    Integer contributionAmount;

    @NotNull(message = "Frequency is required")
    @JsonProperty("frequency")
    PayoutFrequency frequency;

    @Min(value = 1, message = "Total rounds must be positive")
    @JsonProperty("total_rounds")
    Integer totalRounds;

    @Min(value = Pool.MIN_MEMBERS, message = "A pool needs room for at least 2 members")
    @Max(value = Pool.MAX_MEMBERS, message = "A pool can have at most 50 members")
    @JsonProperty("max_members")
    Integer maxMembers;

    @JsonProperty("start_date")
    LocalDate startDate;

    @NotBlank(message = "Admin name is required")
    @JsonProperty("admin_name")
    String adminName;

    @NotBlank(message = "Admin email is required")
    @Email(message = "Admin email must be a valid email address")
    @JsonProperty("admin_email")
    String adminEmail;

    @JsonProperty("admin_user_id")
    UUID adminUserId;
}
