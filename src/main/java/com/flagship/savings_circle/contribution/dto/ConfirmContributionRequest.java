package com.flagship.savings_circle.contribution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Attestation that a member has paid for the current round.
 *
 * member_id (id or email) is only needed when the admin records a payment
 * on behalf of someone else; it defaults to the caller.
 */
@Value
public class ConfirmContributionRequest {

    @JsonProperty("member_id")
    String memberId;

    @NotBlank(message = "Payment method is required")
    @Size(max = 50, message = "Payment method must be at most 50 characters")
    @JsonProperty("method")
    String method;

    @Size(max = 100, message = "Transaction id must be at most 100 characters")
    @JsonProperty("transaction_id")
    String transactionId;
}
