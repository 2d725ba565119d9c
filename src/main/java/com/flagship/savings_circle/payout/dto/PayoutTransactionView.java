package com.flagship.savings_circle.payout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.payout.PayoutTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PayoutTransactionView {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("pool_id")
    UUID poolId;

    @JsonProperty("round")
    int round;

    @JsonProperty("recipient_member_id")
    UUID recipientMemberId;

    @JsonProperty("recipient_name")
    String recipientName;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("scheduled_date")
    LocalDate scheduledDate;

    @JsonProperty("issued_at")
    Instant issuedAt;

    @JsonProperty("was_early_payout")
    boolean wasEarlyPayout;

    @JsonProperty("reason")
    String reason;

    public static PayoutTransactionView from(PayoutTransaction tx) {
        return new PayoutTransactionView(
                tx.getId(),
                tx.getPoolId(),
                tx.getRound(),
                tx.getRecipientMemberId(),
                tx.getRecipientName(),
                tx.getAmount(),
                tx.getScheduledDate(),
                tx.getIssuedAt(),
                tx.isWasEarlyPayout(),
                tx.getReason()
        );
    }
}
