package com.flagship.savings_circle.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.payout.PayoutResult;
import lombok.Value;

@Value
public class PayoutReceipt {

    @JsonProperty("transaction")
    PayoutTransactionView transaction;

    @JsonProperty("next_round")
    int nextRound;

    @JsonProperty("is_complete")
    boolean complete;

    public static PayoutReceipt from(PayoutResult result) {
        return new PayoutReceipt(PayoutTransactionView.from(result.getTransaction()),
                result.getNextRound(), result.isComplete());
    }
}
