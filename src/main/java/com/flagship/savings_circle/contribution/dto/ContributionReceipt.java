package com.flagship.savings_circle.contribution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A contribution change together with where the round now stands.
 */
@Value
public class ContributionReceipt {

    @JsonProperty("round")
    int round;

    @JsonProperty("contribution")
    ContributionLine contribution;

    @JsonProperty("all_contributions_received")
    boolean allContributionsReceived;
}
