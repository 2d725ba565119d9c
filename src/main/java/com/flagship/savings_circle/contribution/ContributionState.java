package com.flagship.savings_circle.contribution;

import java.time.Instant;

/**
 * State of a single (member, round) contribution attestation.
 *
 * A closed set of variants: only the fields that make sense for a state
 * exist on it, so a pending contribution has no confirmation time and a
 * confirmed one has no failure reason.
 */
public sealed interface ContributionState
        permits ContributionState.Pending, ContributionState.Confirmed, ContributionState.Failed {

    ContributionStatus status();

    record Pending() implements ContributionState {
        @Override
        public ContributionStatus status() {
            return ContributionStatus.PENDING;
        }
    }

    /**
     * Self-reported payment. The method is a free-form tag ("venmo", "cash")
     * and is metadata only.
     */
    record Confirmed(Instant confirmedAt, String method) implements ContributionState {
        @Override
        public ContributionStatus status() {
            return ContributionStatus.CONFIRMED;
        }
    }

    record Failed(String reason) implements ContributionState {
        @Override
        public ContributionStatus status() {
            return ContributionStatus.FAILED;
        }
    }
}
