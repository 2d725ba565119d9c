package com.flagship.savings_circle.contribution;

public enum ContributionStatus {
    PENDING,
    CONFIRMED,
    FAILED
}
