package com.flagship.savings_circle.round;

public enum RoundState {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED
}
