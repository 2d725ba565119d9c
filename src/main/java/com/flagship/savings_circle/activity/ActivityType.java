package com.flagship.savings_circle.activity;

/**
 * Activity entries the engine posts to the pool's discussion feed.
 */
public enum ActivityType {
    PAYMENT_RECEIVED,
    PAYOUT_SENT,
    MEMBER_JOINED,
    ROUND_STARTED
}
