package com.flagship.savings_circle.roster;

/**
 * Rotation status of a member.
 *
 * CURRENT is the recipient of the round in progress, COMPLETED members
 * have been paid, UPCOMING are still waiting. REMOVED members have left
 * the roster and hold no position.
 */
public enum MemberStatus {
    CURRENT,
    UPCOMING,
    COMPLETED,
    REMOVED
}
