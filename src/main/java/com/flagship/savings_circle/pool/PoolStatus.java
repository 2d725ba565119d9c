package com.flagship.savings_circle.pool;

/**
 * Lifecycle of a savings pool.
 *
 * ACTIVE accepts contributions and payouts. COMPLETED is reached when the
 * last round is paid out. CANCELLED is set by an admin. Both non-active
 * states are terminal.
 */
public enum PoolStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED
}
