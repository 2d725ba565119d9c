package com.flagship.savings_circle.notification;

import java.time.Instant;
import java.util.UUID;

/**
 * Event handed to the notification service.
 *
 * Every notification carries a unique event id so the consumer side can
 * drop redeliveries.
 */
public interface PoolNotification {

    String AGGREGATE_TYPE = "PoolNotification";

    UUID getEventId();

    UUID getPoolId();

    String getEventType();

    Instant getOccurredAt();
}
