package com.flagship.savings_circle.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox to be published to Kafka.
 *
 * Written in the same transaction as the pool change it describes, so the
 * event exists if and only if that change committed. The aggregate id is
 * always the pool id, which keeps one pool's events on one partition.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // PoolActivity or PoolNotification
    UUID aggregateId;          // pool id
    String eventType;          // e.g. PAYOUT_SENT, RoundAdvanced
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until Kafka acknowledged it
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID poolId, String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            poolId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null  // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * Whether the publisher has given up on this event.
     */
    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
