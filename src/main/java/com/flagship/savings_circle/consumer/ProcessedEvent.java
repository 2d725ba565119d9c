package com.flagship.savings_circle.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    public static ProcessedEvent success(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId,
                consumerGroup, Instant.now(), ProcessingResult.SUCCESS, null);
    }

    /**
     * An event the consumer does not handle, for example an unknown type.
     */
    public static ProcessedEvent skipped(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId,
                consumerGroup, Instant.now(), ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent failed(UUID eventId, String eventType,
                                        String aggregateType, UUID aggregateId,
                                        String consumerGroup, String errorMessage) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId,
                consumerGroup, Instant.now(), ProcessingResult.FAILED, errorMessage);
    }
}
