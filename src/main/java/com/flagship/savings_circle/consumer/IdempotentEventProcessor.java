package com.flagship.savings_circle.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs an event handler at most once per (event id, consumer group).
 *
 * The dedup row is written in the same transaction as the handler's own
 * work. When the handler throws, both roll back and the event is handled
 * again on redelivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} ({}) by consumer group {}: {}",
                    eventId, eventType, consumerGroup, e.getMessage(), e);
            throw e;
        }

        record(ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Marks an event this consumer does not handle so it is not looked at again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        record(ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup, reason));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void record(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }
}
