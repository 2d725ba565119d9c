package com.flagship.savings_circle.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes pool events to the outbox and tracks their publication.
 *
 * {@link #saveEvent} joins the caller's transaction: if the pool change
 * rolls back (a conflict retry, a failed rule) its events roll back too.
 * Publishing to Kafka is the job of {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an already serialized event within the current transaction.
     *
     * Serialize with {@link #serializePayload(Object)} before calling: a
     * failure raised in here marks the caller's transaction rollback-only.
     *
     * @param aggregateType PoolActivity or PoolNotification
     * @param poolId pool the event belongs to, used as the Kafka key
     * @param eventType event type name
     * @param payload event JSON
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID poolId, String eventType, String payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, poolId, eventType, payload);
        repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, poolId={}", eventType, aggregateType, poolId);
        return event;
    }

    /**
     * Not transactional, so a payload that cannot be written never touches
     * the surrounding pool change.
     *
     * @throws IllegalArgumentException if the payload cannot be serialized
     */
    public String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }

    /**
     * Locks and returns the next batch to publish.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            log.warn("Marked event {} as failed (retry #{}): {}", eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForPool(UUID poolId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(poolId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForPool(String aggregateType, UUID poolId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, poolId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    /**
     * Deletes published events older than the cutoff.
     *
     * @return number of deleted rows
     */
    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        int deleted = repository.deletePublishedEventsBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} published outbox events older than {}", deleted, cutoff);
        }
        return deleted;
    }
}
