package com.flagship.savings_circle.outbox;

import com.flagship.savings_circle.activity.PoolActivityEvent;
import com.flagship.savings_circle.notification.PoolNotification;
import com.flagship.savings_circle.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes pending events to Kafka.
 *
 * Activity events go to the activity topic consumed by the discussion
 * feed; notification events go to the notifications topic. The pool id is
 * the record key, so a pool's events stay ordered within its partition.
 *
 * A failed send increments the retry count. Events at max-retries stay in
 * the table as dead letters and are no longer picked up.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.activity:pool-activity}")
    private String activityTopic;

    @Value("${kafka.topic.notifications:pool-notifications}")
    private String notificationsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Value("${outbox.retention.days:7}")
    private int retentionDays;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} outbox events to publish", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    @Scheduled(cron = "${outbox.retention.cron:0 30 3 * * *}")
    public void purgePublishedEvents() {
        outboxService.purgePublishedBefore(Instant.now().minus(Duration.ofDays(retentionDays)));
    }

    private void publishEvent(OutboxEvent event) {
        String key = event.getAggregateId().toString();

        try {
            String topic = topicFor(event);
            SendResult<String, String> result = kafkaTemplate.send(topic, key, event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, poolId={}, error={}",
                    event.getId(), event.getEventType(), event.getAggregateId(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), leaving it as a dead letter. eventType={}, poolId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case PoolActivityEvent.AGGREGATE_TYPE -> activityTopic;
            case PoolNotification.AGGREGATE_TYPE -> notificationsTopic;
            default -> throw new IllegalArgumentException(
                    "No topic configured for aggregate type " + event.getAggregateType());
        };
    }
}
