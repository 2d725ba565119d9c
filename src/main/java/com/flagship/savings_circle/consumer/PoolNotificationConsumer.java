package com.flagship.savings_circle.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.savings_circle.notification.NotificationDispatcher;
import com.flagship.savings_circle.notification.PayoutIssuedEvent;
import com.flagship.savings_circle.notification.PoolNotification;
import com.flagship.savings_circle.notification.RoundAdvancedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Consumes pool notifications and hands them to the notification service.
 *
 * Offsets are acknowledged manually after the handler commits; redelivered
 * events are dropped by {@link IdempotentEventProcessor}.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PoolNotificationConsumer {

    static final String CONSUMER_GROUP = "pool-notification-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final NotificationDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.notifications:pool-notifications}",
        groupId = "${spring.kafka.consumer.group-id:savings-circle-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse notification at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        boolean processed = route(envelope, record.value());
        ack.acknowledge();

        if (processed) {
            log.info("Processed notification: type={}, eventId={}, poolId={}",
                    envelope.eventType(), envelope.eventId(), envelope.poolId());
        }
    }

    private boolean route(EventEnvelope envelope, String payload) {
        return switch (envelope.eventType()) {
            case RoundAdvancedEvent.EVENT_TYPE -> process(envelope,
                    () -> dispatcher.onRoundAdvanced(deserialize(payload, RoundAdvancedEvent.class)));
            case PayoutIssuedEvent.EVENT_TYPE -> process(envelope,
                    () -> dispatcher.onPayoutIssued(deserialize(payload, PayoutIssuedEvent.class)));
            default -> {
                log.debug("Unknown notification type {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(),
                        PoolNotification.AGGREGATE_TYPE, envelope.poolId(),
                        CONSUMER_GROUP, "Unknown event type");
                yield false;
            }
        };
    }

    private boolean process(EventEnvelope envelope, Runnable handler) {
        return eventProcessor.processEvent(envelope.eventId(), envelope.eventType(),
                PoolNotification.AGGREGATE_TYPE, envelope.poolId(), CONSUMER_GROUP, handler);
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("poolId")
                    || !node.hasNonNull("eventType")) {
                return null;
            }
            return new EventEnvelope(
                    UUID.fromString(node.get("eventId").asText()),
                    UUID.fromString(node.get("poolId").asText()),
                    node.get("eventType").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse notification envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private record EventEnvelope(UUID eventId, UUID poolId, String eventType) {}
}
