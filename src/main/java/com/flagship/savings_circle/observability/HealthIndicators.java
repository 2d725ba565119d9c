package com.flagship.savings_circle.observability;

import com.flagship.savings_circle.outbox.OutboxEventRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the savings circle service.
 *
 * Only the database is required to serve requests: Redis backs an optional
 * status cache and Kafka is fed through the outbox.
 */
public class HealthIndicators {

    /**
     * Unhealthy when too many pool events wait to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the contribution status cache; when it is missing or
     * down the service reads from the database and reports DEGRADED.
     */
    @Component("statusCacheHealth")
    public static class StatusCacheHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Contribution status is served from the database";

        private final ObjectProvider<StringRedisTemplate> redisTemplate;
        private final boolean cacheEnabled;

        public StatusCacheHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate,
                                          @Value("${pool.status-cache.enabled:true}") boolean cacheEnabled) {
            this.redisTemplate = redisTemplate;
            this.cacheEnabled = cacheEnabled;
        }

        @Override
        public Health health() {
            if (!cacheEnabled) {
                return Health.up().withDetail("cache", "disabled").build();
            }
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No Redis connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
