package com.flagship.savings_circle.observability;

import com.flagship.savings_circle.pool.PoolStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for rotation engine operations.
 *
 * Metrics exposed:
 * - pool.contributions: contribution actions by action and outcome
 * - pool.payouts: issued payouts, tagged early/regular
 * - pool.engine.conflicts: optimistic lock conflicts by operation
 * - pool.engine.operations: engine calls by operation and result code
 * - pool.engine.latency: engine call latency by operation
 * - pool.status_cache: status view cache hits and misses
 * - pool.pools: pools by status, refreshed by {@link MetricsScheduler}
 */
@Component
public class PoolMetrics {

    private final MeterRegistry registry;
    private final Map<PoolStatus, AtomicLong> poolsByStatus = new EnumMap<>(PoolStatus.class);

    public PoolMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (PoolStatus status : PoolStatus.values()) {
            AtomicLong count = new AtomicLong(0);
            poolsByStatus.put(status, count);
            Gauge.builder("pool.pools", count, AtomicLong::get)
                    .description("Number of pools in each status")
                    .tag("status", status.name())
                    .register(registry);
        }
    }

    public void recordContribution(String action, String outcome) {
        registry.counter("pool.contributions",
                "action", sanitizeTag(action),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordPayoutIssued(boolean early) {
        registry.counter("pool.payouts",
                "type", early ? "early" : "regular"
        ).increment();
    }

    public void recordConflict(String operation) {
        registry.counter("pool.engine.conflicts",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordConflictExhausted(String operation) {
        registry.counter("pool.engine.conflicts.exhausted",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    /**
     * Records the result of one engine call.
     *
     * @param result "success" or the error code of the failure
     */
    public void recordOperation(String operation, String result, long durationMs) {
        registry.counter("pool.engine.operations",
                "operation", sanitizeTag(operation),
                "result", sanitizeTag(result)
        ).increment();
        registry.timer("pool.engine.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordStatusCacheHit() {
        registry.counter("pool.status_cache", "result", "hit").increment();
    }

    public void recordStatusCacheMiss() {
        registry.counter("pool.status_cache", "result", "miss").increment();
    }

    public void recordNotificationDispatched(String eventType) {
        registry.counter("pool.notifications.dispatched",
                "event_type", sanitizeTag(eventType)
        ).increment();
    }

    public void updatePoolCount(PoolStatus status, long count) {
        poolsByStatus.get(status).set(count);
    }

    /**
     * Keeps tag values short and free of characters that break exporters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
