package com.flagship.savings_circle.contribution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.savings_circle.contribution.dto.ContributionStatusView;
import com.flagship.savings_circle.observability.PoolMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis cache for contribution status views.
 *
 * Best effort in both directions: a Redis failure is logged and the caller
 * falls back to the database. The database is the source of truth.
 *
 * Entries are keyed by a per-pool generation that {@link #evict} bumps
 * after every committed write. A reader captures the generation before it
 * loads from the database, so a view loaded before a write lands under
 * the old generation and is never served once the write has evicted.
 * Orphaned entries expire with the TTL.
 */
@Component
@Slf4j
public class ContributionStatusCache {

    private static final String KEY_PREFIX = "pool:contribution-status:";
    private static final String GENERATION_PREFIX = KEY_PREFIX + "generation:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final PoolMetrics poolMetrics;
    private final boolean enabled;
    private final Duration ttl;

    public ContributionStatusCache(Optional<StringRedisTemplate> redisTemplate,
                                   ObjectMapper objectMapper,
                                   PoolMetrics poolMetrics,
                                   @Value("${pool.status-cache.enabled:true}") boolean enabled,
                                   @Value("${pool.status-cache.ttl-seconds:30}") long ttlSeconds) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.poolMetrics = poolMetrics;
        this.enabled = enabled && redisTemplate.isPresent();
        this.ttl = Duration.ofSeconds(Math.max(1, ttlSeconds));
    }

    /**
     * Returns the cached view of the pool's current generation, or loads
     * it and caches it under the generation read before loading.
     */
    public ContributionStatusView getOrLoad(UUID poolId, Supplier<ContributionStatusView> loader) {
        if (!enabled) {
            return loader.get();
        }
        Optional<Long> generation = currentGeneration(poolId);
        if (generation.isEmpty()) {
            return loader.get();
        }
        String key = key(poolId, generation.get());

        Optional<ContributionStatusView> cached = read(poolId, key);
        if (cached.isPresent()) {
            poolMetrics.recordStatusCacheHit();
            return cached.get();
        }
        poolMetrics.recordStatusCacheMiss();

        ContributionStatusView fresh = loader.get();
        write(key, fresh);
        return fresh;
    }

    /**
     * Moves the pool to a new generation. Must be called after the write
     * has committed.
     */
    public void evict(UUID poolId) {
        if (!enabled) {
            return;
        }
        try {
            Long next = redisTemplate.get().opsForValue().increment(GENERATION_PREFIX + poolId);
            if (next != null && next > 0) {
                redisTemplate.get().delete(key(poolId, next - 1));
            }
        } catch (RuntimeException e) {
            // Entries of the old generation expire with their TTL.
            log.warn("Failed to evict cached status for pool {}: {}", poolId, e.getMessage());
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Key the next read of the pool would use; empty while Redis is unreachable.
     */
    Optional<String> currentKey(UUID poolId) {
        return currentGeneration(poolId).map(generation -> key(poolId, generation));
    }

    private Optional<Long> currentGeneration(UUID poolId) {
        try {
            String value = redisTemplate.get().opsForValue().get(GENERATION_PREFIX + poolId);
            return Optional.of(value == null ? 0L : Long.parseLong(value));
        } catch (NumberFormatException e) {
            log.warn("Ignoring corrupt cache generation for pool {}: {}", poolId, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for pool {}, reading from database: {}", poolId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ContributionStatusView> read(UUID poolId, String key) {
        try {
            String json = redisTemplate.get().opsForValue().get(key);
            return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, ContributionStatusView.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached status for pool {}: {}", poolId, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for pool {}, reading from database: {}", poolId, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, ContributionStatusView view) {
        try {
            redisTemplate.get().opsForValue().set(key, objectMapper.writeValueAsString(view), ttl);
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Failed to cache status for pool {}: {}", view.getPoolId(), e.getMessage());
        }
    }

    private static String key(UUID poolId, long generation) {
        return KEY_PREFIX + poolId + ":" + generation;
    }
}
