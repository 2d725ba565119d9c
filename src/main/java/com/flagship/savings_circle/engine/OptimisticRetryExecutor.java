package com.flagship.savings_circle.engine;

import com.flagship.savings_circle.engine.exception.ConflictException;
import com.flagship.savings_circle.observability.PoolMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs a pool mutation as one transaction and retries it when a concurrent
 * writer got there first.
 *
 * Each attempt starts a fresh transaction and so re-reads the pool. A
 * conflict is either an optimistic lock failure on the pool version or a
 * unique-constraint violation on contributions/payouts. Domain failures
 * are never retried. After the last attempt a {@link ConflictException}
 * is raised. Backoff grows linearly with the attempt number.
 *
 * All-or-nothing per call: a failed attempt rolls back everything it wrote,
 * outbox events included.
 */
@Component
@Slf4j
public class OptimisticRetryExecutor {

    private final TransactionTemplate transactionTemplate;
    private final PoolMetrics poolMetrics;
    private final RetryConfig retryConfig;

    public OptimisticRetryExecutor(PlatformTransactionManager transactionManager,
                                   PoolMetrics poolMetrics,
                                   @Value("${pool.concurrency.max-attempts:3}") int maxAttempts,
                                   @Value("${pool.concurrency.backoff-ms:25}") long backoffMs) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(5);
        this.poolMetrics = poolMetrics;

        long step = Math.max(1, backoffMs);
        this.retryConfig = RetryConfig.custom()
            .maxAttempts(Math.max(1, maxAttempts))
            .intervalFunction(IntervalFunction.of(Duration.ofMillis(step), previous -> previous + step))
            .retryExceptions(ConcurrencyFailureException.class, DataIntegrityViolationException.class)
            .build();
    }

    /**
     * @param operation name used in logs and metrics
     * @param poolId pool being modified
     * @param work the read-modify-write cycle; must load the pool through
     *             {@link PoolAggregateStore#loadForWrite(UUID)}
     * @throws ConflictException if every attempt hit a conflict
     */
    public <T> T execute(String operation, UUID poolId, Supplier<T> work) {
        Retry retry = Retry.of(operation, retryConfig);
        retry.getEventPublisher().onRetry(event -> {
            poolMetrics.recordConflict(operation);
            log.warn("Concurrent modification of pool {} during {} (attempt {}/{}): {}",
                    poolId, operation, event.getNumberOfRetryAttempts(), getMaxAttempts(),
                    event.getLastThrowable().getClass().getSimpleName());
        });

        Supplier<T> attempt = () -> transactionTemplate.execute(status -> work.get());
        try {
            return Retry.decorateSupplier(retry, attempt).get();
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            poolMetrics.recordConflict(operation);
            poolMetrics.recordConflictExhausted(operation);
            log.error("Giving up on {} for pool {} after {} attempts", operation, poolId, getMaxAttempts());
            throw new ConflictException("The pool was modified concurrently; please retry the request", e);
        }
    }

    public int getMaxAttempts() {
        return retryConfig.getMaxAttempts();
    }
}
