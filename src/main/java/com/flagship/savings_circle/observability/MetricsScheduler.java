package com.flagship.savings_circle.observability;

import com.flagship.savings_circle.pool.PoolRepository;
import com.flagship.savings_circle.pool.PoolStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query, so a scrape never does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final PoolMetrics poolMetrics;
    private final PoolRepository poolRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        refreshPoolCounts();
    }

    void refreshPoolCounts() {
        try {
            for (PoolStatus status : PoolStatus.values()) {
                poolMetrics.updatePoolCount(status, poolRepository.countByStatus(status));
            }
        } catch (Exception e) {
            log.warn("Failed to refresh pool gauges: {}", e.getMessage());
        }
    }
}
