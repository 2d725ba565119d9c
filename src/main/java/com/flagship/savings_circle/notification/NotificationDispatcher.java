package com.flagship.savings_circle.notification;

import com.flagship.savings_circle.observability.PoolMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hands consumed notification events to the gateway.
 *
 * Called by the Kafka consumer after the idempotency check, so every
 * event reaches the gateway at most once per consumer group.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final NotificationGateway gateway;
    private final PoolMetrics poolMetrics;

    public void onRoundAdvanced(RoundAdvancedEvent event) {
        log.debug("Dispatching RoundAdvanced: poolId={}, round={}", event.getPoolId(), event.getCurrentRound());
        gateway.roundAdvanced(event);
        poolMetrics.recordNotificationDispatched(RoundAdvancedEvent.EVENT_TYPE);
    }

    public void onPayoutIssued(PayoutIssuedEvent event) {
        log.debug("Dispatching PayoutIssued: poolId={}, round={}", event.getPoolId(), event.getRound());
        gateway.payoutIssued(event);
        poolMetrics.recordNotificationDispatched(PayoutIssuedEvent.EVENT_TYPE);
    }
}
