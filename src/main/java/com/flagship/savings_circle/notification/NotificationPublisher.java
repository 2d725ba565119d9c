package com.flagship.savings_circle.notification;

import com.flagship.savings_circle.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes notification events to the outbox inside the payout transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationPublisher {

    private final OutboxService outboxService;

    public void publish(PoolNotification notification) {
        String payload;
        try {
            payload = outboxService.serializePayload(notification);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping {} notification for pool {}: {}",
                    notification.getEventType(), notification.getPoolId(), e.getMessage());
            return;
        }
        outboxService.saveEvent(PoolNotification.AGGREGATE_TYPE, notification.getPoolId(),
                notification.getEventType(), payload);
    }
}
