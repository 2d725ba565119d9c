package com.flagship.savings_circle.activity;

import com.flagship.savings_circle.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Posts activity entries to the discussion feed through the outbox.
 *
 * Best effort: the feed is a side channel, so an entry that cannot be
 * serialized is logged and dropped instead of failing the contribution or
 * payout that triggered it. Serialization runs before the outbox write so
 * the surrounding transaction is left untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActivityPublisher {

    private final OutboxService outboxService;

    /**
     * Must be called inside the transaction of the change being announced.
     *
     * @return true if the entry was written to the outbox
     */
    public boolean publish(PoolActivityEvent event) {
        String payload;
        try {
            payload = outboxService.serializePayload(event);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping {} activity entry for pool {}: {}",
                    event.getType(), event.getPoolId(), e.getMessage());
            return false;
        }
        outboxService.saveEvent(PoolActivityEvent.AGGREGATE_TYPE, event.getPoolId(), event.getEventType(), payload);
        return true;
    }
}
