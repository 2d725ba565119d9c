package com.flagship.savings_circle.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gateway used when no delivery channel is wired in: records what would
 * have been sent.
 */
@Component
@Slf4j
public class LoggingNotificationGateway implements NotificationGateway {

    @Override
    public void roundAdvanced(RoundAdvancedEvent event) {
        if (event.isPoolCompleted()) {
            log.info("Would notify members: pool {} completed after round {}",
                    event.getPoolId(), event.getPreviousRound());
            return;
        }
        log.info("Would notify members: pool {} moved to round {}, next recipient {} on {}",
                event.getPoolId(), event.getCurrentRound(), event.getNextRecipientName(),
                event.getNextScheduledDate());
    }

    @Override
    public void payoutIssued(PayoutIssuedEvent event) {
        log.info("Would notify {}: payout of {} for round {} of pool {} (early={})",
                event.getRecipientName(), event.getAmount(), event.getRound(),
                event.getPoolId(), event.isEarlyPayout());
    }
}
