package com.flagship.savings_circle.notification;

/**
 * Delivery channel of the notification service (push, e-mail, SMS).
 * Delivery itself lives outside this service.
 */
public interface NotificationGateway {

    void roundAdvanced(RoundAdvancedEvent event);

    void payoutIssued(PayoutIssuedEvent event);
}
