/*
 * Where: billing service layer
 * What: reminder sender that only writes a structured log line
 * Why: notification delivery is owned by another service; the log is the local audit trail
 */
package io.paysync.billing.service;

import io.paysync.billing.model.SubscriptionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingSubscriptionReminderSender implements SubscriptionReminderSender {

  private static final Logger logger =
      LoggerFactory.getLogger(LoggingSubscriptionReminderSender.class);

  @Override
  public void sendCancellationReminder(SubscriptionRecord subscription, int daysRemaining) {
    logger.info(
        "subscription cancellation reminder subscriptionId={} customerId={} daysRemaining={}"
            + " periodEnd={}",
        subscription.id(),
        subscription.customerId(),
        daysRemaining,
        subscription.currentPeriodEnd());
  }
}
