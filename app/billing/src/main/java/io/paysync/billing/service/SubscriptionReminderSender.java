package io.paysync.billing.service;

import io.paysync.billing.model.SubscriptionRecord;

/** Delivers the "your subscription ends soon" notice for subscriptions set to cancel. */
public interface SubscriptionReminderSender {

  void sendCancellationReminder(SubscriptionRecord subscription, int daysRemaining);
}
