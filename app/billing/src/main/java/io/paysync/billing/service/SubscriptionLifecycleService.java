/*
 * Where: billing service layer
 * What: turns subscription deadlines into scheduled events (cancellation reminders, expiry)
 * Why: the sweep may run on several instances and more than once a day; dedup keys keep one row
 */
package io.paysync.billing.service;

import io.paysync.billing.config.SubscriptionLifecycleProperties;
import io.paysync.billing.handler.BillingEventTypes;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.handler.payload.SubscriptionTimerPayload;
import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.repository.ScheduledEventRepository;
import io.paysync.billing.repository.SubscriptionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubscriptionLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionLifecycleService.class);

  private final SubscriptionRepository subscriptionRepository;
  private final ScheduledEventRepository scheduledEventRepository;
  private final SubscriptionLifecycleProperties properties;
  private final ProviderPayloadReader payloadReader;
  private final Clock clock;

  public record SweepResult(int remindersScheduled, int expirationsScheduled) {}

  public SweepResult sweep() {
    final Instant now = Instant.now(clock);
    final SweepResult result = new SweepResult(scheduleReminders(now), scheduleExpirations(now));
    logger.info(
        "subscription lifecycle sweep reminders={} expirations={}",
        result.remindersScheduled(),
        result.expirationsScheduled());
    return result;
  }

  /** One reminder per configured day for subscriptions whose period ends inside that day. */
  int scheduleReminders(Instant now) {
    int scheduled = 0;
    for (int days : properties.reminderDays()) {
      final Instant from = now.plus(Duration.ofDays(days));
      final Instant to = from.plus(Duration.ofDays(1));
      for (SubscriptionRecord subscription :
          subscriptionRepository.findCancelingWithPeriodEndBetween(from, to)) {
        final String dedupKey =
            String.format(
                "%s:%d:%d:%s",
                BillingEventTypes.SUBSCRIPTION_REMINDER,
                subscription.id(),
                days,
                periodEndDate(subscription));
        final String payload =
            payloadReader.toJson(new SubscriptionTimerPayload(subscription.id(), days));
        if (scheduledEventRepository.insertIfAbsent(
            BillingEventTypes.SUBSCRIPTION_REMINDER, now, payload, dedupKey, now)) {
          scheduled++;
        }
      }
    }
    return scheduled;
  }

  /** Delinquent subscriptions past period end plus the grace period get one expire event. */
  int scheduleExpirations(Instant now) {
    int scheduled = 0;
    final Instant threshold = now.minus(properties.gracePeriod());
    for (SubscriptionRecord subscription :
        subscriptionRepository.findDelinquentWithPeriodEndBefore(threshold)) {
      final String dedupKey =
          String.format(
              "%s:%d:%s",
              BillingEventTypes.SUBSCRIPTION_EXPIRE,
              subscription.id(),
              periodEndDate(subscription));
      final String payload =
          payloadReader.toJson(new SubscriptionTimerPayload(subscription.id(), null));
      if (scheduledEventRepository.insertIfAbsent(
          BillingEventTypes.SUBSCRIPTION_EXPIRE, now, payload, dedupKey, now)) {
        scheduled++;
      }
    }
    return scheduled;
  }

  private static LocalDate periodEndDate(SubscriptionRecord subscription) {
    return LocalDate.ofInstant(subscription.currentPeriodEnd(), ZoneOffset.UTC);
  }
}
