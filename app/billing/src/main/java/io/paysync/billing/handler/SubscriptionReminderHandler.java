package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.handler.payload.SubscriptionTimerPayload;
import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.repository.SubscriptionRepository;
import io.paysync.billing.service.SubscriptionReminderSender;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Sends the cancellation reminder unless the customer has undone the cancellation since. */
@Component
@Order(200)
@RequiredArgsConstructor
public class SubscriptionReminderHandler implements BillingEventHandler {

  private final ProviderPayloadReader payloadReader;
  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionReminderSender reminderSender;

  @Override
  public String eventType() {
    return BillingEventTypes.SUBSCRIPTION_REMINDER;
  }

  @Override
  public void handle(JsonNode payload) {
    final SubscriptionTimerPayload timer =
        payloadReader.read(payload, SubscriptionTimerPayload.class);
    final SubscriptionRecord subscription =
        subscriptionRepository
            .findByIdForUpdate(timer.subscriptionId())
            .orElseThrow(
                () ->
                    new EventSkipException(
                        "reminder for missing subscription",
                        Map.of("subscription_id", timer.subscriptionId())));
    if (!subscription.cancelAtPeriodEnd() || !subscription.isActive()) {
      throw new EventSkipException(
          "reminder no longer applies",
          Map.of(
              "subscription_id", timer.subscriptionId(),
              "status", subscription.status().wireValue()));
    }
    final int daysRemaining = timer.daysRemaining() == null ? 0 : timer.daysRemaining();
    reminderSender.sendCancellationReminder(subscription, daysRemaining);
  }
}
