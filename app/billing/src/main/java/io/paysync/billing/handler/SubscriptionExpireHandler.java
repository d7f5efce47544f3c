package io.paysync.billing.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.paysync.billing.dispatch.BillingEventHandler;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.handler.payload.ProviderPayloadReader;
import io.paysync.billing.handler.payload.SubscriptionTimerPayload;
import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.model.SubscriptionStatus;
import io.paysync.billing.repository.SubscriptionRepository;
import io.paysync.billing.service.EntitlementReconciler;
import io.paysync.billing.service.SubscriptionStateMachine;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Cancels a subscription still delinquent after the grace period. */
@Component
@Order(210)
@RequiredArgsConstructor
public class SubscriptionExpireHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionExpireHandler.class);

  static final String REASON_EXPIRED = "Subscription expired after grace period";
  private static final Set<SubscriptionStatus> DELINQUENT =
      EnumSet.of(SubscriptionStatus.PAST_DUE, SubscriptionStatus.UNPAID);

  private final ProviderPayloadReader payloadReader;
  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionStateMachine stateMachine;
  private final EntitlementReconciler entitlementReconciler;
  private final Clock clock;

  @Override
  public String eventType() {
    return BillingEventTypes.SUBSCRIPTION_EXPIRE;
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
                        "expiry for missing subscription",
                        Map.of("subscription_id", timer.subscriptionId())));
    if (!DELINQUENT.contains(subscription.status())) {
      throw new EventSkipException(
          "subscription recovered before expiry",
          Map.of(
              "subscription_id", timer.subscriptionId(),
              "status", subscription.status().wireValue()));
    }
    final SubscriptionRecord canceled = stateMachine.cancel(subscription);
    subscriptionRepository.update(canceled, Instant.now(clock));
    entitlementReconciler.revokeForSubscription(canceled, REASON_EXPIRED);
    logger.info(
        "subscription expired subscriptionId={} previousStatus={}",
        canceled.id(),
        subscription.status().wireValue());
  }
}
