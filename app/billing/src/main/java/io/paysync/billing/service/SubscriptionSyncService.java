/*
 * Where: billing service layer
 * What: applies provider subscription snapshots to the local row and its entitlements
 * Why: the status change and the entitlement diff commit together under the subscription row lock
 */
package io.paysync.billing.service;

import io.paysync.billing.config.PricingProperties;
import io.paysync.billing.dispatch.EventRetryException;
import io.paysync.billing.dispatch.EventSkipException;
import io.paysync.billing.handler.payload.SubscriptionPayload;
import io.paysync.billing.model.CustomerRecord;
import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.model.SubscriptionStatus;
import io.paysync.billing.repository.CustomerRepository;
import io.paysync.billing.repository.SubscriptionRepository;
import io.paysync.billing.repository.SubscriptionRepository.UpsertResult;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class SubscriptionSyncService {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionSyncService.class);

  public static final String REASON_CANCELED = "Subscription canceled";
  public static final String REASON_PAUSED = "Subscription paused";
  public static final String REASON_STATUS_CHANGED = "Subscription status changed to: ";

  private final CustomerRepository customerRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionStateMachine stateMachine;
  private final EntitlementReconciler entitlementReconciler;
  private final PricingProperties pricingProperties;
  private final ProviderSubscriptionGateway gateway;
  private final Clock clock;

  /**
   * Creates or refreshes the local subscription. An unknown customer is a race with the customer
   * sync, so the event is retried.
   */
  @Transactional
  public SubscriptionRecord applyCreated(SubscriptionPayload payload) {
    requireId(payload);
    final CustomerRecord customer =
        customerRepository
            .findByExternalId(payload.customer())
            .orElseThrow(
                () ->
                    new EventRetryException(
                        "customer not synced yet",
                        Map.of(
                            "external_customer_id", String.valueOf(payload.customer()),
                            "external_subscription_id", payload.id())));
    final SubscriptionPayload snapshot = withPeriod(payload);
    final SubscriptionStatus status = statusOf(snapshot);
    if (snapshot.priceId() == null) {
      throw new EventSkipException(
          "subscription payload without price", Map.of("external_subscription_id", snapshot.id()));
    }
    final SubscriptionRecord candidate =
        SubscriptionRecord.builder()
            .customerId(customer.id())
            .externalSubscriptionId(snapshot.id())
            .priceId(snapshot.priceId())
            .status(status)
            .currentPeriodStart(snapshot.currentPeriodStartInstant())
            .currentPeriodEnd(snapshot.currentPeriodEndInstant())
            .cancelAtPeriodEnd(snapshot.cancelAtPeriodEnd())
            .trialStart(snapshot.trialStartInstant())
            .trialEnd(snapshot.trialEndInstant())
            .build();
    final UpsertResult result = subscriptionRepository.upsert(candidate, Instant.now(clock));
    final SubscriptionRecord subscription = result.subscription();
    if (subscription.isActive()) {
      entitlementReconciler.sync(subscription, pricingProperties.featuresFor(subscription.priceId()));
    }
    logger.info(
        "subscription {} subscriptionId={} externalId={} status={} priceId={}",
        result.created() ? "created" : "refreshed",
        subscription.id(),
        subscription.externalSubscriptionId(),
        subscription.status().wireValue(),
        subscription.priceId());
    return subscription;
  }

  /**
   * Copies the snapshot onto the locked row. A subscription that is not stored yet means the
   * created event is still in flight, so the update is retried rather than dropped.
   */
  @Transactional
  public SubscriptionRecord applyUpdated(SubscriptionPayload payload) {
    requireId(payload);
    final SubscriptionRecord locked =
        subscriptionRepository
            .findByExternalIdForUpdate(payload.id())
            .orElseThrow(
                () ->
                    new EventRetryException(
                        "subscription not synced yet",
                        Map.of("external_subscription_id", payload.id())));
    final SubscriptionPayload snapshot = withPeriod(payload);
    final SubscriptionStatus status = statusOf(snapshot);
    final SubscriptionRecord copied =
        locked.toBuilder()
            .priceId(snapshot.priceId() == null ? locked.priceId() : snapshot.priceId())
            .currentPeriodStart(snapshot.currentPeriodStartInstant())
            .currentPeriodEnd(snapshot.currentPeriodEndInstant())
            .cancelAtPeriodEnd(snapshot.cancelAtPeriodEnd())
            .canceledAt(
                snapshot.canceledAt() == null ? locked.canceledAt() : snapshot.canceledAtInstant())
            .trialStart(snapshot.trialStartInstant())
            .trialEnd(snapshot.trialEndInstant())
            .build();
    final SubscriptionRecord updated = stateMachine.applyStatus(copied, status);
    subscriptionRepository.update(updated, Instant.now(clock));
    if (updated.isActive()) {
      entitlementReconciler.sync(updated, pricingProperties.featuresFor(updated.priceId()));
    } else {
      entitlementReconciler.revokeForSubscription(
          updated, REASON_STATUS_CHANGED + updated.status().wireValue());
    }
    logger.info(
        "subscription updated subscriptionId={} externalId={} from={} to={}",
        updated.id(),
        updated.externalSubscriptionId(),
        locked.status().wireValue(),
        updated.status().wireValue());
    return updated;
  }

  @Transactional
  public SubscriptionRecord applyDeleted(SubscriptionPayload payload) {
    final SubscriptionRecord canceled = stateMachine.cancel(lockOrSkip(payload));
    subscriptionRepository.update(canceled, Instant.now(clock));
    entitlementReconciler.revokeForSubscription(canceled, REASON_CANCELED);
    logger.info(
        "subscription canceled subscriptionId={} externalId={}",
        canceled.id(),
        canceled.externalSubscriptionId());
    return canceled;
  }

  @Transactional
  public SubscriptionRecord applyPaused(SubscriptionPayload payload) {
    final SubscriptionRecord paused = stateMachine.pause(lockOrSkip(payload));
    subscriptionRepository.update(paused, Instant.now(clock));
    entitlementReconciler.revokeForSubscription(paused, REASON_PAUSED);
    logger.info(
        "subscription paused subscriptionId={} externalId={}",
        paused.id(),
        paused.externalSubscriptionId());
    return paused;
  }

  @Transactional
  public SubscriptionRecord applyResumed(SubscriptionPayload payload) {
    final SubscriptionRecord locked = lockOrSkip(payload);
    final SubscriptionRecord resumed =
        stateMachine.resume(
            locked, payload.currentPeriodStartInstant(), payload.currentPeriodEndInstant());
    subscriptionRepository.update(resumed, Instant.now(clock));
    if (resumed.isActive()) {
      entitlementReconciler.sync(resumed, pricingProperties.featuresFor(resumed.priceId()));
    }
    logger.info(
        "subscription resumed subscriptionId={} externalId={} periodEnd={}",
        resumed.id(),
        resumed.externalSubscriptionId(),
        resumed.currentPeriodEnd());
    return resumed;
  }

  private SubscriptionRecord lockOrSkip(SubscriptionPayload payload) {
    requireId(payload);
    return subscriptionRepository
        .findByExternalIdForUpdate(payload.id())
        .orElseThrow(
            () ->
                new EventSkipException(
                    "subscription not found", Map.of("external_subscription_id", payload.id())));
  }

  private SubscriptionPayload withPeriod(SubscriptionPayload payload) {
    requireId(payload);
    if (payload.hasPeriod()) {
      return payload;
    }
    logger.info("subscription payload without period, refetching externalId={}", payload.id());
    return gateway
        .fetchSubscription(payload.id())
        .filter(SubscriptionPayload::hasPeriod)
        .orElseThrow(
            () ->
                new EventSkipException(
                    "subscription period data unavailable",
                    Map.of("external_subscription_id", payload.id())));
  }

  private static SubscriptionStatus statusOf(SubscriptionPayload payload) {
    return SubscriptionStatus.fromWireValue(payload.status())
        .orElseThrow(
            () ->
                new EventSkipException(
                    "unknown subscription status",
                    Map.of(
                        "external_subscription_id", payload.id(),
                        "status", String.valueOf(payload.status()))));
  }

  private static void requireId(SubscriptionPayload payload) {
    if (payload.id() == null || payload.id().isBlank()) {
      throw new EventSkipException("subscription payload without id");
    }
  }
}
