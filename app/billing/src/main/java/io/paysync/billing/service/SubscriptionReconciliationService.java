/*
 * Where: billing service layer
 * What: re-applies the provider's current snapshot to subscriptions whose period ended long ago
 * Why: a lost webhook would otherwise leave access granted past the paid period
 */
package io.paysync.billing.service;

import io.paysync.billing.config.SubscriptionLifecycleProperties;
import io.paysync.billing.handler.payload.SubscriptionPayload;
import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.repository.SubscriptionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubscriptionReconciliationService {

  private static final Logger logger =
      LoggerFactory.getLogger(SubscriptionReconciliationService.class);

  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionSyncService syncService;
  private final ProviderSubscriptionGateway gateway;
  private final SubscriptionLifecycleProperties properties;
  private final Clock clock;

  /** @return number of subscriptions refreshed from the provider */
  public int reconcileStale() {
    final Instant threshold = Instant.now(clock).minus(properties.staleAfter());
    final List<SubscriptionRecord> stale =
        subscriptionRepository.findStale(threshold, properties.reconcileBatchSize());
    int refreshed = 0;
    for (SubscriptionRecord subscription : stale) {
      final Optional<SubscriptionPayload> snapshot =
          gateway.fetchSubscription(subscription.externalSubscriptionId());
      if (snapshot.isEmpty()) {
        logger.info(
            "stale subscription not refreshed, provider returned nothing subscriptionId={}",
            subscription.id());
        continue;
      }
      try {
        syncService.applyUpdated(snapshot.get());
        refreshed++;
      } catch (RuntimeException ex) {
        // one broken row must not starve the rest of the batch
        logger.warn(
            "stale subscription refresh failed subscriptionId={}", subscription.id(), ex);
      }
    }
    logger.info("stale subscription reconciliation stale={} refreshed={}", stale.size(), refreshed);
    return refreshed;
  }
}
