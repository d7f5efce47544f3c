/*
 * Where: billing service layer
 * What: converges a subscription's active entitlements to a desired feature set, plus manual grants
 * Why: the diff runs in the caller's transaction so an active subscription never shows stale access
 */
package io.paysync.billing.service;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import io.paysync.billing.model.EntitlementRecord;
import io.paysync.billing.model.EntitlementSource;
import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.repository.EntitlementRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class EntitlementReconciler {

  private static final Logger logger = LoggerFactory.getLogger(EntitlementReconciler.class);

  public static final String REASON_FEATURE_REMOVED = "Feature removed from subscription";
  public static final int DEFAULT_TRIAL_DAYS = 14;

  private final EntitlementRepository entitlementRepository;
  private final Clock clock;

  public record SyncResult(Set<String> granted, Set<String> revoked) {

    public boolean changed() {
      return !granted.isEmpty() || !revoked.isEmpty();
    }
  }

  /**
   * Grants {@code desired - current} and revokes {@code current - desired}. Features in both sets
   * are not touched, so their usage counters survive.
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public SyncResult sync(SubscriptionRecord subscription, Collection<String> desiredFeatures) {
    final long subscriptionId = requireId(subscription);
    final Instant now = Instant.now(clock);
    final Set<String> desired = ImmutableSet.copyOf(desiredFeatures);
    final Set<String> current =
        entitlementRepository.findActiveFeaturesForSubscription(subscriptionId);
    final Set<String> toGrant = ImmutableSet.copyOf(Sets.difference(desired, current));
    final Set<String> toRevoke = ImmutableSet.copyOf(Sets.difference(current, desired));
    for (String feature : toGrant) {
      entitlementRepository.upsertGrantIfNotActive(
          subscription.customerId(),
          feature,
          EntitlementSource.SUBSCRIPTION,
          subscriptionId,
          null,
          null,
          now);
    }
    entitlementRepository.revokeFeaturesForSubscription(
        subscriptionId, toRevoke, REASON_FEATURE_REMOVED, now);
    if (!toGrant.isEmpty() || !toRevoke.isEmpty()) {
      logger.info(
          "entitlements synced subscriptionId={} customerId={} granted={} revoked={}",
          subscriptionId,
          subscription.customerId(),
          toGrant,
          toRevoke);
    }
    return new SyncResult(toGrant, toRevoke);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public int revokeForSubscription(SubscriptionRecord subscription, String reason) {
    final long subscriptionId = requireId(subscription);
    final int revoked =
        entitlementRepository.revokeAllForSubscription(subscriptionId, reason, Instant.now(clock));
    if (revoked > 0) {
      logger.info(
          "entitlements revoked subscriptionId={} count={} reason={}",
          subscriptionId,
          revoked,
          reason);
    }
    return revoked;
  }

  /**
   * Grants a feature outside any subscription. Returns empty when an active grant already exists;
   * a revoked one is reactivated in place.
   */
  @Transactional
  public Optional<EntitlementRecord> grant(
      long customerId,
      String feature,
      EntitlementSource source,
      Instant expiresAt,
      Integer usageLimit) {
    if (source == EntitlementSource.SUBSCRIPTION) {
      throw new IllegalArgumentException("subscription grants go through sync");
    }
    final Optional<EntitlementRecord> granted =
        entitlementRepository.upsertGrantIfNotActive(
            customerId, feature, source, null, expiresAt, usageLimit, Instant.now(clock));
    granted.ifPresent(
        record ->
            logger.info(
                "entitlement granted customerId={} feature={} source={} expiresAt={}",
                customerId,
                feature,
                source.dbValue(),
                expiresAt));
    return granted;
  }

  @Transactional
  public Optional<EntitlementRecord> grantTrial(long customerId, String feature) {
    return grantTrial(customerId, feature, DEFAULT_TRIAL_DAYS);
  }

  @Transactional
  public Optional<EntitlementRecord> grantTrial(long customerId, String feature, int days) {
    if (days <= 0) {
      throw new IllegalArgumentException("trial days must be positive");
    }
    final Instant expiresAt = Instant.now(clock).plus(Duration.ofDays(days));
    return grant(customerId, feature, EntitlementSource.TRIAL, expiresAt, null);
  }

  /** Revokes every active row for the customer and feature, whatever granted it. */
  @Transactional
  public int revoke(long customerId, String feature, String reason) {
    final int revoked =
        entitlementRepository.revokeFeatureForCustomer(
            customerId, feature, reason, Instant.now(clock));
    logger.info(
        "entitlement revoked customerId={} feature={} count={} reason={}",
        customerId,
        feature,
        revoked,
        reason);
    return revoked;
  }

  public boolean hasAccess(long customerId, String feature) {
    return entitlementRepository.existsUsable(customerId, feature, Instant.now(clock));
  }

  public List<String> activeFeatures(long customerId) {
    return entitlementRepository.findActiveFeatures(customerId, Instant.now(clock));
  }

  /** @return false when no usable row is left, e.g. the usage limit is reached */
  @Transactional
  public boolean incrementUsage(long customerId, String feature) {
    return entitlementRepository.incrementUsage(customerId, feature, Instant.now(clock)) > 0;
  }

  private static long requireId(SubscriptionRecord subscription) {
    if (subscription.id() == null) {
      throw new IllegalArgumentException("subscription must be persisted before syncing");
    }
    return subscription.id();
  }
}
