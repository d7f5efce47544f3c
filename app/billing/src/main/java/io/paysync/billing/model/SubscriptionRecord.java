/*
 * Where: billing domain model
 * What: snapshot of one subscriptions row
 * Why: handlers and the state machine work on immutable copies and persist them explicitly
 */
package io.paysync.billing.model;

import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record SubscriptionRecord(
    Long id,
    long customerId,
    String externalSubscriptionId,
    String priceId,
    SubscriptionStatus status,
    Instant currentPeriodStart,
    Instant currentPeriodEnd,
    boolean cancelAtPeriodEnd,
    Instant canceledAt,
    Instant trialStart,
    Instant trialEnd,
    Instant pausedAt,
    Instant resumedAt) {

  public boolean isActive() {
    return status != null && status.isActive();
  }
}
