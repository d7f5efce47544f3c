/*
 * Where: billing service layer
 * What: applies provider status changes and the explicit cancel/pause/resume operations
 * Why: the provider is authoritative; an unexpected transition is logged as an anomaly, never refused
 */
package io.paysync.billing.service;

import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.model.SubscriptionStatus;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SubscriptionStateMachine {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionStateMachine.class);

  private final Clock clock;

  /** Same-status changes return the input unchanged. */
  public SubscriptionRecord applyStatus(SubscriptionRecord subscription, SubscriptionStatus target) {
    final SubscriptionStatus current = subscription.status();
    if (current == target) {
      return subscription;
    }
    if (current != null && !current.canTransitionTo(target)) {
      logger.warn(
          "unexpected subscription transition subscriptionId={} externalId={} from={} to={}"
              + " expected={}",
          subscription.id(),
          subscription.externalSubscriptionId(),
          current.wireValue(),
          target.wireValue(),
          current.expectedTransitions());
    }
    return subscription.toBuilder().status(target).build();
  }

  public SubscriptionRecord cancel(SubscriptionRecord subscription) {
    return applyStatus(subscription, SubscriptionStatus.CANCELED).toBuilder()
        .canceledAt(Instant.now(clock))
        .build();
  }

  public SubscriptionRecord pause(SubscriptionRecord subscription) {
    return applyStatus(subscription, SubscriptionStatus.PAUSED).toBuilder()
        .pausedAt(Instant.now(clock))
        .build();
  }

  /** Null period boundaries keep the stored ones. */
  public SubscriptionRecord resume(
      SubscriptionRecord subscription, Instant periodStart, Instant periodEnd) {
    return applyStatus(subscription, SubscriptionStatus.ACTIVE).toBuilder()
        .resumedAt(Instant.now(clock))
        .pausedAt(null)
        .currentPeriodStart(
            periodStart == null ? subscription.currentPeriodStart() : periodStart)
        .currentPeriodEnd(periodEnd == null ? subscription.currentPeriodEnd() : periodEnd)
        .build();
  }
}
