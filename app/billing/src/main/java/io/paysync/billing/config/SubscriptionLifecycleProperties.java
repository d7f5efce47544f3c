/*
 * Where: billing configuration binding
 * What: reminder/expiry sweep and stale-subscription reconciliation settings
 * Why: the grace period and reminder days are business policy, not code
 */
package io.paysync.billing.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.lifecycle")
public record SubscriptionLifecycleProperties(
    boolean enabled,
    Duration sweepInterval,
    List<Integer> reminderDays,
    Duration gracePeriod,
    boolean reconcileEnabled,
    Duration reconcileInterval,
    Duration staleAfter,
    int reconcileBatchSize) {

  public SubscriptionLifecycleProperties {
    reminderDays = reminderDays == null ? List.of(7, 3, 1) : List.copyOf(reminderDays);
    gracePeriod = gracePeriod == null ? Duration.ofDays(7) : gracePeriod;
    staleAfter = staleAfter == null ? Duration.ofDays(1) : staleAfter;
    reconcileBatchSize = reconcileBatchSize <= 0 ? 100 : reconcileBatchSize;
  }
}
