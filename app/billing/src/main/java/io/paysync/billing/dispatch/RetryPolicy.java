/*
 * Where: billing event dispatch
 * What: bounded attempt budget with an increasing delay schedule
 * Why: exhausted events stay unprocessed for operators instead of retrying forever
 */
package io.paysync.billing.dispatch;

import io.paysync.billing.config.BillingEventsProperties;
import java.time.Duration;
import java.util.List;

public record RetryPolicy(int maxAttempts, List<Duration> delays) {

  public RetryPolicy {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be positive");
    }
    if (delays == null || delays.isEmpty()) {
      throw new IllegalArgumentException("delays must not be empty");
    }
    delays = List.copyOf(delays);
  }

  public static RetryPolicy from(BillingEventsProperties properties) {
    return new RetryPolicy(properties.maxAttempts(), properties.retryDelays());
  }

  /** {@code failedAttempts} counts every invocation so far, including the one that just failed. */
  public boolean isExhausted(int failedAttempts) {
    return failedAttempts >= maxAttempts;
  }

  /** The last delay repeats when the budget is longer than the schedule. */
  public Duration delayAfter(int failedAttempts) {
    final int index = Math.min(Math.max(failedAttempts, 1), delays.size()) - 1;
    return delays.get(index);
  }
}
