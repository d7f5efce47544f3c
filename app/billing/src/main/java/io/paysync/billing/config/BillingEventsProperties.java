/*
 * Where: billing configuration binding
 * What: polling, lease and retry budget for provider event processing
 * Why: the retry schedule is an operational knob, and a broken schedule must fail startup
 */
package io.paysync.billing.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "billing.events")
@Validated
public record BillingEventsProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int maxAttempts,
    @NotEmpty List<Duration> retryDelays,
    @NotNull Duration lease,
    @Positive int errorMessageMaxLength) {

  public BillingEventsProperties {
    retryDelays = retryDelays == null ? List.of() : List.copyOf(retryDelays);
  }

  @AssertTrue(message = "billing.events.retry-delays must all be positive")
  public boolean isRetryDelaysPositive() {
    return retryDelays.stream().allMatch(delay -> !delay.isZero() && !delay.isNegative());
  }

  @AssertTrue(message = "billing.events.lease must be positive")
  public boolean isLeasePositive() {
    return lease != null && !lease.isZero() && !lease.isNegative();
  }
}
