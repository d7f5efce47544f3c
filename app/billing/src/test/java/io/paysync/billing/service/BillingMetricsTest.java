package io.paysync.billing.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class BillingMetricsTest {

  @Test
  void recordsOutcomeCountersAndExhaustedGauge() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BillingMetrics metrics = new BillingMetrics(registry);

    metrics.recordEventOutcome("processed");
    metrics.recordEventOutcome("processed");
    metrics.recordEventOutcome("skipped");
    metrics.recordScheduledOutcome("failed");
    metrics.updateExhaustedCurrent(3);

    final Counter processed =
        registry.get("billing.events.outcome").tag("outcome", "processed").counter();
    final Counter skipped =
        registry.get("billing.events.outcome").tag("outcome", "skipped").counter();
    final Counter scheduledFailed =
        registry.get("billing.scheduled.outcome").tag("outcome", "failed").counter();
    final Gauge exhausted = registry.get("billing.events.exhausted.current").gauge();

    assertThat(processed.count()).isEqualTo(2.0d);
    assertThat(skipped.count()).isEqualTo(1.0d);
    assertThat(scheduledFailed.count()).isEqualTo(1.0d);
    assertThat(exhausted.value()).isEqualTo(3.0d);
  }

  @Test
  void exhaustedGaugeNeverGoesNegative() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BillingMetrics metrics = new BillingMetrics(registry);

    metrics.updateExhaustedCurrent(-1);

    assertThat(registry.get("billing.events.exhausted.current").gauge().value()).isZero();
  }
}
