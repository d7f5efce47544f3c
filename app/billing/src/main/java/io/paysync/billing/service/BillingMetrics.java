/*
 * Where: billing service layer
 * What: outcome counters for provider and scheduled events, plus the exhausted-event gauge
 * Why: exhausted events never leave the table by themselves, so operators alert on the gauge
 */
package io.paysync.billing.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class BillingMetrics {

  private static final String METRIC_EVENT_OUTCOME = "billing.events.outcome";
  private static final String METRIC_EVENTS_EXHAUSTED = "billing.events.exhausted.current";
  private static final String METRIC_SCHEDULED_OUTCOME = "billing.scheduled.outcome";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger exhaustedCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> eventCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> scheduledCounters = new ConcurrentHashMap<>();

  public BillingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_EVENTS_EXHAUSTED, exhaustedCurrent, AtomicInteger::get)
        .description("Provider events that used up their retry budget and wait for an operator")
        .register(meterRegistry);
  }

  public void recordEventOutcome(String outcome) {
    eventCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_EVENT_OUTCOME)
                    .description("Provider event processing outcomes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordScheduledOutcome(String outcome) {
    scheduledCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_SCHEDULED_OUTCOME)
                    .description("Scheduled event processing outcomes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void updateExhaustedCurrent(int exhaustedCount) {
    exhaustedCurrent.set(Math.max(exhaustedCount, 0));
  }
}
