package io.paysync.billing.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.paysync.billing.model.SubscriptionRecord;
import io.paysync.billing.model.SubscriptionStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class SubscriptionStateMachineTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Instant PERIOD_START = Instant.parse("2024-04-15T00:00:00Z");
  private static final Instant PERIOD_END = Instant.parse("2024-05-15T00:00:00Z");

  private final SubscriptionStateMachine stateMachine =
      new SubscriptionStateMachine(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void sameStatusReturnsInputUnchanged() {
    final SubscriptionRecord active = subscription(SubscriptionStatus.ACTIVE);

    assertThat(stateMachine.applyStatus(active, SubscriptionStatus.ACTIVE)).isSameAs(active);
  }

  @Test
  void unexpectedTransitionIsStillApplied() {
    final SubscriptionRecord canceled = subscription(SubscriptionStatus.CANCELED);

    final SubscriptionRecord reactivated =
        stateMachine.applyStatus(canceled, SubscriptionStatus.ACTIVE);

    assertThat(SubscriptionStatus.CANCELED.canTransitionTo(SubscriptionStatus.ACTIVE)).isFalse();
    assertThat(reactivated.status()).isEqualTo(SubscriptionStatus.ACTIVE);
  }

  @Test
  void cancelStampsCanceledAt() {
    final SubscriptionRecord canceled = stateMachine.cancel(subscription(SubscriptionStatus.PAST_DUE));

    assertThat(canceled.status()).isEqualTo(SubscriptionStatus.CANCELED);
    assertThat(canceled.canceledAt()).isEqualTo(NOW);
    assertThat(canceled.isActive()).isFalse();
  }

  @Test
  void pauseThenResumeClearsPausedAtAndReplacesPeriod() {
    final SubscriptionRecord paused = stateMachine.pause(subscription(SubscriptionStatus.ACTIVE));
    final Instant nextStart = Instant.parse("2024-05-01T12:00:00Z");
    final Instant nextEnd = Instant.parse("2024-06-01T12:00:00Z");

    final SubscriptionRecord resumed = stateMachine.resume(paused, nextStart, nextEnd);

    assertThat(paused.status()).isEqualTo(SubscriptionStatus.PAUSED);
    assertThat(paused.pausedAt()).isEqualTo(NOW);
    assertThat(resumed.status()).isEqualTo(SubscriptionStatus.ACTIVE);
    assertThat(resumed.pausedAt()).isNull();
    assertThat(resumed.resumedAt()).isEqualTo(NOW);
    assertThat(resumed.currentPeriodStart()).isEqualTo(nextStart);
    assertThat(resumed.currentPeriodEnd()).isEqualTo(nextEnd);
  }

  @Test
  void resumeWithoutPeriodKeepsStoredPeriod() {
    final SubscriptionRecord resumed =
        stateMachine.resume(subscription(SubscriptionStatus.PAUSED), null, null);

    assertThat(resumed.currentPeriodStart()).isEqualTo(PERIOD_START);
    assertThat(resumed.currentPeriodEnd()).isEqualTo(PERIOD_END);
  }

  @Test
  void pastDueKeepsAccess() {
    assertThat(SubscriptionStatus.PAST_DUE.isActive()).isTrue();
    assertThat(SubscriptionStatus.UNPAID.isActive()).isFalse();
    assertThat(SubscriptionStatus.CANCELED.isTerminal()).isTrue();
  }

  private static SubscriptionRecord subscription(SubscriptionStatus status) {
    return SubscriptionRecord.builder()
        .id(1L)
        .customerId(10L)
        .externalSubscriptionId("sub_1")
        .priceId("price_pro_monthly")
        .status(status)
        .currentPeriodStart(PERIOD_START)
        .currentPeriodEnd(PERIOD_END)
        .build();
  }
}
