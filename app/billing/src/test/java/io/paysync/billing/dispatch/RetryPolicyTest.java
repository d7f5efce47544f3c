package io.paysync.billing.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private final RetryPolicy policy =
      new RetryPolicy(
          5,
          List.of(
              Duration.ofMinutes(1),
              Duration.ofMinutes(5),
              Duration.ofMinutes(15),
              Duration.ofHours(1),
              Duration.ofHours(2)));

  @Test
  void delaysGrowWithAttempts() {
    assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMinutes(1));
    assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMinutes(5));
    assertThat(policy.delayAfter(4)).isEqualTo(Duration.ofHours(1));
  }

  @Test
  void lastDelayRepeatsBeyondSchedule() {
    final RetryPolicy shortSchedule = new RetryPolicy(10, List.of(Duration.ofSeconds(30)));

    assertThat(shortSchedule.delayAfter(7)).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void exhaustedAtMaxAttempts() {
    assertThat(policy.isExhausted(4)).isFalse();
    assertThat(policy.isExhausted(5)).isTrue();
    assertThat(policy.isExhausted(6)).isTrue();
  }

  @Test
  void rejectsEmptySchedule() {
    assertThatThrownBy(() -> new RetryPolicy(3, List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RetryPolicy(0, List.of(Duration.ofSeconds(1))))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
