package com.scada.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

  private final RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(200), Duration.ofMillis(1000), 0.2);

  @Test
  @DisplayName("Задержка удваивается и упирается в максимум")
  void delayGrowsExponentiallyUpToCap() {
    // середина диапазона случайности → без разброса
    assertThat(policy.delayAfter(1, () -> 0.5)).isEqualTo(Duration.ofMillis(200));
    assertThat(policy.delayAfter(2, () -> 0.5)).isEqualTo(Duration.ofMillis(400));
    assertThat(policy.delayAfter(3, () -> 0.5)).isEqualTo(Duration.ofMillis(800));
    assertThat(policy.delayAfter(4, () -> 0.5)).isEqualTo(Duration.ofMillis(1000));
    assertThat(policy.delayAfter(40, () -> 0.5)).isEqualTo(Duration.ofMillis(1000));
  }

  @Test
  @DisplayName("Разброс не выходит за ±jitter")
  void jitterStaysWithinBounds() {
    assertThat(policy.delayAfter(1, () -> 0.0)).isEqualTo(Duration.ofMillis(160));
    assertThat(policy.delayAfter(1, () -> 0.999999)).isBetween(Duration.ofMillis(239), Duration.ofMillis(240));
  }

  @Test
  @DisplayName("Некорректные параметры политики отклоняются")
  void rejectsInvalidParameters() {
    assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 0.0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(1), 0.0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
