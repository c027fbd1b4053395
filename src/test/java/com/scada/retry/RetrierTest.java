package com.scada.retry;

import com.scada.bus.BrokerUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrierTest {

  private final List<Duration> sleeps = new ArrayList<>();
  private final Retrier retrier = new Retrier(
      new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), 0.0), sleeps::add);

  @Test
  @DisplayName("Повторяемая ошибка → повтор, затем успех")
  void retriesUntilSuccess() {
    // Given
    AtomicInteger calls = new AtomicInteger();

    // When
    String result = retrier.call("тест", () -> {
      if (calls.incrementAndGet() < 3) {
        throw new BrokerUnavailableException("нет связи");
      }
      return "ok";
    }, Retrier.on(BrokerUnavailableException.class));

    // Then
    assertThat(result).isEqualTo("ok");
    assertThat(calls).hasValue(3);
    assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
  }

  @Test
  @DisplayName("После исчерпания попыток пробрасывается последнее исключение")
  void rethrowsAfterExhaustion() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> retrier.run("тест", () -> {
      calls.incrementAndGet();
      throw new BrokerUnavailableException("попытка " + calls.get());
    }, Retrier.on(BrokerUnavailableException.class)))
        .isInstanceOf(BrokerUnavailableException.class)
        .hasMessage("попытка 3");
    assertThat(sleeps).hasSize(2);
  }

  @Test
  @DisplayName("Неповторяемая ошибка пробрасывается сразу")
  void doesNotRetryOtherErrors() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> retrier.run("тест", () -> {
      calls.incrementAndGet();
      throw new IllegalStateException("баг");
    }, Retrier.on(BrokerUnavailableException.class)))
        .isInstanceOf(IllegalStateException.class);
    assertThat(calls).hasValue(1);
    assertThat(sleeps).isEmpty();
  }
}
