package com.scada.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Политика повторов: число попыток, базовая и максимальная задержка, доля случайного разброса.
 * <p>
 * Одна и та же политика используется для переподключения к брокеру, повторов записи в БД
 * и повторов публикации. Задержка перед попыткой {@code n} (с 1):
 * {@code min(maxDelay, baseDelay * 2^(n-1)) * (1 ± jitter)}.
 *
 * @param maxAttempts Максимум попыток, включая первую (≥ 1).
 * @param baseDelay   Задержка после первой неудачи.
 * @param maxDelay    Верхняя граница задержки.
 * @param jitter      Доля разброса 0..1.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {

  public RetryPolicy {
    Objects.requireNonNull(baseDelay, "baseDelay cannot be null");
    Objects.requireNonNull(maxDelay, "maxDelay cannot be null");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
    }
    if (baseDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("delays cannot be negative");
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    }
    if (jitter < 0.0 || jitter > 1.0) {
      throw new IllegalArgumentException("jitter must be within 0..1: " + jitter);
    }
  }

  public static RetryPolicy noRetry() {
    return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0);
  }

  /**
   * Задержка после неудачной попытки с номером {@code failedAttempt}.
   *
   * @param failedAttempt Номер неудачной попытки, начиная с 1.
   * @param random        Источник случайных чисел в диапазоне [0, 1).
   */
  public Duration delayAfter(int failedAttempt, DoubleSupplier random) {
    if (failedAttempt < 1) {
      throw new IllegalArgumentException("failedAttempt must be >= 1: " + failedAttempt);
    }
    long base = baseDelay.toMillis();
    long cap = maxDelay.toMillis();
    int shift = Math.min(failedAttempt - 1, 30);
    long exponential = base > (cap >> shift) ? cap : Math.min(cap, base << shift);
    double spread = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
    return Duration.ofMillis(Math.max(0L, Math.round(exponential * spread)));
  }
}
