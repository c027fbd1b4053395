package com.scada.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Выполняет операцию по {@link RetryPolicy}.
 * <p>
 * Повторяются только исключения, признанные повторяемыми; после исчерпания попыток
 * пробрасывается последнее исключение, чтобы вызывающий сам решил, что делать
 * (отклонить подтверждение, отбросить публикацию и т. п.).
 */
public class Retrier {

  private static final Logger logger = LoggerFactory.getLogger(Retrier.class);

  private final RetryPolicy policy;
  private final Sleeper sleeper;

  public Retrier(RetryPolicy policy) {
    this(policy, Sleeper.SYSTEM);
  }

  public Retrier(RetryPolicy policy, Sleeper sleeper) {
    this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
  }

  public RetryPolicy policy() {
    return policy;
  }

  /**
   * Выполняет операцию с повторами.
   *
   * @param operation Название операции для логов.
   * @param action    Сама операция.
   * @param retryable Какие исключения повторять.
   * @return Результат первой успешной попытки.
   * @throws RuntimeException последнее исключение, если попытки исчерпаны, ошибка не повторяемая
   *                          или поток прерван во время паузы.
   */
  public <T> T call(String operation, Supplier<T> action, Predicate<RuntimeException> retryable) {
    for (int attempt = 1; ; attempt++) {
      try {
        return action.get();
      } catch (RuntimeException e) {
        if (!retryable.test(e) || attempt >= policy.maxAttempts()) {
          if (retryable.test(e)) {
            logger.warn("Операция '{}' не удалась после {} попыток: {}", operation, attempt, e.getMessage());
          }
          throw e;
        }
        Duration delay = policy.delayAfter(attempt, ThreadLocalRandom.current()::nextDouble);
        logger.debug("Операция '{}': попытка {}/{} не удалась ({}), повтор через {} мс",
            operation, attempt, policy.maxAttempts(), e.getMessage(), delay.toMillis());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          throw e;
        }
      }
    }
  }

  public void run(String operation, Runnable action, Predicate<RuntimeException> retryable) {
    call(operation, () -> {
      action.run();
      return null;
    }, retryable);
  }

  /**
   * Предикат "повторять исключения данного типа".
   */
  public static Predicate<RuntimeException> on(Class<? extends RuntimeException> type) {
    return type::isInstance;
  }
}
