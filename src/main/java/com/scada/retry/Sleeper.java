package com.scada.retry;

import java.time.Duration;

/**
 * Пауза между попытками. Отдельный интерфейс, чтобы тесты не ждали реального времени.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
