package com.scada.prediction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Периодическая задача: поток-таймер отдаёт работу одному рабочему потоку.
 * <p>
 * Если к очередному тику рабочий поток ещё занят, тик пропускается, очередь не копится.
 */
public class PeriodicTask {

  private static final Logger logger = LoggerFactory.getLogger(PeriodicTask.class);

  private final String name;
  private final Duration initialDelay;
  private final Duration period;
  private final Runnable action;

  private final ScheduledExecutorService ticker;
  private final ExecutorService worker;
  private final AtomicBoolean busy = new AtomicBoolean();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicLong skipped = new AtomicLong();

  public PeriodicTask(String name, Duration initialDelay, Duration period, Runnable action) {
    if (period.isZero() || period.isNegative()) {
      throw new IllegalArgumentException("period must be positive: " + period);
    }
    this.name = name;
    this.initialDelay = initialDelay;
    this.period = period;
    this.action = action;
    this.ticker = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, name + "-ticker"));
    this.worker = Executors.newSingleThreadExecutor(r -> daemon(r, name + "-worker"));
  }

  private static Thread daemon(Runnable r, String threadName) {
    Thread t = new Thread(r, threadName);
    t.setDaemon(true);
    return t;
  }

  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    ticker.scheduleAtFixedRate(this::tick, initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    logger.info("Задача '{}' запущена: первый запуск через {} с, период {} с",
        name, initialDelay.toSeconds(), period.toSeconds());
  }

  void tick() {
    if (!busy.compareAndSet(false, true)) {
      skipped.incrementAndGet();
      logger.warn("⚠️ Задача '{}' ещё выполняется, тик пропущен", name);
      return;
    }
    try {
      worker.execute(this::runOnce);
    } catch (RejectedExecutionException e) {
      busy.set(false);
      logger.debug("Задача '{}' остановлена, тик не выполнен", name);
    }
  }

  private void runOnce() {
    try {
      action.run();
    } catch (RuntimeException e) {
      logger.error("❌ Задача '{}' завершилась ошибкой", name, e);
    } finally {
      busy.set(false);
    }
  }

  /**
   * Сколько тиков пропущено из-за того, что предыдущий запуск ещё не закончился.
   */
  public long skippedTicks() {
    return skipped.get();
  }

  public boolean isBusy() {
    return busy.get();
  }

  /**
   * Останавливает таймер и ждёт текущий запуск не дольше {@code timeout}, затем прерывает его.
   */
  public void stop(Duration timeout) {
    ticker.shutdownNow();
    worker.shutdown();
    try {
      if (!worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("Задача '{}' не завершилась за {} мс, прерываем", name, timeout.toMillis());
        worker.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      worker.shutdownNow();
    }
    logger.info("Задача '{}' остановлена", name);
  }
}
