package com.scada.ingest;

import com.scada.bus.InboundMessage;
import com.scada.bus.MessageBus;
import com.scada.db.StorageUnavailableException;
import com.scada.topic.TopicContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Подписывается на {@code {ns}/data/+} и раскладывает сообщения по "полосам" обработки.
 * <p>
 * Полоса — однопоточный исполнитель; датчик всегда попадает в одну и ту же полосу
 * (по хешу топика), поэтому измерения одного датчика обрабатываются по порядку,
 * а разные датчики — параллельно.
 * <p>
 * Очередь полосы ограничена. Сообщение, которому не хватило места, сразу отклоняется
 * с причиной {@code StorageUnavailable}: брокер получает PUBACK, а производитель — отказ
 * в топике подтверждений. Поток шины при этом не блокируется.
 */
public class IngestionAdapter {

  private static final Logger logger = LoggerFactory.getLogger(IngestionAdapter.class);

  public static final int DEFAULT_LANE_CAPACITY = 1000;

  private final MessageBus bus;
  private final TopicContract contract;
  private final IngestionService service;
  private final List<ExecutorService> lanes;
  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicLong overflowed = new AtomicLong();

  public IngestionAdapter(MessageBus bus, TopicContract contract, IngestionService service, int laneCount) {
    this(bus, contract, service, laneCount, DEFAULT_LANE_CAPACITY);
  }

  /**
   * Конструктор адаптера.
   *
   * @param bus          Шина, подключённая под принципалом приёма.
   * @param contract     Иерархия топиков.
   * @param service      Обработка одного сообщения.
   * @param laneCount    Число полос обработки.
   * @param laneCapacity Сколько сообщений может ждать в очереди одной полосы.
   */
  public IngestionAdapter(MessageBus bus, TopicContract contract, IngestionService service,
                          int laneCount, int laneCapacity) {
    if (laneCount < 1) {
      throw new IllegalArgumentException("laneCount must be >= 1: " + laneCount);
    }
    if (laneCapacity < 1) {
      throw new IllegalArgumentException("laneCapacity must be >= 1: " + laneCapacity);
    }
    this.bus = bus;
    this.contract = contract;
    this.service = service;
    this.lanes = new ArrayList<>(laneCount);
    for (int i = 0; i < laneCount; i++) {
      String name = "ingest-lane-" + i;
      lanes.add(new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
          new ArrayBlockingQueue<>(laneCapacity), r -> new Thread(r, name)));
    }
  }

  /**
   * Оформляет подписку. Шина сама повторит её после переподключения.
   */
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    bus.subscribe(contract.readingSubscription(), this::onMessage);
    logger.info("🚀 Приём измерений запущен: '{}', полос обработки: {}", contract.readingSubscription(), lanes.size());
  }

  /**
   * @return {@code false}, если приём остановлен и сообщение нельзя подтверждать брокеру.
   */
  boolean onMessage(InboundMessage message) {
    if (!running.get()) {
      logger.warn("Приём остановлен, сообщение из '{}' не обработано", message.topic());
      return false;
    }
    ExecutorService lane = laneFor(message.topic());
    try {
      lane.execute(() -> handle(message));
      return true;
    } catch (RejectedExecutionException e) {
      if (lane.isShutdown()) {
        logger.warn("Приём останавливается, сообщение из '{}' не обработано", message.topic());
        return false;
      }
      overflowed.incrementAndGet();
      logger.warn("⚠️ Очередь полосы переполнена, сообщение из '{}' отклонено", message.topic());
      refuse(message);
      return true;
    }
  }

  private void refuse(InboundMessage message) {
    try {
      service.refuse(message, StorageUnavailableException.REASON);
    } catch (RuntimeException e) {
      logger.error("❌ Не удалось отклонить сообщение из '{}'", message.topic(), e);
    }
  }

  private void handle(InboundMessage message) {
    try {
      service.process(message);
    } catch (RuntimeException e) {
      // Сбой одного сообщения не должен останавливать полосу.
      logger.error("❌ Непредвиденная ошибка обработки сообщения из '{}'", message.topic(), e);
    }
  }

  ExecutorService laneFor(String topic) {
    return lanes.get(Math.floorMod(topic.hashCode(), lanes.size()));
  }

  /**
   * Прекращает приём и даёт уже принятым сообщениям завершиться, но не дольше {@code drainTimeout}.
   */
  public void stop(Duration drainTimeout) {
    if (!running.compareAndSet(true, false)) {
      lanes.forEach(ExecutorService::shutdownNow);
      return;
    }
    lanes.forEach(ExecutorService::shutdown);
    long deadline = System.nanoTime() + drainTimeout.toNanos();
    try {
      for (ExecutorService lane : lanes) {
        long left = deadline - System.nanoTime();
        if (left <= 0 || !lane.awaitTermination(left, TimeUnit.NANOSECONDS)) {
          logger.warn("Полоса обработки не завершилась за {} мс, остаток прерван", drainTimeout.toMillis());
          lane.shutdownNow();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      lanes.forEach(ExecutorService::shutdownNow);
    }
    logger.info("Приём измерений остановлен");
  }

  public boolean isRunning() {
    return running.get();
  }

  /** Сколько сообщений отклонено из-за переполненной очереди полосы. */
  public long overflowedCount() {
    return overflowed.get();
  }
}
