package com.scada.publish;

import com.scada.acl.AccessDeniedException;
import com.scada.acl.AccessPolicy;
import com.scada.bus.BrokerUnavailableException;
import com.scada.bus.MessageBus;
import com.scada.codec.PayloadCodec;
import com.scada.model.Confirmation;
import com.scada.model.Prediction;
import com.scada.model.Reading;
import com.scada.retry.Retrier;
import com.scada.topic.TopicContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Публикация прогнозов, подтверждений и (для симулятора) измерений в шину.
 * <p>
 * Публикации выполняются в отдельном потоке "publisher" с повторами по политике повторов;
 * после исчерпания попыток сообщение записывается в лог и отбрасывается: потерянный прогноз —
 * устаревшие данные, следующий цикл инференса его заменит.
 * <p>
 * Очередь ожидающих публикаций ограничена; публикация в полную очередь сразу отбрасывается.
 */
public class PublicationAdapter implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(PublicationAdapter.class);

  public static final int DEFAULT_QUEUE_CAPACITY = 1000;

  private final MessageBus bus;
  private final Retrier retrier;
  private final PayloadCodec codec;
  private final TopicContract contract;
  private final AccessPolicy policy;
  private final String principal;
  private final ExecutorService executor;

  public PublicationAdapter(MessageBus bus, Retrier retrier, PayloadCodec codec,
                            TopicContract contract, AccessPolicy policy, String principal) {
    this(bus, retrier, codec, contract, policy, principal, DEFAULT_QUEUE_CAPACITY);
  }

  /**
   * Конструктор адаптера.
   *
   * @param bus           Шина, подключённая под учётной записью {@code principal}.
   * @param retrier       Повторы при недоступности брокера.
   * @param codec         Кодек полезных нагрузок.
   * @param contract      Иерархия топиков.
   * @param policy        Политика доступа.
   * @param principal     Принципал, от имени которого идут публикации.
   * @param queueCapacity Сколько публикаций может ждать отправки.
   */
  public PublicationAdapter(MessageBus bus, Retrier retrier, PayloadCodec codec,
                            TopicContract contract, AccessPolicy policy, String principal, int queueCapacity) {
    if (queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be >= 1: " + queueCapacity);
    }
    this.bus = Objects.requireNonNull(bus, "bus cannot be null");
    this.retrier = Objects.requireNonNull(retrier, "retrier cannot be null");
    this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    this.contract = Objects.requireNonNull(contract, "contract cannot be null");
    this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    this.principal = Objects.requireNonNull(principal, "principal cannot be null");
    this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity), r -> {
          Thread t = new Thread(r, "publisher-" + principal);
          t.setDaemon(true);
          return t;
        });
  }

  public CompletableFuture<Boolean> publishReading(Reading reading) {
    return publish(contract.readingTopic(reading.entityId()), codec.encodeReading(reading));
  }

  public CompletableFuture<Boolean> publishPrediction(Prediction prediction) {
    return publish(contract.predictionTopic(prediction.entityId()), codec.encodePrediction(prediction));
  }

  public CompletableFuture<Boolean> publishConfirmation(Confirmation confirmation) {
    return publish(contract.confirmationTopic(confirmation.entityId()), codec.encodeConfirmation(confirmation));
  }

  /**
   * Публикует сообщение с доставкой "хотя бы один раз".
   *
   * @return {@code true}, если брокер подтвердил приём; {@code false}, если публикация отброшена
   *         (нет прав на топик, попытки исчерпаны, очередь полна, адаптер закрыт).
   */
  public CompletableFuture<Boolean> publish(String topic, byte[] payload) {
    try {
      policy.checkPublish(principal, topic);
    } catch (AccessDeniedException e) {
      logger.error("❌ Публикация отклонена политикой доступа: {}", e.getMessage());
      return CompletableFuture.completedFuture(false);
    }
    try {
      return CompletableFuture.supplyAsync(() -> publishWithRetry(topic, payload), executor);
    } catch (RejectedExecutionException e) {
      if (executor.isShutdown()) {
        logger.warn("Адаптер публикации остановлен, сообщение в '{}' отброшено", topic);
      } else {
        logger.warn("⚠️ Очередь публикаций переполнена, сообщение в '{}' отброшено", topic);
      }
      return CompletableFuture.completedFuture(false);
    }
  }

  private boolean publishWithRetry(String topic, byte[] payload) {
    try {
      retrier.run("публикация в " + topic, () -> bus.publish(topic, payload),
          Retrier.on(BrokerUnavailableException.class));
      logger.debug("Опубликовано в {}", topic);
      return true;
    } catch (BrokerUnavailableException e) {
      logger.error("❌ Сообщение в '{}' отброшено после {} попыток: {}",
          topic, retrier.policy().maxAttempts(), e.getMessage());
      return false;
    }
  }

  /**
   * Дожидается уже поставленных публикаций, но не дольше {@code timeoutMillis}.
   */
  public void drain(long timeoutMillis) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        logger.warn("Не все публикации завершились за {} мс, остаток отброшен", timeoutMillis);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  @Override
  public void close() {
    drain(0);
  }
}
