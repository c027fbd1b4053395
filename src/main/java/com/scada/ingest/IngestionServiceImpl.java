package com.scada.ingest;

import com.scada.bus.InboundMessage;
import com.scada.codec.MalformedPayloadException;
import com.scada.codec.PayloadCodec;
import com.scada.db.ReadingWriter;
import com.scada.db.StorageUnavailableException;
import com.scada.model.Confirmation;
import com.scada.model.Reading;
import com.scada.publish.PublicationAdapter;
import com.scada.retry.Retrier;
import com.scada.topic.MalformedTopicException;
import com.scada.topic.TopicContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Реализация сервиса приёма измерений.
 * <p>
 * Запись в БД выполняется синхронно внутри обработки сообщения, подтверждение
 * публикуется только после неё.
 */
public class IngestionServiceImpl implements IngestionService {

  private static final Logger logger = LoggerFactory.getLogger(IngestionServiceImpl.class);

  private final TopicContract contract;
  private final PayloadCodec codec;
  private final ReadingWriter writer;
  private final Retrier retrier;
  private final PublicationAdapter publisher;

  private final AtomicLong accepted = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();

  /**
   * Конструктор сервиса.
   *
   * @param contract  Иерархия топиков.
   * @param codec     Кодек полезных нагрузок.
   * @param writer    Запись измерений в БД.
   * @param retrier   Повторы записи при недоступности БД.
   * @param publisher Публикация подтверждений.
   */
  public IngestionServiceImpl(TopicContract contract, PayloadCodec codec, ReadingWriter writer,
                              Retrier retrier, PublicationAdapter publisher) {
    this.contract = contract;
    this.codec = codec;
    this.writer = writer;
    this.retrier = retrier;
    this.publisher = publisher;
  }

  @Override
  public Optional<Confirmation> process(InboundMessage message) {
    if (message == null) {
      throw new IllegalArgumentException("Message cannot be null");
    }

    // 1. Датчик из топика
    String entityId;
    try {
      entityId = contract.entityFromReadingTopic(message.topic());
    } catch (MalformedTopicException e) {
      rejected.incrementAndGet();
      logger.warn("❌ {}: {}", e.reason(), e.getMessage());
      return Optional.empty();
    }

    // 2. Разбор нагрузки
    Reading reading;
    try {
      reading = codec.decodeReading(entityId, message.payload());
    } catch (MalformedPayloadException e) {
      logger.warn("❌ Измерение от {} отклонено ({}): {}", entityId, e.reason(), e.getMessage());
      return Optional.of(reject(entityId, message, e.reason()));
    }

    // 3. Запись в БД с повторами
    try {
      retrier.run("запись измерения " + entityId, () -> writer.upsert(reading),
          Retrier.on(StorageUnavailableException.class));
    } catch (StorageUnavailableException e) {
      logger.error("❌ Измерение от {} на {} не сохранено: {}", entityId, reading.timestamp(), e.getMessage());
      return Optional.of(reject(entityId, message, e.reason()));
    }

    // 4. Подтверждение
    Confirmation confirmation = Confirmation.accepted(reading);
    publisher.publishConfirmation(confirmation);
    accepted.incrementAndGet();
    logger.debug("✅ Измерение от {} сохранено: {} = {}", entityId, reading.timestamp(), reading.value());
    return Optional.of(confirmation);
  }

  @Override
  public Optional<Confirmation> refuse(InboundMessage message, String reason) {
    String entityId;
    try {
      entityId = contract.entityFromReadingTopic(message.topic());
    } catch (MalformedTopicException e) {
      rejected.incrementAndGet();
      logger.warn("❌ {}: {}", e.reason(), e.getMessage());
      return Optional.empty();
    }
    return Optional.of(reject(entityId, message, reason));
  }

  private Confirmation reject(String entityId, InboundMessage message, String reason) {
    Confirmation confirmation = Confirmation.rejected(entityId, codec.peekTimestamp(message.payload()), reason);
    publisher.publishConfirmation(confirmation);
    rejected.incrementAndGet();
    return confirmation;
  }

  public long acceptedCount() {
    return accepted.get();
  }

  public long rejectedCount() {
    return rejected.get();
  }
}
