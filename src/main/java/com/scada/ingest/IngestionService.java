package com.scada.ingest;

import com.scada.bus.InboundMessage;
import com.scada.model.Confirmation;

import java.util.Optional;

/**
 * Сервис для обработки входящих измерений от датчиков.
 * <p>
 * Отвечает за разбор сообщения, сохранение измерения в БД и публикацию подтверждения.
 */
public interface IngestionService {

  /**
   * Обрабатывает одно сообщение из шины. Никогда не бросает исключений из-за содержимого сообщения
   * или недоступности хранилища: любой сбой превращается в отклонённое подтверждение.
   *
   * @param message Сообщение из топика {@code {ns}/data/{entity_id}}.
   * @return Опубликованное подтверждение; пустое, если из топика нельзя извлечь датчик
   *         (подтверждение некуда отправить).
   */
  Optional<Confirmation> process(InboundMessage message);

  /**
   * Отклоняет сообщение, не пытаясь его сохранить (например, когда очередь обработки переполнена).
   * Реализация по умолчанию подтверждений не публикует.
   *
   * @param message Сообщение из топика {@code {ns}/data/{entity_id}}.
   * @param reason  Причина для поля {@code reason} подтверждения.
   * @return Опубликованное отклонённое подтверждение, если его было куда отправить.
   */
  default Optional<Confirmation> refuse(InboundMessage message, String reason) {
    return Optional.empty();
  }
}
