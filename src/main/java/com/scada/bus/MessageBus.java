package com.scada.bus;

import com.scada.topic.TopicPattern;

/**
 * Шина публикации/подписки с доставкой "хотя бы один раз".
 * <p>
 * Одна шина — одно соединение под учётной записью одного принципала.
 */
public interface MessageBus extends AutoCloseable {

  /**
   * Подключается к брокеру, повторяя попытки по политике повторов.
   *
   * @throws BrokerUnavailableException если все попытки исчерпаны.
   */
  void connect();

  /**
   * Регистрирует подписку. Подписки запоминаются и повторяются после каждого переподключения.
   *
   * @throws BrokerUnavailableException если брокер недоступен или отклонил подписку.
   */
  void subscribe(TopicPattern pattern, MessageHandler handler);

  /**
   * Публикует сообщение и ждёт подтверждения брокера.
   *
   * @throws BrokerUnavailableException если соединения нет или подтверждение не пришло вовремя.
   */
  void publish(String topic, byte[] payload);

  boolean isConnected();

  @Override
  void close();
}
