package com.scada.bus;

/**
 * Получатель сообщений подписки. Вызывается в потоке ввода-вывода шины,
 * поэтому должен быстро передать работу дальше.
 */
@FunctionalInterface
public interface MessageHandler {

  /**
   * @return {@code false}, если сообщение не принято и подтверждать его брокеру нельзя.
   */
  boolean onMessage(InboundMessage message);
}
