package com.scada.bus;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Сообщение, полученное из шины.
 *
 * @param topic   Конкретный топик публикации.
 * @param payload Тело сообщения (копия, владеет получатель).
 */
public record InboundMessage(String topic, byte[] payload) {

  public InboundMessage {
    Objects.requireNonNull(topic, "topic cannot be null");
    Objects.requireNonNull(payload, "payload cannot be null");
  }

  public String text() {
    return new String(payload, StandardCharsets.UTF_8);
  }
}
