package com.scada.topic;

import com.scada.PipelineException;

/**
 * Топик не соответствует контракту: нет идентификатора датчика, лишние сегменты
 * или топик вне пространства имён.
 */
public class MalformedTopicException extends PipelineException {

  public static final String REASON = "MalformedTopic";

  public MalformedTopicException(String message) {
    super(message);
  }

  @Override
  public String reason() {
    return REASON;
  }
}
