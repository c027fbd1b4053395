package com.scada.codec;

import com.scada.PipelineException;

/**
 * Полезная нагрузка не соответствует схеме измерения.
 */
public class MalformedPayloadException extends PipelineException {

  public static final String REASON = "MalformedPayload";

  public MalformedPayloadException(String message) {
    super(message);
  }

  public MalformedPayloadException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String reason() {
    return REASON;
  }
}
