package com.scada.prediction;

import com.scada.PipelineException;

/**
 * Истории недостаточно для обучения. Не ошибка системы: данных "пока мало".
 */
public class InsufficientDataException extends PipelineException {

  public static final String REASON = "InsufficientData";

  public InsufficientDataException(String message) {
    super(message);
  }

  @Override
  public String reason() {
    return REASON;
  }
}
