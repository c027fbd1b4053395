package com.scada.prediction;

import com.scada.PipelineException;

/**
 * Обучение завершилось ошибкой. Текущая модель при этом остаётся активной.
 */
public class TrainerException extends PipelineException {

  public static final String REASON = "TrainerError";

  public TrainerException(String message) {
    super(message);
  }

  public TrainerException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String reason() {
    return REASON;
  }
}
