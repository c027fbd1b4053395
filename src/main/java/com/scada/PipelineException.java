package com.scada;

/**
 * Базовое исключение конвейера.
 * <p>
 * {@link #reason()} — имя вида ошибки, которое уходит в поле {@code reason}
 * отклонённого подтверждения и в логи.
 */
public abstract class PipelineException extends RuntimeException {

  protected PipelineException(String message) {
    super(message);
  }

  protected PipelineException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract String reason();
}
