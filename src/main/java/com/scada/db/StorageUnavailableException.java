package com.scada.db;

import com.scada.PipelineException;

/**
 * Хранилище временных рядов недоступно (нет соединения, ошибка выполнения запроса).
 */
public class StorageUnavailableException extends PipelineException {

  public static final String REASON = "StorageUnavailable";

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String reason() {
    return REASON;
  }
}
