package com.scada.bus;

import com.scada.PipelineException;

/**
 * Брокер недоступен: нет соединения, не пришло подтверждение или брокер отказал.
 */
public class BrokerUnavailableException extends PipelineException {

  public static final String REASON = "BrokerUnavailable";

  public BrokerUnavailableException(String message) {
    super(message);
  }

  public BrokerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String reason() {
    return REASON;
  }
}
