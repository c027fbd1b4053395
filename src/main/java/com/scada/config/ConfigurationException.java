package com.scada.config;

import com.scada.PipelineException;

import java.util.List;

/**
 * Некорректная конфигурация при старте. Единственная фатальная ошибка конвейера.
 */
public class ConfigurationException extends PipelineException {

  public static final String REASON = "InvalidConfiguration";

  private final List<String> problems;

  public ConfigurationException(String message) {
    this(List.of(message));
  }

  public ConfigurationException(List<String> problems) {
    super("Конфигурация некорректна: " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> problems() {
    return problems;
  }

  @Override
  public String reason() {
    return REASON;
  }
}
