package com.scada.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Одно измерение датчика.
 * <p>
 * Естественный ключ — пара ({@code timestamp}, {@code entityId}). Повторная доставка
 * той же пары перезаписывает {@code value} и {@code quality}, новая строка не создаётся.
 *
 * @param entityId  Идентификатор датчика (например, "pressure-1").
 * @param timestamp Момент измерения.
 * @param value     Измеренное значение.
 * @param quality   Оценка достоверности 0–100.
 */
public record Reading(String entityId, Instant timestamp, double value, int quality) {

  public static final int MIN_QUALITY = 0;
  public static final int MAX_QUALITY = 100;
  public static final int DEFAULT_QUALITY = MAX_QUALITY;

  public Reading {
    Objects.requireNonNull(entityId, "entityId cannot be null");
    Objects.requireNonNull(timestamp, "timestamp cannot be null");
    if (entityId.isBlank()) {
      throw new IllegalArgumentException("entityId cannot be blank");
    }
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("value must be finite: " + value);
    }
    if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
      throw new IllegalArgumentException("quality must be within 0..100: " + quality);
    }
  }
}
