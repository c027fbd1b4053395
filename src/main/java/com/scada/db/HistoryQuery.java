package com.scada.db;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Запрос истории измерений.
 *
 * @param entities Какие датчики нужны; пустое множество — все.
 * @param from     Нижняя граница времени включительно, {@code null} — без границы.
 * @param to       Верхняя граница времени не включительно, {@code null} — без границы.
 * @param limit    Максимум строк (больше нуля).
 * @param order    Порядок по времени.
 */
public record HistoryQuery(Set<String> entities, Instant from, Instant to, int limit, SortOrder order) {

  public HistoryQuery {
    entities = entities == null ? Set.of() : Set.copyOf(entities);
    Objects.requireNonNull(order, "order cannot be null");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    if (from != null && to != null && from.isAfter(to)) {
      throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
    }
  }

  /**
   * Последние {@code limit} измерений одного датчика, начиная с {@code from}, новые первыми.
   */
  public static HistoryQuery latest(String entityId, Instant from, int limit) {
    return new HistoryQuery(Set.of(entityId), from, null, limit, SortOrder.DESCENDING);
  }

  /**
   * Окно [from, to) по набору датчиков, старые первыми.
   */
  public static HistoryQuery window(Set<String> entities, Instant from, Instant to, int limit) {
    return new HistoryQuery(entities, from, to, limit, SortOrder.ASCENDING);
  }

  public HistoryQuery withLimit(int newLimit) {
    return new HistoryQuery(entities, from, to, newLimit, order);
  }
}
