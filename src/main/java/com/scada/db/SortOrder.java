package com.scada.db;

/**
 * Порядок выдачи истории по времени измерения.
 */
public enum SortOrder {
  /** Сначала старые. */
  ASCENDING("ASC"),
  /** Сначала новые. */
  DESCENDING("DESC");

  private final String sql;

  SortOrder(String sql) {
    this.sql = sql;
  }

  String sql() {
    return sql;
  }
}
