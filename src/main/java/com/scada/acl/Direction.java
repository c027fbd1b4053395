package com.scada.acl;

import java.util.Locale;

/**
 * Направление доступа к топику в терминах брокера.
 */
public enum Direction {
  READ("read"),
  WRITE("write"),
  READWRITE("readwrite");

  private final String wireName;

  Direction(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Покрывает ли выданное право запрошенное направление.
   */
  public boolean allows(Direction requested) {
    return this == READWRITE || this == requested;
  }

  public static Direction parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("direction cannot be null");
    }
    for (Direction d : values()) {
      if (d.wireName.equals(text.trim().toLowerCase(Locale.ROOT))) {
        return d;
      }
    }
    throw new IllegalArgumentException("Неизвестное направление доступа: '" + text + "'");
  }
}
