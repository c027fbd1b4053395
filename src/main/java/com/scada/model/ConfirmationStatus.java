package com.scada.model;

/**
 * Итог приёма одного входящего сообщения.
 */
public enum ConfirmationStatus {
  ACCEPTED("accepted"),
  REJECTED("rejected");

  private final String wireName;

  ConfirmationStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
