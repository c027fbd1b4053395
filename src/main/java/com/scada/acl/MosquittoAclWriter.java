package com.scada.acl;

/**
 * Выводит политику доступа в формате {@code acl_file} Mosquitto, чтобы брокер и конвейер
 * работали по одной и той же таблице.
 */
public final class MosquittoAclWriter {

  private MosquittoAclWriter() {
    throw new UnsupportedOperationException("Utility class");
  }

  public static String render(AccessPolicy policy) {
    StringBuilder sb = new StringBuilder("# Сгенерировано из политики доступа конвейера\n");
    for (String principal : policy.principals()) {
      sb.append('\n').append("user ").append(principal).append('\n');
      for (Grant grant : policy.grants(principal)) {
        sb.append("topic ").append(grant.direction().wireName()).append(' ').append(grant.pattern()).append('\n');
      }
    }
    return sb.toString();
  }
}
