package com.scada.topic;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Иерархический шаблон топика MQTT: сегменты через {@code /}, {@code +} — ровно один сегмент,
 * {@code #} — любой хвост (в том числе пустой), допустим только последним сегментом.
 * <p>
 * Один и тот же тип используется для маршрутизации подписок и для проверки прав доступа.
 */
public final class TopicPattern {

  public static final String SINGLE_LEVEL = "+";
  public static final String MULTI_LEVEL = "#";

  private final String text;
  private final List<String> segments;

  private TopicPattern(String text, List<String> segments) {
    this.text = text;
    this.segments = segments;
  }

  /**
   * Разбирает шаблон.
   *
   * @param pattern Строка шаблона, например "ai_scada/data/+".
   * @return Разобранный шаблон.
   * @throws IllegalArgumentException если шаблон пуст или {@code #}/{@code +} стоят не на своём месте.
   */
  public static TopicPattern parse(String pattern) {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    if (pattern.isEmpty()) {
      throw new IllegalArgumentException("Шаблон топика не может быть пустым");
    }
    List<String> segments = Arrays.asList(pattern.split("/", -1));
    for (int i = 0; i < segments.size(); i++) {
      String segment = segments.get(i);
      if (segment.contains(MULTI_LEVEL) && (!segment.equals(MULTI_LEVEL) || i != segments.size() - 1)) {
        throw new IllegalArgumentException("'#' допустим только как последний сегмент: " + pattern);
      }
      if (segment.contains(SINGLE_LEVEL) && !segment.equals(SINGLE_LEVEL)) {
        throw new IllegalArgumentException("'+' должен занимать сегмент целиком: " + pattern);
      }
    }
    return new TopicPattern(pattern, List.copyOf(segments));
  }

  /**
   * Проверяет, что конкретный топик (без шаблонных символов) подходит под шаблон.
   */
  public boolean matches(String topic) {
    Objects.requireNonNull(topic, "topic cannot be null");
    String[] parts = topic.split("/", -1);
    for (int i = 0; i < segments.size(); i++) {
      String segment = segments.get(i);
      if (segment.equals(MULTI_LEVEL)) {
        return true;
      }
      if (i >= parts.length) {
        return false;
      }
      if (!segment.equals(SINGLE_LEVEL) && !segment.equals(parts[i])) {
        return false;
      }
    }
    return parts.length == segments.size();
  }

  /**
   * Проверяет, что любой топик, подходящий под {@code other}, подходит и под этот шаблон.
   * Нужна для проверки "объявленный трафик компонента ⊆ выданные права".
   */
  public boolean covers(TopicPattern other) {
    List<String> mine = segments;
    List<String> theirs = other.segments;
    for (int i = 0; i < mine.size(); i++) {
      String segment = mine.get(i);
      if (segment.equals(MULTI_LEVEL)) {
        return true;
      }
      if (i >= theirs.size()) {
        return false;
      }
      String their = theirs.get(i);
      if (their.equals(MULTI_LEVEL)) {
        return false;
      }
      if (segment.equals(SINGLE_LEVEL)) {
        continue;
      }
      if (their.equals(SINGLE_LEVEL) || !segment.equals(their)) {
        return false;
      }
    }
    return mine.size() == theirs.size();
  }

  public boolean isWildcard() {
    return text.contains(SINGLE_LEVEL) || text.contains(MULTI_LEVEL);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TopicPattern)) return false;
    return text.equals(((TopicPattern) o).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
