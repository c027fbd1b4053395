package com.scada.topic;

import java.util.Objects;

/**
 * Иерархия топиков конвейера. Все топики лежат под общим префиксом пространства имён.
 * <pre>
 * {ns}/data/{entity_id}                 — сырые измерения
 * {ns}/data/{entity_id}/confirmation    — подтверждения приёма
 * {ns}/predictions/{entity_id}          — прогнозы
 * {ns}/alarms/{entity_id}               — зарезервировано
 * {ns}/recommendations/{entity_id}      — зарезервировано
 * {ns}/control/{entity_id}              — команды HMI, конвейер не читает
 * </pre>
 */
public final class TopicContract {

  public static final String DEFAULT_NAMESPACE = "ai_scada";

  public static final String DATA = "data";
  public static final String CONFIRMATION = "confirmation";
  public static final String PREDICTIONS = "predictions";
  public static final String ALARMS = "alarms";
  public static final String RECOMMENDATIONS = "recommendations";
  public static final String CONTROL = "control";

  private final String namespace;

  public TopicContract(String namespace) {
    Objects.requireNonNull(namespace, "namespace cannot be null");
    if (namespace.isBlank() || namespace.startsWith("/") || namespace.endsWith("/")
        || namespace.contains(TopicPattern.SINGLE_LEVEL) || namespace.contains(TopicPattern.MULTI_LEVEL)) {
      throw new IllegalArgumentException("Некорректное пространство имён топиков: '" + namespace + "'");
    }
    this.namespace = namespace;
  }

  public String namespace() {
    return namespace;
  }

  public String readingTopic(String entityId) {
    return namespace + "/" + DATA + "/" + checkEntity(entityId);
  }

  public String confirmationTopic(String entityId) {
    return readingTopic(entityId) + "/" + CONFIRMATION;
  }

  public String predictionTopic(String entityId) {
    return namespace + "/" + PREDICTIONS + "/" + checkEntity(entityId);
  }

  public String alarmTopic(String entityId) {
    return namespace + "/" + ALARMS + "/" + checkEntity(entityId);
  }

  public String recommendationTopic(String entityId) {
    return namespace + "/" + RECOMMENDATIONS + "/" + checkEntity(entityId);
  }

  public String controlTopic(String entityId) {
    return namespace + "/" + CONTROL + "/" + checkEntity(entityId);
  }

  /**
   * Подписка адаптера приёма: один уровень под {@code data}, все датчики.
   */
  public TopicPattern readingSubscription() {
    return TopicPattern.parse(namespace + "/" + DATA + "/" + TopicPattern.SINGLE_LEVEL);
  }

  public TopicPattern confirmationPattern() {
    return TopicPattern.parse(namespace + "/" + DATA + "/" + TopicPattern.SINGLE_LEVEL + "/" + CONFIRMATION);
  }

  public TopicPattern predictionPattern() {
    return TopicPattern.parse(namespace + "/" + PREDICTIONS + "/" + TopicPattern.SINGLE_LEVEL);
  }

  /**
   * Шаблон с подставленным пространством имён: "%ns%/data/+" → "ai_scada/data/+".
   */
  public TopicPattern resolve(String template) {
    return TopicPattern.parse(template.replace("%ns%", namespace));
  }

  /**
   * Извлекает идентификатор датчика из топика измерения.
   *
   * @param topic Топик вида "{ns}/data/{entity_id}".
   * @return Идентификатор датчика.
   * @throws MalformedTopicException если топик вне {@code {ns}/data/}, суффикс пуст или сегментов больше одного.
   */
  public String entityFromReadingTopic(String topic) {
    if (topic == null) {
      throw new MalformedTopicException("Топик отсутствует");
    }
    String prefix = namespace + "/" + DATA + "/";
    if (!topic.startsWith(prefix)) {
      throw new MalformedTopicException("Топик вне '" + prefix + "': " + topic);
    }
    String suffix = topic.substring(prefix.length());
    if (suffix.isBlank()) {
      throw new MalformedTopicException("В топике нет идентификатора датчика: '" + topic + "'");
    }
    if (suffix.contains("/")) {
      throw new MalformedTopicException("Лишние сегменты после идентификатора датчика: " + topic);
    }
    if (suffix.contains(TopicPattern.SINGLE_LEVEL) || suffix.contains(TopicPattern.MULTI_LEVEL)) {
      throw new MalformedTopicException("Шаблонный символ в идентификаторе датчика: " + topic);
    }
    return suffix;
  }

  private static String checkEntity(String entityId) {
    Objects.requireNonNull(entityId, "entityId cannot be null");
    if (entityId.isBlank() || entityId.contains("/")
        || entityId.contains(TopicPattern.SINGLE_LEVEL) || entityId.contains(TopicPattern.MULTI_LEVEL)) {
      throw new IllegalArgumentException("Идентификатор датчика должен быть одним сегментом топика: '" + entityId + "'");
    }
    return entityId;
  }
}
