package com.scada.config;

import com.scada.prediction.TrainingMode;
import com.scada.retry.RetryPolicy;
import com.scada.topic.TopicContract;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Полный набор настроек конвейера, прочитанный и проверенный один раз при старте.
 * <p>
 * Все ошибки собираются вместе и отдаются одним {@link ConfigurationException}:
 * процесс не должен стартовать в частично настроенном состоянии.
 */
public final class PipelineSettings {

  /** Подключение к брокеру MQTT под учётной записью одного принципала. */
  public record MqttSettings(
      String host,
      int port,
      String clientId,
      String username,
      String password,
      Duration keepAlive,
      Duration ackTimeout
  ) {

    public MqttSettings withIdentity(String clientId, String username, String password) {
      return new MqttSettings(host, port, clientId, username, password, keepAlive, ackTimeout);
    }
  }

  public record DatabaseSettings(String url, String user, String password) {
  }

  /**
   * @param lanes        Число полос обработки.
   * @param laneCapacity Сколько сообщений может ждать в очереди одной полосы.
   * @param drainTimeout Сколько ждать обработки принятых сообщений при остановке.
   */
  public record IngestSettings(int lanes, int laneCapacity, Duration drainTimeout) {
  }

  public record PredictionSettings(
      Duration trainingInterval,
      Duration inferenceInterval,
      Duration trainingWindow,
      int trainingLimit,
      int inferenceLookback,
      Duration horizon,
      List<String> entities,
      TrainingMode mode,
      int minSamples
  ) {
  }

  /** Имена принципалов ACL, под которыми работают компоненты. */
  public record Principals(String ingest, String prediction, String simulator) {
  }

  private final MqttSettings mqtt;
  private final DatabaseSettings database;
  private final String namespace;
  private final String aclPolicyLocation;
  private final Principals principals;
  private final RetryPolicy retryPolicy;
  private final IngestSettings ingest;
  private final int historyMaxLimit;
  private final int publishQueueCapacity;
  private final PredictionSettings prediction;
  private final Duration simulatorInterval;
  private final Map<String, String> passwords = new HashMap<>();

  private PipelineSettings(Reader r) {
    this.principals = new Principals(
        r.optional("acl.principal.ingest", "api-service"),
        r.optional("acl.principal.prediction", "automl-service"),
        r.optional("acl.principal.simulator", "simulator")
    );
    String defaultPassword = r.optional("mqtt.password", "");
    for (String principal : List.of(principals.ingest(), principals.prediction(), principals.simulator())) {
      String password = r.optional("mqtt.password." + principal, defaultPassword);
      // симулятор запускается только по флагу, его пароль проверяется в mqttFor
      if (password.isEmpty() && !principal.equals(principals.simulator())) {
        r.problems.add("не задан пароль MQTT для принципала '" + principal
            + "' (mqtt.password." + principal + " или mqtt.password)");
      }
      passwords.put(principal, password);
    }
    String clientId = r.optional("mqtt.client.id", "scada-pipeline");
    this.mqtt = new MqttSettings(
        r.required("mqtt.host"),
        r.intValue("mqtt.port", 1883, 1, 65535),
        clientId,
        principals.ingest(),
        passwords.get(principals.ingest()),
        Duration.ofSeconds(r.intValue("mqtt.keepalive.seconds", 60, 0, 65535)),
        Duration.ofMillis(r.intValue("mqtt.ack.timeout.ms", 5000, 1, Integer.MAX_VALUE))
    );
    this.database = new DatabaseSettings(
        r.required("db.url"),
        r.required("db.user"),
        r.present("db.password")
    );
    this.namespace = r.optional("topic.namespace", TopicContract.DEFAULT_NAMESPACE);
    this.aclPolicyLocation = r.optional("acl.policy", "classpath:acl-policy.json");
    this.retryPolicy = r.retryPolicy();
    this.ingest = new IngestSettings(
        r.intValue("ingest.lanes", 4, 1, 256),
        r.intValue("ingest.lane.capacity", 1000, 1, 1_000_000),
        Duration.ofMillis(r.intValue("ingest.drain.timeout.ms", 5000, 0, Integer.MAX_VALUE))
    );
    this.historyMaxLimit = r.intValue("history.max.limit", 10_000, 1, Integer.MAX_VALUE);
    this.publishQueueCapacity = r.intValue("publish.queue.capacity", 1000, 1, 1_000_000);
    this.prediction = new PredictionSettings(
        Duration.ofSeconds(r.intValue("prediction.training.interval.seconds", 600, 1, Integer.MAX_VALUE)),
        Duration.ofSeconds(r.intValue("prediction.inference.interval.seconds", 30, 1, Integer.MAX_VALUE)),
        Duration.ofMinutes(r.intValue("prediction.training.window.minutes", 1440, 1, Integer.MAX_VALUE)),
        r.intValue("prediction.training.limit", 10_000, 1, Integer.MAX_VALUE),
        r.intValue("prediction.inference.lookback", 4, 1, 1000),
        Duration.ofSeconds(r.intValue("prediction.horizon.seconds", 30, 0, Integer.MAX_VALUE)),
        r.list("prediction.entities"),
        r.trainingMode(),
        r.intValue("prediction.min.samples", 10, 1, Integer.MAX_VALUE)
    );
    this.simulatorInterval = Duration.ofSeconds(r.intValue("simulator.interval.seconds", 5, 1, Integer.MAX_VALUE));

    if (prediction.trainingLimit() > historyMaxLimit) {
      r.problems.add("prediction.training.limit (" + prediction.trainingLimit()
          + ") превышает history.max.limit (" + historyMaxLimit + ")");
    }
    if (!r.problems.isEmpty()) {
      throw new ConfigurationException(r.problems);
    }
  }

  /**
   * Читает настройки из {@link Config} (системные свойства, окружение, application.properties).
   *
   * @throws ConfigurationException если обязательные параметры не заданы или значения некорректны.
   */
  public static PipelineSettings load() {
    return from(Config::getProperty);
  }

  /**
   * Читает настройки из произвольного источника.
   */
  public static PipelineSettings from(Function<String, Optional<String>> source) {
    return new PipelineSettings(new Reader(source));
  }

  public MqttSettings mqtt() {
    return mqtt;
  }

  /**
   * Подключение под учётной записью принципала: имя пользователя брокера совпадает с именем
   * принципала в политике доступа, идентификатор клиента получает суффикс принципала.
   */
  public MqttSettings mqttFor(String principal) {
    String password = passwords.get(principal);
    if (password == null) {
      throw new IllegalArgumentException("Unknown principal: " + principal);
    }
    if (password.isEmpty()) {
      throw new ConfigurationException("не задан пароль MQTT для принципала '" + principal
          + "' (mqtt.password." + principal + " или mqtt.password)");
    }
    return mqtt.withIdentity(mqtt.clientId() + "-" + principal, principal, password);
  }

  public DatabaseSettings database() {
    return database;
  }

  public String namespace() {
    return namespace;
  }

  public String aclPolicyLocation() {
    return aclPolicyLocation;
  }

  public Principals principals() {
    return principals;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public IngestSettings ingest() {
    return ingest;
  }

  public int historyMaxLimit() {
    return historyMaxLimit;
  }

  /** Сколько публикаций может ждать отправки у одного адаптера публикации. */
  public int publishQueueCapacity() {
    return publishQueueCapacity;
  }

  public PredictionSettings prediction() {
    return prediction;
  }

  public Duration simulatorInterval() {
    return simulatorInterval;
  }

  /**
   * Читает значения и копит ошибки, чтобы сообщить обо всех сразу.
   */
  private static final class Reader {

    private final Function<String, Optional<String>> source;
    private final List<String> problems = new ArrayList<>();

    Reader(Function<String, Optional<String>> source) {
      this.source = source;
    }

    String required(String key) {
      Optional<String> value = source.apply(key).filter(v -> !v.isEmpty());
      if (value.isEmpty()) {
        problems.add("не задан обязательный параметр '" + key + "'");
        return "";
      }
      return value.get();
    }

    /** Параметр должен быть задан, но может быть пустым (пароль БД). */
    String present(String key) {
      Optional<String> value = source.apply(key);
      if (value.isEmpty()) {
        problems.add("не задан обязательный параметр '" + key + "'");
        return "";
      }
      return value.get();
    }

    String optional(String key, String defaultValue) {
      return source.apply(key).filter(v -> !v.isEmpty()).orElse(defaultValue);
    }

    int intValue(String key, int defaultValue, int min, int max) {
      Optional<String> raw = source.apply(key).filter(v -> !v.isEmpty());
      if (raw.isEmpty()) {
        return defaultValue;
      }
      try {
        int value = Integer.parseInt(raw.get());
        if (value < min || value > max) {
          problems.add("'" + key + "' = " + value + " вне диапазона " + min + ".." + max);
          return defaultValue;
        }
        return value;
      } catch (NumberFormatException e) {
        problems.add("'" + key + "' должен быть целым числом, получено '" + raw.get() + "'");
        return defaultValue;
      }
    }

    double doubleValue(String key, double defaultValue, double min, double max) {
      Optional<String> raw = source.apply(key).filter(v -> !v.isEmpty());
      if (raw.isEmpty()) {
        return defaultValue;
      }
      try {
        double value = Double.parseDouble(raw.get());
        if (!(value >= min && value <= max)) {
          problems.add("'" + key + "' = " + value + " вне диапазона " + min + ".." + max);
          return defaultValue;
        }
        return value;
      } catch (NumberFormatException e) {
        problems.add("'" + key + "' должен быть числом, получено '" + raw.get() + "'");
        return defaultValue;
      }
    }

    List<String> list(String key) {
      return source.apply(key)
          .map(v -> Arrays.stream(v.split(","))
              .map(String::trim)
              .filter(s -> !s.isEmpty())
              .collect(Collectors.toUnmodifiableList()))
          .orElse(List.of());
    }

    TrainingMode trainingMode() {
      String raw = optional("prediction.training.mode", TrainingMode.PER_ENTITY.name());
      try {
        return TrainingMode.valueOf(raw.toUpperCase(Locale.ROOT).replace('-', '_'));
      } catch (IllegalArgumentException e) {
        problems.add("'prediction.training.mode' должен быть одним из "
            + Arrays.toString(TrainingMode.values()) + ", получено '" + raw + "'");
        return TrainingMode.PER_ENTITY;
      }
    }

    RetryPolicy retryPolicy() {
      int attempts = intValue("retry.max.attempts", 5, 1, 100);
      int base = intValue("retry.base.delay.ms", 200, 0, Integer.MAX_VALUE);
      int max = intValue("retry.max.delay.ms", 10_000, 0, Integer.MAX_VALUE);
      double jitter = doubleValue("retry.jitter", 0.2, 0.0, 1.0);
      if (max < base) {
        problems.add("'retry.max.delay.ms' (" + max + ") меньше 'retry.base.delay.ms' (" + base + ")");
        max = base;
      }
      return new RetryPolicy(attempts, Duration.ofMillis(base), Duration.ofMillis(max), jitter);
    }
  }
}
