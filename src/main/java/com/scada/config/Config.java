package com.scada.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Утилитарный класс для загрузки конфигурации из application.properties.
 * <p>
 * Порядок приоритета: системное свойство JVM ({@code -Dmqtt.host=...}), затем переменная
 * окружения ({@code MQTT_HOST}), затем classpath-файл "application.properties".
 */
public final class Config {

  private static final String RESOURCE = "application.properties";

  private static final Properties PROPS = new Properties();

  static {
    try (InputStream input = Config.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (input != null) {
        PROPS.load(input);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Не удалось загрузить " + RESOURCE, e);
    }
  }

  /**
   * Возвращает значение параметра, если он задан хоть в одном источнике.
   *
   * @param key Ключ параметра (например, "mqtt.host").
   * @return Значение без пробелов по краям; пустое, если параметр не задан.
   */
  public static Optional<String> getProperty(String key) {
    String sysValue = System.getProperty(key);
    if (sysValue != null) {
      return Optional.of(sysValue.trim());
    }
    String envValue = System.getenv(toEnvName(key));
    if (envValue != null) {
      return Optional.of(envValue.trim());
    }
    String propValue = PROPS.getProperty(key);
    return propValue == null ? Optional.empty() : Optional.of(propValue.trim());
  }

  /**
   * "db.url" → "DB_URL".
   */
  static String toEnvName(String key) {
    return key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  // Запрещаем создание экземпляров
  private Config() {
    throw new UnsupportedOperationException("Utility class");
  }
}
