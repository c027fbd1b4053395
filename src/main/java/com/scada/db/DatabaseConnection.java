package com.scada.db;

import com.scada.config.PipelineSettings.DatabaseSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Класс для управления соединением с PostgreSQL/TimescaleDB и инициализации таблиц.
 */
public class DatabaseConnection {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

  private final String url;
  private final String user;
  private final String password;

  public DatabaseConnection(DatabaseSettings settings) {
    Objects.requireNonNull(settings, "settings cannot be null");
    this.url = settings.url();
    this.user = settings.user();
    this.password = settings.password();
  }

  /**
   * Создаёт новое соединение с базой данных.
   * @return Новое соединение с PostgreSQL.
   * @throws StorageUnavailableException если подключение не удалось.
   */
  public Connection getConnection() {
    try {
      return DriverManager.getConnection(url, user, password);
    } catch (SQLException e) {
      throw new StorageUnavailableException(
          "Не удалось подключиться к базе данных по адресу: " + url +
              ". Проверьте, что PostgreSQL запущен и параметры подключения верны.",
          e
      );
    }
  }

  /**
   * Инициализирует базу данных: создаёт таблицу sensor_data, если она отсутствует,
   * и превращает её в гипертаблицу, если установлено расширение TimescaleDB.
   * Вызывается при старте приложения.
   * @throws StorageUnavailableException если не удалось создать таблицу.
   */
  public void initializeDatabase() {
    try (Connection conn = getConnection();
         Statement stmt = conn.createStatement()) {

      String createSensorDataTableSQL = """
                CREATE TABLE IF NOT EXISTS sensor_data (
                    timestamp TIMESTAMPTZ NOT NULL,
                    sensor_id VARCHAR(100) NOT NULL,
                    value DOUBLE PRECISION NOT NULL,
                    quality SMALLINT NOT NULL,
                    PRIMARY KEY (timestamp, sensor_id)
                );
                """;
      stmt.execute(createSensorDataTableSQL);
      stmt.execute("CREATE INDEX IF NOT EXISTS sensor_data_sensor_ts_idx ON sensor_data (sensor_id, timestamp DESC)");
      logger.info("✅ Таблица 'sensor_data' создана или уже существует.");

      if (hasTimescale(stmt)) {
        stmt.execute("SELECT create_hypertable('sensor_data', 'timestamp', if_not_exists => TRUE, migrate_data => TRUE)");
        logger.info("✅ 'sensor_data' является гипертаблицей TimescaleDB.");
      } else {
        logger.warn("Расширение TimescaleDB не найдено, 'sensor_data' остаётся обычной таблицей PostgreSQL.");
      }

    } catch (SQLException e) {
      throw new StorageUnavailableException(
          "Не удалось инициализировать базу данных. Ошибка при создании таблицы 'sensor_data'.",
          e
      );
    }
  }

  private boolean hasTimescale(Statement stmt) {
    try (ResultSet rs = stmt.executeQuery("SELECT 1 FROM pg_extension WHERE extname = 'timescaledb'")) {
      return rs.next();
    } catch (SQLException e) {
      logger.warn("Не удалось проверить наличие расширения TimescaleDB: {}", e.getMessage());
      return false;
    }
  }
}
