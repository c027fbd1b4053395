package com.scada.db;

import com.scada.model.Reading;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * DAO-класс для записи в таблицу sensor_data.
 * <p>
 * Upsert выполняется одним оператором {@code INSERT ... ON CONFLICT DO UPDATE}:
 * сериализацию по ключу строки обеспечивает PostgreSQL, своих блокировок здесь нет.
 */
public class ReadingDao implements ReadingWriter {

  static final String UPSERT_SQL = """
      INSERT INTO sensor_data (timestamp, sensor_id, value, quality)
      VALUES (?, ?, ?, ?)
      ON CONFLICT (timestamp, sensor_id)
      DO UPDATE SET value = EXCLUDED.value, quality = EXCLUDED.quality
      """;

  private final DatabaseConnection database;

  public ReadingDao(DatabaseConnection database) {
    this.database = database;
  }

  @Override
  public void upsert(Reading reading) {
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(UPSERT_SQL)) {
      pstmt.setObject(1, OffsetDateTime.ofInstant(reading.timestamp(), ZoneOffset.UTC));
      pstmt.setString(2, reading.entityId());
      pstmt.setDouble(3, reading.value());
      pstmt.setInt(4, reading.quality());
      pstmt.executeUpdate();
    } catch (SQLException e) {
      throw new StorageUnavailableException("Не удалось сохранить измерение в базу данных. " +
          "Датчик: " + reading.entityId() + ", Время: " + reading.timestamp() + ", Значение: " + reading.value(), e);
    }
  }
}
