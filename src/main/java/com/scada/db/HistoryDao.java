package com.scada.db;

import com.scada.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO-класс для чтения истории из таблицы sensor_data.
 */
public class HistoryDao implements HistoryReader {

  private static final Logger logger = LoggerFactory.getLogger(HistoryDao.class);

  private final DatabaseConnection database;
  private final int maxLimit;

  /**
   * @param database Источник соединений.
   * @param maxLimit Верхняя граница размера выборки, чтобы обучающая таблица помещалась в память.
   */
  public HistoryDao(DatabaseConnection database, int maxLimit) {
    if (maxLimit <= 0) {
      throw new IllegalArgumentException("maxLimit must be positive: " + maxLimit);
    }
    this.database = database;
    this.maxLimit = maxLimit;
  }

  @Override
  public List<Reading> fetch(HistoryQuery query) {
    HistoryQuery bounded = query;
    if (query.limit() > maxLimit) {
      logger.debug("Лимит выборки {} урезан до {}", query.limit(), maxLimit);
      bounded = query.withLimit(maxLimit);
    }

    StringBuilder sql = new StringBuilder("SELECT timestamp, sensor_id, value, quality FROM sensor_data WHERE TRUE");
    if (!bounded.entities().isEmpty()) {
      sql.append(" AND sensor_id = ANY(?)");
    }
    if (bounded.from() != null) {
      sql.append(" AND timestamp >= ?");
    }
    if (bounded.to() != null) {
      sql.append(" AND timestamp < ?");
    }
    String dir = bounded.order().sql();
    sql.append(" ORDER BY timestamp ").append(dir).append(", sensor_id ").append(dir).append(" LIMIT ?");

    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql.toString())) {
      int i = 1;
      if (!bounded.entities().isEmpty()) {
        Array array = conn.createArrayOf("varchar", bounded.entities().toArray());
        pstmt.setArray(i++, array);
      }
      if (bounded.from() != null) {
        pstmt.setObject(i++, OffsetDateTime.ofInstant(bounded.from(), ZoneOffset.UTC));
      }
      if (bounded.to() != null) {
        pstmt.setObject(i++, OffsetDateTime.ofInstant(bounded.to(), ZoneOffset.UTC));
      }
      pstmt.setInt(i, bounded.limit());

      List<Reading> readings = new ArrayList<>();
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          readings.add(new Reading(
              rs.getString("sensor_id"),
              rs.getObject("timestamp", OffsetDateTime.class).toInstant(),
              rs.getDouble("value"),
              rs.getInt("quality")
          ));
        }
      }
      return readings;
    } catch (SQLException e) {
      throw new StorageUnavailableException("Не удалось прочитать историю измерений: " + bounded, e);
    }
  }

  @Override
  public List<String> entities(Instant from, Instant to) {
    StringBuilder sql = new StringBuilder("SELECT DISTINCT sensor_id FROM sensor_data WHERE TRUE");
    if (from != null) {
      sql.append(" AND timestamp >= ?");
    }
    if (to != null) {
      sql.append(" AND timestamp < ?");
    }
    sql.append(" ORDER BY sensor_id");

    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql.toString())) {
      int i = 1;
      if (from != null) {
        pstmt.setObject(i++, OffsetDateTime.ofInstant(from, ZoneOffset.UTC));
      }
      if (to != null) {
        pstmt.setObject(i, OffsetDateTime.ofInstant(to, ZoneOffset.UTC));
      }
      List<String> ids = new ArrayList<>();
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          ids.add(rs.getString(1));
        }
      }
      return ids;
    } catch (SQLException e) {
      throw new StorageUnavailableException("Не удалось получить список датчиков", e);
    }
  }
}
