package com.scada.db;

import com.scada.config.PipelineSettings.DatabaseSettings;
import com.scada.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadingDaoTest {

  @Test
  @DisplayName("БД недоступна → StorageUnavailable, а не SQLException")
  void unreachableDatabaseIsStorageUnavailable() {
    // Given: порт, на котором никто не слушает
    DatabaseConnection database = new DatabaseConnection(
        new DatabaseSettings("jdbc:postgresql://127.0.0.1:1/scada?connectTimeout=1", "scada", ""));
    ReadingDao dao = new ReadingDao(database);

    // When / Then
    assertThatThrownBy(() -> dao.upsert(new Reading("flow-1", Instant.now(), 1.0, 100)))
        .isInstanceOf(StorageUnavailableException.class)
        .extracting(e -> ((StorageUnavailableException) e).reason())
        .isEqualTo("StorageUnavailable");
  }
}
