package com.scada.db;

import com.scada.model.Reading;

/**
 * Запись измерений в хранилище временных рядов.
 */
public interface ReadingWriter {

  /**
   * Идемпотентно записывает измерение по ключу ({@code timestamp}, {@code entityId}).
   * <p>
   * Повторная запись той же пары перезаписывает значение и качество (побеждает последняя запись).
   * Записи разных датчиков не блокируют друг друга.
   *
   * @param reading Измерение.
   * @throws StorageUnavailableException если хранилище недоступно.
   */
  void upsert(Reading reading);
}
