package com.scada.db;

import com.scada.model.Reading;

import java.time.Instant;
import java.util.List;

/**
 * Чтение истории измерений для обучения и инференса.
 */
public interface HistoryReader {

  /**
   * Возвращает измерения, упорядоченные по времени в порядке {@link HistoryQuery#order()}.
   * Пустой результат — пустой список, а не ошибка.
   *
   * @throws StorageUnavailableException если хранилище недоступно.
   */
  List<Reading> fetch(HistoryQuery query);

  /**
   * Датчики, у которых есть измерения в окне [from, to). Границы {@code null} — без ограничения.
   *
   * @throws StorageUnavailableException если хранилище недоступно.
   */
  List<String> entities(Instant from, Instant to);
}
