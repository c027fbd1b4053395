package com.scada.prediction;

import com.scada.model.ModelHandle;
import com.scada.model.Reading;

import java.util.List;

/**
 * Алгоритм обучения. Подключаемая точка расширения движка прогнозирования.
 */
public interface Trainer {

  /**
   * Обучает модель на измерениях окна.
   *
   * @param readings Измерения, упорядоченные по времени (старые первыми), возможно по нескольким датчикам.
   * @return Новая ссылка на модель.
   * @throws InsufficientDataException если ни по одному датчику не хватает данных.
   * @throws TrainerException          если обучение не удалось.
   */
  ModelHandle train(List<Reading> readings);
}
