package com.scada.prediction;

import com.scada.model.Reading;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Обученная модель прогноза. Экземпляр неизменяем и безопасен для чтения из нескольких потоков.
 */
public interface Model {

  /**
   * Прогноз следующего значения датчика.
   *
   * @param entityId          Идентификатор датчика.
   * @param recentOldestFirst Последние измерения датчика, старые первыми.
   * @return Прогноз; пусто, если модель не знает датчик или истории мало.
   */
  OptionalDouble predict(String entityId, List<Reading> recentOldestFirst);

  /**
   * Уверенность модели для датчика в диапазоне 0..1, если модель её оценивает.
   */
  default OptionalDouble confidence(String entityId) {
    return OptionalDouble.empty();
  }
}
