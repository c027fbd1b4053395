package com.scada.model;

import com.scada.prediction.Model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Неизменяемая ссылка на активную модель.
 * <p>
 * Заменяется целиком по окончании успешного обучения; старый экземпляр остаётся
 * пригодным для инференса, который уже начался.
 *
 * @param id          Идентификатор модели (для логов и диагностики).
 * @param trainedAt   Момент завершения обучения.
 * @param sampleCount Сколько измерений ушло в обучающую выборку.
 * @param entities    Датчики, для которых модель умеет строить прогноз.
 * @param model       Сама модель.
 */
public record ModelHandle(String id, Instant trainedAt, int sampleCount, Set<String> entities, Model model) {

  public ModelHandle {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(trainedAt, "trainedAt cannot be null");
    Objects.requireNonNull(model, "model cannot be null");
    entities = Set.copyOf(entities);
  }
}
