package com.scada.model;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Прогноз для одного датчика, рассчитанный в цикле инференса.
 * <p>
 * Не сохраняется в БД: публикуется и вытесняется прогнозом следующего цикла.
 *
 * @param entityId       Идентификатор датчика.
 * @param generatedAt    Момент расчёта.
 * @param horizon        Момент времени, на который сделан прогноз.
 * @param predictedValue Прогнозное значение.
 * @param confidence     Уверенность модели 0..1, если модель её сообщает.
 */
public record Prediction(
    String entityId,
    Instant generatedAt,
    Instant horizon,
    double predictedValue,
    OptionalDouble confidence
) {

  public Prediction {
    Objects.requireNonNull(entityId, "entityId cannot be null");
    Objects.requireNonNull(generatedAt, "generatedAt cannot be null");
    Objects.requireNonNull(horizon, "horizon cannot be null");
    Objects.requireNonNull(confidence, "confidence cannot be null, use OptionalDouble.empty()");
  }
}
