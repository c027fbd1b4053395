package com.scada.prediction;

/**
 * Как строится модель по обучающей таблице.
 */
public enum TrainingMode {
  /** Отдельные коэффициенты для каждого датчика. */
  PER_ENTITY,
  /** Одни коэффициенты на все датчики (совместная таблица). */
  GLOBAL
}
