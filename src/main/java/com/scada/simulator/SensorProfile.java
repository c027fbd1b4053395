package com.scada.simulator;

import java.util.List;

/**
 * Описание имитируемого датчика: физический диапазон, нормальный режим и уровень шума.
 *
 * @param entityId  Идентификатор датчика (суффикс топика).
 * @param name      Человекочитаемое название.
 * @param type      Тип датчика, определяет форму аномалии.
 * @param unit      Единица измерения.
 * @param min       Нижняя граница физического диапазона.
 * @param max       Верхняя граница физического диапазона.
 * @param normalMin Нижняя граница нормального режима.
 * @param normalMax Верхняя граница нормального режима.
 * @param noise     Амплитуда равномерного шума.
 */
public record SensorProfile(
    String entityId,
    String name,
    SensorType type,
    String unit,
    double min,
    double max,
    double normalMin,
    double normalMax,
    double noise
) {

  public enum SensorType {
    PRESSURE, FLOW, TEMPERATURE, VIBRATION, PRODUCTION, PERCENTAGE, VALVE
  }

  public SensorProfile {
    if (!(min <= normalMin && normalMin <= normalMax && normalMax <= max)) {
      throw new IllegalArgumentException("Invalid ranges for " + entityId
          + ": expected min <= normalMin <= normalMax <= max");
    }
    if (noise < 0) {
      throw new IllegalArgumentException("noise must be >= 0: " + noise);
    }
  }

  /**
   * Датчики трубопровода: вход, магистраль, выход, сепаратор, задвижки.
   */
  public static List<SensorProfile> pipelineCatalogue() {
    return List.of(
        // вход
        new SensorProfile("pressure-1", "Intake Pressure", SensorType.PRESSURE, "PSI", 7.25, 72.5, 14.5, 43.5, 1.45),
        new SensorProfile("flow-1", "Intake Flow Rate", SensorType.FLOW, "MCF/day", 8.5, 85.0, 34.0, 51.0, 1.7),
        new SensorProfile("temp-1", "Intake Temperature", SensorType.TEMPERATURE, "°F", 41.0, 86.0, 59.0, 77.0, 0.9),
        // магистраль
        new SensorProfile("pressure-2", "Main Pressure", SensorType.PRESSURE, "PSI", 7.25, 87.0, 29.0, 58.0, 1.45),
        new SensorProfile("flow-2", "Main Flow Rate", SensorType.FLOW, "MCF/day", 8.5, 85.0, 34.0, 51.0, 1.7),
        new SensorProfile("vibration-1", "Pipeline Vibration", SensorType.VIBRATION, "mm/s", 0.0, 10.0, 0.0, 3.0, 0.2),
        // выход
        new SensorProfile("pressure-3", "Output Pressure", SensorType.PRESSURE, "PSI", 1.45, 58.0, 7.25, 29.0, 1.45),
        new SensorProfile("flow-3", "Output Flow Rate", SensorType.FLOW, "MCF/day", 8.5, 85.0, 34.0, 51.0, 1.7),
        new SensorProfile("temp-2", "Output Temperature", SensorType.TEMPERATURE, "°F", 41.0, 95.0, 59.0, 77.0, 0.9),
        // сепаратор
        new SensorProfile("oil-production", "Oil Production Rate", SensorType.PRODUCTION, "barrels/day",
            50.0, 200.0, 70.0, 120.0, 3.0),
        new SensorProfile("water-production", "Water Production Rate", SensorType.PRODUCTION, "barrels/day",
            100.0, 300.0, 120.0, 180.0, 5.0),
        new SensorProfile("gas-production", "Gas Production Rate", SensorType.PRODUCTION, "MCF/day",
            20.0, 100.0, 30.0, 60.0, 2.0),
        new SensorProfile("water-cut", "Water Cut", SensorType.PERCENTAGE, "%", 40.0, 80.0, 50.0, 70.0, 1.0),
        // задвижки
        new SensorProfile("valve-inlet", "Inlet Valve Position", SensorType.VALVE, "%", 0.0, 100.0, 60.0, 100.0, 0.5),
        new SensorProfile("valve-gas", "Gas Valve Position", SensorType.VALVE, "%", 0.0, 100.0, 40.0, 60.0, 0.5),
        new SensorProfile("valve-water", "Water Valve Position", SensorType.VALVE, "%", 0.0, 100.0, 60.0, 80.0, 0.5),
        new SensorProfile("valve-oil", "Oil Valve Position", SensorType.VALVE, "%", 0.0, 100.0, 20.0, 30.0, 0.5)
    );
  }
}
