package com.scada.prediction;

import com.scada.model.ModelHandle;
import com.scada.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Встроенный алгоритм: линейная авторегрессия по трём предыдущим значениям и скорости изменения.
 * <p>
 * Признаки: свободный член, {@code prev_value_1..3}, {@code rate_of_change = prev_value_1 - prev_value_2}.
 * Коэффициенты находятся методом наименьших квадратов с небольшой гребневой регуляризацией,
 * которая снимает линейную зависимость скорости от лагов.
 */
public class LinearTrendTrainer implements Trainer {

  private static final Logger logger = LoggerFactory.getLogger(LinearTrendTrainer.class);

  /** Сколько предыдущих значений нужно для одного прогноза. */
  public static final int LAGS = 3;

  private static final int FEATURES = LAGS + 2;
  private static final double RIDGE = 1e-6;
  private static final double PIVOT_EPSILON = 1e-12;

  private final TrainingMode mode;
  private final int minSamples;
  private final Clock clock;

  public LinearTrendTrainer(TrainingMode mode, int minSamples) {
    this(mode, minSamples, Clock.systemUTC());
  }

  public LinearTrendTrainer(TrainingMode mode, int minSamples, Clock clock) {
    if (minSamples < 1) {
      throw new IllegalArgumentException("minSamples must be >= 1: " + minSamples);
    }
    this.mode = mode;
    this.minSamples = minSamples;
    this.clock = clock;
  }

  @Override
  public ModelHandle train(List<Reading> readings) {
    Map<String, double[]> series = qualifyingSeries(readings);
    if (series.isEmpty()) {
      throw new InsufficientDataException("Ни у одного датчика нет " + Math.max(minSamples, LAGS + 1)
          + " измерений в окне обучения (всего строк: " + readings.size() + ")");
    }

    Map<String, Coefficients> perEntity = new HashMap<>();
    Coefficients global = null;
    if (mode == TrainingMode.GLOBAL) {
      global = fit(new ArrayList<>(series.values()));
    } else {
      for (Map.Entry<String, double[]> e : series.entrySet()) {
        perEntity.put(e.getKey(), fit(List.of(e.getValue())));
      }
    }

    int samples = series.values().stream().mapToInt(v -> v.length).sum();
    Instant trainedAt = clock.instant();
    String id = "linear-trend-" + mode.name().toLowerCase(Locale.ROOT) + "-" + trainedAt.toEpochMilli();
    logger.info("Модель {} обучена: датчиков {}, измерений {}", id, series.size(), samples);
    return new ModelHandle(id, trainedAt, samples, series.keySet(), new LinearTrendModel(perEntity, global));
  }

  /**
   * Группирует по датчикам и сортирует по времени; отбрасывает датчики, у которых мало данных.
   */
  private Map<String, double[]> qualifyingSeries(List<Reading> readings) {
    Map<String, List<Reading>> grouped = new LinkedHashMap<>();
    for (Reading r : readings) {
      grouped.computeIfAbsent(r.entityId(), k -> new ArrayList<>()).add(r);
    }
    int required = Math.max(minSamples, LAGS + 1);
    Map<String, double[]> series = new LinkedHashMap<>();
    for (Map.Entry<String, List<Reading>> e : grouped.entrySet()) {
      List<Reading> rows = e.getValue();
      if (rows.size() < required) {
        logger.debug("Датчик {} пропущен: {} измерений из {} необходимых", e.getKey(), rows.size(), required);
        continue;
      }
      rows.sort(Comparator.comparing(Reading::timestamp));
      series.put(e.getKey(), rows.stream().mapToDouble(Reading::value).toArray());
    }
    return series;
  }

  private static double[] features(double[] values, int target) {
    double y1 = values[target - 1];
    double y2 = values[target - 2];
    double y3 = values[target - 3];
    return new double[]{1.0, y1, y2, y3, y1 - y2};
  }

  private static Coefficients fit(List<double[]> allSeries) {
    double[][] xtx = new double[FEATURES][FEATURES];
    double[] xty = new double[FEATURES];
    int rows = 0;
    for (double[] values : allSeries) {
      for (int t = LAGS; t < values.length; t++) {
        double[] x = features(values, t);
        for (int i = 0; i < FEATURES; i++) {
          xty[i] += x[i] * values[t];
          for (int j = 0; j < FEATURES; j++) {
            xtx[i][j] += x[i] * x[j];
          }
        }
        rows++;
      }
    }

    double trace = 0;
    for (int i = 0; i < FEATURES; i++) {
      trace += xtx[i][i];
    }
    double lambda = RIDGE * trace / FEATURES;
    // свободный член не штрафуется
    for (int i = 1; i < FEATURES; i++) {
      xtx[i][i] += lambda;
    }

    double[] weights = solve(xtx, xty);
    return new Coefficients(weights, confidenceOf(weights, allSeries), rows);
  }

  /**
   * Гаусс с выбором главного элемента. Матрица маленькая (5x5), поэтому без библиотек.
   */
  private static double[] solve(double[][] a, double[] b) {
    int n = b.length;
    double[][] m = new double[n][];
    for (int i = 0; i < n; i++) {
      m[i] = new double[n + 1];
      System.arraycopy(a[i], 0, m[i], 0, n);
      m[i][n] = b[i];
    }
    for (int col = 0; col < n; col++) {
      int pivot = col;
      for (int row = col + 1; row < n; row++) {
        if (Math.abs(m[row][col]) > Math.abs(m[pivot][col])) {
          pivot = row;
        }
      }
      if (!(Math.abs(m[pivot][col]) > PIVOT_EPSILON)) {
        throw new TrainerException("Система нормальных уравнений вырождена (столбец " + col + ")");
      }
      double[] tmp = m[col];
      m[col] = m[pivot];
      m[pivot] = tmp;
      for (int row = col + 1; row < n; row++) {
        double factor = m[row][col] / m[col][col];
        for (int k = col; k <= n; k++) {
          m[row][k] -= factor * m[col][k];
        }
      }
    }
    double[] x = new double[n];
    for (int row = n - 1; row >= 0; row--) {
      double sum = m[row][n];
      for (int k = row + 1; k < n; k++) {
        sum -= m[row][k] * x[k];
      }
      x[row] = sum / m[row][row];
      if (!Double.isFinite(x[row])) {
        throw new TrainerException("Коэффициенты модели не конечны");
      }
    }
    return x;
  }

  /**
   * Коэффициент детерминации на обучающей выборке, обрезанный до 0..1.
   */
  private static double confidenceOf(double[] weights, List<double[]> allSeries) {
    double sum = 0;
    int count = 0;
    for (double[] values : allSeries) {
      for (int t = LAGS; t < values.length; t++) {
        sum += values[t];
        count++;
      }
    }
    double mean = sum / count;
    double residual = 0;
    double total = 0;
    for (double[] values : allSeries) {
      for (int t = LAGS; t < values.length; t++) {
        double error = values[t] - dot(weights, features(values, t));
        residual += error * error;
        total += (values[t] - mean) * (values[t] - mean);
      }
    }
    if (total < PIVOT_EPSILON) {
      return residual < PIVOT_EPSILON ? 1.0 : 0.0;
    }
    return Math.max(0.0, Math.min(1.0, 1.0 - residual / total));
  }

  private static double dot(double[] w, double[] x) {
    double result = 0;
    for (int i = 0; i < w.length; i++) {
      result += w[i] * x[i];
    }
    return result;
  }

  private record Coefficients(double[] weights, double confidence, int rows) {
  }

  /**
   * Результат обучения: коэффициенты по датчикам (PER_ENTITY) или общий набор (GLOBAL).
   */
  static final class LinearTrendModel implements Model {

    private final Map<String, Coefficients> perEntity;
    private final Coefficients global;

    private LinearTrendModel(Map<String, Coefficients> perEntity, Coefficients global) {
      this.perEntity = Map.copyOf(perEntity);
      this.global = global;
    }

    private Coefficients coefficientsFor(String entityId) {
      Coefficients c = perEntity.get(entityId);
      return c != null ? c : global;
    }

    @Override
    public OptionalDouble predict(String entityId, List<Reading> recentOldestFirst) {
      Coefficients c = coefficientsFor(entityId);
      if (c == null || recentOldestFirst.size() < LAGS) {
        return OptionalDouble.empty();
      }
      double[] values = recentOldestFirst.stream().mapToDouble(Reading::value).toArray();
      double prediction = dot(c.weights(), features(values, values.length));
      return Double.isFinite(prediction) ? OptionalDouble.of(prediction) : OptionalDouble.empty();
    }

    @Override
    public OptionalDouble confidence(String entityId) {
      Coefficients c = coefficientsFor(entityId);
      return c == null ? OptionalDouble.empty() : OptionalDouble.of(c.confidence());
    }
  }
}
