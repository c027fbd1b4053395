package com.scada.prediction;

import com.scada.config.PipelineSettings.PredictionSettings;
import com.scada.db.HistoryQuery;
import com.scada.db.HistoryReader;
import com.scada.db.SortOrder;
import com.scada.db.StorageUnavailableException;
import com.scada.model.ModelHandle;
import com.scada.model.Prediction;
import com.scada.model.Reading;
import com.scada.publish.PublicationAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * Движок прогнозирования: два независимых периодических цикла.
 * <ul>
 *   <li>обучение: читает окно истории, обучает модель и атомарно заменяет активную;</li>
 *   <li>инференс: для каждого датчика берёт последние измерения и публикует прогноз.</li>
 * </ul>
 * Ошибка обучения не трогает активную модель. Пока модели нет, инференс ничего не публикует.
 */
public class PredictionEngine {

  private static final Logger logger = LoggerFactory.getLogger(PredictionEngine.class);

  private final HistoryReader history;
  private final Trainer trainer;
  private final ModelHolder holder;
  private final PublicationAdapter publisher;
  private final PredictionSettings settings;
  private final Clock clock;

  private final Object trainingLock = new Object();
  private final Object inferenceLock = new Object();
  private volatile boolean stopping;

  private PeriodicTask trainingTask;
  private PeriodicTask inferenceTask;

  public PredictionEngine(HistoryReader history, Trainer trainer, ModelHolder holder,
                          PublicationAdapter publisher, PredictionSettings settings) {
    this(history, trainer, holder, publisher, settings, Clock.systemUTC());
  }

  public PredictionEngine(HistoryReader history, Trainer trainer, ModelHolder holder,
                          PublicationAdapter publisher, PredictionSettings settings, Clock clock) {
    this.history = history;
    this.trainer = trainer;
    this.holder = holder;
    this.publisher = publisher;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Запускает оба цикла. Если модели ещё нет, обучение стартует сразу.
   */
  public synchronized void start() {
    if (trainingTask != null) {
      return;
    }
    Duration firstTraining = holder.current().isPresent() ? settings.trainingInterval() : Duration.ZERO;
    trainingTask = new PeriodicTask("training", firstTraining, settings.trainingInterval(), this::runTrainingCycle);
    inferenceTask = new PeriodicTask("inference", settings.inferenceInterval(), settings.inferenceInterval(),
        this::runInferenceCycle);
    trainingTask.start();
    inferenceTask.start();
    logger.info("🚀 Движок прогнозирования запущен (режим {}, горизонт {} с)",
        settings.mode(), settings.horizon().toSeconds());
  }

  /**
   * Один цикл обучения.
   *
   * @return {@code true}, если активная модель заменена.
   */
  public boolean runTrainingCycle() {
    synchronized (trainingLock) {
      Instant now = clock.instant();
      HistoryQuery query = new HistoryQuery(Set.copyOf(settings.entities()),
          now.minus(settings.trainingWindow()), now, settings.trainingLimit(), SortOrder.DESCENDING);

      List<Reading> readings;
      try {
        readings = new ArrayList<>(history.fetch(query));
      } catch (StorageUnavailableException e) {
        logger.warn("⚠️ Обучение пропущено, история недоступна: {}", e.getMessage());
        return false;
      }
      // Берём самые свежие строки окна, а обучаемся в хронологическом порядке.
      Collections.reverse(readings);

      if (stopping) {
        return false;
      }

      ModelHandle handle;
      try {
        handle = trainer.train(readings);
      } catch (InsufficientDataException e) {
        logger.info("Обучение отложено: {}", e.getMessage());
        return false;
      } catch (TrainerException e) {
        logger.error("❌ Ошибка обучения, остаётся прежняя модель: {}", e.getMessage(), e);
        return false;
      } catch (RuntimeException e) {
        logger.error("❌ Непредвиденная ошибка обучения, остаётся прежняя модель", e);
        return false;
      }

      Optional<ModelHandle> previous = holder.swap(handle);
      logger.info("✅ Активная модель: {} (была: {})", handle.id(),
          previous.map(ModelHandle::id).orElse("нет"));
      return true;
    }
  }

  /**
   * Один цикл инференса.
   *
   * @return Сколько прогнозов отправлено на публикацию.
   */
  public int runInferenceCycle() {
    synchronized (inferenceLock) {
      Optional<ModelHandle> current = holder.current();
      if (current.isEmpty()) {
        logger.debug("Инференс пропущен: модель ещё не обучена");
        return 0;
      }
      ModelHandle handle = current.get();
      Instant now = clock.instant();
      int published = 0;

      for (String entityId : monitoredEntities(handle)) {
        if (stopping) {
          logger.info("Инференс прерван остановкой");
          break;
        }
        try {
          if (predictOne(handle, entityId, now)) {
            published++;
          }
        } catch (StorageUnavailableException e) {
          logger.warn("⚠️ Прогноз для {} пропущен, история недоступна: {}", entityId, e.getMessage());
        }
      }
      logger.debug("Инференс по модели {}: отправлено прогнозов {}", handle.id(), published);
      return published;
    }
  }

  private boolean predictOne(ModelHandle handle, String entityId, Instant now) {
    List<Reading> recent = new ArrayList<>(
        history.fetch(HistoryQuery.latest(entityId, null, settings.inferenceLookback())));
    if (recent.isEmpty()) {
      logger.debug("Нет измерений для {}, прогноз не строится", entityId);
      return false;
    }
    Collections.reverse(recent);

    OptionalDouble value = handle.model().predict(entityId, recent);
    if (value.isEmpty()) {
      logger.debug("Модель {} не дала прогноз для {}", handle.id(), entityId);
      return false;
    }
    // Горизонт отсчитывается от последнего измерения, а не от момента расчёта.
    Instant lastObserved = recent.get(recent.size() - 1).timestamp();
    Prediction prediction = new Prediction(entityId, now, lastObserved.plus(settings.horizon()),
        value.getAsDouble(), handle.model().confidence(entityId));
    publisher.publishPrediction(prediction);
    return true;
  }

  private Set<String> monitoredEntities(ModelHandle handle) {
    if (!settings.entities().isEmpty()) {
      return new LinkedHashSet<>(settings.entities());
    }
    return new TreeSet<>(handle.entities());
  }

  public Optional<ModelHandle> currentModel() {
    return holder.current();
  }

  /**
   * Останавливает оба цикла; текущий запуск прерывается на ближайшей контрольной точке.
   */
  public synchronized void stop(Duration timeout) {
    stopping = true;
    if (trainingTask != null) {
      trainingTask.stop(timeout);
      inferenceTask.stop(timeout);
    }
    logger.info("Движок прогнозирования остановлен");
  }
}
