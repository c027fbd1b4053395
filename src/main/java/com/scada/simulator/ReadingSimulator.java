package com.scada.simulator;

import com.scada.model.Reading;
import com.scada.publish.PublicationAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Имитатор датчиков: раз в интервал публикует по одному измерению на каждый профиль.
 * <p>
 * Обычно значение равномерно распределено в нормальном диапазоне плюс шум. Во время аномалии
 * значение одного датчика плавно уходит к границе физического диапазона.
 */
public class ReadingSimulator {

  private static final Logger logger = LoggerFactory.getLogger(ReadingSimulator.class);

  private final List<SensorProfile> profiles;
  private final PublicationAdapter publisher;
  private final Random random;
  private final Clock clock;

  private Anomaly anomaly;

  private record Anomaly(SensorProfile profile, Instant start, Duration duration, boolean towardsMax) {

    double progress(Instant now) {
      double elapsed = Duration.between(start, now).toMillis();
      return Math.max(0.0, Math.min(1.0, elapsed / duration.toMillis()));
    }

    boolean finished(Instant now) {
      return !now.isBefore(start.plus(duration));
    }
  }

  public ReadingSimulator(List<SensorProfile> profiles, PublicationAdapter publisher) {
    this(profiles, publisher, new Random(), Clock.systemUTC());
  }

  public ReadingSimulator(List<SensorProfile> profiles, PublicationAdapter publisher, Random random, Clock clock) {
    if (profiles.isEmpty()) {
      throw new IllegalArgumentException("profiles cannot be empty");
    }
    this.profiles = List.copyOf(profiles);
    this.publisher = publisher;
    this.random = random;
    this.clock = clock;
  }

  /**
   * Генерирует и публикует по одному измерению на датчик.
   *
   * @return Опубликованные измерения.
   */
  public synchronized List<Reading> publishAll() {
    Instant now = clock.instant();
    List<Reading> readings = new ArrayList<>(profiles.size());
    for (SensorProfile profile : profiles) {
      Reading reading = new Reading(profile.entityId(), now, valueFor(profile, now), Reading.MAX_QUALITY);
      publisher.publishReading(reading);
      readings.add(reading);
    }
    logger.info("Опубликованы измерения {} датчиков", readings.size());

    if (anomaly != null && anomaly.finished(now)) {
      logger.info("Аномалия датчика {} завершена", anomaly.profile().entityId());
      anomaly = null;
    }
    return readings;
  }

  /**
   * Запускает аномалию на датчике, если другая аномалия сейчас не идёт.
   *
   * @return {@code true}, если аномалия запущена.
   */
  public synchronized boolean startAnomaly(String entityId, Duration duration) {
    if (anomaly != null) {
      return false;
    }
    SensorProfile profile = profiles.stream()
        .filter(p -> p.entityId().equals(entityId))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown sensor: " + entityId));
    anomaly = new Anomaly(profile, clock.instant(), duration, random.nextBoolean());
    logger.info("⚠️ Аномалия датчика {} на {} с", entityId, duration.toSeconds());
    return true;
  }

  /**
   * С вероятностью {@code probability} запускает аномалию 1–5 минут на случайном датчике.
   */
  public synchronized void maybeStartAnomaly(double probability) {
    if (anomaly == null && random.nextDouble() < probability) {
      SensorProfile profile = profiles.get(random.nextInt(profiles.size()));
      startAnomaly(profile.entityId(), Duration.ofSeconds(60 + random.nextInt(241)));
    }
  }

  public synchronized boolean anomalyActive() {
    return anomaly != null;
  }

  double valueFor(SensorProfile p, Instant now) {
    double base;
    if (anomaly != null && anomaly.profile().entityId().equals(p.entityId())) {
      base = anomalyBase(p, anomaly.progress(now), anomaly.towardsMax());
    } else {
      base = p.normalMin() + random.nextDouble() * (p.normalMax() - p.normalMin());
    }
    double noisy = base + (random.nextDouble() * 2 - 1) * p.noise();
    double clamped = Math.max(p.min(), Math.min(p.max(), noisy));
    return Math.round(clamped * 100.0) / 100.0;
  }

  private static double anomalyBase(SensorProfile p, double progress, boolean towardsMax) {
    switch (p.type()) {
      case PRESSURE:
        return p.normalMax() - (p.normalMax() - p.min()) * progress * 0.8;
      case FLOW:
        return p.normalMax() - (p.normalMax() - p.min()) * progress * 0.7;
      case TEMPERATURE:
        return p.normalMin() + (p.max() - p.normalMin()) * progress * 0.6;
      case VIBRATION:
        return p.normalMax() + (p.max() - p.normalMax()) * progress * 0.9;
      case PRODUCTION:
        return p.normalMax() - (p.normalMax() - p.min()) * progress * 0.6;
      case PERCENTAGE:
      case VALVE:
        return towardsMax
            ? p.normalMax() + (p.max() - p.normalMax()) * progress * 0.7
            : p.normalMin() - (p.normalMin() - p.min()) * progress * 0.7;
      default:
        return p.normalMax() - (p.normalMax() - p.min()) * progress * 0.5;
    }
  }
}
