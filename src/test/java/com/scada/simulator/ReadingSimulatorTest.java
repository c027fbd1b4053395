package com.scada.simulator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scada.acl.AccessPolicy;
import com.scada.acl.AccessPolicyLoader;
import com.scada.codec.PayloadCodec;
import com.scada.model.Reading;
import com.scada.publish.PublicationAdapter;
import com.scada.retry.Retrier;
import com.scada.retry.RetryPolicy;
import com.scada.simulator.SensorProfile.SensorType;
import com.scada.testing.InMemoryBus;
import com.scada.topic.TopicContract;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ReadingSimulatorTest {

  private static final Instant T0 = Instant.parse("2025-05-01T10:00:00Z");

  private final TopicContract contract = new TopicContract("ai_scada");
  private final AccessPolicy policy = new AccessPolicyLoader(contract).load("classpath:acl-policy.json");
  private final MutableClock clock = new MutableClock(T0);

  private InMemoryBus bus;
  private PublicationAdapter publisher;

  /** Часы, которые двигает тест. */
  private static final class MutableClock extends Clock {

    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration d) {
      now = now.plus(d);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  @BeforeEach
  void setUp() {
    bus = new InMemoryBus();
    Retrier retrier = new Retrier(new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(2), 0.0), d -> { });
    publisher = new PublicationAdapter(bus, retrier, new PayloadCodec(), contract, policy, "simulator");
  }

  @AfterEach
  void tearDown() {
    publisher.close();
  }

  @Test
  @DisplayName("Каждый датчик каталога публикуется в {ns}/data/{entity}")
  void publishesEveryProfile() throws Exception {
    // Given
    List<SensorProfile> catalogue = SensorProfile.pipelineCatalogue();
    ReadingSimulator simulator = new ReadingSimulator(catalogue, publisher, new Random(7), clock);

    // When
    List<Reading> readings = simulator.publishAll();

    // Then
    assertThat(readings).hasSize(catalogue.size());
    await().atMost(Duration.ofSeconds(2)).until(() -> bus.published().size() == catalogue.size());
    JsonNode first = new ObjectMapper().readTree(bus.publishedTo("ai_scada/data/pressure-1").get(0).payload());
    assertThat(first.get("timestamp").asText()).isEqualTo(T0.toString());
    assertThat(first.get("quality").asInt()).isEqualTo(100);
  }

  @Test
  @DisplayName("Без аномалии значения остаются в нормальном диапазоне с учётом шума")
  void valuesStayNearNormalRange() {
    ReadingSimulator simulator = new ReadingSimulator(SensorProfile.pipelineCatalogue(), publisher,
        new Random(42), clock);

    for (int i = 0; i < 20; i++) {
      for (Reading reading : simulator.publishAll()) {
        SensorProfile p = profile(reading.entityId());
        assertThat(reading.value())
            .isBetween(Math.max(p.min(), p.normalMin() - p.noise() - 0.01),
                Math.min(p.max(), p.normalMax() + p.noise() + 0.01));
      }
      clock.advance(Duration.ofSeconds(5));
    }
  }

  @Test
  @DisplayName("Аномалия вибрации уводит значение к верхней границе и завершается")
  void vibrationAnomalyDriftsUp() {
    // Given
    SensorProfile vibration = profile("vibration-1");
    ReadingSimulator simulator = new ReadingSimulator(List.of(vibration), publisher, new Random(1), clock);

    // When
    assertThat(simulator.startAnomaly("vibration-1", Duration.ofSeconds(100))).isTrue();
    assertThat(simulator.startAnomaly("vibration-1", Duration.ofSeconds(100))).isFalse();
    clock.advance(Duration.ofSeconds(100));
    double peak = simulator.valueFor(vibration, clock.instant());

    // Then
    assertThat(peak).isGreaterThan(vibration.normalMax() + vibration.noise());
    simulator.publishAll();
    assertThat(simulator.anomalyActive()).isFalse();
  }

  @Test
  @DisplayName("Аномалия на неизвестном датчике отвергается")
  void unknownSensorAnomalyRejected() {
    ReadingSimulator simulator = new ReadingSimulator(SensorProfile.pipelineCatalogue(), publisher,
        new Random(1), clock);

    assertThatThrownBy(() -> simulator.startAnomaly("nope", Duration.ofSeconds(60)))
        .isInstanceOf(IllegalArgumentException.class);
    simulator.maybeStartAnomaly(0.0);
    assertThat(simulator.anomalyActive()).isFalse();
    simulator.maybeStartAnomaly(1.0);
    assertThat(simulator.anomalyActive()).isTrue();
  }

  @Test
  @DisplayName("Профиль с перепутанными границами отвергается")
  void invalidProfileRejected() {
    assertThatThrownBy(() -> new SensorProfile("x", "X", SensorType.FLOW, "u", 10, 5, 6, 7, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static SensorProfile profile(String entityId) {
    return SensorProfile.pipelineCatalogue().stream()
        .filter(p -> p.entityId().equals(entityId))
        .findFirst()
        .orElseThrow();
  }
}
