package com.scada.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scada.acl.AccessPolicyLoader;
import com.scada.bus.InboundMessage;
import com.scada.codec.PayloadCodec;
import com.scada.model.Confirmation;
import com.scada.model.ConfirmationStatus;
import com.scada.model.Reading;
import com.scada.publish.PublicationAdapter;
import com.scada.retry.Retrier;
import com.scada.retry.RetryPolicy;
import com.scada.testing.InMemoryBus;
import com.scada.testing.InMemoryReadingStore;
import com.scada.topic.TopicContract;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Тесты сервиса приёма: разбор, запись, подтверждение. Шина и БД — в памяти.
 */
class IngestionServiceImplTest {

  private static final Instant NOW = Instant.parse("2025-05-01T12:00:00Z");

  private final TopicContract contract = new TopicContract("ai_scada");
  private final ObjectMapper mapper = new ObjectMapper();
  private InMemoryBus bus;
  private InMemoryReadingStore store;
  private PublicationAdapter publisher;
  private IngestionServiceImpl service;

  @BeforeEach
  void setUp() {
    bus = new InMemoryBus();
    store = new InMemoryReadingStore();
    Retrier retrier = new Retrier(new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 0.0), d -> { });
    PayloadCodec codec = new PayloadCodec(Clock.fixed(NOW, ZoneOffset.UTC));
    publisher = new PublicationAdapter(bus, retrier, codec, contract,
        new AccessPolicyLoader(contract).load("classpath:acl-policy.json"), "api-service");
    service = new IngestionServiceImpl(contract, codec, store, retrier, publisher);
  }

  @AfterEach
  void tearDown() {
    publisher.close();
  }

  private Optional<Confirmation> process(String topic, String payload) {
    return service.process(new InboundMessage(topic, payload.getBytes(StandardCharsets.UTF_8)));
  }

  private JsonNode lastConfirmation(String entityId) throws Exception {
    publisher.drain(5000);
    var published = bus.publishedTo(contract.confirmationTopic(entityId));
    assertThat(published).isNotEmpty();
    return mapper.readTree(published.get(published.size() - 1).payload());
  }

  @Test
  @DisplayName("Сценарий A: валидное измерение сохраняется и подтверждается как accepted")
  void acceptsValidReading() throws Exception {
    // When
    Optional<Confirmation> result = process("ai_scada/data/pressure-1",
        "{\"timestamp\":\"2025-05-01T10:00:00Z\",\"value\":35.35,\"quality\":100}");

    // Then
    Instant ts = Instant.parse("2025-05-01T10:00:00Z");
    assertThat(result).contains(Confirmation.accepted(new Reading("pressure-1", ts, 35.35, 100)));
    assertThat(store.get("pressure-1", ts)).isEqualTo(new Reading("pressure-1", ts, 35.35, 100));

    JsonNode confirmation = lastConfirmation("pressure-1");
    assertThat(confirmation.get("status").asText()).isEqualTo("accepted");
    assertThat(confirmation.get("original_timestamp").asText()).isEqualTo("2025-05-01T10:00:00Z");
    assertThat(confirmation.get("entity_id").asText()).isEqualTo("pressure-1");
  }

  @Test
  @DisplayName("Повторная доставка того же измерения → одна строка, два accepted")
  void redeliveryIsIdempotent() throws Exception {
    String payload = "{\"timestamp\":\"2025-05-01T10:00:00Z\",\"value\":35.35,\"quality\":100}";

    process("ai_scada/data/pressure-1", payload);
    process("ai_scada/data/pressure-1", payload);
    publisher.drain(5000);

    assertThat(store.countFor("pressure-1")).isEqualTo(1);
    assertThat(service.acceptedCount()).isEqualTo(2);
    assertThat(bus.publishedTo("ai_scada/data/pressure-1/confirmation"))
        .hasSize(2)
        .allMatch(p -> p.text().contains("\"accepted\""));
  }

  @Test
  @DisplayName("Нечисловое value → rejected/MalformedPayload, в БД ничего")
  void rejectsMalformedPayload() throws Exception {
    Optional<Confirmation> result = process("ai_scada/data/flow-1",
        "{\"timestamp\":\"2025-05-01T10:00:00Z\",\"value\":\"abc\"}");

    assertThat(result).hasValueSatisfying(c -> {
      assertThat(c.status()).isEqualTo(ConfirmationStatus.REJECTED);
      assertThat(c.reason()).contains("MalformedPayload");
      assertThat(c.originalTimestamp()).contains(Instant.parse("2025-05-01T10:00:00Z"));
    });
    assertThat(store.size()).isZero();
    assertThat(store.upsertAttempts()).isZero();

    JsonNode confirmation = lastConfirmation("flow-1");
    assertThat(confirmation.get("status").asText()).isEqualTo("rejected");
    assertThat(confirmation.get("reason").asText()).isEqualTo("MalformedPayload");
  }

  @Test
  @DisplayName("Сценарий B: нет поля value → rejected/MalformedPayload, строка не создана")
  void rejectsMissingValue() throws Exception {
    // When
    Optional<Confirmation> result = process("ai_scada/data/pressure-1",
        "{\"timestamp\":\"2025-05-01T10:00:00Z\",\"quality\":100}");

    // Then
    assertThat(result).hasValueSatisfying(c -> {
      assertThat(c.status()).isEqualTo(ConfirmationStatus.REJECTED);
      assertThat(c.reason()).contains("MalformedPayload");
    });
    assertThat(store.countFor("pressure-1")).isZero();
    assertThat(store.upsertAttempts()).isZero();

    JsonNode confirmation = lastConfirmation("pressure-1");
    assertThat(confirmation.get("status").asText()).isEqualTo("rejected");
    assertThat(confirmation.get("reason").asText()).isEqualTo("MalformedPayload");
    assertThat(confirmation.get("original_timestamp").asText()).isEqualTo("2025-05-01T10:00:00Z");
  }

  @Test
  @DisplayName("Без timestamp и quality → время приёма и качество 100")
  void appliesPayloadDefaults() {
    Optional<Confirmation> result = process("ai_scada/data/temp-1", "{\"value\":61.5}");

    assertThat(result).hasValueSatisfying(c -> assertThat(c.isAccepted()).isTrue());
    assertThat(store.get("temp-1", NOW)).isEqualTo(new Reading("temp-1", NOW, 61.5, 100));
  }

  @Test
  @DisplayName("Кратковременный сбой БД переживается повтором")
  void retriesTransientStorageFailure() {
    store.failNext(2);

    Optional<Confirmation> result = process("ai_scada/data/flow-2", "{\"value\":40.0}");

    assertThat(result).hasValueSatisfying(c -> assertThat(c.isAccepted()).isTrue());
    assertThat(store.upsertAttempts()).isEqualTo(3);
    assertThat(store.countFor("flow-2")).isEqualTo(1);
  }

  @Test
  @DisplayName("Сценарий D: БД недоступна дольше бюджета повторов → rejected/StorageUnavailable, сервис жив")
  void rejectsWhenStorageStaysDown() throws Exception {
    store.setUnavailable(true);

    Optional<Confirmation> result = process("ai_scada/data/flow-2", "{\"value\":40.0}");

    assertThat(result).hasValueSatisfying(c -> assertThat(c.reason()).contains("StorageUnavailable"));
    assertThat(store.upsertAttempts()).isEqualTo(3);
    assertThat(lastConfirmation("flow-2").get("reason").asText()).isEqualTo("StorageUnavailable");
    assertThat(service.rejectedCount()).isEqualTo(1);

    // БД вернулась
    store.setUnavailable(false);
    assertThat(process("ai_scada/data/flow-2", "{\"value\":41.0}"))
        .hasValueSatisfying(c -> assertThat(c.isAccepted()).isTrue());
  }

  @Test
  @DisplayName("Топик с лишними сегментами → без подтверждения и без записи")
  void dropsMalformedTopic() {
    Optional<Confirmation> result = process("ai_scada/data/flow-1/extra", "{\"value\":1}");

    publisher.drain(5000);
    assertThat(result).isEmpty();
    assertThat(store.upsertAttempts()).isZero();
    assertThat(bus.published()).isEmpty();
  }

  @Test
  @DisplayName("Пробельный идентификатор датчика в топике → без подтверждения, исключение не вылетает")
  void dropsBlankEntityTopic() {
    // When
    Optional<Confirmation> result = process("ai_scada/data/ ", "{\"value\":1.0}");

    // Then
    publisher.drain(5000);
    assertThat(result).isEmpty();
    assertThat(service.rejectedCount()).isEqualTo(1);
    assertThat(store.upsertAttempts()).isZero();
    assertThat(bus.published()).isEmpty();
  }

  @Test
  @DisplayName("Отказ без записи → rejected с указанной причиной и исходным timestamp")
  void refusesWithoutWriting() throws Exception {
    Optional<Confirmation> result = service.refuse(new InboundMessage("ai_scada/data/flow-1",
        "{\"timestamp\":\"2025-05-01T10:00:00Z\",\"value\":40.0}".getBytes(StandardCharsets.UTF_8)),
        "StorageUnavailable");

    assertThat(result).hasValueSatisfying(c -> {
      assertThat(c.status()).isEqualTo(ConfirmationStatus.REJECTED);
      assertThat(c.reason()).contains("StorageUnavailable");
      assertThat(c.originalTimestamp()).contains(Instant.parse("2025-05-01T10:00:00Z"));
    });
    assertThat(store.upsertAttempts()).isZero();
    assertThat(lastConfirmation("flow-1").get("reason").asText()).isEqualTo("StorageUnavailable");
  }
}
