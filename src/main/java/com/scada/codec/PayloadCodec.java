package com.scada.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scada.model.Confirmation;
import com.scada.model.Prediction;
import com.scada.model.Reading;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * JSON-кодек полезных нагрузок. Формат версионирован полем {@code "v"}.
 * <p>
 * Входящее измерение: {@code {"timestamp": "...", "value": 35.35, "quality": 100, "v": 1}}.
 * Без {@code timestamp} используется время приёма, без {@code quality} — 100.
 */
public class PayloadCodec {

  public static final int WIRE_VERSION = 1;

  static final String FIELD_VERSION = "v";
  static final String FIELD_TIMESTAMP = "timestamp";
  static final String FIELD_VALUE = "value";
  static final String FIELD_QUALITY = "quality";

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public PayloadCodec() {
    this(Clock.systemUTC());
  }

  public PayloadCodec(Clock clock) {
    this.objectMapper = new ObjectMapper();
    this.clock = clock;
  }

  /**
   * Разбирает полезную нагрузку измерения.
   *
   * @param entityId Идентификатор датчика, извлечённый из топика.
   * @param payload  Тело сообщения.
   * @return Измерение.
   * @throws MalformedPayloadException при любом нарушении схемы.
   */
  public Reading decodeReading(String entityId, byte[] payload) {
    JsonNode root = parse(payload);

    JsonNode version = root.get(FIELD_VERSION);
    if (version != null && (!version.canConvertToInt() || !version.isIntegralNumber() || version.intValue() != WIRE_VERSION)) {
      throw new MalformedPayloadException("Неподдерживаемая версия формата: " + version);
    }

    JsonNode value = root.get(FIELD_VALUE);
    if (value == null || value.isNull()) {
      throw new MalformedPayloadException("Нет обязательного поля 'value'");
    }
    if (!value.isNumber()) {
      throw new MalformedPayloadException("Поле 'value' должно быть числом: " + value);
    }
    double measured = value.doubleValue();
    if (!Double.isFinite(measured)) {
      throw new MalformedPayloadException("Поле 'value' должно быть конечным числом: " + value);
    }

    int quality = Reading.DEFAULT_QUALITY;
    JsonNode qualityNode = root.get(FIELD_QUALITY);
    if (qualityNode != null && !qualityNode.isNull()) {
      if (!qualityNode.isIntegralNumber() || !qualityNode.canConvertToInt()) {
        throw new MalformedPayloadException("Поле 'quality' должно быть целым числом: " + qualityNode);
      }
      quality = qualityNode.intValue();
      if (quality < Reading.MIN_QUALITY || quality > Reading.MAX_QUALITY) {
        throw new MalformedPayloadException("Поле 'quality' вне диапазона 0..100: " + quality);
      }
    }

    return new Reading(entityId, decodeTimestamp(root.get(FIELD_TIMESTAMP)), measured, quality);
  }

  /**
   * Достаёт {@code timestamp} из нагрузки, не проверяя остальные поля.
   * Нужна, чтобы отклонённое подтверждение ссылалось на исходное измерение, если это возможно.
   *
   * @return Момент измерения или {@code null}, если его не удалось прочитать.
   */
  public Instant peekTimestamp(byte[] payload) {
    try {
      JsonNode node = objectMapper.readTree(payload);
      if (node == null || !node.isObject()) {
        return null;
      }
      JsonNode ts = node.get(FIELD_TIMESTAMP);
      return ts == null || !ts.isTextual() ? null : parseInstant(ts.asText());
    } catch (java.io.IOException | DateTimeParseException e) {
      return null;
    }
  }

  public byte[] encodeReading(Reading reading) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put(FIELD_VERSION, WIRE_VERSION);
    node.put(FIELD_TIMESTAMP, reading.timestamp().toString());
    node.put(FIELD_VALUE, reading.value());
    node.put(FIELD_QUALITY, reading.quality());
    return write(node);
  }

  public byte[] encodeConfirmation(Confirmation confirmation) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put(FIELD_VERSION, WIRE_VERSION);
    node.put("entity_id", confirmation.entityId());
    confirmation.originalTimestamp().ifPresent(ts -> node.put("original_timestamp", ts.toString()));
    node.put("status", confirmation.status().wireName());
    confirmation.reason().ifPresent(r -> node.put("reason", r));
    return write(node);
  }

  public byte[] encodePrediction(Prediction prediction) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put(FIELD_VERSION, WIRE_VERSION);
    node.put("entity_id", prediction.entityId());
    node.put("generated_at", prediction.generatedAt().toString());
    node.put("horizon", prediction.horizon().toString());
    node.put("predicted_value", prediction.predictedValue());
    prediction.confidence().ifPresent(c -> node.put("confidence", c));
    node.put("type", "prediction");
    return write(node);
  }

  private JsonNode parse(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new MalformedPayloadException("Пустая полезная нагрузка");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (java.io.IOException e) {
      throw new MalformedPayloadException("Нагрузка не является JSON: "
          + new String(payload, StandardCharsets.UTF_8), e);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedPayloadException("Нагрузка должна быть JSON-объектом");
    }
    return root;
  }

  private Instant decodeTimestamp(JsonNode node) {
    if (node == null || node.isNull()) {
      return clock.instant();
    }
    if (!node.isTextual()) {
      throw new MalformedPayloadException("Поле 'timestamp' должно быть строкой ISO-8601: " + node);
    }
    try {
      return parseInstant(node.asText());
    } catch (DateTimeParseException e) {
      throw new MalformedPayloadException("Не удалось разобрать 'timestamp': " + node.asText(), e);
    }
  }

  /**
   * ISO-8601 с зоной или без неё; время без зоны считается UTC.
   */
  static Instant parseInstant(String text) {
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    }
  }

  private byte[] write(ObjectNode node) {
    try {
      return objectMapper.writeValueAsBytes(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Не удалось сериализовать " + node, e);
    }
  }
}
