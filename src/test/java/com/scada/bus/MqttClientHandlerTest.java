package com.scada.bus;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPubAckMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttSubAckMessage;
import io.netty.handler.codec.mqtt.MqttSubAckPayload;
import io.netty.handler.timeout.IdleStateEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Модульные тесты MqttClientHandler на EmbeddedChannel: без сети и брокера.
 */
class MqttClientHandlerTest {

  @Mock
  private MqttClientHandler.Listener listener;

  private MqttClientHandler handler;
  private EmbeddedChannel channel;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    when(listener.onPublish(anyString(), any())).thenReturn(true);
    handler = new MqttClientHandler(listener);
    channel = new EmbeddedChannel(handler);
  }

  @Test
  @DisplayName("CONNACK завершает ожидание подключения")
  void completesConnAck() throws Exception {
    // When
    channel.writeInbound(MqttMessageBuilders.connAck()
        .returnCode(MqttConnectReturnCode.CONNECTION_ACCEPTED)
        .sessionPresent(false)
        .build());

    // Then
    MqttConnAckMessage ack = handler.connAck().get();
    assertThat(ack.variableHeader().connectReturnCode()).isEqualTo(MqttConnectReturnCode.CONNECTION_ACCEPTED);
  }

  @Test
  @DisplayName("Входящий PUBLISH QoS 1 → получатель вызван, брокеру ушёл PUBACK с тем же id")
  void deliversPublishAndAcknowledges() {
    // Given
    String payload = "{\"value\":35.35}";

    // When
    channel.writeInbound(MqttMessageBuilders.publish()
        .topicName("ai_scada/data/pressure-1")
        .qos(MqttQoS.AT_LEAST_ONCE)
        .messageId(7)
        .payload(Unpooled.copiedBuffer(payload, StandardCharsets.UTF_8))
        .build());

    // Then
    ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
    verify(listener).onPublish(eq("ai_scada/data/pressure-1"), captor.capture());
    assertThat(new String(captor.getValue(), StandardCharsets.UTF_8)).isEqualTo(payload);

    MqttPubAckMessage ack = channel.readOutbound();
    assertThat(ack.variableHeader().messageId()).isEqualTo(7);
  }

  @Test
  @DisplayName("Ошибка получателя не мешает подтвердить PUBLISH")
  void acknowledgesEvenIfListenerFails() {
    doThrow(new IllegalStateException("сбой")).when(listener).onPublish(anyString(), any());

    channel.writeInbound(MqttMessageBuilders.publish()
        .topicName("ai_scada/data/flow-1")
        .qos(MqttQoS.AT_LEAST_ONCE)
        .messageId(8)
        .payload(Unpooled.copiedBuffer("{}", StandardCharsets.UTF_8))
        .build());

    MqttPubAckMessage ack = channel.readOutbound();
    assertThat(ack.variableHeader().messageId()).isEqualTo(8);
    assertThat(channel.isActive()).isTrue();
  }

  @Test
  @DisplayName("Получатель отказался от PUBLISH → PUBACK не отправляется, брокер доставит повторно")
  void skipsAcknowledgementWhenNotAccepted() {
    // Given
    when(listener.onPublish(anyString(), any())).thenReturn(false);

    // When
    channel.writeInbound(MqttMessageBuilders.publish()
        .topicName("ai_scada/data/flow-1")
        .qos(MqttQoS.AT_LEAST_ONCE)
        .messageId(9)
        .payload(Unpooled.copiedBuffer("{}", StandardCharsets.UTF_8))
        .build());

    // Then
    verify(listener).onPublish(eq("ai_scada/data/flow-1"), any());
    Object outbound = channel.readOutbound();
    assertThat(outbound).isNull();
  }

  @Test
  @DisplayName("PUBACK и SUBACK сопоставляются с ожиданиями по id пакета")
  void matchesAcknowledgementsById() throws Exception {
    // Given
    CompletableFuture<Void> pubAck = handler.expectPubAck(3);
    CompletableFuture<Void> otherPubAck = handler.expectPubAck(4);
    CompletableFuture<List<Integer>> subAck = handler.expectSubAck(5);

    // When
    channel.writeInbound(MqttClientHandler.pubAck(3));
    channel.writeInbound(new MqttSubAckMessage(
        new MqttFixedHeader(MqttMessageType.SUBACK, false, MqttQoS.AT_MOST_ONCE, false, 0),
        MqttMessageIdVariableHeader.from(5),
        new MqttSubAckPayload(1)));

    // Then
    assertThat(pubAck).isCompleted();
    assertThat(otherPubAck).isNotDone();
    assertThat(subAck.get()).containsExactly(1);
  }

  @Test
  @DisplayName("Простой на запись → PINGREQ")
  void sendsPingOnWriterIdle() {
    channel.pipeline().fireUserEventTriggered(IdleStateEvent.WRITER_IDLE_STATE_EVENT);

    MqttMessage ping = channel.readOutbound();
    assertThat(ping.fixedHeader().messageType()).isEqualTo(MqttMessageType.PINGREQ);
  }

  @Test
  @DisplayName("Обрыв соединения: ожидания завершаются BrokerUnavailable, шина уведомлена")
  void failsPendingOnDisconnect() {
    // Given
    CompletableFuture<Void> pubAck = handler.expectPubAck(9);

    // When
    channel.close();

    // Then
    assertThatThrownBy(pubAck::get)
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(BrokerUnavailableException.class);
    assertThat(handler.connAck()).isCompletedExceptionally();
    verify(listener).onConnectionLost();
  }
}
