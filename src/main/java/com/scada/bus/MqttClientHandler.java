package com.scada.bus;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPubAckMessage;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttSubAckMessage;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Обработчик MQTT-пакетов одного соединения.
 * <p>
 * Сопоставляет подтверждения (CONNACK, SUBACK, PUBACK) с ожидающими их запросами,
 * отдаёт входящие PUBLISH получателю и подтверждает их, поддерживает keep-alive.
 */
public class MqttClientHandler extends SimpleChannelInboundHandler<MqttMessage> {

  private static final Logger logger = LoggerFactory.getLogger(MqttClientHandler.class);

  /** Код отказа в SUBACK. */
  static final int SUBSCRIPTION_FAILURE = 0x80;

  /**
   * События соединения, интересные шине.
   */
  public interface Listener {

    /**
     * @return {@code false}, если сообщение не принято: PUBACK тогда не отправляется.
     */
    boolean onPublish(String topic, byte[] payload);

    void onConnectionLost();
  }

  private final Listener listener;
  private final CompletableFuture<MqttConnAckMessage> connAck = new CompletableFuture<>();
  private final Map<Integer, CompletableFuture<Void>> pendingPubAcks = new ConcurrentHashMap<>();
  private final Map<Integer, CompletableFuture<List<Integer>>> pendingSubAcks = new ConcurrentHashMap<>();

  /**
   * Конструктор обработчика.
   *
   * @param listener Получатель входящих сообщений и событий обрыва.
   */
  public MqttClientHandler(Listener listener) {
    this.listener = listener;
  }

  Listener listener() {
    return listener;
  }

  public CompletableFuture<MqttConnAckMessage> connAck() {
    return connAck;
  }

  /**
   * Регистрирует ожидание PUBACK. Вызывать до отправки PUBLISH.
   */
  public CompletableFuture<Void> expectPubAck(int packetId) {
    CompletableFuture<Void> future = new CompletableFuture<>();
    pendingPubAcks.put(packetId, future);
    return future;
  }

  /**
   * Регистрирует ожидание SUBACK. Вызывать до отправки SUBSCRIBE.
   */
  public CompletableFuture<List<Integer>> expectSubAck(int packetId) {
    CompletableFuture<List<Integer>> future = new CompletableFuture<>();
    pendingSubAcks.put(packetId, future);
    return future;
  }

  public void forget(int packetId) {
    pendingPubAcks.remove(packetId);
    pendingSubAcks.remove(packetId);
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg) {
    if (msg.decoderResult().isFailure()) {
      logger.warn("Получен повреждённый MQTT-пакет: {}", msg.decoderResult().cause().getMessage());
      return;
    }
    MqttMessageType type = msg.fixedHeader().messageType();
    switch (type) {
      case CONNACK -> connAck.complete((MqttConnAckMessage) msg);
      case SUBACK -> {
        MqttSubAckMessage subAck = (MqttSubAckMessage) msg;
        CompletableFuture<List<Integer>> future = pendingSubAcks.remove(subAck.variableHeader().messageId());
        if (future != null) {
          future.complete(List.copyOf(subAck.payload().grantedQoSLevels()));
        }
      }
      case PUBACK -> {
        MqttPubAckMessage pubAck = (MqttPubAckMessage) msg;
        CompletableFuture<Void> future = pendingPubAcks.remove(pubAck.variableHeader().messageId());
        if (future != null) {
          future.complete(null);
        }
      }
      case PUBLISH -> handlePublish(ctx, (MqttPublishMessage) msg);
      case PINGRESP -> logger.trace("PINGRESP");
      default -> logger.debug("Пакет {} проигнорирован", type);
    }
  }

  private void handlePublish(ChannelHandlerContext ctx, MqttPublishMessage publish) {
    String topic = publish.variableHeader().topicName();
    byte[] payload = ByteBufUtil.getBytes(publish.payload());
    boolean accepted = true;
    try {
      accepted = listener.onPublish(topic, payload);
    } catch (RuntimeException e) {
      logger.error("❌ Ошибка получателя сообщения из топика {}", topic, e);
    }
    if (publish.fixedHeader().qosLevel() != MqttQoS.AT_LEAST_ONCE) {
      return;
    }
    if (accepted) {
      ctx.writeAndFlush(pubAck(publish.variableHeader().packetId()));
    } else {
      logger.debug("Сообщение {} из '{}' не принято, PUBACK не отправлен", publish.variableHeader().packetId(), topic);
    }
  }

  @Override
  public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
    if (evt instanceof IdleStateEvent && ((IdleStateEvent) evt).state() == IdleState.WRITER_IDLE) {
      ctx.writeAndFlush(control(MqttMessageType.PINGREQ));
      return;
    }
    super.userEventTriggered(ctx, evt);
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    BrokerUnavailableException lost = new BrokerUnavailableException("Соединение с брокером потеряно");
    connAck.completeExceptionally(lost);
    pendingPubAcks.values().forEach(f -> f.completeExceptionally(lost));
    pendingSubAcks.values().forEach(f -> f.completeExceptionally(lost));
    pendingPubAcks.clear();
    pendingSubAcks.clear();
    listener.onConnectionLost();
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("❌ Ошибка MQTT-соединения", cause);
    ctx.close();
  }

  static MqttPubAckMessage pubAck(int packetId) {
    return new MqttPubAckMessage(
        new MqttFixedHeader(MqttMessageType.PUBACK, false, MqttQoS.AT_MOST_ONCE, false, 0),
        MqttMessageIdVariableHeader.from(packetId)
    );
  }

  static MqttMessage control(MqttMessageType type) {
    return new MqttMessage(new MqttFixedHeader(type, false, MqttQoS.AT_MOST_ONCE, false, 0));
  }
}
