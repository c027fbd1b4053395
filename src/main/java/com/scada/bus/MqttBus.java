package com.scada.bus;

import com.scada.config.PipelineSettings.MqttSettings;
import com.scada.retry.Retrier;
import com.scada.topic.TopicPattern;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttVersion;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MQTT 3.1.1-клиент на Netty: QoS 1, чистая сессия, keep-alive.
 * <p>
 * После обрыва соединения переподключается в фоне по {@link com.scada.retry.RetryPolicy}
 * и заново оформляет все подписки: с чистой сессией брокер их не помнит.
 */
public class MqttBus implements MessageBus {

  private static final Logger logger = LoggerFactory.getLogger(MqttBus.class);

  private final MqttSettings settings;
  private final Retrier retrier;
  private final EventLoopGroup group;
  private final ExecutorService reconnector;
  private final Map<TopicPattern, MessageHandler> subscriptions = new ConcurrentHashMap<>();
  private final AtomicInteger packetIds = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicBoolean reconnecting = new AtomicBoolean();

  private volatile Channel channel;
  private volatile MqttClientHandler handler;

  /**
   * Конструктор шины.
   *
   * @param settings Адрес брокера и учётные данные принципала.
   * @param retrier  Политика повторов подключения.
   */
  public MqttBus(MqttSettings settings, Retrier retrier) {
    this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    this.retrier = Objects.requireNonNull(retrier, "retrier cannot be null");
    this.group = new NioEventLoopGroup(1);
    this.reconnector = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "mqtt-reconnect-" + settings.clientId());
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public void connect() {
    retrier.run("подключение к MQTT " + settings.host() + ":" + settings.port(),
        this::connectOnce, Retrier.on(BrokerUnavailableException.class));
  }

  /**
   * Подключается в фоне, не блокируя вызывающего: старт при недоступном брокере не должен
   * останавливать остальные компоненты.
   */
  public void connectInBackground() {
    if (!closed.get() && reconnecting.compareAndSet(false, true)) {
      reconnector.execute(this::reconnectLoop);
    }
  }

  private synchronized void connectOnce() {
    if (closed.get()) {
      throw new IllegalStateException("Шина уже закрыта");
    }
    if (isConnected()) {
      return;
    }
    MqttClientHandler newHandler = new MqttClientHandler(new MqttClientHandler.Listener() {
      @Override
      public boolean onPublish(String topic, byte[] payload) {
        return dispatch(topic, payload);
      }

      @Override
      public void onConnectionLost() {
        handleConnectionLost(this);
      }
    });

    Bootstrap b = new Bootstrap();
    b.group(group)
        .channel(NioSocketChannel.class)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.ackTimeout().toMillis())
        .option(ChannelOption.SO_KEEPALIVE, true)
        .handler(new ChannelInitializer<SocketChannel>() {
          @Override
          public void initChannel(SocketChannel ch) {
            ch.pipeline()
                .addLast(new MqttDecoder())
                .addLast(MqttEncoder.INSTANCE)
                .addLast(new IdleStateHandler(0, keepAliveSeconds(), 0, TimeUnit.SECONDS))
                .addLast(newHandler);
          }
        });

    ChannelFuture f = b.connect(settings.host(), settings.port()).awaitUninterruptibly();
    if (!f.isSuccess()) {
      throw new BrokerUnavailableException("Брокер " + settings.host() + ":" + settings.port() + " недоступен", f.cause());
    }
    Channel ch = f.channel();

    ch.writeAndFlush(MqttMessageBuilders.connect()
        .clientId(settings.clientId())
        .username(settings.username())
        .password(settings.password().getBytes(StandardCharsets.UTF_8))
        .protocolVersion(MqttVersion.MQTT_3_1_1)
        .cleanSession(true)
        .keepAlive((int) settings.keepAlive().getSeconds())
        .build());

    MqttConnAckMessage ack;
    try {
      ack = await(newHandler.connAck(), "CONNACK");
    } catch (BrokerUnavailableException e) {
      ch.close();
      throw e;
    }
    MqttConnectReturnCode code = ack.variableHeader().connectReturnCode();
    if (code != MqttConnectReturnCode.CONNECTION_ACCEPTED) {
      ch.close();
      throw new BrokerUnavailableException("Брокер отклонил подключение '" + settings.clientId() + "': " + code);
    }

    try {
      for (TopicPattern pattern : subscriptions.keySet()) {
        sendSubscribe(ch, newHandler, pattern);
      }
    } catch (BrokerUnavailableException e) {
      ch.close();
      throw e;
    }

    this.handler = newHandler;
    this.channel = ch;
    logger.info("✅ Подключено к MQTT-брокеру {}:{} как '{}'", settings.host(), settings.port(), settings.username());
  }

  @Override
  public synchronized void subscribe(TopicPattern pattern, MessageHandler messageHandler) {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    Objects.requireNonNull(messageHandler, "handler cannot be null");
    subscriptions.put(pattern, messageHandler);
    MqttClientHandler h = handler;
    Channel ch = channel;
    if (h != null && ch != null && ch.isActive()) {
      sendSubscribe(ch, h, pattern);
    }
  }

  private void sendSubscribe(Channel ch, MqttClientHandler h, TopicPattern pattern) {
    int id = nextPacketId();
    CompletableFuture<List<Integer>> subAck = h.expectSubAck(id);
    ch.writeAndFlush(MqttMessageBuilders.subscribe()
        .messageId(id)
        .addSubscription(MqttQoS.AT_LEAST_ONCE, pattern.toString())
        .build());
    List<Integer> granted;
    try {
      granted = await(subAck, "SUBACK");
    } finally {
      h.forget(id);
    }
    if (granted.isEmpty() || granted.get(0) == MqttClientHandler.SUBSCRIPTION_FAILURE) {
      throw new BrokerUnavailableException("Брокер отклонил подписку на '" + pattern + "'");
    }
    logger.info("Подписка на '{}' оформлена (QoS {})", pattern, granted.get(0));
  }

  @Override
  public void publish(String topic, byte[] payload) {
    Objects.requireNonNull(topic, "topic cannot be null");
    MqttClientHandler h = requireHandler();
    Channel ch = channel;
    if (ch == null) {
      throw new BrokerUnavailableException("Нет соединения с брокером " + settings.host() + ":" + settings.port());
    }
    int id = nextPacketId();
    CompletableFuture<Void> pubAck = h.expectPubAck(id);
    ch.writeAndFlush(MqttMessageBuilders.publish()
        .topicName(topic)
        .qos(MqttQoS.AT_LEAST_ONCE)
        .retained(false)
        .messageId(id)
        .payload(Unpooled.wrappedBuffer(payload))
        .build());
    try {
      await(pubAck, "PUBACK");
    } finally {
      h.forget(id);
    }
  }

  @Override
  public boolean isConnected() {
    Channel ch = channel;
    return ch != null && ch.isActive() && handler != null;
  }

  /**
   * @return {@code false}, если хотя бы один подписчик отказался от сообщения.
   */
  private boolean dispatch(String topic, byte[] payload) {
    InboundMessage message = new InboundMessage(topic, payload);
    boolean delivered = false;
    boolean accepted = true;
    for (Map.Entry<TopicPattern, MessageHandler> entry : subscriptions.entrySet()) {
      if (entry.getKey().matches(topic)) {
        accepted &= entry.getValue().onMessage(message);
        delivered = true;
      }
    }
    if (!delivered) {
      logger.debug("Сообщение из '{}' не подошло ни под одну подписку", topic);
    }
    return accepted;
  }

  private void handleConnectionLost(MqttClientHandler.Listener lostListener) {
    MqttClientHandler current = handler;
    if (current == null || current.listener() != lostListener) {
      // Обрыв соединения, которое так и не стало активным: им занимается connect().
      return;
    }
    channel = null;
    handler = null;
    if (closed.get()) {
      return;
    }
    logger.warn("⚠️ Соединение с MQTT-брокером потеряно, переподключение...");
    if (reconnecting.compareAndSet(false, true)) {
      reconnector.execute(this::reconnectLoop);
    }
  }

  /**
   * Переподключается, пока не получится или шину не закроют. Между раундами политика повторов
   * уже выдержала растущие паузы, поэтому длительный простой брокера не приводит к падению.
   */
  private void reconnectLoop() {
    try {
      while (!closed.get() && !isConnected() && !Thread.currentThread().isInterrupted()) {
        try {
          connect();
        } catch (BrokerUnavailableException e) {
          logger.error("❌ Брокер по-прежнему недоступен: {}", e.getMessage());
        }
      }
    } finally {
      reconnecting.set(false);
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    reconnector.shutdownNow();
    Channel ch = channel;
    if (ch != null && ch.isActive()) {
      ch.writeAndFlush(MqttClientHandler.control(MqttMessageType.DISCONNECT)).awaitUninterruptibly(1, TimeUnit.SECONDS);
      ch.close().awaitUninterruptibly(1, TimeUnit.SECONDS);
    }
    group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    logger.info("Отключено от MQTT-брокера ({})", settings.clientId());
  }

  private MqttClientHandler requireHandler() {
    MqttClientHandler h = handler;
    if (h == null || !isConnected()) {
      throw new BrokerUnavailableException("Нет соединения с брокером " + settings.host() + ":" + settings.port());
    }
    return h;
  }

  /** Идентификаторы пакетов 1..65535, ноль запрещён протоколом. */
  private int nextPacketId() {
    return packetIds.updateAndGet(i -> i >= 0xFFFF ? 1 : i + 1);
  }

  private int keepAliveSeconds() {
    long seconds = settings.keepAlive().getSeconds();
    return seconds <= 0 ? 0 : (int) Math.max(1, seconds / 2);
  }

  private <T> T await(CompletableFuture<T> future, String what) {
    Duration timeout = settings.ackTimeout();
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new BrokerUnavailableException(what + " не получен за " + timeout.toMillis() + " мс", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof BrokerUnavailableException) {
        throw (BrokerUnavailableException) cause;
      }
      throw new BrokerUnavailableException("Ошибка ожидания " + what, cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerUnavailableException("Ожидание " + what + " прервано", e);
    }
  }
}
