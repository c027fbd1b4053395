package com.scada.app;

import com.scada.acl.AccessPolicy;
import com.scada.acl.AccessPolicyLoader;
import com.scada.acl.AccessPolicyValidator;
import com.scada.acl.ComponentTraffic;
import com.scada.acl.MosquittoAclWriter;
import com.scada.bus.BrokerUnavailableException;
import com.scada.bus.MqttBus;
import com.scada.codec.PayloadCodec;
import com.scada.config.Config;
import com.scada.config.ConfigurationException;
import com.scada.config.PipelineSettings;
import com.scada.db.DatabaseConnection;
import com.scada.db.HistoryDao;
import com.scada.db.ReadingDao;
import com.scada.db.StorageUnavailableException;
import com.scada.ingest.IngestionAdapter;
import com.scada.ingest.IngestionServiceImpl;
import com.scada.prediction.LinearTrendTrainer;
import com.scada.prediction.ModelHolder;
import com.scada.prediction.PeriodicTask;
import com.scada.prediction.PredictionEngine;
import com.scada.publish.PublicationAdapter;
import com.scada.retry.Retrier;
import com.scada.simulator.ReadingSimulator;
import com.scada.simulator.SensorProfile;
import com.scada.topic.TopicContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

/**
 * Главный класс приложения. Собирает конвейер: приём измерений, движок прогнозирования и,
 * по флагу {@code --simulate}, имитатор датчиков.
 * <p>
 * Флаг {@code --print-acl} печатает политику доступа в формате acl_file Mosquitto и завершает работу.
 */
public class PipelineApplication {

  private static final Logger logger = LoggerFactory.getLogger(PipelineApplication.class);

  /** Раз в час с вероятностью 10% запускается аномалия. */
  private static final double ANOMALIES_PER_SECOND = 0.1 / 3600.0;

  private final PipelineSettings settings;
  private final AccessPolicy policy;
  private final TopicContract contract;
  private final boolean simulate;
  private final Retrier retrier;
  private final PayloadCodec codec = new PayloadCodec();

  private final List<MqttBus> buses = new ArrayList<>();
  private final List<PublicationAdapter> publishers = new ArrayList<>();
  private IngestionAdapter ingestion;
  private PredictionEngine engine;
  private PeriodicTask simulatorTask;

  /**
   * Конструктор приложения. Проверяет политику доступа против трафика компонентов.
   *
   * @param settings Проверенные настройки.
   * @param policy   Загруженная политика доступа.
   * @param simulate Запускать ли имитатор датчиков.
   * @throws ConfigurationException если компоненту не хватает прав или у имитатора нет пароля.
   */
  public PipelineApplication(PipelineSettings settings, AccessPolicy policy, boolean simulate) {
    this.settings = settings;
    this.policy = policy;
    this.contract = new TopicContract(settings.namespace());
    this.simulate = simulate;
    this.retrier = new Retrier(settings.retryPolicy());
    AccessPolicyValidator.validate(policy, declaredTraffic());
    if (simulate) {
      // пароль имитатора обязателен только при --simulate
      settings.mqttFor(settings.principals().simulator());
    }
  }

  /**
   * Трафик каждого компонента, как он его реально использует.
   */
  List<ComponentTraffic> declaredTraffic() {
    PipelineSettings.Principals p = settings.principals();
    List<ComponentTraffic> traffic = new ArrayList<>();
    traffic.add(new ComponentTraffic("ingestion", p.ingest(),
        Set.of(contract.readingSubscription()), Set.of(contract.confirmationPattern())));
    traffic.add(new ComponentTraffic("prediction", p.prediction(),
        Set.of(), Set.of(contract.predictionPattern())));
    if (simulate) {
      traffic.add(new ComponentTraffic("simulator", p.simulator(),
          Set.of(), Set.of(contract.readingSubscription())));
    }
    return traffic;
  }

  /**
   * Инициализирует БД, подключается к брокеру и запускает компоненты.
   */
  public void start() {
    DatabaseConnection database = new DatabaseConnection(settings.database());
    try {
      retrier.run("инициализация БД", database::initializeDatabase, Retrier.on(StorageUnavailableException.class));
    } catch (StorageUnavailableException e) {
      // Измерения будут отклоняться, пока БД не поднимется, но процесс продолжает работу.
      logger.error("❌ БД недоступна при старте, схема не проверена: {}", e.getMessage());
    }

    PipelineSettings.Principals p = settings.principals();

    // Приём измерений
    MqttBus ingestBus = openBus(p.ingest());
    PublicationAdapter confirmations = publisher(ingestBus, p.ingest());
    IngestionServiceImpl service = new IngestionServiceImpl(contract, codec, new ReadingDao(database),
        retrier, confirmations);
    ingestion = new IngestionAdapter(ingestBus, contract, service,
        settings.ingest().lanes(), settings.ingest().laneCapacity());
    ingestion.start();

    // Прогнозирование
    MqttBus predictionBus = p.prediction().equals(p.ingest()) ? ingestBus : openBus(p.prediction());
    PublicationAdapter predictions = publisher(predictionBus, p.prediction());
    PipelineSettings.PredictionSettings ps = settings.prediction();
    engine = new PredictionEngine(new HistoryDao(database, settings.historyMaxLimit()),
        new LinearTrendTrainer(ps.mode(), ps.minSamples()), new ModelHolder(), predictions, ps);
    engine.start();

    if (simulate) {
      startSimulator(p.simulator());
    }
    logger.info("🚀 Конвейер запущен (пространство топиков '{}')", contract.namespace());
  }

  private void startSimulator(String principal) {
    MqttBus simulatorBus = openBus(principal);
    ReadingSimulator simulator = new ReadingSimulator(SensorProfile.pipelineCatalogue(),
        publisher(simulatorBus, principal));
    Duration interval = settings.simulatorInterval();
    double anomalyChance = ANOMALIES_PER_SECOND * interval.toSeconds();
    simulatorTask = new PeriodicTask("simulator", Duration.ZERO, interval, () -> {
      simulator.maybeStartAnomaly(anomalyChance);
      simulator.publishAll();
    });
    simulatorTask.start();
  }

  private MqttBus openBus(String principal) {
    MqttBus bus = new MqttBus(settings.mqttFor(principal), retrier);
    buses.add(bus);
    try {
      bus.connect();
    } catch (BrokerUnavailableException e) {
      logger.error("❌ Брокер недоступен для '{}', подключение продолжится в фоне: {}", principal, e.getMessage());
      bus.connectInBackground();
    }
    return bus;
  }

  private PublicationAdapter publisher(MqttBus bus, String principal) {
    PublicationAdapter adapter = new PublicationAdapter(bus, retrier, codec, contract, policy, principal,
        settings.publishQueueCapacity());
    publishers.add(adapter);
    return adapter;
  }

  /**
   * Останавливает компоненты в порядке: имитатор, прогнозирование, приём, публикации, шины.
   */
  public void stop() {
    Duration drain = settings.ingest().drainTimeout();
    logger.info("Остановка конвейера...");
    if (simulatorTask != null) {
      simulatorTask.stop(drain);
    }
    if (engine != null) {
      engine.stop(drain);
    }
    if (ingestion != null) {
      ingestion.stop(drain);
    }
    publishers.forEach(adapter -> adapter.drain(drain.toMillis()));
    buses.forEach(MqttBus::close);
    logger.info("Конвейер остановлен");
  }

  /**
   * Точка входа в приложение.
   *
   * @param args {@code --print-acl} или {@code --simulate}.
   */
  public static void main(String[] args) throws InterruptedException {
    List<String> flags = Arrays.asList(args);
    PipelineApplication app;
    try {
      if (flags.contains("--print-acl")) {
        // Для экспорта ACL подключения к брокеру и БД не нужны.
        TopicContract contract = new TopicContract(
            Config.getProperty("topic.namespace").orElse(TopicContract.DEFAULT_NAMESPACE));
        String location = Config.getProperty("acl.policy").orElse("classpath:acl-policy.json");
        System.out.print(MosquittoAclWriter.render(new AccessPolicyLoader(contract).load(location)));
        return;
      }
      PipelineSettings settings = PipelineSettings.load();
      AccessPolicy policy = new AccessPolicyLoader(new TopicContract(settings.namespace()))
          .load(settings.aclPolicyLocation());
      app = new PipelineApplication(settings, policy, flags.contains("--simulate"));
    } catch (ConfigurationException e) {
      logger.error("❌ Запуск невозможен: {}", e.getMessage());
      System.exit(1);
      return;
    }

    CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      app.stop();
      stopped.countDown();
    }, "shutdown"));

    app.start();
    stopped.await();
  }
}
