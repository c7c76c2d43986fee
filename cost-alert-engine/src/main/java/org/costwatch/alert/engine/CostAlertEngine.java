package org.costwatch.alert.engine;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.costwatch.alert.engine.anomaly.detector.AnomalyDetector;
import org.costwatch.alert.engine.anomaly.detector.AnomalyDetectorConfig;
import org.costwatch.alert.engine.anomaly.detector.evaluator.AlertRuleEvaluator;
import org.costwatch.alert.engine.anomaly.detector.evaluator.AnomalyRuleEvaluator;
import org.costwatch.alert.engine.anomaly.detector.evaluator.CooldownTracker;
import org.costwatch.alert.engine.anomaly.detector.evaluator.ForecastBreachChecker;
import org.costwatch.alert.engine.anomaly.detector.evaluator.MetricCache;
import org.costwatch.alert.engine.anomaly.detector.evaluator.MetricRequestHandler;
import org.costwatch.alert.engine.anomaly.detector.evaluator.ThresholdRuleEvaluator;
import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.datamodel.AlertNotification;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.AlertRuleValidator;
import org.costwatch.alert.engine.datamodel.CostAnomaly;
import org.costwatch.alert.engine.datamodel.NotificationTarget;
import org.costwatch.alert.engine.datamodel.metric.ForecastProvider;
import org.costwatch.alert.engine.datamodel.metric.MetricAggregator;
import org.costwatch.alert.engine.datamodel.observability.MetaAlertSink;
import org.costwatch.alert.engine.datamodel.observability.MeteredMetaAlertSink;
import org.costwatch.alert.engine.datamodel.rule.source.AlertRuleConverter;
import org.costwatch.alert.engine.datamodel.rule.source.RuleSource;
import org.costwatch.alert.engine.datamodel.store.AlertNotificationStore;
import org.costwatch.alert.engine.datamodel.store.AlertQuery;
import org.costwatch.alert.engine.datamodel.store.AlertRuleStore;
import org.costwatch.alert.engine.datamodel.store.AlertStore;
import org.costwatch.alert.engine.datamodel.store.CostAnomalyStore;
import org.costwatch.alert.engine.datamodel.store.InMemoryAlertNotificationStore;
import org.costwatch.alert.engine.datamodel.store.InMemoryAlertRuleStore;
import org.costwatch.alert.engine.datamodel.store.InMemoryAlertStore;
import org.costwatch.alert.engine.datamodel.store.InMemoryCostAnomalyStore;
import org.costwatch.alert.engine.datamodel.store.Page;
import org.costwatch.alert.engine.lifecycle.AlertLifecycleManager;
import org.costwatch.alert.engine.notification.service.NotificationDispatcher;
import org.costwatch.alert.engine.notification.service.NotificationDispatcherConfig;
import org.costwatch.alert.engine.notification.service.NotificationSenderRegistry;
import org.costwatch.alert.engine.notification.transport.NotificationSenderConfig;
import org.costwatch.alert.engine.notification.transport.webhook.WebhookSender;
import org.costwatch.alert.engine.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator facade of the engine: rule management, alert triage, notification history, anomaly
 * review and on-demand evaluation. Also owns the passes the scheduled jobs trigger.
 */
public class CostAlertEngine implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(CostAlertEngine.class);

  static final String EVALUATOR_CONFIG = "evaluator";
  static final String EVALUATOR_PARALLELISM_CONFIG = "parallelism";
  static final String ANOMALY_CONFIG = "anomaly";
  static final String ANOMALY_DETECTOR_CONFIG = "detector";
  static final String FORECAST_HORIZON_CONFIG = "forecast.horizon.days";
  static final String NOTIFICATION_CONFIG = "notification";
  static final String NOTIFICATION_TRANSPORT_CONFIG = "transport";
  static final int DEFAULT_PARALLELISM = 4;
  static final int DEFAULT_FORECAST_HORIZON_DAYS = 30;

  private final AlertRuleStore ruleStore;
  private final CostAnomalyStore anomalyStore;
  private final AlertLifecycleManager lifecycleManager;
  private final NotificationDispatcher notificationDispatcher;
  private final RuleEvaluationService ruleEvaluationService;
  private final AnomalyDetectionService anomalyDetectionService;
  private final AlertRuleConverter ruleConverter;
  private final Clock clock;
  private final ExecutorService organizationExecutor;
  private final ExecutorService metricRequestExecutor;

  private CostAlertEngine(Builder builder) {
    Config appConfig = builder.appConfig;
    this.clock = builder.clock;
    this.ruleStore = builder.ruleStore;
    this.anomalyStore = builder.anomalyStore;
    this.ruleConverter = new AlertRuleConverter(clock);

    Config evaluatorConfig = subConfig(appConfig, EVALUATOR_CONFIG);
    Config anomalyConfig = subConfig(appConfig, ANOMALY_CONFIG);
    Config notificationConfig = subConfig(appConfig, NOTIFICATION_CONFIG);

    int parallelism =
        evaluatorConfig.hasPath(EVALUATOR_PARALLELISM_CONFIG)
            ? evaluatorConfig.getInt(EVALUATOR_PARALLELISM_CONFIG)
            : DEFAULT_PARALLELISM;
    this.organizationExecutor =
        Executors.newFixedThreadPool(
            parallelism,
            new ThreadFactoryBuilder().setNameFormat("rule-evaluator-%d").setDaemon(true).build());
    this.metricRequestExecutor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("metric-request-%d").setDaemon(true).build());

    MetaAlertSink metaAlertSink =
        builder.metaAlertSink != null
            ? builder.metaAlertSink
            : new MeteredMetaAlertSink(builder.meterRegistry);

    this.lifecycleManager =
        new AlertLifecycleManager(builder.alertStore, clock, builder.meterRegistry);
    this.notificationDispatcher =
        new NotificationDispatcher(
            NotificationDispatcherConfig.from(notificationConfig),
            builder.senderRegistry != null
                ? builder.senderRegistry
                : defaultSenderRegistry(notificationConfig),
            builder.notificationStore,
            metaAlertSink,
            clock,
            builder.meterRegistry);
    lifecycleManager.addListener(new NotificationRoutingListener(notificationDispatcher));

    MetricRequestHandler metricRequestHandler =
        new MetricRequestHandler(
            evaluatorConfig,
            builder.metricAggregator,
            builder.forecastProvider,
            metricRequestExecutor);
    CooldownTracker cooldownTracker = new CooldownTracker(builder.alertStore);
    int forecastHorizonDays =
        appConfig.hasPath(FORECAST_HORIZON_CONFIG)
            ? appConfig.getInt(FORECAST_HORIZON_CONFIG)
            : DEFAULT_FORECAST_HORIZON_DAYS;
    AlertRuleEvaluator alertRuleEvaluator =
        new AlertRuleEvaluator(
            new ThresholdRuleEvaluator(
                new MetricCache(evaluatorConfig, metricRequestHandler, clock)),
            new AnomalyRuleEvaluator(anomalyStore, clock),
            new ForecastBreachChecker(metricRequestHandler, clock, forecastHorizonDays),
            builder.meterRegistry);

    this.ruleEvaluationService =
        new RuleEvaluationService(
            ruleStore,
            alertRuleEvaluator,
            cooldownTracker,
            lifecycleManager,
            metaAlertSink,
            clock,
            organizationExecutor);
    this.anomalyDetectionService =
        new AnomalyDetectionService(
            ruleStore,
            metricRequestHandler,
            new AnomalyDetector(
                AnomalyDetectorConfig.from(subConfig(anomalyConfig, ANOMALY_DETECTOR_CONFIG)),
                clock),
            anomalyStore,
            clock,
            builder.meterRegistry);
  }

  public static Builder builder() {
    return new Builder();
  }

  // rules

  /** Validates and stores a new rule. A missing id is generated. */
  public AlertRule createRule(AlertRule rule) {
    Instant now = clock.instant();
    AlertRule toCreate =
        rule.toBuilder()
            .id(rule.getId() != null ? rule.getId() : UUID.randomUUID().toString())
            .createdAt(now)
            .updatedAt(now)
            .build();
    AlertRuleValidator.validate(toCreate);
    Preconditions.checkArgument(
        ruleStore.findById(toCreate.getId()).isEmpty(),
        "Alert rule %s already exists",
        toCreate.getId());
    LOGGER.info(
        "Creating {} rule {} for organization {}",
        toCreate.getKind(),
        toCreate.getId(),
        toCreate.getOrganizationId());
    return ruleStore.save(toCreate);
  }

  /** Replaces an existing rule, keeping its creation time and organization. */
  public AlertRule updateRule(AlertRule rule) {
    AlertRule existing = requireRule(rule.getId());
    Preconditions.checkArgument(
        existing.getOrganizationId().equals(rule.getOrganizationId()),
        "Alert rule %s cannot move to another organization",
        rule.getId());
    AlertRule updated =
        rule.toBuilder().createdAt(existing.getCreatedAt()).updatedAt(clock.instant()).build();
    AlertRuleValidator.validate(updated);
    LOGGER.info("Updating rule {}", updated.getId());
    return ruleStore.save(updated);
  }

  public AlertRule deactivateRule(String ruleId) {
    AlertRule existing = requireRule(ruleId);
    LOGGER.info("Deactivating rule {}", ruleId);
    return ruleStore.save(existing.toBuilder().active(false).updatedAt(clock.instant()).build());
  }

  public Optional<AlertRule> getRule(String ruleId) {
    return ruleStore.findById(ruleId);
  }

  public List<AlertRule> listRules(String organizationId) {
    return ruleStore.findByOrganization(organizationId);
  }

  /**
   * Loads every valid rule the source provides. Invalid rules are logged and skipped.
   *
   * @return the number of rules stored
   */
  public int seedRules(RuleSource ruleSource) throws IOException {
    List<AlertRule> rules =
        ruleSource.getAllRules(rule -> true).stream()
            .map(ruleConverter::toAlertRule)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    rules.forEach(ruleStore::save);
    LOGGER.info("Seeded {} alert rules", rules.size());
    return rules.size();
  }

  // alerts

  public Alert acknowledgeAlert(String alertId, String acknowledgedBy, String notes) {
    return lifecycleManager.acknowledge(alertId, acknowledgedBy, notes);
  }

  public Alert resolveAlert(String alertId, String resolvedBy, String notes) {
    return lifecycleManager.resolve(alertId, resolvedBy, notes);
  }

  public Alert suppressAlert(String alertId, Instant until, String suppressedBy) {
    return lifecycleManager.suppress(alertId, until, suppressedBy);
  }

  public Alert getAlert(String alertId) {
    return lifecycleManager.get(alertId);
  }

  public Page<Alert> listAlerts(AlertQuery query, int pageNumber, int pageSize) {
    return lifecycleManager.listAlerts(query, pageNumber, pageSize);
  }

  public Page<Alert> listActiveAlerts(String organizationId, int pageNumber, int pageSize) {
    return lifecycleManager.listActiveAlerts(organizationId, pageNumber, pageSize);
  }

  /** Every alert of the organization regardless of status, newest first. */
  public Page<Alert> getAlertHistory(String organizationId, int pageNumber, int pageSize) {
    return lifecycleManager.listAlerts(
        AlertQuery.builder().organizationId(organizationId).build(), pageNumber, pageSize);
  }

  // notifications

  public List<AlertNotification> getNotifications(String alertId) {
    return notificationDispatcher.getNotifications(alertId);
  }

  public AlertNotification confirmDelivery(String notificationId) {
    return notificationDispatcher.confirmDelivery(notificationId);
  }

  public List<CompletableFuture<AlertNotification>> sendTestNotification(
      String organizationId, List<NotificationTarget> targets) {
    return notificationDispatcher.sendTestNotification(organizationId, targets);
  }

  public int resumePendingNotifications() {
    return notificationDispatcher.resumePending();
  }

  // anomalies

  public List<CostAnomaly> listAnomalies(String organizationId, boolean unresolvedOnly) {
    return anomalyStore.findByOrganization(organizationId, unresolvedOnly);
  }

  public CostAnomaly resolveAnomaly(String anomalyId) {
    LOGGER.info("Resolving anomaly {}", anomalyId);
    return anomalyStore
        .markResolved(anomalyId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown anomaly: " + anomalyId));
  }

  // evaluation passes

  /** Evaluates every active rule of one organization immediately, cooldowns included. */
  public List<Alert> evaluateNow(String organizationId) {
    LOGGER.info("On-demand evaluation for organization {}", organizationId);
    return ruleEvaluationService.evaluateOrganization(organizationId);
  }

  public List<Alert> runRuleEvaluation() {
    return ruleEvaluationService.evaluateRules();
  }

  public List<Alert> runForecastCheck() {
    return ruleEvaluationService.checkForecasts();
  }

  public List<CostAnomaly> runAnomalyDetection() {
    return anomalyDetectionService.detectAnomalies();
  }

  @Override
  public void close() {
    organizationExecutor.shutdownNow();
    metricRequestExecutor.shutdownNow();
    notificationDispatcher.shutdown();
  }

  private AlertRule requireRule(String ruleId) {
    return ruleStore
        .findById(ruleId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown alert rule: " + ruleId));
  }

  private static Config subConfig(Config config, String path) {
    return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.parseMap(Map.of());
  }

  private static NotificationSenderRegistry defaultSenderRegistry(Config notificationConfig) {
    HttpWithJsonSender httpSender =
        HttpWithJsonSender.create(
            NotificationSenderConfig.from(
                subConfig(notificationConfig, NOTIFICATION_TRANSPORT_CONFIG)));
    return new NotificationSenderRegistry()
        .register(WebhookSender.CHANNELS, new WebhookSender(httpSender));
  }

  public static class Builder {
    private Config appConfig = ConfigFactory.parseMap(Map.of());
    private MetricAggregator metricAggregator;
    private ForecastProvider forecastProvider;
    private AlertRuleStore ruleStore = new InMemoryAlertRuleStore();
    private AlertStore alertStore = new InMemoryAlertStore();
    private AlertNotificationStore notificationStore = new InMemoryAlertNotificationStore();
    private CostAnomalyStore anomalyStore = new InMemoryCostAnomalyStore();
    private NotificationSenderRegistry senderRegistry;
    private MetaAlertSink metaAlertSink;
    private Clock clock = Clock.systemUTC();
    private MeterRegistry meterRegistry = new SimpleMeterRegistry();

    private Builder() {}

    public Builder appConfig(Config appConfig) {
      this.appConfig = appConfig;
      return this;
    }

    public Builder metricAggregator(MetricAggregator metricAggregator) {
      this.metricAggregator = metricAggregator;
      return this;
    }

    public Builder forecastProvider(ForecastProvider forecastProvider) {
      this.forecastProvider = forecastProvider;
      return this;
    }

    public Builder ruleStore(AlertRuleStore ruleStore) {
      this.ruleStore = ruleStore;
      return this;
    }

    public Builder alertStore(AlertStore alertStore) {
      this.alertStore = alertStore;
      return this;
    }

    public Builder notificationStore(AlertNotificationStore notificationStore) {
      this.notificationStore = notificationStore;
      return this;
    }

    public Builder anomalyStore(CostAnomalyStore anomalyStore) {
      this.anomalyStore = anomalyStore;
      return this;
    }

    /** Defaults to the webhook sender for the Slack, Teams and webhook channels. */
    public Builder senderRegistry(NotificationSenderRegistry senderRegistry) {
      this.senderRegistry = senderRegistry;
      return this;
    }

    public Builder metaAlertSink(MetaAlertSink metaAlertSink) {
      this.metaAlertSink = metaAlertSink;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder meterRegistry(MeterRegistry meterRegistry) {
      this.meterRegistry = meterRegistry;
      return this;
    }

    public CostAlertEngine build() {
      Preconditions.checkNotNull(metricAggregator, "a metric aggregator is required");
      Preconditions.checkNotNull(forecastProvider, "a forecast provider is required");
      return new CostAlertEngine(this);
    }
  }
}
