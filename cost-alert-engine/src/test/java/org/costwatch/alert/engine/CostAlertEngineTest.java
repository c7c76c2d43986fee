package org.costwatch.alert.engine;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import org.costwatch.alert.engine.datamodel.AggregationPeriod;
import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.datamodel.AlertKind;
import org.costwatch.alert.engine.datamodel.AlertNotification;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.AlertStatus;
import org.costwatch.alert.engine.datamodel.ComparisonOperator;
import org.costwatch.alert.engine.datamodel.CostAnomaly;
import org.costwatch.alert.engine.datamodel.InvalidAlertRuleException;
import org.costwatch.alert.engine.datamodel.NotificationChannelType;
import org.costwatch.alert.engine.datamodel.NotificationStatus;
import org.costwatch.alert.engine.datamodel.NotificationTarget;
import org.costwatch.alert.engine.datamodel.RuleCondition;
import org.costwatch.alert.engine.datamodel.Severity;
import org.costwatch.alert.engine.datamodel.metric.CostForecast;
import org.costwatch.alert.engine.datamodel.metric.DailyCost;
import org.costwatch.alert.engine.datamodel.metric.ForecastProvider;
import org.costwatch.alert.engine.datamodel.metric.MetricAggregator;
import org.costwatch.alert.engine.datamodel.metric.MetricUnavailableException;
import org.costwatch.alert.engine.datamodel.observability.MetaAlertSink;
import org.costwatch.alert.engine.datamodel.store.CostAnomalyStore;
import org.costwatch.alert.engine.lifecycle.AlertPreconditionException;
import org.costwatch.alert.engine.notification.service.NotificationSenderRegistry;
import org.costwatch.alert.engine.notification.transport.DeliveryStatus;
import org.costwatch.alert.engine.notification.transport.NotificationSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CostAlertEngineTest {
  private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");
  private static final String ORG = "org-1";
  private static final NotificationTarget SLACK =
      NotificationTarget.of(NotificationChannelType.SLACK, "https://hooks.slack.test/T000/B000");
  private static final NotificationTarget EMAIL =
      NotificationTarget.of(NotificationChannelType.EMAIL, "finops@example.com");
  private static final NotificationTarget ONCALL =
      NotificationTarget.of(NotificationChannelType.WEBHOOK, "https://oncall.test/hook");

  private TestClock clock;
  private MetricAggregator metricAggregator;
  private ForecastProvider forecastProvider;
  private NotificationSender sender;
  private MetaAlertSink metaAlertSink;
  private CostAlertEngine engine;

  @BeforeEach
  void setUp() throws Exception {
    clock = new TestClock(START);
    metricAggregator = mock(MetricAggregator.class);
    forecastProvider = mock(ForecastProvider.class);
    sender = mock(NotificationSender.class);
    metaAlertSink = mock(MetaAlertSink.class);
    when(sender.send(any(), anyString(), anyString(), anyString()))
        .thenReturn(DeliveryStatus.DELIVERED);
    engine = engine(CostAlertEngine.builder());
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  @Test
  void testOneAlertPerCooldownWindow() throws Exception {
    dailyCost(120.0);
    AlertRule rule = engine.createRule(thresholdRule("daily-cost", 100).build());

    // minute 0
    List<Alert> created = engine.runRuleEvaluation();
    Assertions.assertEquals(1, created.size());
    Alert alert = created.get(0);
    Assertions.assertEquals(rule.getId(), alert.getSourceRuleId());
    Assertions.assertEquals(AlertStatus.ACTIVE, alert.getStatus());
    Assertions.assertEquals(Severity.MEDIUM, alert.getSeverity());
    Assertions.assertEquals("Daily Cost", alert.getTitle());
    Assertions.assertEquals(
        "Daily Cost has exceeded the threshold. Current value: $120.00, Threshold: $100.00",
        alert.getDescription());

    Assertions.assertEquals(2, engine.getNotifications(alert.getId()).size());
    List<AlertNotification> notifications =
        awaitNotifications(alert.getId(), n -> n.getStatus() == NotificationStatus.DELIVERED);
    Assertions.assertEquals(2, notifications.size());
    verify(sender).send(eq(NotificationChannelType.SLACK), eq(SLACK.getRecipient()), any(), any());
    verify(sender).send(eq(NotificationChannelType.EMAIL), eq(EMAIL.getRecipient()), any(), any());

    // minute 30
    clock.advance(Duration.ofMinutes(30));
    Assertions.assertTrue(engine.runRuleEvaluation().isEmpty());

    // minute 61
    clock.advance(Duration.ofMinutes(31));
    List<Alert> next = engine.runRuleEvaluation();
    Assertions.assertEquals(1, next.size());
    Assertions.assertNotEquals(alert.getId(), next.get(0).getId());
    Assertions.assertEquals(2, engine.listActiveAlerts(ORG, 0, 10).getTotalCount());
  }

  @Test
  void testConcurrentPassesCreateOneAlert() throws Exception {
    dailyCost(250.0);
    engine.createRule(thresholdRule("daily-cost", 100).build());

    ExecutorService executor = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    List<Callable<List<Alert>>> passes = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      passes.add(
          () -> {
            start.await();
            return engine.evaluateNow(ORG);
          });
    }
    List<Future<List<Alert>>> futures = new ArrayList<>();
    passes.forEach(pass -> futures.add(executor.submit(pass)));
    start.countDown();

    int created = 0;
    for (Future<List<Alert>> future : futures) {
      created += future.get(5, TimeUnit.SECONDS).size();
    }
    executor.shutdownNow();

    Assertions.assertEquals(1, created);
    Assertions.assertEquals(1, engine.getAlertHistory(ORG, 0, 10).getTotalCount());
  }

  @Test
  void testUnavailableMetricOnlySkipsItsRule() throws Exception {
    when(metricAggregator.getAggregatedCost(
            eq(ORG), eq("broken_cost"), anyMap(), any(AggregationPeriod.class)))
        .thenThrow(new MetricUnavailableException("billing export is late"));
    when(metricAggregator.getAggregatedCost(
            eq(ORG), eq("daily_cost"), anyMap(), any(AggregationPeriod.class)))
        .thenReturn(150.0);
    engine.createRule(
        thresholdRule("broken", 100)
            .condition(condition("broken_cost", ComparisonOperator.GT, 100))
            .build());
    engine.createRule(thresholdRule("daily-cost", 100).build());

    List<Alert> created = engine.runRuleEvaluation();

    Assertions.assertEquals(1, created.size());
    Assertions.assertEquals("daily-cost", created.get(0).getSourceRuleId());
    verify(metaAlertSink, never()).ruleEvaluationFailed(any(), any(), any());
  }

  @Test
  void testUnexpectedFailureIsReportedAndIsolated() throws Exception {
    engine.close();
    CostAnomalyStore anomalyStore = mock(CostAnomalyStore.class);
    when(anomalyStore.findLatestUnresolved(anyString(), anyMap()))
        .thenThrow(new IllegalStateException("anomaly store offline"));
    engine = engine(CostAlertEngine.builder().anomalyStore(anomalyStore));
    dailyCost(150.0);
    engine.createRule(
        AlertRule.builder()
            .id("ec2-anomaly")
            .organizationId(ORG)
            .name("EC2 anomaly")
            .kind(AlertKind.ANOMALY)
            .condition(
                condition(RuleCondition.ANOMALY_SCORE_METRIC, ComparisonOperator.GTE, 0.6))
            .build());
    engine.createRule(thresholdRule("daily-cost", 100).build());

    List<Alert> created = engine.runRuleEvaluation();

    Assertions.assertEquals(1, created.size());
    verify(metaAlertSink)
        .ruleEvaluationFailed(
            argThat(rule -> "ec2-anomaly".equals(rule.getId())),
            eq("anomaly store offline"),
            any(IllegalStateException.class));
  }

  @Test
  void testDeactivatedRuleIsNotEvaluated() throws Exception {
    dailyCost(500.0);
    engine.createRule(thresholdRule("daily-cost", 100).build());
    AlertRule deactivated = engine.deactivateRule("daily-cost");

    Assertions.assertFalse(deactivated.isActive());
    Assertions.assertTrue(engine.runRuleEvaluation().isEmpty());
    Assertions.assertTrue(engine.evaluateNow(ORG).isEmpty());
    verify(metricAggregator, never()).getAggregatedCost(any(), any(), any(), any());
  }

  @Test
  void testAutoResolveWhenConditionClears() throws Exception {
    when(metricAggregator.getAggregatedCost(
            eq(ORG), eq("daily_cost"), anyMap(), any(AggregationPeriod.class)))
        .thenReturn(150.0, 50.0);
    engine.createRule(thresholdRule("daily-cost", 100).autoResolve(true).build());

    Alert alert = engine.runRuleEvaluation().get(0);
    clock.advance(Duration.ofMinutes(5));
    Assertions.assertTrue(engine.runRuleEvaluation().isEmpty());

    Alert resolved = engine.getAlert(alert.getId());
    Assertions.assertEquals(AlertStatus.RESOLVED, resolved.getStatus());
    Assertions.assertEquals(RuleEvaluationService.SYSTEM_USER, resolved.getResolvedBy());
    Assertions.assertEquals(RuleEvaluationService.AUTO_RESOLVE_NOTE, resolved.getResolutionNotes());
  }

  @Test
  void testForecastRulesRunInTheirOwnPass() throws Exception {
    when(forecastProvider.getForecast(eq(ORG), anyMap(), any(LocalDate.class)))
        .thenAnswer(
            invocation ->
                Optional.of(
                    CostForecast.builder()
                        .forecastDate(invocation.getArgument(2))
                        .predictedCost(900)
                        .lowerBound(800)
                        .upperBound(1100)
                        .confidenceScore(0.9)
                        .build()));
    engine.createRule(
        thresholdRule("budget-forecast", 1000)
            .name("Monthly budget forecast")
            .kind(AlertKind.FORECAST_BREACH)
            .condition(
                condition("daily_cost", ComparisonOperator.GT, 1000).toBuilder()
                    .forecastHorizonDays(7)
                    .build())
            .build());

    Assertions.assertTrue(engine.runRuleEvaluation().isEmpty());
    List<Alert> created = engine.runForecastCheck();

    Assertions.assertEquals(1, created.size());
    Assertions.assertEquals(AlertKind.FORECAST_BREACH, created.get(0).getKind());
    Assertions.assertEquals(Severity.CRITICAL, created.get(0).getSeverity());
    Assertions.assertEquals(1L, created.get(0).getTriggerPayload().get("daysUntilBreach"));
  }

  @Test
  void testAnomalyDetectionStoresWithoutAlerting() throws Exception {
    engine.createRule(thresholdRule("daily-cost", 10000).build());
    LocalDate target = spikeYesterday();

    List<CostAnomaly> anomalies = engine.runAnomalyDetection();

    Assertions.assertEquals(1, anomalies.size());
    CostAnomaly anomaly = anomalies.get(0);
    Assertions.assertEquals(target, anomaly.getAnomalyDate());
    Assertions.assertEquals(1.0, anomaly.getAnomalyScore());
    Assertions.assertEquals(Severity.CRITICAL, anomaly.getSeverity());
    Assertions.assertEquals(0, engine.getAlertHistory(ORG, 0, 10).getTotalCount());

    clock.advance(Duration.ofHours(1));
    Assertions.assertEquals(anomaly.getId(), engine.runAnomalyDetection().get(0).getId());
    Assertions.assertEquals(1, engine.listAnomalies(ORG, true).size());
  }

  @Test
  void testResolvedAnomalyStaysResolvedOnNextPass() throws Exception {
    engine.createRule(thresholdRule("daily-cost", 10000).build());
    spikeYesterday();
    CostAnomaly anomaly = engine.runAnomalyDetection().get(0);

    Assertions.assertTrue(engine.resolveAnomaly(anomaly.getId()).isResolved());
    Assertions.assertTrue(engine.listAnomalies(ORG, true).isEmpty());

    // the hourly pass scores the same day again
    clock.advance(Duration.ofHours(1));
    engine.runAnomalyDetection();

    Assertions.assertTrue(engine.listAnomalies(ORG, true).isEmpty());
    List<CostAnomaly> all = engine.listAnomalies(ORG, false);
    Assertions.assertEquals(1, all.size());
    Assertions.assertTrue(all.get(0).isResolved());
  }

  @Test
  void testAnomalyRaisesOneAlertAcrossCooldowns() throws Exception {
    AlertRule rule =
        engine.createRule(
            thresholdRule("anomaly-watch", 0)
                .name("Spend anomaly")
                .kind(AlertKind.ANOMALY)
                .condition(
                    condition(RuleCondition.ANOMALY_SCORE_METRIC, ComparisonOperator.GTE, 0.5))
                .notificationTargets(List.of(ONCALL))
                .build());
    spikeYesterday();
    CostAnomaly anomaly = engine.runAnomalyDetection().get(0);
    Assertions.assertEquals(0, engine.getAlertHistory(ORG, 0, 10).getTotalCount());

    List<Alert> created = engine.runRuleEvaluation();
    Assertions.assertEquals(1, created.size());
    Alert alert = created.get(0);
    Assertions.assertEquals(AlertKind.ANOMALY, alert.getKind());
    Assertions.assertEquals(rule.getId(), alert.getSourceRuleId());
    Assertions.assertEquals(anomaly.getId(), alert.getAnomalyId());
    List<AlertNotification> notifications =
        awaitNotifications(alert.getId(), n -> n.getStatus() == NotificationStatus.DELIVERED);
    Assertions.assertEquals(ONCALL.getRecipient(), notifications.get(0).getRecipient());

    for (int pass = 0; pass < 2; pass++) {
      clock.advance(Duration.ofMinutes(61));
      engine.runAnomalyDetection();
      Assertions.assertTrue(engine.runRuleEvaluation().isEmpty());
    }
    Assertions.assertEquals(1, engine.getAlertHistory(ORG, 0, 10).getTotalCount());
  }

  @Test
  void testRuleManagement() {
    AlertRule created = engine.createRule(thresholdRule(null, 100).build());

    Assertions.assertNotNull(created.getId());
    Assertions.assertEquals(START, created.getCreatedAt());
    Assertions.assertEquals(Optional.of(created), engine.getRule(created.getId()));
    Assertions.assertThrows(IllegalArgumentException.class, () -> engine.createRule(created));
    Assertions.assertThrows(
        InvalidAlertRuleException.class,
        () -> engine.createRule(thresholdRule("negative", -5).build()));

    clock.advance(Duration.ofMinutes(1));
    AlertRule updated =
        engine.updateRule(created.toBuilder().severity(Severity.CRITICAL).build());
    Assertions.assertEquals(Severity.CRITICAL, updated.getSeverity());
    Assertions.assertEquals(START, updated.getCreatedAt());
    Assertions.assertEquals(START.plus(Duration.ofMinutes(1)), updated.getUpdatedAt());
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> engine.updateRule(created.toBuilder().organizationId("org-2").build()));
    Assertions.assertThrows(
        IllegalArgumentException.class, () -> engine.deactivateRule("missing"));

    Assertions.assertEquals(List.of(updated), engine.listRules(ORG));
    Assertions.assertTrue(engine.listRules("org-2").isEmpty());
  }

  @Test
  void testAlertTriageThroughFacade() throws Exception {
    dailyCost(130.0);
    engine.createRule(thresholdRule("daily-cost", 100).build());
    Alert alert = engine.runRuleEvaluation().get(0);

    Alert acknowledged = engine.acknowledgeAlert(alert.getId(), "alice", "looking");
    Assertions.assertEquals(AlertStatus.ACKNOWLEDGED, acknowledged.getStatus());
    Assertions.assertTrue(engine.listActiveAlerts(ORG, 0, 10).getItems().isEmpty());

    engine.resolveAlert(alert.getId(), "alice", "reserved instances bought");
    Assertions.assertThrows(
        AlertPreconditionException.class,
        () -> engine.acknowledgeAlert(alert.getId(), "bob", null));
    Assertions.assertThrows(
        AlertPreconditionException.class,
        () -> engine.suppressAlert(alert.getId(), START.plus(Duration.ofHours(1)), "bob"));
    Assertions.assertEquals(AlertStatus.RESOLVED, engine.getAlert(alert.getId()).getStatus());
  }

  @Test
  void testTestNotificationUsesRegularDelivery() throws Exception {
    List<AlertNotification> delivered = new ArrayList<>();
    engine
        .sendTestNotification(ORG, List.of(SLACK))
        .forEach(future -> delivered.add(future.join()));

    Assertions.assertEquals(1, delivered.size());
    Assertions.assertEquals(NotificationStatus.DELIVERED, delivered.get(0).getStatus());
    Assertions.assertTrue(delivered.get(0).getAlertId().startsWith("test-"));
    Assertions.assertEquals(0, engine.getAlertHistory(ORG, 0, 10).getTotalCount());
  }

  private CostAlertEngine engine(CostAlertEngine.Builder builder) {
    return engine(builder, Map.of());
  }

  private CostAlertEngine engine(CostAlertEngine.Builder builder, Map<String, Object> extra) {
    Map<String, Object> config = new HashMap<>();
    config.put("evaluator.metric.cache.ttl", "0s");
    config.put("evaluator.request.timeout", "2s");
    config.put("notification.backoff.base", "10ms");
    config.put("notification.backoff.max", "50ms");
    config.putAll(extra);
    return builder
        .appConfig(ConfigFactory.parseMap(config))
        .metricAggregator(metricAggregator)
        .forecastProvider(forecastProvider)
        .senderRegistry(
            new NotificationSenderRegistry()
                .register(List.of(NotificationChannelType.values()), sender))
        .metaAlertSink(metaAlertSink)
        .clock(clock)
        .meterRegistry(new SimpleMeterRegistry())
        .build();
  }

  private LocalDate spikeYesterday() throws MetricUnavailableException {
    LocalDate target = LocalDate.parse("2024-02-29");
    List<DailyCost> series = new ArrayList<>();
    for (int day = 14; day >= 1; day--) {
      series.add(DailyCost.of(target.minusDays(day), day % 2 == 0 ? 102 : 98));
    }
    series.add(DailyCost.of(target, 400));
    when(metricAggregator.getDailyCosts(eq(ORG), eq(Map.of()), any(), eq(target)))
        .thenReturn(series);
    return target;
  }

  private void dailyCost(double value) throws MetricUnavailableException {
    when(metricAggregator.getAggregatedCost(
            eq(ORG), eq("daily_cost"), anyMap(), any(AggregationPeriod.class)))
        .thenReturn(value);
  }

  private List<AlertNotification> awaitNotifications(
      String alertId, Predicate<AlertNotification> condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    List<AlertNotification> notifications = engine.getNotifications(alertId);
    while (System.nanoTime() < deadline
        && (notifications.isEmpty() || !notifications.stream().allMatch(condition))) {
      Thread.sleep(20);
      notifications = engine.getNotifications(alertId);
    }
    Assertions.assertFalse(notifications.isEmpty());
    Assertions.assertTrue(notifications.stream().allMatch(condition), notifications::toString);
    return notifications;
  }

  private static AlertRule.AlertRuleBuilder<?, ?> thresholdRule(String id, double threshold) {
    return AlertRule.builder()
        .id(id)
        .organizationId(ORG)
        .name("Daily Cost")
        .kind(AlertKind.THRESHOLD)
        .condition(condition("daily_cost", ComparisonOperator.GT, threshold))
        .cooldown(Duration.ofMinutes(60))
        .notificationTargets(List.of(SLACK, EMAIL));
  }

  private static RuleCondition condition(
      String metric, ComparisonOperator operator, double threshold) {
    return RuleCondition.builder()
        .metricName(metric)
        .operator(operator)
        .threshold(threshold)
        .period(AggregationPeriod.DAILY)
        .build();
  }
}
