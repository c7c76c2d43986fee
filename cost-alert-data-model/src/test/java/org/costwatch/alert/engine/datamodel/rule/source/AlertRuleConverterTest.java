package org.costwatch.alert.engine.datamodel.rule.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.File;
import java.net.URL;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.costwatch.alert.engine.datamodel.AlertKind;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.ComparisonOperator;
import org.costwatch.alert.engine.datamodel.NotificationChannelType;
import org.costwatch.alert.engine.datamodel.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class AlertRuleConverterTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

  @Test
  void testValidRules() throws Exception {
    RuleSource ruleSource = RuleSourceProvider.getProvider(ruleSourceConfig("alert-rules.json"));
    List<JsonNode> documents = ruleSource.getAllRules(node -> true);
    Assertions.assertEquals(3, documents.size());

    AlertRuleConverter converter = new AlertRuleConverter(CLOCK);

    AlertRule threshold = converter.toAlertRule(documents.get(0)).orElseThrow();
    Assertions.assertEquals("daily-cost-over-100", threshold.getId());
    Assertions.assertEquals(AlertKind.THRESHOLD, threshold.getKind());
    Assertions.assertEquals(ComparisonOperator.GT, threshold.getCondition().getOperator());
    Assertions.assertEquals(100.0, threshold.getCondition().getThreshold());
    Assertions.assertEquals(Severity.HIGH, threshold.getSeverity());
    Assertions.assertEquals(Duration.ofMinutes(60), threshold.getCooldown());
    Assertions.assertEquals(2, threshold.getNotificationTargets().size());
    Assertions.assertEquals(
        NotificationChannelType.EMAIL, threshold.getNotificationTargets().get(1).getChannel());
    Assertions.assertTrue(threshold.isActive());
    Assertions.assertEquals(CLOCK.instant(), threshold.getCreatedAt());

    AlertRule anomaly = converter.toAlertRule(documents.get(1)).orElseThrow();
    Assertions.assertEquals(AlertKind.ANOMALY, anomaly.getKind());
    Assertions.assertEquals(ComparisonOperator.GTE, anomaly.getCondition().getOperator());
    Assertions.assertEquals(Map.of("service", "ec2"), anomaly.getCondition().getDimensions());
    Assertions.assertNull(anomaly.getSeverity());

    AlertRule forecast = converter.toAlertRule(documents.get(2)).orElseThrow();
    Assertions.assertEquals(AlertKind.FORECAST_BREACH, forecast.getKind());
    Assertions.assertEquals(14, forecast.getCondition().getForecastHorizonDays());
    Assertions.assertEquals(AlertRule.DEFAULT_COOLDOWN, forecast.getCooldown());
    Assertions.assertFalse(forecast.isActive());
  }

  @Test
  void testPredicateFiltersRules() throws Exception {
    RuleSource ruleSource = RuleSourceProvider.getProvider(ruleSourceConfig("alert-rules.json"));
    List<JsonNode> documents =
        ruleSource.getAllRules(node -> "org-2".equals(node.get("organizationId").textValue()));
    Assertions.assertEquals(1, documents.size());
    Assertions.assertEquals("monthly-budget-forecast", documents.get(0).get("id").textValue());
  }

  @ParameterizedTest
  @MethodSource("provideInvalidRules")
  void testInvalidRulesAreSkipped(String ruleFile) throws Exception {
    RuleSource ruleSource =
        RuleSourceProvider.getProvider(ruleSourceConfig("invalid-rules/" + ruleFile));
    List<JsonNode> documents = ruleSource.getAllRules(node -> true);
    Assertions.assertEquals(1, documents.size());

    Optional<AlertRule> rule = new AlertRuleConverter(CLOCK).toAlertRule(documents.get(0));
    Assertions.assertTrue(rule.isEmpty());
  }

  @Test
  void testUnknownRuleSourceType() {
    Config config = ConfigFactory.parseMap(Map.of("type", "dataStore"));
    Assertions.assertThrows(RuntimeException.class, () -> RuleSourceProvider.getProvider(config));
  }

  private static Stream<Arguments> provideInvalidRules() {
    return Stream.of(
        Arguments.arguments("negative-threshold.json"),
        Arguments.arguments("unknown-comparator.json"),
        Arguments.arguments("negative-cooldown.json"),
        Arguments.arguments("anomaly-score-out-of-range.json"));
  }

  private static Config ruleSourceConfig(String resource) throws Exception {
    URL url = Thread.currentThread().getContextClassLoader().getResource(resource);
    File file = Paths.get(url.toURI()).toFile();
    return ConfigFactory.parseMap(Map.of("type", "fs", "fs.path", file.getAbsolutePath()));
  }
}
