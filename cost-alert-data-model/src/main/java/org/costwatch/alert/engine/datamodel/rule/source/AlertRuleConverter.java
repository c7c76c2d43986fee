package org.costwatch.alert.engine.datamodel.rule.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.costwatch.alert.engine.datamodel.AggregationPeriod;
import org.costwatch.alert.engine.datamodel.AlertKind;
import org.costwatch.alert.engine.datamodel.AlertRule;
import org.costwatch.alert.engine.datamodel.AlertRuleValidator;
import org.costwatch.alert.engine.datamodel.ComparisonOperator;
import org.costwatch.alert.engine.datamodel.InvalidAlertRuleException;
import org.costwatch.alert.engine.datamodel.NotificationChannelType;
import org.costwatch.alert.engine.datamodel.NotificationTarget;
import org.costwatch.alert.engine.datamodel.RuleCondition;
import org.costwatch.alert.engine.datamodel.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps JSON rule documents to {@link AlertRule}s, dropping the ones that fail validation. */
public class AlertRuleConverter {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertRuleConverter.class);

  static final String ID = "id";
  static final String ORGANIZATION_ID = "organizationId";
  static final String NAME = "name";
  static final String DESCRIPTION = "description";
  static final String KIND = "kind";
  static final String CONDITION = "condition";
  static final String METRIC = "metric";
  static final String COMPARATOR = "comparator";
  static final String THRESHOLD = "threshold";
  static final String PERIOD = "period";
  static final String DIMENSIONS = "dimensions";
  static final String FORECAST_HORIZON_DAYS = "forecastHorizonDays";
  static final String SEVERITY = "severity";
  static final String COOLDOWN_MINUTES = "cooldownMinutes";
  static final String ACTIVE = "active";
  static final String AUTO_RESOLVE = "autoResolve";
  static final String NOTIFICATION_CHANNELS = "notificationChannels";
  static final String CHANNEL = "channel";
  static final String RECIPIENT = "recipient";

  private final Clock clock;

  public AlertRuleConverter(Clock clock) {
    this.clock = clock;
  }

  public Optional<AlertRule> toAlertRule(JsonNode rule) {
    try {
      AlertRule alertRule = convert(rule);
      AlertRuleValidator.validate(alertRule);
      return Optional.of(alertRule);
    } catch (InvalidAlertRuleException | UnsupportedOperationException e) {
      LOGGER.info("Skipping invalid alert rule {}: {}", rule, e.getMessage());
      return Optional.empty();
    }
  }

  private AlertRule convert(JsonNode rule) {
    JsonNode condition = required(rule, CONDITION);
    Instant now = clock.instant();

    RuleCondition.RuleConditionBuilder<?, ?> conditionBuilder =
        RuleCondition.builder()
            .metricName(required(condition, METRIC).asText())
            .operator(ComparisonOperator.fromSymbol(required(condition, COMPARATOR).asText()))
            .threshold(required(condition, THRESHOLD).asDouble())
            .dimensions(toStringMap(condition.get(DIMENSIONS)));
    if (condition.hasNonNull(PERIOD)) {
      conditionBuilder.period(parse(condition.get(PERIOD).asText(), AggregationPeriod::fromString));
    }
    if (condition.hasNonNull(FORECAST_HORIZON_DAYS)) {
      conditionBuilder.forecastHorizonDays(condition.get(FORECAST_HORIZON_DAYS).asInt());
    }

    AlertRule.AlertRuleBuilder<?, ?> builder =
        AlertRule.builder()
            .id(required(rule, ID).asText())
            .organizationId(required(rule, ORGANIZATION_ID).asText())
            .name(rule.hasNonNull(NAME) ? rule.get(NAME).asText() : rule.get(ID).asText())
            .description(rule.hasNonNull(DESCRIPTION) ? rule.get(DESCRIPTION).asText() : null)
            .kind(parse(required(rule, KIND).asText(), AlertKind::fromString))
            .condition(conditionBuilder.build())
            .notificationTargets(toTargets(rule.get(NOTIFICATION_CHANNELS)))
            .autoResolve(rule.path(AUTO_RESOLVE).asBoolean(false))
            .active(rule.path(ACTIVE).asBoolean(true))
            .createdAt(now)
            .updatedAt(now);
    if (rule.hasNonNull(SEVERITY)) {
      builder.severity(parse(rule.get(SEVERITY).asText(), Severity::fromString));
    }
    if (rule.hasNonNull(COOLDOWN_MINUTES)) {
      builder.cooldown(Duration.ofMinutes(rule.get(COOLDOWN_MINUTES).asLong()));
    }
    return builder.build();
  }

  private static List<NotificationTarget> toTargets(JsonNode channels) {
    List<NotificationTarget> targets = new ArrayList<>();
    if (channels == null || channels.isNull()) {
      return targets;
    }
    if (!channels.isArray()) {
      throw new InvalidAlertRuleException(NOTIFICATION_CHANNELS + " must be an array");
    }
    for (JsonNode channel : channels) {
      targets.add(
          NotificationTarget.of(
              parse(required(channel, CHANNEL).asText(), NotificationChannelType::fromString),
              required(channel, RECIPIENT).asText()));
    }
    return targets;
  }

  private static Map<String, String> toStringMap(JsonNode node) {
    Map<String, String> values = new LinkedHashMap<>();
    if (node == null || node.isNull()) {
      return values;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      values.put(field.getKey(), field.getValue().asText());
    }
    return values;
  }

  private static JsonNode required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new InvalidAlertRuleException("Missing required field: " + field);
    }
    return value;
  }

  private static <T> T parse(String value, Function<String, T> parser) {
    try {
      return parser.apply(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidAlertRuleException("Unknown value: " + value);
    }
  }
}
