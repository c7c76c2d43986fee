package org.costwatch.alert.engine.notification.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.StringJoiner;
import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.datamodel.NotificationChannelType;
import org.costwatch.alert.engine.notification.transport.webhook.ObjectMapperProvider;

/** Turns an alert into the subject and body a channel expects. */
public class AlertMessageRenderer {
  static final String SUBJECT_PREFIX = "CostWatch Alert: ";
  private static final int SMS_MAX_LENGTH = 160;

  public RenderedMessage render(Alert alert, NotificationChannelType channel) {
    String subject = SUBJECT_PREFIX + alert.getTitle();
    switch (channel) {
      case SLACK:
        return RenderedMessage.of(subject, toJson(AlertSlackMessage.getMessage(alert)));
      case WEBHOOK:
      case TEAMS:
        return RenderedMessage.of(subject, toJson(AlertWebhookEvent.from(alert)));
      case EMAIL:
        return RenderedMessage.of(subject, emailBody(alert));
      case SMS:
        return RenderedMessage.of(subject, smsBody(alert));
      default:
        throw new UnsupportedOperationException("Unsupported channel: " + channel);
    }
  }

  private static String emailBody(Alert alert) {
    StringJoiner body = new StringJoiner("\n");
    body.add(alert.getTitle());
    body.add("");
    if (alert.getDescription() != null) {
      body.add(alert.getDescription());
      body.add("");
    }
    body.add("Severity: " + alert.getSeverity().name().toLowerCase(Locale.ROOT));
    body.add("Alert type: " + alert.getKind().name().toLowerCase(Locale.ROOT));
    body.add("Alert id: " + alert.getId());
    body.add("Organization: " + alert.getOrganizationId());
    body.add("Triggered at: " + alert.getTriggeredAt());
    alert.getTriggerPayload().forEach((key, value) -> body.add(key + ": " + value));
    return body.toString();
  }

  private static String smsBody(Alert alert) {
    String line = String.format("[%s] CostWatch: %s", alert.getSeverity().name(), alert.getTitle());
    return line.length() <= SMS_MAX_LENGTH ? line : line.substring(0, SMS_MAX_LENGTH - 3) + "...";
  }

  private static String toJson(Object message) {
    try {
      return ObjectMapperProvider.get().writeValueAsString(message);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
