package org.costwatch.alert.engine.notification.service.notification;

import static org.costwatch.alert.engine.notification.service.notification.SlackMessage.addIfNotEmpty;
import static org.costwatch.alert.engine.notification.service.notification.SlackMessage.addTimestamp;
import static org.costwatch.alert.engine.notification.service.notification.SlackMessage.getTitleBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.costwatch.alert.engine.datamodel.Alert;
import org.costwatch.alert.engine.datamodel.Severity;
import org.costwatch.alert.engine.notification.transport.webhook.slack.Attachment;
import org.costwatch.alert.engine.notification.transport.webhook.slack.Block;
import org.costwatch.alert.engine.notification.transport.webhook.slack.HeaderBlock;
import org.costwatch.alert.engine.notification.transport.webhook.slack.SectionBlock;
import org.costwatch.alert.engine.notification.transport.webhook.slack.Text;

public class AlertSlackMessage implements SlackMessage {
  public static final String SEVERITY = "Severity";
  public static final String ALERT_ID = "Alert Id";
  public static final String TRIGGERED_AT = "Triggered At";
  public static final String ALERT_KIND = "Alert Type";
  private final List<Attachment> attachments;

  public AlertSlackMessage(List<Attachment> attachments) {
    this.attachments = attachments;
  }

  public static AlertSlackMessage getMessage(Alert alert) {
    List<Text> metadataFields = new ArrayList<>();
    addIfNotEmpty(metadataFields, alert.getSeverity().name().toLowerCase(Locale.ROOT), SEVERITY);
    addIfNotEmpty(metadataFields, alert.getId(), ALERT_ID);
    addTimestamp(metadataFields, alert.getTriggeredAt(), TRIGGERED_AT);
    addIfNotEmpty(metadataFields, alert.getKind().name().toLowerCase(Locale.ROOT), ALERT_KIND);

    SectionBlock metadataBlock = new SectionBlock();
    metadataBlock.setFields(metadataFields);

    List<Block> blocks = new ArrayList<>();
    blocks.add(new HeaderBlock(alert.getTitle()));
    blocks.add(metadataBlock);
    if (alert.getDescription() != null) {
      blocks.add(getTitleBlock(alert.getDescription()));
    }
    return new AlertSlackMessage(List.of(new Attachment(color(alert.getSeverity()), blocks)));
  }

  public List<Attachment> getAttachments() {
    return attachments;
  }

  private static String color(Severity severity) {
    switch (severity) {
      case CRITICAL:
        return Attachment.RED;
      case HIGH:
        return Attachment.ORANGE;
      case MEDIUM:
        return Attachment.YELLOW;
      default:
        return Attachment.GREY;
    }
  }
}
