package org.costwatch.alert.engine.notification.transport.webhook;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Set;
import okhttp3.HttpUrl;
import okhttp3.Response;
import org.costwatch.alert.engine.datamodel.NotificationChannelType;
import org.costwatch.alert.engine.notification.transport.DeliveryStatus;
import org.costwatch.alert.engine.notification.transport.NotificationDeliveryException;
import org.costwatch.alert.engine.notification.transport.NotificationSender;
import org.costwatch.alert.engine.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers Slack, Teams and generic webhook notifications. The recipient is the webhook URL and
 * the body is the already rendered JSON payload. A 2xx answer means the receiver accepted it.
 */
public class WebhookSender implements NotificationSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSender.class);
  public static final Set<NotificationChannelType> CHANNELS =
      EnumSet.of(
          NotificationChannelType.SLACK,
          NotificationChannelType.TEAMS,
          NotificationChannelType.WEBHOOK);

  private final HttpWithJsonSender sender;

  public WebhookSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  @Override
  public DeliveryStatus send(
      NotificationChannelType channel, String recipient, String subject, String body)
      throws NotificationDeliveryException {
    Preconditions.checkArgument(CHANNELS.contains(channel), "Not a webhook channel: %s", channel);
    if (recipient == null || HttpUrl.parse(recipient) == null) {
      throw new NotificationDeliveryException("Invalid webhook url: " + recipient);
    }

    Response response;
    try {
      response = sender.send(recipient, body);
    } catch (IOException e) {
      throw new NotificationDeliveryException(
          String.format("Failed posting %s notification to %s", channel, recipient), e);
    }

    int responseCode = response.code();
    if (!response.isSuccessful()) {
      LOGGER.warn(
          "Error response from {} webhook {}. Response Code: {}, Response Message: {}",
          channel,
          recipient,
          responseCode,
          response.message());
      throw new NotificationDeliveryException(
          String.format("%s webhook answered %d %s", channel, responseCode, response.message()));
    }
    LOGGER.debug("{} webhook {} accepted notification '{}'", channel, recipient, subject);
    return DeliveryStatus.DELIVERED;
  }
}
