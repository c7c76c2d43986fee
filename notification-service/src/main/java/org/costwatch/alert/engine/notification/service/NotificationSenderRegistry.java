package org.costwatch.alert.engine.notification.service;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.costwatch.alert.engine.datamodel.NotificationChannelType;
import org.costwatch.alert.engine.notification.transport.NotificationSender;

/** Which sender handles which channel. A channel without a sender is a configuration error. */
public class NotificationSenderRegistry {
  private final Map<NotificationChannelType, NotificationSender> senders =
      new ConcurrentHashMap<>();

  public NotificationSenderRegistry register(
      NotificationChannelType channel, NotificationSender sender) {
    senders.put(channel, sender);
    return this;
  }

  public NotificationSenderRegistry register(
      Collection<NotificationChannelType> channels, NotificationSender sender) {
    channels.forEach(channel -> register(channel, sender));
    return this;
  }

  public Optional<NotificationSender> find(NotificationChannelType channel) {
    return Optional.ofNullable(senders.get(channel));
  }
}
