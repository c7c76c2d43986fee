package org.costwatch.alert.engine.datamodel;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A single (channel, recipient) pair an alert is delivered to. */
@AllArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class NotificationTarget {
  private final NotificationChannelType channel;
  private final String recipient;
}
