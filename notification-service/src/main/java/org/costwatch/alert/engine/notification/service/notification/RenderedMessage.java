package org.costwatch.alert.engine.notification.service.notification;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor(staticName = "of")
@Getter
@ToString
public class RenderedMessage {
  private final String subject;
  private final String body;
}
