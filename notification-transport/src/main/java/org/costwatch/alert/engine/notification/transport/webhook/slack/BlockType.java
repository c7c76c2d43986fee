package org.costwatch.alert.engine.notification.transport.webhook.slack;

public enum BlockType {
  SECTION,
  HEADER,
  DIVIDER
}
