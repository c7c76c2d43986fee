package org.costwatch.alert.engine.notification.transport.webhook.slack;

public interface Block {
  String getType();
}
