package org.costwatch.alert.engine.notification.transport.webhook.slack;

import java.util.Locale;

/** Header blocks only accept plain text. */
public class HeaderBlock implements Block {
  public static final String TYPE = BlockType.HEADER.name().toLowerCase(Locale.ROOT);
  private final Text text;

  public HeaderBlock(String title) {
    this.text = new Text(Text.PLAINTEXT_TYPE, title);
  }

  @Override
  public String getType() {
    return TYPE;
  }

  public Text getText() {
    return text;
  }
}
