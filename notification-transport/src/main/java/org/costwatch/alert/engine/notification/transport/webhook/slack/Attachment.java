package org.costwatch.alert.engine.notification.transport.webhook.slack;

import java.util.List;

/** POJO to serialize a Slack attachment; the color renders as the side bar. */
public class Attachment {
  public static final String RED = "#d41729";
  public static final String ORANGE = "#f2711c";
  public static final String YELLOW = "#fbbd08";
  public static final String GREY = "#a0a0a0";
  private String color;
  private List<Block> blocks;

  public Attachment() {}

  public Attachment(String color, List<Block> blocks) {
    this.color = color;
    this.blocks = blocks;
  }

  public String getColor() {
    return color;
  }

  public void setColor(String color) {
    this.color = color;
  }

  public List<Block> getBlocks() {
    return blocks;
  }

  public void setBlocks(List<Block> blocks) {
    this.blocks = blocks;
  }
}
