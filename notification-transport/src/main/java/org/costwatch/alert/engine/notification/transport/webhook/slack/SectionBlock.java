package org.costwatch.alert.engine.notification.transport.webhook.slack;

import java.util.List;
import java.util.Locale;

public class SectionBlock implements Block {
  public static final String TYPE = BlockType.SECTION.name().toLowerCase(Locale.ROOT);
  private String type;
  private Text text;
  private List<Text> fields;

  public SectionBlock() {
    this.type = TYPE;
  }

  public SectionBlock(Text text) {
    this();
    this.text = text;
  }

  @Override
  public String getType() {
    return type;
  }

  public Text getText() {
    return text;
  }

  public void setText(Text text) {
    this.text = text;
  }

  public List<Text> getFields() {
    return fields;
  }

  public void setFields(List<Text> fields) {
    this.fields = fields;
  }
}
