package org.costwatch.alert.engine.notification.service.notification;

import com.google.common.base.Strings;
import java.time.Instant;
import java.util.List;
import org.costwatch.alert.engine.notification.transport.webhook.slack.SectionBlock;
import org.costwatch.alert.engine.notification.transport.webhook.slack.Text;

public interface SlackMessage {

  static SectionBlock getTitleBlock(String titleMessage) {
    return new SectionBlock(Text.markdown(titleMessage));
  }

  static void addIfNotEmpty(List<Text> metadataFields, String value, String type) {
    if (!Strings.isNullOrEmpty(value)) {
      metadataFields.add(Text.markdown("*" + type + ":*\n" + value));
    }
  }

  // renders in the reader's timezone, falling back to the UTC string
  static void addTimestamp(List<Text> metadataFields, Instant value, String type) {
    if (value != null) {
      metadataFields.add(
          Text.markdown(
              "*"
                  + type
                  + ":*\n"
                  + "<!date^"
                  + value.getEpochSecond()
                  + "^"
                  + "{date_num} {time_secs}|"
                  + value
                  + ">"));
    }
  }
}
