package org.costwatch.alert.engine.datamodel;

import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class CooldownRecord {
  private final DedupKey dedupKey;
  private final Instant lastTriggeredAt;

  public boolean isCoolingDown(Duration cooldown, Instant now) {
    return now.isBefore(lastTriggeredAt.plus(cooldown));
  }
}
