package org.costwatch.alert.engine.datamodel;

import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;

/** Identity under which cooldown is tracked: the rule id plus the dimension values it targets. */
@EqualsAndHashCode
public final class DedupKey {
  private final String value;

  private DedupKey(String value) {
    this.value = value;
  }

  public static DedupKey forRule(AlertRule rule) {
    return new DedupKey(rule.getId() + render(rule.getCondition().getDimensions()));
  }

  public static DedupKey parse(String value) {
    return new DedupKey(value);
  }

  public String asString() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }

  private static String render(Map<String, String> dimensions) {
    StringJoiner joiner = new StringJoiner(",", "[", "]");
    new TreeMap<>(dimensions).forEach((key, val) -> joiner.add(key + "=" + val));
    return joiner.toString();
  }
}
