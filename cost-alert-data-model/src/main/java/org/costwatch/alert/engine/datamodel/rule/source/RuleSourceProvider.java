package org.costwatch.alert.engine.datamodel.rule.source;

import com.typesafe.config.Config;

public class RuleSourceProvider {
  public static final String RULE_SOURCE_TYPE = "type";
  public static final String RULE_SOURCE_TYPE_FS = "fs";

  public static RuleSource getProvider(Config ruleSourceConfig) {
    RuleSource ruleSource;
    String ruleSourceType = ruleSourceConfig.getString(RULE_SOURCE_TYPE);
    switch (ruleSourceType) {
      case RULE_SOURCE_TYPE_FS:
        ruleSource = new FSRuleSource(ruleSourceConfig.getConfig(RULE_SOURCE_TYPE_FS));
        break;
      default:
        throw new RuntimeException(String.format("Invalid rule source type:%s", ruleSourceType));
    }
    return ruleSource;
  }
}
