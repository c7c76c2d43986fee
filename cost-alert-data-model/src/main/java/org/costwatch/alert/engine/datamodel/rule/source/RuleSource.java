package org.costwatch.alert.engine.datamodel.rule.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.List;
import java.util.function.Predicate;

public interface RuleSource {
  List<JsonNode> getAllRules(Predicate<JsonNode> predicate) throws IOException;
}
