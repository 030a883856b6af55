package org.robincores.scheduler.instruction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// Thrown when a line doesn't match a template; the aggregate one carries every template's reason
public class ParsingException extends Exception {
  private final Map<String, String> reasons;

  public ParsingException(String msg) {
    super(msg);
    this.reasons = Collections.emptyMap();
  }

  public ParsingException(String msg, Map<String, String> reasons) {
    super(msg + describe(reasons));
    this.reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
  }

  // Rejection reason per attempted template name, in the order they were tried
  public Map<String, String> getReasons() {
    return reasons;
  }

  private static String describe(Map<String, String> reasons) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> e : reasons.entrySet()) {
      sb.append("\n* ").append(String.format("%-24s", e.getKey() + ":")).append(' ').append(e.getValue());
    }
    return sb.toString();
  }
}
