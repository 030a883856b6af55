package org.robincores.scheduler.instruction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Represents a compiled template: its regex and the capture groups of each logical field
public final class TemplatePattern {
  private final String template;
  private final Pattern regex;
  // field name -> (raw group, symbolic group)
  private final Map<String, String[]> registerGroups;
  // field name -> group
  private final Map<String, String> fieldGroups;

  TemplatePattern(String template, Pattern regex, Map<String, String[]> registerGroups,
                  Map<String, String> fieldGroups) {
    this.template = template;
    this.regex = regex;
    this.registerGroups = Collections.unmodifiableMap(new LinkedHashMap<>(registerGroups));
    this.fieldGroups = Collections.unmodifiableMap(new LinkedHashMap<>(fieldGroups));
  }

  public String getTemplate() {
    return template;
  }

  public Pattern getRegex() {
    return regex;
  }

  public List<String> getRegisterFields() {
    return List.copyOf(registerGroups.keySet());
  }

  public List<String> getAttributeFields() {
    return List.copyOf(fieldGroups.keySet());
  }

  // Register fields hold the digits of r3 ("3") or the symbolic name of R<acc>
  public Map<String, String> match(String line) throws ParsingException {
    Matcher m = regex.matcher(line);
    if (!m.matches()) {
      throw new ParsingException("Does not match instruction pattern " + template
          + " [regex: " + regex.pattern() + "]");
    }
    Map<String, String> res = new LinkedHashMap<>();
    for (Map.Entry<String, String[]> e : registerGroups.entrySet()) {
      String raw = m.group(e.getValue()[0]);
      res.put(e.getKey(), raw != null ? raw : m.group(e.getValue()[1]));
    }
    for (Map.Entry<String, String> e : fieldGroups.entrySet()) {
      String v = m.group(e.getValue());
      if (v != null) {
        res.put(e.getKey(), v);
      }
    }
    return res;
  }

  @Override
  public String toString() {
    return template + " -> " + regex.pattern();
  }
}
