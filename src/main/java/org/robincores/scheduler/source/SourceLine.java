package org.robincores.scheduler.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One line of assembly together with its annotation tags.
 *
 * <p>Tags are attached in a trailing line comment, e.g. {@code ldr r0, [r1]  // @reads=buf0}.
 * Instances are immutable; every transformation returns a new line.
 */
public final class SourceLine {
  public static final String TAG_READS = "reads";
  public static final String TAG_WRITES = "writes";

  private static final Pattern TAG_PATTERN = Pattern.compile("@(\\w+)=([\\w,]+)");

  private final String text;
  private final Map<String, List<String>> tags;

  private SourceLine(String text, Map<String, List<String>> tags) {
    this.text = Objects.requireNonNull(text);
    this.tags = tags;
  }

  public static SourceLine of(String text) {
    return new SourceLine(text, Collections.emptyMap());
  }

  // Build a line, picking up any "@key=value[,value]" tags from its line comment
  public static SourceLine parse(String text) {
    Map<String, List<String>> tags = new LinkedHashMap<>();
    int comment = text.indexOf("//");
    if (comment >= 0) {
      Matcher m = TAG_PATTERN.matcher(text.substring(comment));
      while (m.find()) {
        List<String> values = tags.computeIfAbsent(m.group(1), k -> new ArrayList<>());
        for (String v : m.group(2).split(",")) {
          if (!v.isEmpty()) {
            values.add(v);
          }
        }
      }
    }
    return new SourceLine(text, freeze(tags));
  }

  public static List<SourceLine> parseAll(List<String> lines) {
    List<SourceLine> res = new ArrayList<>(lines.size());
    for (String l : lines) {
      res.add(parse(l));
    }
    return res;
  }

  public static List<String> texts(List<SourceLine> lines) {
    List<String> res = new ArrayList<>(lines.size());
    for (SourceLine l : lines) {
      res.add(l.getText());
    }
    return res;
  }

  public String getText() {
    return text;
  }

  public Map<String, List<String>> getTags() {
    return tags;
  }

  public List<String> getTag(String key) {
    return tags.getOrDefault(key, Collections.emptyList());
  }

  public SourceLine withText(String newText) {
    return new SourceLine(newText, tags);
  }

  public SourceLine withTag(String key, List<String> values) {
    Map<String, List<String>> copy = new LinkedHashMap<>(tags);
    copy.put(key, new ArrayList<>(values));
    return new SourceLine(text, freeze(copy));
  }

  private static Map<String, List<String>> freeze(Map<String, List<String>> tags) {
    if (tags.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, List<String>> res = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> e : tags.entrySet()) {
      res.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
    }
    return Collections.unmodifiableMap(res);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SourceLine)) return false;
    SourceLine that = (SourceLine) o;
    return text.equals(that.text) && tags.equals(that.tags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, tags);
  }

  @Override
  public String toString() {
    return text;
  }
}
