package org.robincores.scheduler.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tracks register aliases introduced by {@code .req} and dropped by {@code .unreq}.
 *
 * <p>An alias of an alias is resolved once, at the time it is introduced, to whatever its target
 * currently maps to.
 */
public class AliasTable {
  static final Pattern REQ = Pattern.compile("\\s*(\\w+)\\s+\\.req\\s+(\\w+)");
  static final Pattern UNREQ = Pattern.compile("\\s*\\.unreq\\s+(\\w+)");

  private final Map<String, String> allocations = new LinkedHashMap<>();

  public AliasTable() {}

  public AliasTable(Map<String, String> initial) {
    for (Map.Entry<String, String> e : initial.entrySet()) {
      addAlias(e.getKey(), e.getValue());
    }
  }

  public void addAlias(String alias, String reg) {
    if (allocations.containsKey(alias)) {
      throw new AsmHelperException("Double definition of alias " + alias);
    }
    allocations.put(alias, allocations.getOrDefault(reg, reg));
  }

  public void removeAlias(String alias) {
    if (!allocations.containsKey(alias)) {
      throw new AsmHelperException("Couldn't find alias " + alias
          + " -- .unreq without .req in your source?");
    }
    allocations.remove(alias);
  }

  /**
   * Updates the table if {@code line} is a {@code .req} or {@code .unreq} directive. Any other
   * line is ignored.
   */
  public void parseLine(String line) {
    Matcher p = REQ.matcher(line);
    if (p.lookingAt()) {
      addAlias(p.group(1), p.group(2));
      return;
    }
    p = UNREQ.matcher(line);
    if (p.lookingAt()) {
      removeAlias(p.group(1));
    }
  }

  public void parse(List<String> src) {
    for (String s : src) {
      parseLine(s);
    }
  }

  public String resolve(String name) {
    return allocations.getOrDefault(name, name);
  }

  public boolean contains(String alias) {
    return allocations.containsKey(alias);
  }

  public Map<String, String> getAllocations() {
    return Collections.unmodifiableMap(allocations);
  }

  // Rewrite the given lines using the current state of the table
  public List<String> unfold(List<String> src) {
    return unfoldAllAliases(allocations, src);
  }

  public static Map<String, String> parseAliases(List<String> src) {
    AliasTable table = new AliasTable();
    table.parse(src);
    return new LinkedHashMap<>(table.allocations);
  }

  public static String unfoldAliases(Map<String, String> aliases, String line) {
    for (Map.Entry<String, String> e : aliases.entrySet()) {
      line = line.replaceAll("(?<!\\w)" + Pattern.quote(e.getKey()) + "(?!\\w)",
          Matcher.quoteReplacement(e.getValue()));
    }
    return line;
  }

  /**
   * Replaces every standalone occurrence of an alias by its register.
   */
  public static List<String> unfoldAllAliases(Map<String, String> aliases, List<String> src) {
    List<String> res = new ArrayList<>(src.size());
    for (String l : src) {
      res.add(unfoldAliases(aliases, l));
    }
    return res;
  }
}
