package org.robincores.scheduler.instruction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

// Compiles templates such as add<width> <Rd>, <Ra>, <Rb>, cached by template text
public final class PatternCompiler {
  private static final Pattern REGISTER_PLACEHOLDER = Pattern.compile("<([RST])(\\w+)>");

  private static final Map<String, TemplatePattern> CACHE = new ConcurrentHashMap<>();

  private PatternCompiler() {}

  // Returns the compiled pattern for a template, compiling it on first use
  public static TemplatePattern get(String template) {
    return CACHE.computeIfAbsent(template, PatternCompiler::compile);
  }

  static int cacheSize() {
    return CACHE.size();
  }

  // Bypasses the cache
  public static TemplatePattern compile(String template) {
    String s = template;

    // Literal '.', '[' and ']' may be surrounded by whitespace
    s = s.replace(".", "\\s*\\.\\s*")
        .replace("[", "\\s*\\[\\s*")
        .replace("]", "\\s*\\]\\s*");

    // <Rd> matches either r<digits> or R<symbol>
    Map<String, String[]> registerGroups = new LinkedHashMap<>();
    Matcher matcher = REGISTER_PLACEHOLDER.matcher(s);
    StringBuffer result = new StringBuffer();
    while (matcher.find()) {
      String letter = matcher.group(1);
      String field = letter + matcher.group(2);
      if (registerGroups.containsKey(field)) {
        throw new FatalParsingException("Register placeholder <" + field + "> used twice in " + template);
      }
      int idx = registerGroups.size();
      String raw = "reg" + idx + "raw";
      String sym = "reg" + idx + "sym";
      registerGroups.put(field, new String[] {raw, sym});
      String cls = "[" + letter.toLowerCase() + letter + "]";
      String replacement = "(?:" + cls + "(?<" + raw + ">[0-9_][0-9_]*)|" + cls + "<(?<" + sym + ">\\w+)>)";
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    s = result.toString();

    // Whitespace after a comma is optional, elsewhere at least one blank is required
    s = s.replace(", ", ",")
        .replace(" ", "\\s+")
        .replace(",", "\\s*,\\s*");

    Map<String, String> fieldGroups = new LinkedHashMap<>();
    for (FieldCategory c : FieldCategory.values()) {
      s = replacePlaceholders(s, c, template, fieldGroups);
    }

    String regex = "\\s*" + s + "\\s*(?://.*)?";
    try {
      return new TemplatePattern(template, Pattern.compile(regex), registerGroups, fieldGroups);
    } catch (PatternSyntaxException e) {
      throw new FatalParsingException("Bad regex for template '" + template + "': " + regex + " -- " + e);
    }
  }

  // Replace <key> or <key0>, <key1>, ... by capture groups
  private static String replacePlaceholders(String s, FieldCategory c, String template,
                                            Map<String, String> fieldGroups) {
    Pattern placeholder = Pattern.compile("<" + c.key() + "(\\d*)>");
    Matcher m = placeholder.matcher(s);
    List<String> suffixes = new ArrayList<>();
    while (m.find()) {
      suffixes.add(m.group(1));
    }
    if (suffixes.isEmpty()) {
      return s;
    }
    if (suffixes.size() == 1 && suffixes.get(0).isEmpty()) {
      fieldGroups.put(c.group(), c.group());
      return s.replace("<" + c.key() + ">", "(?<" + c.group() + ">" + c.regex() + ")");
    }
    for (int i = 0; i < suffixes.size(); i++) {
      if (!suffixes.contains(Integer.toString(i))) {
        throw new FatalParsingException("Placeholder <" + c.key() + "> occurs " + suffixes.size()
            + " times in " + template + " but is not indexed 0.." + (suffixes.size() - 1));
      }
    }
    for (int i = 0; i < suffixes.size(); i++) {
      String group = c.group() + i;
      fieldGroups.put(group, group);
      s = s.replace("<" + c.key() + i + ">", "(?<" + group + ">" + c.regex() + ")");
    }
    return s;
  }
}
