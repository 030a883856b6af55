package org.robincores.scheduler.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Line-oriented helpers for dealing with assembly
public final class AsmHelper {
  private static final Pattern ALIGN = Pattern.compile("^\\s*\\.(?:p2)?align");
  private static final Pattern LABEL_ONLY = Pattern.compile("\\s*\\w+\\s*:\\s*");
  private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*[^*]*\\*/");

  private AsmHelper() {}

  static int indentationOf(String l) {
    int i = 0;
    while (i < l.length() && Character.isWhitespace(l.charAt(i))) {
      i++;
    }
    return i;
  }

  /**
   * Finds the prevailing indentation of a piece of assembly.
   *
   * <p>Labels often sit at a different indentation, so only the top quarter of the sorted
   * indentations has to agree.
   *
   * @return the dominant indentation, or {@code null} if there is none
   */
  public static Integer findIndentation(List<String> source) {
    List<Integer> indentations = new ArrayList<>();
    for (String l : source) {
      if (!l.trim().isEmpty()) {
        indentations.add(indentationOf(l));
      }
    }
    int l = indentations.size();
    if (l == 0) {
      return null;
    }
    Collections.sort(indentations);
    List<Integer> top = indentations.subList((3 * l) / 4, l);
    if (top.get(0).equals(top.get(top.size() - 1))) {
      return top.get(0);
    }
    return null;
  }

  public static List<String> applyIndentation(List<String> source, Integer indentation) {
    if (indentation == null) {
      return source;
    }
    String indent = " ".repeat(indentation);
    List<String> res = new ArrayList<>(source.size());
    for (String l : source) {
      res.add(indent + l.stripLeading());
    }
    return res;
  }

  // Rename a function's label and its .global/.type declarations
  public static String renameFunction(String source, String oldName, String newName) {
    String old = Pattern.quote(oldName);
    String repl = Matcher.quoteReplacement(newName);
    List<String> res = new ArrayList<>();
    for (String s : source.split("\n", -1)) {
      s = s.replaceAll(old + ":", repl + ":");
      s = s.replaceAll("\\.global(\\s+)" + old, ".global$1" + repl);
      s = s.replaceAll("\\.type(\\s+)" + old, ".type$1" + repl);
      res.add(s);
    }
    return String.join("\n", res);
  }

  public static List<String> splitSemicolons(List<String> body) {
    List<String> res = new ArrayList<>();
    for (String s : body) {
      res.addAll(splitStatements(s));
    }
    return res;
  }

  // Splits at semicolons outside comments; a trailing comment stays with the last statement
  static List<String> splitStatements(String s) {
    List<String> res = new ArrayList<>();
    int from = 0;
    int i = 0;
    while (i < s.length()) {
      if (s.startsWith("//", i)) {
        break;
      }
      if (s.startsWith("/*", i)) {
        int end = s.indexOf("*/", i + 2);
        if (end < 0) {
          break;
        }
        i = end + 2;
        continue;
      }
      if (s.charAt(i) == ';') {
        res.add(s.substring(from, i));
        from = i + 1;
      }
      i++;
    }
    res.add(s.substring(from));
    return res;
  }

  static String stripComment(String s) {
    int idx = s.indexOf("//");
    if (idx >= 0) {
      s = s.substring(0, idx);
    }
    s = BLOCK_COMMENT.matcher(s).replaceAll("");
    return s.strip();
  }

  // We only accept (and ignore) .req, .unreq and alignment directives in code so far
  static boolean isIgnoredDirective(String s) {
    return AliasTable.REQ.matcher(s).lookingAt()
        || AliasTable.UNREQ.matcher(s).lookingAt()
        || ALIGN.matcher(s).lookingAt();
  }

  static boolean isLabel(String s) {
    return LABEL_ONLY.matcher(s).matches();
  }

  /**
   * Simplifies a source line: strips comments and surrounding whitespace.
   *
   * @return the simplified line, or {@code null} for blank, label-only and ignored directive lines
   */
  public static String reduceSourceLine(String line) {
    line = stripComment(line);
    if (line.isEmpty() || isIgnoredDirective(line) || isLabel(line)) {
      return null;
    }
    return line;
  }

  public static List<String> reduceSource(List<String> src, boolean allowNops) {
    List<String> res = new ArrayList<>();
    for (String l : src) {
      String r = reduceSourceLine(l);
      if (r == null || (!allowNops && r.equals("nop"))) {
        continue;
      }
      res.add(r);
    }
    return res;
  }

  public static List<String> reduceSource(List<String> src) {
    return reduceSource(src, true);
  }

  public static List<String> lines(String text) {
    List<String> res = new ArrayList<>();
    Collections.addAll(res, text.split("\\R", -1));
    return res;
  }
}
