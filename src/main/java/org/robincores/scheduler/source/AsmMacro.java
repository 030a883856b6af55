package org.robincores.scheduler.source;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// An assembly macro: parsed from .macro/.endm blocks and unfolded at its call sites
public class AsmMacro {
  private static final Logger logger = LogManager.getLogger();

  private static final Pattern MACRO_START = Pattern.compile("^\\s*\\.macro\\s+(\\w+)(.*)$");
  private static final Pattern MACRO_END = Pattern.compile("^\\s*\\.endm\\s*$");
  private static final Pattern NO_UNFOLD = Pattern.compile(".*//\\s*@no-unfold\\s*$");
  private static final Pattern INDENTATION = Pattern.compile("^(\\s*)");
  private static final String PASTE = "\\()";

  // Self-referential macros never reach a fixpoint
  static final int MAX_ROUNDS = 1000;

  private final String name;
  private final List<String> args;
  private final List<String> body;
  private final List<Pattern> argPatterns;
  private final Pattern invocation;

  public AsmMacro(String name, List<String> args, List<String> body) {
    this.name = name;
    this.args = Collections.unmodifiableList(new ArrayList<>(args));
    this.body = Collections.unmodifiableList(new ArrayList<>(body));

    argPatterns = new ArrayList<>();
    for (String arg : args) {
      argPatterns.add(Pattern.compile("\\\\" + Pattern.quote(arg) + "(?!\\w)"));
    }

    StringBuilder re = new StringBuilder("^\\s*").append(Pattern.quote(name));
    if (!args.isEmpty()) {
      re.append("\\s+");
    }
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        re.append(',');
      }
      re.append("\\s*([^,]+)\\s*");
    }
    re.append("\\s*$");
    invocation = Pattern.compile(re.toString());
  }

  public String getName() {
    return name;
  }

  public List<String> getArgs() {
    return args;
  }

  public List<String> getBody() {
    return body;
  }

  /**
   * Instantiates the macro body for the given argument values.
   */
  public List<String> apply(Map<String, String> values) {
    List<String> output = new ArrayList<>();
    for (String l : body) {
      for (int i = 0; i < args.size(); i++) {
        String value = values.get(args.get(i));
        if (value == null) {
          throw new AsmHelperException("Missing argument " + args.get(i) + " for macro " + name);
        }
        l = argPatterns.get(i).matcher(l).replaceAll(Matcher.quoteReplacement(value));
      }
      l = l.replace(PASTE, "");
      output.add(l);
    }
    return output;
  }

  /**
   * Unfolds all invocations of this macro in {@code source}, keeping the indentation of the
   * invoking line.
   *
   * @param onChange called once per unfolded invocation, may be {@code null}
   */
  public List<String> unfoldIn(List<String> source, Runnable onChange) {
    List<String> output = new ArrayList<>();
    for (String l : source) {
      String lp = AsmHelper.reduceSourceLine(l);
      Matcher p = lp == null ? null : invocation.matcher(lp);
      if (p == null || !p.matches()) {
        output.add(l);
        continue;
      }
      if (onChange != null) {
        onChange.run();
      }
      Map<String, String> values = new LinkedHashMap<>();
      for (int i = 0; i < args.size(); i++) {
        values.put(args.get(i), p.group(i + 1).strip());
      }
      Matcher ind = INDENTATION.matcher(l);
      String indentation = ind.lookingAt() ? ind.group(1) : "";
      for (String s : apply(values)) {
        output.add(indentation + s.strip());
      }
    }
    return output;
  }

  public List<String> unfoldIn(List<String> source) {
    return unfoldIn(source, null);
  }

  /**
   * Unfolds all macros until no invocation is left, so macros may expand into invocations of
   * other macros.
   */
  public static List<String> unfoldAllMacros(Map<String, AsmMacro> macros, List<String> source) {
    int[] changes = new int[1];
    int rounds = 0;
    do {
      if (rounds++ >= MAX_ROUNDS) {
        throw new AsmHelperException("Macro unfolding did not terminate after " + MAX_ROUNDS
            + " rounds; recursive macro among " + macros.keySet() + "?");
      }
      changes[0] = 0;
      for (AsmMacro m : macros.values()) {
        source = m.unfoldIn(source, () -> changes[0]++);
      }
      logger.debug("Macro unfolding round {}: {} invocation(s) unfolded", rounds, changes[0]);
    } while (changes[0] > 0);
    return source;
  }

  public static List<String> unfoldAllMacros(List<String> definitions, List<String> source) {
    return unfoldAllMacros(extract(definitions), source);
  }

  /**
   * Parses all macro definitions in an assembly source. Macros whose {@code .macro} line ends in
   * {@code // @no-unfold} are skipped.
   */
  public static Map<String, AsmMacro> extract(List<String> source) {
    Map<String, AsmMacro> macros = new LinkedHashMap<>();

    boolean inMacro = false;
    String currentName = null;
    List<String> currentArgs = null;
    List<String> currentBody = null;

    for (String cur : source) {
      if (!inMacro) {
        Matcher p = MACRO_START.matcher(cur);
        if (!p.matches()) {
          continue;
        }
        if (NO_UNFOLD.matcher(cur).matches()) {
          logger.debug("Skipping macro {} marked as no-unfold", p.group(1));
          continue;
        }
        currentName = p.group(1);
        String argText = stripTrailingComment(p.group(2)).strip();
        currentArgs = new ArrayList<>();
        if (!argText.isEmpty()) {
          for (String a : argText.split(",")) {
            currentArgs.add(a.strip());
          }
        }
        currentBody = new ArrayList<>();
        inMacro = true;
        continue;
      }

      if (!MACRO_END.matcher(cur).matches()) {
        currentBody.add(cur);
        continue;
      }
      macros.put(currentName, new AsmMacro(currentName, currentArgs, currentBody));
      inMacro = false;
    }

    if (inMacro) {
      throw new AsmHelperException("Unterminated macro " + currentName);
    }
    return macros;
  }

  public static Map<String, AsmMacro> extractFromFile(Path file) throws IOException {
    return extract(Files.readAllLines(file, StandardCharsets.UTF_8));
  }

  private static String stripTrailingComment(String s) {
    int idx = s.indexOf("//");
    return idx >= 0 ? s.substring(0, idx) : s;
  }

  @Override
  public String toString() {
    return name;
  }
}
