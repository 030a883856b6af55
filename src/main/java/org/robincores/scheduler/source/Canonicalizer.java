package org.robincores.scheduler.source;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes raw assembly before parsing: isolates the region (or loop) of interest, optionally
 * runs the preprocessor, unfolds macros, resolves register aliases and reduces the body to one
 * instruction per line.
 */
public class Canonicalizer {
  private static final Logger logger = LogManager.getLogger();

  private String startLabel;
  private String endLabel;
  private String loopLabel;
  private boolean expandMacros = true;
  private boolean resolveAliases = true;
  private boolean allowNops = false;
  private Preprocessor preprocessor;
  private Map<String, String> defaultAliases = Collections.emptyMap();
  private final Map<String, AsmMacro> extraMacros = new LinkedHashMap<>();

  public void setStartLabel(String startLabel) {
    this.startLabel = startLabel;
  }

  public void setEndLabel(String endLabel) {
    this.endLabel = endLabel;
  }

  public void setLoopLabel(String loopLabel) {
    this.loopLabel = loopLabel;
  }

  public void setExpandMacros(boolean expandMacros) {
    this.expandMacros = expandMacros;
  }

  public void setResolveAliases(boolean resolveAliases) {
    this.resolveAliases = resolveAliases;
  }

  public void setAllowNops(boolean allowNops) {
    this.allowNops = allowNops;
  }

  // null disables preprocessing
  public void setPreprocessor(Preprocessor preprocessor) {
    this.preprocessor = preprocessor;
  }

  // Architecture aliases applied after the source's own, e.g. lr -> r14
  public void setDefaultAliases(Map<String, String> defaultAliases) {
    this.defaultAliases = defaultAliases;
  }

  // Macros defined outside the source, e.g. in a separate macro file
  public void addMacros(Map<String, AsmMacro> macros) {
    extraMacros.putAll(macros);
  }

  public CanonicalSource canonicalize(String source) {
    return canonicalize(AsmHelper.lines(source));
  }

  public CanonicalSource canonicalize(List<String> source) {
    Region region;
    LoopRegion loop = null;
    if (loopLabel != null) {
      loop = Loop.extract(source, loopLabel);
      region = loop;
      logger.debug("Found loop {} counting with {}", loopLabel, loop.getCounter());
    } else {
      region = RegionExtractor.extractCore(source, startLabel, endLabel);
    }
    // An end label was found exactly when something follows it, if only the rest of its line
    String foundEnd = loop == null && endLabel != null && !region.getPost().isEmpty() ? endLabel : null;
    String foundStart = loop == null ? startLabel : null;
    List<String> pre = region.getPre();
    List<String> body = region.getBody();
    logger.debug("Region has {} line(s) before, {} in, {} after", pre.size(), body.size(),
        region.getPost().size());

    if (preprocessor != null) {
      body = preprocessor.unfold(pre, body);
    }

    Integer indentation = AsmHelper.findIndentation(body);

    // Before macros, so that each statement of a line is a separate invocation
    body = AsmHelper.splitSemicolons(body);

    if (expandMacros) {
      Map<String, AsmMacro> macros = new LinkedHashMap<>(extraMacros);
      macros.putAll(AsmMacro.extract(pre));
      if (!macros.isEmpty()) {
        logger.debug("Unfolding macros {}", macros.keySet());
        body = AsmMacro.unfoldAllMacros(macros, body);
      }
    }

    if (resolveAliases) {
      body = resolveAliases(pre, body);
    }

    List<SourceLine> reduced = new ArrayList<>();
    for (String l : body) {
      SourceLine line = SourceLine.parse(l);
      String text = AsmHelper.reduceSourceLine(l);
      if (text == null || (!allowNops && text.equals("nop"))) {
        continue;
      }
      reduced.add(line.withText(text));
    }
    logger.debug("Canonical body has {} instruction(s)", reduced.size());
    return new CanonicalSource(pre, reduced, region.getPost(), indentation, loop, foundStart, foundEnd);
  }

  // Aliases from the prologue apply throughout; .req/.unreq in the body apply from where they occur.
  // Only the code is rewritten: tag values in the line comment name memory, not registers.
  private List<String> resolveAliases(List<String> pre, List<String> body) {
    AliasTable table = new AliasTable();
    table.parse(pre);
    List<String> res = new ArrayList<>(body.size());
    for (String l : body) {
      table.parseLine(l);
      int idx = l.indexOf("//");
      String code = idx >= 0 ? l.substring(0, idx) : l;
      String comment = idx >= 0 ? l.substring(idx) : "";
      code = AliasTable.unfoldAliases(table.getAllocations(), code);
      res.add(AliasTable.unfoldAliases(defaultAliases, code) + comment);
    }
    return res;
  }
}
