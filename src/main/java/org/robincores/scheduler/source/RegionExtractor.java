package org.robincores.scheduler.source;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an assembly listing into (prologue, body, epilogue) around a start and/or end label.
 *
 * <p>When a label line is hit, the text following the colon is kept as the first line of the
 * next part.
 */
public final class RegionExtractor {
  static final Pattern LABEL_LINE = Pattern.compile("^\\s*(\\w+)\\s*:(.*)$");

  private static final int BEFORE_START = 0;
  private static final int IN_BODY = 1;
  private static final int AFTER_END = 2;

  private RegionExtractor() {}

  /**
   * Extracts the region and simplifies its body (comments, labels, ignored directives and nops
   * are dropped).
   */
  public static Region extract(List<String> source, String startLabel, String endLabel) {
    Region r = extractCore(source, startLabel, endLabel);
    return new Region(r.getPre(), AsmHelper.reduceSource(r.getBody(), false), r.getPost());
  }

  public static Region extractCore(List<String> source, String startLabel, String endLabel) {
    List<String> pre = new ArrayList<>();
    List<String> body = new ArrayList<>();
    List<String> post = new ArrayList<>();

    if (startLabel == null && endLabel == null) {
      body.addAll(source);
      return new Region(pre, body, post);
    }

    // If no start label is provided, scan from the start to the end label
    int state = startLabel == null ? IN_BODY : BEFORE_START;
    String[] expected = {startLabel, endLabel};
    List<List<String>> buffers = List.of(pre, body);

    Iterator<String> lines = source.iterator();
    String l = null;
    boolean keep = false;
    while (true) {
      if (!keep) {
        l = lines.hasNext() ? lines.next() : null;
      }
      if (l == null) {
        break;
      }
      keep = false;
      if (state == AFTER_END) {
        post.add(l);
        continue;
      }
      Matcher p = LABEL_LINE.matcher(l);
      if (p.matches() && p.group(1).equals(expected[state])) {
        l = p.group(2);
        keep = true;
        state++;
        continue;
      }
      buffers.get(state).add(l);
    }

    if (state < AFTER_END) {
      if (startLabel != null && endLabel != null) {
        throw new AsmHelperException("Failed to identify region " + startLabel + "-" + endLabel);
      }
      if (state == BEFORE_START) {
        throw new AsmHelperException("Couldn't find label " + startLabel);
      }
    }
    return new Region(pre, body, post);
  }
}
