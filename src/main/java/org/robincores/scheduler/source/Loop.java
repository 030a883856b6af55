package org.robincores.scheduler.source;

import org.robincores.scheduler.instruction.FatalParsingException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and emission of simple counted loops.
 *
 * <p>Only the following loop shape is recognized:
 * <pre>
 * loop_lbl:
 *     {code}
 *     sub[s] &lt;cnt&gt;, &lt;cnt&gt;, #1
 *     (cbnz|cbz) &lt;cnt&gt;, loop_lbl   or   bne loop_lbl
 * </pre>
 */
public class Loop {
  private static final Pattern DECREMENT =
      Pattern.compile("^\\s*sub(s?)(?:\\.w)?\\s+(\\w+)\\s*,\\s*(\\w+)\\s*,\\s*(#1)\\s*(?://.*)?$");
  private static final Set<Integer> UNROLL_FACTORS = Set.of(1, 2, 4, 8, 16, 32);

  private final String lblStart;
  private final String lblEnd;
  private final String loopInit;

  public Loop() {
    this("1");
  }

  public Loop(String lblStart) {
    this(lblStart, "2", "lr");
  }

  public Loop(String lblStart, String lblEnd, String loopInit) {
    this.lblStart = lblStart;
    this.lblEnd = lblEnd;
    this.loopInit = loopInit;
  }

  public String getLblStart() {
    return lblStart;
  }

  public String getLblEnd() {
    return lblEnd;
  }

  public String getLoopInit() {
    return loopInit;
  }

  /**
   * Emits the loop counter setup and the start label.
   *
   * @param jumpIfEmpty label to branch to when the counter is zero, may be {@code null}
   */
  public List<String> start(String loopCnt, int indentation, int fixup, int unroll, String jumpIfEmpty) {
    String indent = " ".repeat(indentation);
    List<String> res = new ArrayList<>();
    if (!UNROLL_FACTORS.contains(unroll)) {
      throw new IllegalArgumentException("Unsupported unroll factor " + unroll);
    }
    if (unroll > 1) {
      res.add(indent + "lsr " + loopCnt + ", " + loopCnt + ", #" + Integer.numberOfTrailingZeros(unroll));
    }
    if (fixup != 0) {
      res.add(indent + "sub " + loopCnt + ", " + loopCnt + ", #" + fixup);
    }
    if (jumpIfEmpty != null) {
      res.add(indent + "cbz " + loopCnt + ", " + jumpIfEmpty);
    }
    res.add(lblStart + ":");
    return res;
  }

  // Emits the flag-setting decrement and the branch back to the start label
  public List<String> end(String counter, String counterSource, String decrement, int indentation) {
    String indent = " ".repeat(indentation);
    String target = lblStart;
    if (target.chars().allMatch(Character::isDigit)) {
      target += "b";
    }
    List<String> res = new ArrayList<>();
    res.add(indent + "subs " + counter + ", " + counterSource + ", " + decrement);
    res.add(indent + "cbnz " + counter + ", " + target);
    return res;
  }

  public List<String> end(LoopRegion loop, int indentation) {
    return end(loop.getCounter(), loop.getCounterSource(), loop.getDecrement(), indentation);
  }

  /**
   * Locates the loop starting at label {@code lbl} in {@code source}.
   *
   * @throws AsmHelperException    if no loop of the supported shape is found
   * @throws FatalParsingException if the loop tail branches on a register other than the counter
   */
  public static LoopRegion extract(List<String> source, String lbl) {
    List<String> pre = new ArrayList<>();
    List<String> body = new ArrayList<>();
    List<String> post = new ArrayList<>();

    String quoted = Pattern.quote(lbl);
    Pattern branch = Pattern.compile(
        "^\\s*(?:(cbnz|cbz)\\s+(\\w+)\\s*,\\s*|(bne)(?:\\.w|\\.n)?\\s+)" + quoted + "[bf]?\\s*(?://.*)?$");

    // 0: before loop, 1: in loop, 2: saw decrement, 3: after loop
    int state = 0;
    String pending = null;
    String counter = null;
    String counterSource = null;
    String decrement = null;
    boolean flagSetting = false;

    Iterator<String> lines = source.iterator();
    String l = null;
    boolean keep = false;
    while (true) {
      if (!keep) {
        l = lines.hasNext() ? lines.next() : null;
      }
      keep = false;
      if (l == null) {
        break;
      }
      switch (state) {
        case 0: {
          Matcher p = RegionExtractor.LABEL_LINE.matcher(l);
          if (p.matches() && p.group(1).equals(lbl)) {
            l = p.group(2);
            keep = true;
            state = 1;
          } else {
            pre.add(l);
          }
          break;
        }
        case 1: {
          Matcher p = DECREMENT.matcher(l);
          if (p.matches()) {
            flagSetting = !p.group(1).isEmpty();
            counter = p.group(2);
            counterSource = p.group(3);
            decrement = p.group(4);
            pending = l;
            state = 2;
          } else {
            body.add(l);
          }
          break;
        }
        case 2: {
          if (l.trim().isEmpty()) {
            break;
          }
          Matcher p = branch.matcher(l);
          if (!p.matches()) {
            // The decrement was not the loop tail after all
            body.add(pending);
            pending = null;
            keep = true;
            state = 1;
            break;
          }
          if (p.group(3) != null && !flagSetting) {
            throw new FatalParsingException("Loop " + lbl + " branches on flags, but '"
                + pending.strip() + "' does not set them");
          }
          if (p.group(2) != null && !p.group(2).equals(counter)) {
            throw new FatalParsingException("Loop " + lbl + " decrements " + counter
                + " but branches on " + p.group(2));
          }
          state = 3;
          break;
        }
        default:
          post.add(l);
          break;
      }
    }
    if (state < 3) {
      throw new AsmHelperException("Couldn't identify loop " + lbl);
    }
    return new LoopRegion(pre, body, post, lbl, counter, counterSource, decrement, flagSetting);
  }
}
