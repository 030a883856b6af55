package org.robincores.scheduler.source;

import java.util.List;

/**
 * A loop located by {@link Loop#extract(List, String)}: the code around it, its body without the
 * counter decrement and branch, and the decrement operands needed to re-emit the loop tail.
 */
public class LoopRegion extends Region {
  private final String label;
  private final String counter;
  private final String counterSource;
  private final String decrement;
  private final boolean flagSetting;

  public LoopRegion(List<String> pre, List<String> body, List<String> post, String label,
                    String counter, String counterSource, String decrement, boolean flagSetting) {
    super(pre, body, post);
    this.label = label;
    this.counter = counter;
    this.counterSource = counterSource;
    this.decrement = decrement;
    this.flagSetting = flagSetting;
  }

  public String getLabel() {
    return label;
  }

  // Register written by the decrement
  public String getCounter() {
    return counter;
  }

  // Register read by the decrement
  public String getCounterSource() {
    return counterSource;
  }

  // Decrement immediate, including the '#'
  public String getDecrement() {
    return decrement;
  }

  public boolean isFlagSetting() {
    return flagSetting;
  }
}
