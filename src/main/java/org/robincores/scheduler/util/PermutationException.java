package org.robincores.scheduler.util;

import java.util.List;

// Raised when a mapping is not a bijection on {0, ..., n-1}
public class PermutationException extends RuntimeException {
  private final List<Integer> keys;
  private final List<Integer> values;

  public PermutationException(String msg, List<Integer> keys, List<Integer> values) {
    super(msg + "\nKeys:   " + keys + "\nValues: " + values);
    this.keys = keys;
    this.values = values;
  }

  public List<Integer> getKeys() {
    return keys;
  }

  public List<Integer> getValues() {
    return values;
  }
}
