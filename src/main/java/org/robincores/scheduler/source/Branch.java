package org.robincores.scheduler.source;

import java.util.List;

// Helpers for emitting branches
public final class Branch {
  private Branch() {}

  public static List<String> ifEqual(String cnt, int val, String lbl) {
    return List.of("cmp " + cnt + ", #" + val, "beq " + lbl);
  }

  public static List<String> ifGreaterEqual(String cnt, int val, String lbl) {
    return List.of("cmp " + cnt + ", #" + val, "bge " + lbl);
  }

  public static List<String> unconditional(String lbl) {
    return List.of("b " + lbl);
  }
}
