package org.robincores.scheduler.instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// Register classes; placeholders name theirs by first letter (R, S, T)
public enum RegisterType {
  GPR,
  FPR,
  STACK_FPR,
  STACK_GPR,
  FLAGS,
  HINT;

  public static final String FLAGS_NAME = "flags";
  public static final String HINT_PREFIX = "hint_";

  private static final Map<RegisterType, List<String>> REGISTERS = new EnumMap<>(RegisterType.class);
  private static final Map<RegisterType, Set<String>> LOOKUP = new EnumMap<>(RegisterType.class);

  static {
    List<String> stack = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      stack.add("STACK" + i);
    }
    List<String> gprs = new ArrayList<>();
    for (int i = 0; i < 15; i++) {
      if (i != 13) {
        gprs.add("r" + i);
      }
    }
    List<String> fprs = new ArrayList<>();
    for (int i = 0; i < 31; i++) {
      fprs.add("s" + i);
    }
    List<String> hints = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      hints.add("t" + i);
    }
    for (int i = 0; i < 8; i++) {
      for (int j = 0; j < 8; j++) {
        hints.add("t" + i + j);
      }
    }
    for (int i = 0; i < 16; i++) {
      for (int j = 0; j < 16; j++) {
        hints.add("t" + i + "_" + j);
      }
    }
    REGISTERS.put(GPR, Collections.unmodifiableList(gprs));
    REGISTERS.put(FPR, Collections.unmodifiableList(fprs));
    REGISTERS.put(STACK_FPR, Collections.unmodifiableList(stack));
    REGISTERS.put(STACK_GPR, Collections.unmodifiableList(stack));
    REGISTERS.put(HINT, Collections.unmodifiableList(hints));
    REGISTERS.put(FLAGS, List.of(FLAGS_NAME));
    for (Map.Entry<RegisterType, List<String>> e : REGISTERS.entrySet()) {
      LOOKUP.put(e.getKey(), new HashSet<>(e.getValue()));
    }
  }

  // All architectural registers of this type
  public List<String> registers() {
    return REGISTERS.get(this);
  }

  // Hint registers are never renamed
  public boolean isRenamed() {
    return this != HINT;
  }

  // null for an unknown name
  public static RegisterType findType(String r) {
    if (r.startsWith(HINT_PREFIX)) {
      return HINT;
    }
    for (RegisterType ty : values()) {
      if (LOOKUP.get(ty).contains(r)) {
        return ty;
      }
    }
    return null;
  }

  public static RegisterType fromString(String string) {
    switch (string.toLowerCase()) {
      case "fprstack":
        return STACK_FPR;
      case "stack":
        return STACK_GPR;
      case "fpr":
        return FPR;
      case "gpr":
        return GPR;
      case "hint":
        return HINT;
      case "flags":
        return FLAGS;
      default:
        return null;
    }
  }

  public static RegisterType fromPlaceholder(String placeholder) {
    switch (Character.toUpperCase(placeholder.charAt(0))) {
      case 'R':
        return GPR;
      case 'S':
        return FPR;
      case 'T':
        return HINT;
      default:
        throw new FatalParsingException("Unknown pattern: " + placeholder);
    }
  }

  // Letter prefixing architectural names of this class in assembly, e.g. 'r' in r3
  public char classLetter() {
    switch (this) {
      case GPR:
        return 'r';
      case FPR:
        return 's';
      case HINT:
        return 't';
      default:
        throw new FatalParsingException("Register type " + this + " has no textual form");
    }
  }

  public static Set<String> defaultReserved() {
    Set<String> res = new LinkedHashSet<>(List.of(FLAGS_NAME, "r13", "lr"));
    res.addAll(HINT.registers());
    return res;
  }

  public static Map<String, String> defaultAliases() {
    return Map.of("lr", "r14");
  }
}
