package org.robincores.scheduler.instruction;

import com.google.gson.annotations.SerializedName;

// Addressing of a load/store template: base register placeholder (or "sp") and addressing mode
public class MemoryAccess {
  public static final String STACK_POINTER = "sp";

  public enum Mode {
    // [base], [base, imm]
    @SerializedName("offset") OFFSET,
    // [base], imm
    @SerializedName("postIncrement") POST_INCREMENT,
    // [base, imm]!
    @SerializedName("preIncrementWriteback") PRE_INCREMENT_WRITEBACK
  }

  String base;
  Mode mode;

  MemoryAccess() {}

  public MemoryAccess(String base, Mode mode) {
    this.base = base;
    this.mode = mode;
  }

  public String getBase() {
    return base;
  }

  public Mode getMode() {
    return mode == null ? Mode.OFFSET : mode;
  }

  public boolean isStackRelative() {
    return STACK_POINTER.equals(base);
  }
}
