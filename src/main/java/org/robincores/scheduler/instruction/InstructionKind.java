package org.robincores.scheduler.instruction;

import com.google.gson.annotations.SerializedName;

// Coarse classification of instruction templates
public enum InstructionKind {
  @SerializedName("arithmetic") ARITHMETIC,
  @SerializedName("logical") LOGICAL,
  @SerializedName("load") LOAD,
  @SerializedName("store") STORE,
  @SerializedName("fp") FP,
  @SerializedName("other") OTHER
}
