package org.robincores.scheduler.instruction;

import java.util.Objects;

// A register operand position of a template: its placeholder name and register class
public final class OperandSlot {
  private final String placeholder;
  private final RegisterType type;

  public OperandSlot(String placeholder, RegisterType type) {
    this.placeholder = placeholder;
    this.type = type;
  }

  static OperandSlot flags() {
    return new OperandSlot(RegisterType.FLAGS_NAME, RegisterType.FLAGS);
  }

  public String getPlaceholder() {
    return placeholder;
  }

  public RegisterType getType() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof OperandSlot)) return false;
    OperandSlot that = (OperandSlot) o;
    return placeholder.equals(that.placeholder) && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(placeholder, type);
  }

  @Override
  public String toString() {
    return placeholder + ":" + type;
  }
}
