package org.robincores.scheduler.instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Represents one instruction variant as loaded by Gson; prepare() must run before use
public class InstructionTemplate {
  String name;
  String pattern;
  List<String> inputs = new ArrayList<>();
  List<String> outputs = new ArrayList<>();
  List<String> inOuts = new ArrayList<>();
  boolean modifiesFlags;
  boolean dependsOnFlags;
  InstructionKind kind;
  MemoryAccess memory;

  // Derived from the fields above, never serialized
  transient String mnemonic;
  transient List<OperandSlot> inputSlots;
  transient List<OperandSlot> outputSlots;
  transient List<OperandSlot> inOutSlots;

  InstructionTemplate() {}

  public InstructionTemplate(String name, String pattern, List<String> inputs, List<String> outputs,
                             List<String> inOuts, boolean modifiesFlags, boolean dependsOnFlags,
                             InstructionKind kind, MemoryAccess memory) {
    this.name = name;
    this.pattern = pattern;
    this.inputs = inputs;
    this.outputs = outputs;
    this.inOuts = inOuts;
    this.modifiesFlags = modifiesFlags;
    this.dependsOnFlags = dependsOnFlags;
    this.kind = kind;
    this.memory = memory;
    prepare();
  }

  public InstructionTemplate prepare() {
    if (name == null || pattern == null) {
      throw new FatalParsingException("Each template must have a 'name' and a 'pattern' field");
    }
    if (inputs == null) inputs = new ArrayList<>();
    if (outputs == null) outputs = new ArrayList<>();
    if (inOuts == null) inOuts = new ArrayList<>();
    if (kind == null) kind = InstructionKind.OTHER;

    mnemonic = pattern.split(" ")[0].replaceAll("<\\w+>", "");

    inputSlots = slots(inputs);
    outputSlots = slots(outputs);
    inOutSlots = slots(inOuts);
    if (modifiesFlags) {
      outputSlots.add(OperandSlot.flags());
    }
    if (dependsOnFlags) {
      inputSlots.add(OperandSlot.flags());
    }

    if (memory != null && !memory.isStackRelative()
        && !inputs.contains(memory.base) && !inOuts.contains(memory.base)) {
      throw new FatalParsingException("Template " + name + ": address register " + memory.base
          + " is neither an input nor an input-output");
    }
    inputSlots = Collections.unmodifiableList(inputSlots);
    outputSlots = Collections.unmodifiableList(outputSlots);
    inOutSlots = Collections.unmodifiableList(inOutSlots);
    return this;
  }

  private List<OperandSlot> slots(List<String> placeholders) {
    List<OperandSlot> res = new ArrayList<>();
    for (String p : placeholders) {
      if (!pattern.contains("<" + p + ">")) {
        throw new FatalParsingException("Template " + name + ": operand <" + p + "> does not occur in " + pattern);
      }
      res.add(new OperandSlot(p, RegisterType.fromPlaceholder(p)));
    }
    return res;
  }

  public TemplatePattern compiled() {
    return PatternCompiler.get(pattern);
  }

  public String getName() {
    return name;
  }

  public String getPattern() {
    return pattern;
  }

  public String getMnemonic() {
    return mnemonic;
  }

  public List<OperandSlot> getInputSlots() {
    return inputSlots;
  }

  public List<OperandSlot> getOutputSlots() {
    return outputSlots;
  }

  public List<OperandSlot> getInOutSlots() {
    return inOutSlots;
  }

  public boolean modifiesFlags() {
    return modifiesFlags;
  }

  public boolean dependsOnFlags() {
    return dependsOnFlags;
  }

  public InstructionKind getKind() {
    return kind;
  }

  public MemoryAccess getMemory() {
    return memory;
  }

  @Override
  public String toString() {
    return name + " [" + pattern + "]";
  }
}
