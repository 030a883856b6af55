package org.robincores.scheduler.instruction;

import org.apache.logging.log4j.Logger;
import org.robincores.scheduler.source.SourceLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Represents a parsed instruction with its operands by role and decoded attributes
public class Instruction {
  private static final Pattern PLACEHOLDER = Pattern.compile("<(\\w+)>");

  private final InstructionTemplate template;
  private SourceLine sourceLine;
  private InstructionHooks hooks = InstructionHooks.NONE;

  private final List<OperandSlot> inputSlots;
  private final List<OperandSlot> outputSlots;
  private final List<OperandSlot> inOutSlots;
  private final List<String> argsIn = new ArrayList<>();
  private final List<String> argsOut = new ArrayList<>();
  private final List<String> argsInOut = new ArrayList<>();
  private final List<String> hintsIn = new ArrayList<>();
  private final List<String> hintsOut = new ArrayList<>();

  private final Map<FieldCategory, List<Object>> attributes = new EnumMap<>(FieldCategory.class);
  private final Set<FieldCategory> indexed = EnumSet.noneOf(FieldCategory.class);

  private String addr;
  private String preIndex;
  private String increment;

  private Instruction(InstructionTemplate template) {
    this.template = template;
    this.inputSlots = new ArrayList<>(template.getInputSlots());
    this.outputSlots = new ArrayList<>(template.getOutputSlots());
    this.inOutSlots = new ArrayList<>(template.getInOutSlots());
  }

  public static Instruction build(InstructionTemplate template, String src) throws ParsingException {
    return build(template, template.compiled().match(src));
  }

  // Fields as returned by TemplatePattern.match
  public static Instruction build(InstructionTemplate template, Map<String, String> fields) {
    Instruction obj = new Instruction(template);

    for (FieldCategory c : FieldCategory.values()) {
      obj.decodeAttribute(c, fields);
    }

    obj.bindRegisters(obj.inputSlots, obj.argsIn, fields);
    obj.bindRegisters(obj.outputSlots, obj.argsOut, fields);
    obj.bindRegisters(obj.inOutSlots, obj.argsInOut, fields);

    if (obj.argsIn.size() != template.getInputSlots().size()
        || obj.argsOut.size() != template.getOutputSlots().size()
        || obj.argsInOut.size() != template.getInOutSlots().size()) {
      throw new FatalParsingException("Something wrong parsing " + fields + " as " + template.getName()
          + ": expected " + template.getInputSlots().size() + " inputs, " + template.getOutputSlots().size()
          + " outputs, " + template.getInOutSlots().size() + " input-outputs");
    }

    obj.resolveMemoryAccess();
    return obj;
  }

  private void decodeAttribute(FieldCategory c, Map<String, String> fields) {
    String group = c.group();
    if (fields.containsKey(group)) {
      attributes.put(c, Collections.singletonList(c.decode(fields.get(group))));
      return;
    }
    List<Object> values = new ArrayList<>();
    for (int i = 0; fields.containsKey(group + i); i++) {
      values.add(c.decode(fields.get(group + i)));
    }
    if (!values.isEmpty()) {
      attributes.put(c, Collections.unmodifiableList(values));
      indexed.add(c);
    }
  }

  private void bindRegisters(List<OperandSlot> slots, List<String> args, Map<String, String> fields) {
    for (OperandSlot slot : slots) {
      if (slot.getType() == RegisterType.FLAGS) {
        args.add(RegisterType.FLAGS_NAME);
        continue;
      }
      String value = fields.get(slot.getPlaceholder());
      if (value == null) {
        throw new FatalParsingException("No value for operand <" + slot.getPlaceholder() + "> of "
            + template.getName() + " in " + fields);
      }
      args.add(toRegister(slot.getType(), value));
    }
  }

  // Digits captured for r3 become "r3"; symbolic names stay as they are
  static String toRegister(RegisterType ty, String s) {
    if (!s.isEmpty() && s.replace("_", "").chars().allMatch(Character::isDigit)
        && !s.replace("_", "").isEmpty()) {
      return ty.classLetter() + s;
    }
    return s;
  }

  private void resolveMemoryAccess() {
    MemoryAccess memory = template.getMemory();
    if (memory == null) {
      return;
    }
    if (memory.isStackRelative()) {
      addr = MemoryAccess.STACK_POINTER;
    } else {
      int idx = indexOfSlot(inOutSlots, memory.getBase());
      addr = idx >= 0 ? argsInOut.get(idx) : argsIn.get(indexOfSlot(inputSlots, memory.getBase()));
    }
    switch (memory.getMode()) {
      case OFFSET:
        preIndex = getImmediate();
        break;
      case POST_INCREMENT:
      case PRE_INCREMENT_WRITEBACK:
        increment = getImmediate();
        break;
      default:
        break;
    }
  }

  private static int indexOfSlot(List<OperandSlot> slots, String placeholder) {
    for (int i = 0; i < slots.size(); i++) {
      if (slots.get(i).getPlaceholder().equals(placeholder)) {
        return i;
      }
    }
    return -1;
  }

  // Hint operands model memory effects not visible in the operand list
  public Instruction extractReadWrites() {
    if (sourceLine == null) {
      return this;
    }
    for (String w : sourceLine.getTag(SourceLine.TAG_WRITES)) {
      hintsOut.add(RegisterType.HINT_PREFIX + w);
    }
    for (String r : sourceLine.getTag(SourceLine.TAG_READS)) {
      hintsIn.add(RegisterType.HINT_PREFIX + r);
    }
    return this;
  }

  // Only sound when the value read is dead
  public void remodelInOutAsOutput(int idx) {
    OperandSlot slot = inOutSlots.remove(idx);
    String arg = argsInOut.remove(idx);
    outputSlots.add(slot);
    argsOut.add(arg);
  }

  public boolean globalParsingCallback(List<Instruction> context, Logger log) {
    return hooks.remodel(this, context, log);
  }

  public boolean globalFusionCallback(List<Instruction> context, Logger log) {
    return hooks.fuse(this, context, log);
  }

  public String write() {
    Map<String, String> replacements = new LinkedHashMap<>();
    addRegisterReplacements(inputSlots, argsIn, replacements);
    addRegisterReplacements(outputSlots, argsOut, replacements);
    addRegisterReplacements(inOutSlots, argsInOut, replacements);
    for (Map.Entry<FieldCategory, List<Object>> e : attributes.entrySet()) {
      FieldCategory c = e.getKey();
      List<Object> values = e.getValue();
      if (indexed.contains(c)) {
        for (int i = 0; i < values.size(); i++) {
          replacements.put(c.key() + i, c.encode(values.get(i)));
        }
      } else {
        replacements.put(c.key(), c.encode(values.get(0)));
      }
    }

    Matcher m = PLACEHOLDER.matcher(template.getPattern());
    StringBuffer out = new StringBuffer();
    while (m.find()) {
      String rep = replacements.get(m.group(1));
      if (rep == null) {
        throw new FatalParsingException("Failed to replace <" + m.group(1) + "> in " + template.getPattern());
      }
      m.appendReplacement(out, Matcher.quoteReplacement(rep));
    }
    m.appendTail(out);
    return out.toString().replace("\\[", "[").replace("\\]", "]");
  }

  private static void addRegisterReplacements(List<OperandSlot> slots, List<String> args,
                                              Map<String, String> replacements) {
    for (int i = 0; i < slots.size(); i++) {
      OperandSlot slot = slots.get(i);
      if (slot.getType() == RegisterType.FLAGS) {
        continue;
      }
      replacements.put(slot.getPlaceholder(), registerText(slot, args.get(i)));
    }
  }

  // r3 is written as is; a symbolic register acc is written R<acc>
  static String registerText(OperandSlot slot, String arg) {
    char letter = slot.getType().classLetter();
    if (arg.length() > 1 && Character.toLowerCase(arg.charAt(0)) == letter) {
      String rest = arg.substring(1);
      if (rest.replace("_", "").chars().allMatch(Character::isDigit) && !rest.replace("_", "").isEmpty()) {
        return letter + rest;
      }
    }
    return Character.toUpperCase(slot.getPlaceholder().charAt(0)) + "<" + arg + ">";
  }

  // Hint and flag operands are left alone
  public void renameRegisters(Map<String, String> renaming) {
    rename(inputSlots, argsIn, renaming);
    rename(outputSlots, argsOut, renaming);
    rename(inOutSlots, argsInOut, renaming);
    if (addr != null && renaming.containsKey(addr)) {
      addr = renaming.get(addr);
    }
  }

  private static void rename(List<OperandSlot> slots, List<String> args, Map<String, String> renaming) {
    for (int i = 0; i < slots.size(); i++) {
      RegisterType ty = slots.get(i).getType();
      if (ty == RegisterType.FLAGS || !ty.isRenamed()) {
        continue;
      }
      String to = renaming.get(args.get(i));
      if (to != null) {
        args.set(i, to);
      }
    }
  }

  public boolean isEquivalentTo(Instruction other) {
    return template.getName().equals(other.template.getName())
        && argsIn.equals(other.argsIn)
        && argsOut.equals(other.argsOut)
        && argsInOut.equals(other.argsInOut)
        && attributes.equals(other.attributes)
        && Objects.equals(addr, other.addr);
  }

  public InstructionTemplate getTemplate() {
    return template;
  }

  public String getName() {
    return template.getName();
  }

  public String getMnemonic() {
    return template.getMnemonic();
  }

  public SourceLine getSourceLine() {
    return sourceLine;
  }

  void setSourceLine(SourceLine sourceLine) {
    this.sourceLine = sourceLine;
  }

  void setHooks(InstructionHooks hooks) {
    this.hooks = hooks;
  }

  // Template operands only, without hints
  public List<String> getArgsIn() {
    return Collections.unmodifiableList(argsIn);
  }

  public List<String> getArgsOut() {
    return Collections.unmodifiableList(argsOut);
  }

  public List<String> getArgsInOut() {
    return Collections.unmodifiableList(argsInOut);
  }

  // Everything read, including hint registers
  public List<String> getInputs() {
    List<String> res = new ArrayList<>(argsIn);
    res.addAll(hintsIn);
    return res;
  }

  // Everything written, including hint registers
  public List<String> getOutputs() {
    List<String> res = new ArrayList<>(argsOut);
    res.addAll(hintsOut);
    return res;
  }

  public List<RegisterType> getInputTypes() {
    List<RegisterType> res = types(inputSlots);
    hintsIn.forEach(h -> res.add(RegisterType.HINT));
    return res;
  }

  public List<RegisterType> getOutputTypes() {
    List<RegisterType> res = types(outputSlots);
    hintsOut.forEach(h -> res.add(RegisterType.HINT));
    return res;
  }

  public List<RegisterType> getInOutTypes() {
    return types(inOutSlots);
  }

  private static List<RegisterType> types(List<OperandSlot> slots) {
    List<RegisterType> res = new ArrayList<>();
    for (OperandSlot s : slots) {
      res.add(s.getType());
    }
    return res;
  }

  public List<String> getHintsIn() {
    return Collections.unmodifiableList(hintsIn);
  }

  public List<String> getHintsOut() {
    return Collections.unmodifiableList(hintsOut);
  }

  public void setArgIn(int idx, String reg) {
    argsIn.set(idx, reg);
  }

  public void setArgOut(int idx, String reg) {
    argsOut.set(idx, reg);
  }

  public void setArgInOut(int idx, String reg) {
    argsInOut.set(idx, reg);
  }

  // Decoded values of a category, empty if the template has no such placeholder
  public List<Object> getAttribute(FieldCategory c) {
    return attributes.getOrDefault(c, Collections.emptyList());
  }

  public boolean isIndexed(FieldCategory c) {
    return indexed.contains(c);
  }

  private String first(FieldCategory c) {
    List<Object> v = attributes.get(c);
    return v == null ? null : (String) v.get(0);
  }

  public String getImmediate() {
    return first(FieldCategory.IMMEDIATE);
  }

  public List<String> getImmediates() {
    List<String> res = new ArrayList<>();
    for (Object o : getAttribute(FieldCategory.IMMEDIATE)) {
      res.add((String) o);
    }
    return res;
  }

  public String getDatatype() {
    return first(FieldCategory.DATATYPE);
  }

  public Integer getIndex() {
    List<Object> v = attributes.get(FieldCategory.INDEX);
    return v == null ? null : (Integer) v.get(0);
  }

  public String getFlag() {
    return first(FieldCategory.FLAG);
  }

  public String getWidth() {
    return first(FieldCategory.WIDTH);
  }

  public String getBarrel() {
    return first(FieldCategory.BARREL);
  }

  public String getAddr() {
    return addr;
  }

  public String getPreIndex() {
    return preIndex;
  }

  public String getIncrement() {
    return increment;
  }

  public boolean isLoad() {
    return template.getKind() == InstructionKind.LOAD;
  }

  public boolean isStore() {
    return template.getKind() == InstructionKind.STORE;
  }

  public boolean isLoadStore() {
    return isLoad() || isStore();
  }

  @Override
  public String toString() {
    return write();
  }
}
