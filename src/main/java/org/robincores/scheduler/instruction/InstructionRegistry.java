package org.robincores.scheduler.instruction;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.robincores.scheduler.source.SourceLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Represents the instruction templates of one architecture; immutable once built
public class InstructionRegistry {
  private static final Logger logger = LogManager.getLogger();

  private final ArchitectureSpec spec;
  private final List<InstructionTemplate> templates;
  private final Map<String, InstructionTemplate> byName;
  private final Map<String, InstructionHooks> hooks;

  public InstructionRegistry(ArchitectureSpec spec) {
    this(spec, Collections.emptyMap());
  }

  public InstructionRegistry(ArchitectureSpec spec, Map<String, InstructionHooks> hooks) {
    this.spec = spec;
    this.templates = spec.getTemplates();
    Map<String, InstructionTemplate> names = new LinkedHashMap<>();
    for (InstructionTemplate t : templates) {
      if (names.put(t.getName(), t) != null) {
        throw new FatalParsingException("Duplicate template name " + t.getName());
      }
      // Compile eagerly so that malformed templates fail at startup
      t.compiled();
    }
    for (String name : hooks.keySet()) {
      if (!names.containsKey(name)) {
        throw new IllegalArgumentException("Hooks registered for unknown template " + name);
      }
    }
    this.byName = Collections.unmodifiableMap(names);
    this.hooks = Collections.unmodifiableMap(new LinkedHashMap<>(hooks));
  }

  private static class Armv7mHolder {
    static final InstructionRegistry INSTANCE =
        new InstructionRegistry(ArchitectureSpec.fromResource(ArchitectureSpec.ARMV7M));
  }

  // Registry of the bundled Armv7-M templates
  public static InstructionRegistry armv7m() {
    return Armv7mHolder.INSTANCE;
  }

  public ArchitectureSpec getSpec() {
    return spec;
  }

  public List<InstructionTemplate> getTemplates() {
    return templates;
  }

  public InstructionTemplate find(String name) {
    InstructionTemplate t = byName.get(name);
    if (t == null) {
      throw new IllegalArgumentException("Couldn't find instruction template " + name);
    }
    return t;
  }

  public Instruction make(String name, String src) throws ParsingException {
    Instruction inst = Instruction.build(find(name), src);
    inst.setHooks(hooks.getOrDefault(name, InstructionHooks.NONE));
    return inst;
  }

  /**
   * Parses a line by trying every template in turn; the first match wins.
   *
   * @throws ParsingException if no template matches; it lists every template's rejection reason
   */
  public Instruction parse(SourceLine line) throws ParsingException {
    String src = line.getText();
    // Tags live in the comment; immediates would swallow it otherwise
    int comment = src.indexOf("//");
    if (comment >= 0) {
      src = src.substring(0, comment);
    }
    src = src.strip();
    Map<String, String> exceptions = new LinkedHashMap<>();

    for (InstructionTemplate t : templates) {
      Instruction inst;
      try {
        inst = Instruction.build(t, src);
      } catch (ParsingException e) {
        exceptions.put(t.getName(), e.getMessage());
        continue;
      }
      inst.setSourceLine(line);
      inst.setHooks(hooks.getOrDefault(t.getName(), InstructionHooks.NONE));
      inst.extractReadWrites();
      logger.debug("Parsing result for '{}': {}", src, t.getName());
      return inst;
    }

    logger.error("Failed to parse instruction {}", src);
    logger.error("A list of attempted parsers and their exceptions follows.");
    for (Map.Entry<String, String> e : exceptions.entrySet()) {
      logger.error("* {} {}", String.format("%-24s", e.getKey() + ":"), e.getValue());
    }
    throw new ParsingException("Couldn't parse " + src
        + "\nYou may need to add support for a new instruction (variant)?", exceptions);
  }

  public Instruction parse(String line) throws ParsingException {
    return parse(SourceLine.parse(line));
  }

  public List<Instruction> parseAll(List<SourceLine> lines) throws ParsingException {
    List<Instruction> res = new ArrayList<>(lines.size());
    for (SourceLine l : lines) {
      res.add(parse(l));
    }
    return res;
  }

  public static List<String> render(List<Instruction> instructions, int indentation) {
    String indent = " ".repeat(indentation);
    List<String> res = new ArrayList<>(instructions.size());
    for (Instruction i : instructions) {
      res.add(indent + i.write());
    }
    return res;
  }
}
