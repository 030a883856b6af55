package org.robincores.scheduler.instruction;

import static org.junit.Assert.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;
import org.robincores.scheduler.source.SourceLine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InstructionRegistryTest {
  private static final Logger logger = LogManager.getLogger();

  // One line per bundled template, each written in the form the template renders
  private static final String[][] SAMPLES = {
      {"vmov_gpr", "vmov r0, s1"},
      {"vmov_fpr", "vmov s2, r3"},
      {"add", "add r0, r1, r2"},
      {"add_short", "add r0, r1"},
      {"add_imm", "add r0, r1, #4"},
      {"add_imm_short", "add r0, #4"},
      {"add_shifted", "add r0, r1, r2, lsl #2"},
      {"adds", "adds r0, r1, r2"},
      {"sub", "sub r0, r1, r2"},
      {"sub_shifted", "sub r0, r1, r2, asr #3"},
      {"sub_short", "sub r0, r1"},
      {"sub_imm_short", "sub r0, #1"},
      {"mul", "mul r0, r1, r2"},
      {"smull", "smull r0, r1, r2, r3"},
      {"smlal", "smlal r0, r1, r2, r3"},
      {"mov", "mov r0, r1"},
      {"mov_imm", "mov r0, #255"},
      {"ubfx", "ubfx r0, r1, #3, #5"},
      {"sbfx", "sbfx r0, r1, #3, #5"},
      {"bfi", "bfi r0, r1, #8, #8"},
      {"log_and", "and r0, r1, r2"},
      {"log_or", "orr r0, r1, r2"},
      {"eor", "eor r0, r1, r2"},
      {"eors", "eors r0, r1, r2"},
      {"eors_short", "eors r0, r1"},
      {"eor_shifted", "eor r0, r1, r2, ror #7"},
      {"bic", "bic r0, r1, r2"},
      {"bics", "bics r0, r1, r2"},
      {"bic_shifted", "bic r0, r1, r2, lsr #1"},
      {"ror", "ror r0, r1, #3"},
      {"ror_short", "ror r0, #3"},
      {"rors_short", "rors r0, #3"},
      {"ldr", "ldr r0, [r1]"},
      {"ldr_with_imm", "ldr r0, [r1, #8]"},
      {"ldr_with_imm_stack", "ldr r0, [sp, #8]"},
      {"ldr_with_postinc", "ldr r0, [r1], #4"},
      {"ldr_with_inc_writeback", "ldr r0, [r1, #4]!"},
      {"str_with_imm", "str r0, [r1, #8]"},
      {"str_with_imm_stack", "str r0, [sp, #8]"},
      {"str_with_postinc", "str r0, [r1], #4"},
      {"cmp", "cmp r0, r1"},
      {"cmp_imm", "cmp r0, #0"},
  };

  @Test
  public void testEveryTemplateDispatchesAndRenders() throws ParsingException {
    InstructionRegistry registry = InstructionRegistry.armv7m();
    assertEquals(SAMPLES.length, registry.getTemplates().size());
    for (String[] sample : SAMPLES) {
      Instruction i = registry.parse(sample[1]);
      assertEquals(sample[1], sample[0], i.getName());
      assertEquals(sample[1], i.write());
    }
  }

  @Test
  public void testAggregateFailure() {
    InstructionRegistry registry = InstructionRegistry.armv7m();
    try {
      registry.parse("frobnicate r0, r1");
      fail("Expected a ParsingException");
    } catch (ParsingException e) {
      assertTrue(e.getMessage().startsWith("Couldn't parse frobnicate r0, r1"));
      assertEquals(registry.getTemplates().size(), e.getReasons().size());
      assertEquals("vmov_gpr", e.getReasons().keySet().iterator().next());
      assertTrue(e.getMessage().contains("* cmp_imm:"));
    }
  }

  @Test
  public void testOperandRoles() throws ParsingException {
    InstructionRegistry registry = InstructionRegistry.armv7m();
    Instruction cmp = registry.parse("cmp r0, r1");
    assertEquals(Arrays.asList("r0", "r1", "flags"), cmp.getInputs());
    assertEquals(Arrays.asList("flags"), cmp.getOutputs());

    Instruction adds = registry.parse("adds r0, r1, r2");
    assertEquals(Arrays.asList("r0", "flags"), adds.getOutputs());

    Instruction smlal = registry.parse("smlal r4, r5, r6, r7");
    assertEquals(Arrays.asList("r6", "r7"), smlal.getArgsIn());
    assertEquals(Arrays.asList("r4", "r5"), smlal.getArgsInOut());
  }

  @Test
  public void testMemoryAttributes() throws ParsingException {
    InstructionRegistry registry = InstructionRegistry.armv7m();
    Instruction ldr = registry.parse("ldr r0, [r1, #8]");
    assertTrue(ldr.isLoad());
    assertEquals("r1", ldr.getAddr());
    assertEquals("8", ldr.getPreIndex());

    Instruction stack = registry.parse("str r2, [sp, #12]");
    assertTrue(stack.isStore());
    assertEquals("sp", stack.getAddr());
    assertEquals(Arrays.asList("r2"), stack.getArgsIn());

    Instruction wb = registry.parse("ldr r0, [r3, #16]!");
    assertEquals("r3", wb.getAddr());
    assertEquals("16", wb.getIncrement());
    assertEquals(Arrays.asList("r3"), wb.getArgsInOut());
  }

  @Test
  public void testHintsFromTags() throws ParsingException {
    Instruction i = InstructionRegistry.armv7m().parse("ldr r0, [r1]  // @reads=buf @writes=scratch");
    assertEquals(Arrays.asList("hint_buf"), i.getHintsIn());
    assertEquals(Arrays.asList("r1", "hint_buf"), i.getInputs());
    assertEquals(Arrays.asList("r0", "hint_scratch"), i.getOutputs());
    assertEquals(Arrays.asList(RegisterType.GPR, RegisterType.HINT), i.getOutputTypes());
    assertEquals("ldr r0, [r1]", i.write());

    i.renameRegisters(Collections.singletonMap("hint_buf", "hint_other"));
    assertEquals(Arrays.asList("hint_buf"), i.getHintsIn());
  }

  @Test
  public void testSourceLineKept() throws ParsingException {
    SourceLine line = SourceLine.parse("mov r0, r1 // @writes=x");
    assertSame(line, InstructionRegistry.armv7m().parse(line).getSourceLine());
  }

  @Test
  public void testHooks() throws ParsingException {
    List<String> seen = new ArrayList<>();
    InstructionHooks hooks = new InstructionHooks() {
      @Override
      public boolean remodel(Instruction inst, List<Instruction> context, Logger log) {
        seen.add(inst.getName());
        inst.remodelInOutAsOutput(0);
        return true;
      }
    };
    InstructionRegistry registry = new InstructionRegistry(ArchitectureSpec.fromResource(ArchitectureSpec.ARMV7M),
        Collections.singletonMap("add_short", hooks));

    Instruction shortAdd = registry.parse("add r0, r1");
    Instruction plainAdd = registry.parse("add r0, r1, r2");
    List<Instruction> context = Arrays.asList(shortAdd, plainAdd);
    assertTrue(shortAdd.globalParsingCallback(context, logger));
    assertFalse(plainAdd.globalParsingCallback(context, logger));
    assertFalse(shortAdd.globalFusionCallback(context, logger));
    assertEquals(Arrays.asList("add_short"), seen);
    assertEquals(Arrays.asList("r0"), shortAdd.getArgsOut());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testHooksForUnknownTemplate() {
    new InstructionRegistry(ArchitectureSpec.fromResource(ArchitectureSpec.ARMV7M),
        Collections.singletonMap("vfma", InstructionHooks.NONE));
  }

  @Test(expected = FatalParsingException.class)
  public void testDuplicateTemplateNames() {
    InstructionTemplate a = new InstructionTemplate("mov", "mov <Rd>, <Ra>", Arrays.asList("Ra"),
        Arrays.asList("Rd"), Collections.emptyList(), false, false, InstructionKind.ARITHMETIC, null);
    new InstructionRegistry(new ArchitectureSpec("dup", Collections.emptyMap(), Arrays.asList(a, a)));
  }

  @Test
  public void testFindAndMake() throws ParsingException {
    InstructionRegistry registry = InstructionRegistry.armv7m();
    assertEquals("add_imm", registry.find("add_imm").getName());
    Instruction i = registry.make("add_imm", "add r0, r1, #1");
    assertEquals("1", i.getImmediate());
    try {
      registry.find("vfma");
      fail("Expected an IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertEquals("Couldn't find instruction template vfma", e.getMessage());
    }
  }

  @Test(expected = ParsingException.class)
  public void testMakeWithWrongTemplate() throws ParsingException {
    InstructionRegistry.armv7m().make("add", "add r0, r1, #1");
  }

  @Test
  public void testParseAllAndRender() throws ParsingException {
    List<SourceLine> lines = SourceLine.parseAll(Arrays.asList("add r0,r1,r2", "eor.w r3, r3, r0"));
    List<Instruction> parsed = InstructionRegistry.armv7m().parseAll(lines);
    assertEquals(Arrays.asList("  add r0, r1, r2", "  eor.w r3, r3, r0"), InstructionRegistry.render(parsed, 2));
  }

  @Test
  public void testCustomArchitecture() throws ParsingException {
    Map<String, String> aliases = new LinkedHashMap<>();
    aliases.put("ip", "r12");
    InstructionTemplate nop = new InstructionTemplate("nop", "nop", Collections.emptyList(),
        Collections.emptyList(), Collections.emptyList(), false, false, InstructionKind.OTHER, null);
    InstructionRegistry registry = new InstructionRegistry(new ArchitectureSpec("tiny", aliases, Arrays.asList(nop)));
    assertEquals("nop", registry.parse("  nop ").write());
    assertEquals("r12", registry.getSpec().getAliases().get("ip"));
  }
}
