package org.robincores.scheduler.instruction;

import static org.junit.Assert.*;

import org.junit.Test;

import java.util.Collections;
import java.util.Set;

public class RegisterTypeTest {

  @Test
  public void testRegisters() {
    assertEquals(14, RegisterType.GPR.registers().size());
    assertFalse(RegisterType.GPR.registers().contains("r13"));
    assertTrue(RegisterType.GPR.registers().contains("r14"));
    assertEquals(31, RegisterType.FPR.registers().size());
    assertEquals(8, RegisterType.STACK_GPR.registers().size());
    assertEquals(Collections.singletonList("flags"), RegisterType.FLAGS.registers());
  }

  @Test
  public void testFindType() {
    assertEquals(RegisterType.GPR, RegisterType.findType("r3"));
    assertEquals(RegisterType.FPR, RegisterType.findType("s30"));
    assertEquals(RegisterType.FLAGS, RegisterType.findType("flags"));
    assertEquals(RegisterType.HINT, RegisterType.findType("hint_buf0"));
    assertEquals(RegisterType.HINT, RegisterType.findType("t5"));
    assertEquals(RegisterType.STACK_FPR, RegisterType.findType("STACK0"));
    assertNull(RegisterType.findType("r13"));
    assertNull(RegisterType.findType("x9"));
  }

  @Test
  public void testFromString() {
    assertEquals(RegisterType.GPR, RegisterType.fromString("gpr"));
    assertEquals(RegisterType.STACK_GPR, RegisterType.fromString("Stack"));
    assertEquals(RegisterType.STACK_FPR, RegisterType.fromString("fprstack"));
    assertNull(RegisterType.fromString("vector"));
  }

  @Test
  public void testFromPlaceholder() {
    assertEquals(RegisterType.GPR, RegisterType.fromPlaceholder("Rd"));
    assertEquals(RegisterType.FPR, RegisterType.fromPlaceholder("Sa"));
    assertEquals(RegisterType.HINT, RegisterType.fromPlaceholder("Tx"));
  }

  @Test(expected = FatalParsingException.class)
  public void testUnknownPlaceholder() {
    RegisterType.fromPlaceholder("Qd");
  }

  @Test
  public void testRenaming() {
    assertTrue(RegisterType.GPR.isRenamed());
    assertTrue(RegisterType.FLAGS.isRenamed());
    assertFalse(RegisterType.HINT.isRenamed());
  }

  @Test
  public void testClassLetter() {
    assertEquals('r', RegisterType.GPR.classLetter());
    assertEquals('s', RegisterType.FPR.classLetter());
    assertEquals('t', RegisterType.HINT.classLetter());
  }

  @Test(expected = FatalParsingException.class)
  public void testFlagsHaveNoClassLetter() {
    RegisterType.FLAGS.classLetter();
  }

  @Test
  public void testDefaults() {
    assertEquals("r14", RegisterType.defaultAliases().get("lr"));
    Set<String> reserved = RegisterType.defaultReserved();
    assertTrue(reserved.contains("r13"));
    assertTrue(reserved.contains("lr"));
    assertTrue(reserved.contains("flags"));
    assertFalse(reserved.contains("r0"));
  }
}
