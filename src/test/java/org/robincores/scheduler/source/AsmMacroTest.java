package org.robincores.scheduler.source;

import static org.junit.Assert.*;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class AsmMacroTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static final List<String> DEFS = Arrays.asList(
      ".macro double_add a, b",
      "  add \\a, \\a, \\b",
      "  add \\a, \\a, \\b",
      ".endm",
      ".macro clear reg",
      "  eor \\reg, \\reg, \\reg",
      ".endm",
      ".macro clear_pair x, y",
      "  clear \\x",
      "  clear \\y",
      ".endm");

  @Test
  public void testExtract() {
    Map<String, AsmMacro> macros = AsmMacro.extract(DEFS);
    assertEquals(Arrays.asList("double_add", "clear", "clear_pair"), Arrays.asList(macros.keySet().toArray()));
    AsmMacro m = macros.get("double_add");
    assertEquals(Arrays.asList("a", "b"), m.getArgs());
    assertEquals(2, m.getBody().size());
  }

  @Test
  public void testApply() {
    AsmMacro m = new AsmMacro("ld", Arrays.asList("n", "base"),
        Arrays.asList("ldr r\\n\\(), [\\base, #\\n]", "add \\base\\base"));
    Map<String, String> values = new java.util.HashMap<>();
    values.put("n", "3");
    values.put("base", "r7");
    assertEquals(Arrays.asList("ldr r3, [r7, #3]", "add r7r7"), m.apply(values));
  }

  @Test(expected = AsmHelperException.class)
  public void testApplyMissingArgument() {
    new AsmMacro("m", Arrays.asList("a"), Arrays.asList("mov \\a, #0")).apply(Collections.emptyMap());
  }

  @Test
  public void testUnfoldKeepsIndentation() {
    AsmMacro m = AsmMacro.extract(DEFS).get("double_add");
    int[] count = new int[1];
    List<String> out = m.unfoldIn(Arrays.asList("    double_add r0, r1  // twice", "  bx lr"), () -> count[0]++);
    assertEquals(Arrays.asList("    add r0, r0, r1", "    add r0, r0, r1", "  bx lr"), out);
    assertEquals(1, count[0]);
  }

  @Test
  public void testUnfoldAllMacrosNested() {
    List<String> out = AsmMacro.unfoldAllMacros(DEFS, Arrays.asList("  clear_pair r2, r3"));
    assertEquals(Arrays.asList("  eor r2, r2, r2", "  eor r3, r3, r3"), out);
    assertEquals(out, AsmMacro.unfoldAllMacros(DEFS, out));
  }

  @Test
  public void testNoUnfoldMacroSkipped() {
    List<String> src = Arrays.asList(
        ".macro keep reg // @no-unfold",
        "  mov \\reg, #0",
        ".endm",
        ".macro zero reg",
        "  mov \\reg, #0",
        ".endm");
    Map<String, AsmMacro> macros = AsmMacro.extract(src);
    assertEquals(Collections.singleton("zero"), macros.keySet());
  }

  @Test(expected = AsmHelperException.class)
  public void testUnterminatedMacro() {
    AsmMacro.extract(Arrays.asList(".macro open a", "  add \\a, \\a, #1"));
  }

  @Test(expected = AsmHelperException.class)
  public void testRecursiveMacroDetected() {
    AsmMacro.unfoldAllMacros(Arrays.asList(".macro again", "  again", ".endm"), Arrays.asList("again"));
  }

  @Test
  public void testExtractFromFile() throws IOException {
    File f = folder.newFile("macros.s");
    Files.write(f.toPath(), DEFS, StandardCharsets.UTF_8);
    assertEquals(3, AsmMacro.extractFromFile(f.toPath()).size());
  }
}
