package org.robincores.scheduler.source;

import static org.junit.Assert.*;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class CPreprocessorTest {

  @Test
  public void testExtractBody() {
    assertEquals(Arrays.asList("add r0, r0, r1", ""),
        CPreprocessor.extractBody(Arrays.asList("# 1 \"<stdin>\"", "#define X", CPreprocessor.MAGIC_STRING,
            "add r0, r0, r1", "")));
  }

  @Test(expected = AsmHelperException.class)
  public void testExtractBodyWithoutMarker() {
    CPreprocessor.extractBody(Arrays.asList("add r0, r0, r1"));
  }

  @Test(expected = AsmHelperException.class)
  public void testMissingCompiler() {
    new CPreprocessor("/nonexistent/scheduler-test-cc").unfold(Collections.emptyList(),
        Arrays.asList("add r0, r0, r1"));
  }
}
