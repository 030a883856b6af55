package org.robincores.scheduler.source;

import static org.junit.Assert.*;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class SourceLineTest {

  @Test
  public void testParseTags() {
    SourceLine l = SourceLine.parse("  ldr r0, [r1]  // @reads=buf0,buf1 @writes=out");
    assertEquals("  ldr r0, [r1]  // @reads=buf0,buf1 @writes=out", l.getText());
    assertEquals(Arrays.asList("buf0", "buf1"), l.getTag(SourceLine.TAG_READS));
    assertEquals(Arrays.asList("out"), l.getTag(SourceLine.TAG_WRITES));
  }

  @Test
  public void testTagsOnlyInComments() {
    SourceLine l = SourceLine.parse("add r0, r0, r1 @reads=x");
    assertTrue(l.getTags().isEmpty());
    assertEquals(Collections.emptyList(), l.getTag(SourceLine.TAG_READS));
  }

  @Test
  public void testWithTextKeepsTags() {
    SourceLine l = SourceLine.parse("str r0, [r1] // @writes=y").withText("str r0, [r1]");
    assertEquals("str r0, [r1]", l.getText());
    assertEquals(Arrays.asList("y"), l.getTag(SourceLine.TAG_WRITES));
  }

  @Test
  public void testWithTag() {
    SourceLine plain = SourceLine.of("add r0, r0, r1");
    SourceLine tagged = plain.withTag(SourceLine.TAG_READS, Arrays.asList("a"));
    assertTrue(plain.getTags().isEmpty());
    assertEquals(Arrays.asList("a"), tagged.getTag(SourceLine.TAG_READS));
    assertNotEquals(plain, tagged);
    assertEquals(tagged, SourceLine.parse("add r0, r0, r1").withTag(SourceLine.TAG_READS, Arrays.asList("a")));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testTagsImmutable() {
    SourceLine.parse("nop // @reads=a").getTag(SourceLine.TAG_READS).add("b");
  }

  @Test
  public void testTexts() {
    assertEquals(Arrays.asList("a", "b // @reads=x"),
        SourceLine.texts(SourceLine.parseAll(Arrays.asList("a", "b // @reads=x"))));
  }
}
