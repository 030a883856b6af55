package org.robincores.scheduler.util;

import static org.junit.Assert.*;

import org.junit.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class PermutationTest {

  private static Map<Integer, Integer> perm(int... images) {
    Map<Integer, Integer> res = new HashMap<>();
    for (int i = 0; i < images.length; i++) {
      res.put(i, images[i]);
    }
    return res;
  }

  @Test
  public void testIsPermutation() {
    assertTrue(Permutation.isPermutation(perm(2, 0, 1), 3));
    assertTrue(Permutation.isPermutation(perm(), 0));
    assertFalse(Permutation.isPermutation(perm(0, 0, 1), 3));
    assertFalse(Permutation.isPermutation(perm(0, 1, 2), 4));
    assertFalse(Permutation.isPermutation(perm(0, 1, 3), 3));
  }

  @Test
  public void testCheckPermutationCarriesSortedKeysAndValues() {
    Map<Integer, Integer> p = perm(1, 1, 0);
    try {
      Permutation.checkPermutation(p, 3);
      fail("Expected a PermutationException");
    } catch (PermutationException e) {
      assertEquals(Arrays.asList(0, 1, 2), e.getKeys());
      assertEquals(Arrays.asList(0, 1, 1), e.getValues());
    }
  }

  @Test
  public void testIdentity() {
    Map<Integer, Integer> id = Permutation.identity(4);
    assertEquals(perm(0, 1, 2, 3), id);
    assertEquals(0, Permutation.inversions(id, 4).count());
  }

  @Test
  public void testCompose() {
    Map<Integer, Integer> inner = perm(1, 2, 0);
    Map<Integer, Integer> outer = perm(0, 2, 1);
    // i -> outer(inner(i))
    assertEquals(perm(2, 1, 0), Permutation.compose(outer, inner));
    assertEquals(inner, Permutation.compose(Permutation.identity(3), inner));
    assertEquals(inner, Permutation.compose(inner, Permutation.identity(3)));
  }

  @Test
  public void testComposeAssociative() {
    Map<Integer, Integer> p = perm(1, 3, 0, 2);
    Map<Integer, Integer> q = perm(3, 2, 1, 0);
    Map<Integer, Integer> r = perm(0, 2, 3, 1);
    assertEquals(Permutation.compose(Permutation.compose(p, q), r),
        Permutation.compose(p, Permutation.compose(q, r)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testComposeSizeMismatch() {
    Permutation.compose(perm(0, 1), perm(0, 1, 2));
  }

  @Test
  public void testPad() {
    Map<Integer, Integer> padded = Permutation.pad(perm(1, 0), 2, 3);
    assertEquals(perm(0, 1, 3, 2, 4, 5, 6), padded);
    assertTrue(Permutation.isPermutation(padded, 7));
  }

  @Test
  public void testMoveEntryForward() {
    assertEquals(perm(0, 2, 3, 1, 4), Permutation.moveEntryForward(5, 3, 1));
    assertEquals(Permutation.identity(3), Permutation.moveEntryForward(3, 1, 1));
    List<String> moved = Permutation.apply(Permutation.moveEntryForward(4, 3, 0),
        Arrays.asList("a", "b", "c", "d"));
    assertEquals(Arrays.asList("d", "a", "b", "c"), moved);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMoveEntryBackwardRejected() {
    Permutation.moveEntryForward(5, 1, 3);
  }

  @Test
  public void testInversions() {
    List<Inversion> inv = Permutation.inversions(perm(1, 0), 2).collect(Collectors.toList());
    assertEquals(1, inv.size());
    assertEquals(new Inversion(0, 1, 1, 0), inv.get(0));
    assertEquals("(0, 1)", inv.get(0).toString());

    List<Inversion> rev = Permutation.inversions(perm(2, 1, 0), 3).collect(Collectors.toList());
    assertEquals(3, rev.size());
    assertEquals(0, rev.get(0).first);
    assertEquals(1, rev.get(0).second);
    assertEquals(1, rev.get(2).first);
    assertEquals(2, rev.get(2).second);
  }

  @Test
  public void testInversionsAreLazy() {
    assertTrue(Permutation.inversions(perm(3, 2, 1, 0), 4).findFirst().isPresent());
  }

  @Test
  public void testFromOrderAndApply() {
    // New order: original instruction 2 first, then 0, then 1
    Map<Integer, Integer> p = Permutation.fromOrder(Arrays.asList(2, 0, 1));
    assertEquals(perm(1, 2, 0), p);
    assertEquals(Arrays.asList("c", "a", "b"), Permutation.apply(p, Arrays.asList("a", "b", "c")));
  }

  @Test(expected = PermutationException.class)
  public void testFromOrderRejectsDuplicates() {
    Permutation.fromOrder(Arrays.asList(0, 0, 1));
  }
}
