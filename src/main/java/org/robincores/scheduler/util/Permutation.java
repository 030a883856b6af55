package org.robincores.scheduler.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

// Represents instruction reorderings as bijections of {0, ..., n-1}: original position -> new position
public final class Permutation {
  private static final Logger logger = LogManager.getLogger();

  private Permutation() {}

  public static boolean isPermutation(Map<Integer, Integer> perm, int size) {
    try {
      checkPermutation(perm, size);
      return true;
    } catch (PermutationException e) {
      logger.error("Keys:   {}", e.getKeys());
      logger.error("Values: {}", e.getValues());
      return false;
    }
  }

  public static void checkPermutation(Map<Integer, Integer> perm, int size) {
    List<Integer> keys = new ArrayList<>(perm.keySet());
    List<Integer> values = new ArrayList<>(perm.values());
    Collections.sort(keys);
    Collections.sort(values);
    List<Integer> expected = range(size);
    if (!keys.equals(expected) || !values.equals(expected)) {
      throw new PermutationException("Not a permutation of size " + size, keys, values);
    }
  }

  public static Map<Integer, Integer> identity(int size) {
    Map<Integer, Integer> res = new TreeMap<>();
    for (int i = 0; i < size; i++) {
      res.put(i, i);
    }
    return res;
  }

  // i -> outer(inner(i))
  public static Map<Integer, Integer> compose(Map<Integer, Integer> outer, Map<Integer, Integer> inner) {
    if (outer.size() != inner.size()) {
      throw new IllegalArgumentException("Cannot compose permutations of size "
          + outer.size() + " and " + inner.size());
    }
    Map<Integer, Integer> res = new TreeMap<>();
    for (int i = 0; i < inner.size(); i++) {
      res.put(i, outer.get(inner.get(i)));
    }
    return res;
  }

  public static Map<Integer, Integer> pad(Map<Integer, Integer> perm, int before, int after) {
    int size = perm.size();
    Map<Integer, Integer> res = new TreeMap<>();
    for (Map.Entry<Integer, Integer> e : perm.entrySet()) {
      res.put(before + e.getKey(), before + e.getValue());
    }
    for (int i = 0; i < before; i++) {
      res.put(i, i);
    }
    for (int i = 0; i < after; i++) {
      int idx = before + size + i;
      res.put(idx, idx);
    }
    return res;
  }

  // Moves entry from to position to; [to, from) shifts back by one
  public static Map<Integer, Integer> moveEntryForward(int size, int from, int to) {
    if (to > from) {
      throw new IllegalArgumentException("Target index " + to + " lies after source index " + from);
    }
    Map<Integer, Integer> res = new TreeMap<>();
    for (int i = 0; i < to; i++) {
      res.put(i, i);
    }
    for (int i = to; i < from; i++) {
      res.put(i, i + 1);
    }
    res.put(from, to);
    for (int i = from + 1; i < size; i++) {
      res.put(i, i);
    }
    return res;
  }

  public static Stream<Inversion> inversions(Map<Integer, Integer> perm, int size) {
    return IntStream.range(0, size).boxed()
        .flatMap(i -> IntStream.range(i + 1, size)
            .filter(j -> perm.get(j) < perm.get(i))
            .mapToObj(j -> new Inversion(i, j, perm.get(i), perm.get(j))));
  }

  // order lists the original indices in their new order
  public static Map<Integer, Integer> fromOrder(List<Integer> order) {
    Map<Integer, Integer> res = new TreeMap<>();
    for (int pos = 0; pos < order.size(); pos++) {
      res.put(order.get(pos), pos);
    }
    checkPermutation(res, order.size());
    return res;
  }

  public static <T> List<T> apply(Map<Integer, Integer> perm, List<T> items) {
    checkPermutation(perm, items.size());
    List<T> res = new ArrayList<>(Collections.nCopies(items.size(), (T) null));
    for (int i = 0; i < items.size(); i++) {
      res.set(perm.get(i), items.get(i));
    }
    return res;
  }

  private static List<Integer> range(int size) {
    return IntStream.range(0, size).boxed().collect(Collectors.toList());
  }
}
