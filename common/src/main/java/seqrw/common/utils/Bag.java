package seqrw.common.utils;

import java.util.HashMap;
import java.util.Map;

/** Multiset. Counts never go below zero. */
public class Bag<T> {

  private final Map<T, Integer> countMap;

  public Bag() {
    countMap = new HashMap<>();
  }

  public void add(T e, int count) {
    countMap.merge(e, count, Integer::sum);
  }

  public void add(T e) {
    add(e, 1);
  }

  /** Removes one occurrence. Returns false if there was none to remove. */
  public boolean removeOne(T e) {
    final int c = count(e);
    if (c == 0) return false;
    if (c == 1) countMap.remove(e);
    else countMap.put(e, c - 1);
    return true;
  }

  public int count(T e) {
    return countMap.getOrDefault(e, 0);
  }

  public boolean isEmpty() {
    return countMap.isEmpty();
  }
}
