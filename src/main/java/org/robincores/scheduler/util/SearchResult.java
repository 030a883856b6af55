package org.robincores.scheduler.util;

// Smallest accepted parameter value and the payload of the probe that accepted it
public final class SearchResult<T> {
  private final int value;
  private final T result;

  public SearchResult(int value, T result) {
    this.value = value;
    this.result = result;
  }

  public int getValue() {
    return value;
  }

  public T getResult() {
    return result;
  }

  @Override
  public String toString() {
    return "SearchResult{value=" + value + ", result=" + result + '}';
  }
}
