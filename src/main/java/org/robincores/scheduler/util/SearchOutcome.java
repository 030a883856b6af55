package org.robincores.scheduler.util;

// Represents the result of one probe
public final class SearchOutcome<T> {
  private final boolean success;
  private final T result;

  private SearchOutcome(boolean success, T result) {
    this.success = success;
    this.result = result;
  }

  public static <T> SearchOutcome<T> success(T result) {
    return new SearchOutcome<>(true, result);
  }

  public static <T> SearchOutcome<T> failure(T result) {
    return new SearchOutcome<>(false, result);
  }

  public static <T> SearchOutcome<T> of(boolean success, T result) {
    return new SearchOutcome<>(success, result);
  }

  public boolean isSuccess() {
    return success;
  }

  public T getResult() {
    return result;
  }
}
