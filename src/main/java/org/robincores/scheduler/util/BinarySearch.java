package org.robincores.scheduler.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

// Exponential probing until some value succeeds, then bisection
public final class BinarySearch {
  private static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_THRESHOLD = 256;
  public static final int DEFAULT_MINIMUM = -1;
  public static final int DEFAULT_START = 0;
  public static final int DEFAULT_PRECISION = 1;

  private BinarySearch() {}

  public static <T> SearchResult<T> search(SearchPredicate<T> predicate) {
    return search(predicate, DEFAULT_THRESHOLD, DEFAULT_MINIMUM, DEFAULT_START, DEFAULT_PRECISION, null);
  }

  public static <T> SearchResult<T> search(SearchPredicate<T> predicate, int threshold, int minimum,
                                           int start, int precision) {
    return search(predicate, threshold, minimum, start, precision, null);
  }

  /**
   * Finds the smallest value for which {@code predicate} succeeds.
   *
   * @param predicate             the feasibility check
   * @param threshold             largest value probed before giving up
   * @param minimum               value assumed to fail
   * @param start                 first value probed (raised to {@code minimum} if below it)
   * @param precision             bracket width below which probes run under the relaxed timeout
   * @param timeoutBelowPrecision relaxed timeout, or {@code null} to keep every probe exact
   * @return the smallest accepted value and the payload of its probe
   * @throws BinarySearchLimitException if a probed value exceeds {@code threshold} before any success
   * @throws IllegalArgumentException   if the first probed value would be negative
   */
  public static <T> SearchResult<T> search(SearchPredicate<T> predicate, int threshold, int minimum,
                                           int start, int precision, Integer timeoutBelowPrecision) {
    int val = Math.max(start, minimum);
    if (val < 0) {
      throw new IllegalArgumentException("Search must start at a non-negative value, got " + val);
    }
    int lastFailure = minimum;
    int lastSuccess;
    T lastSuccessResult;

    if (val > threshold) {
      throw new BinarySearchLimitException("Search limit " + threshold + " exceeded at " + val);
    }

    // Find some value that works
    while (true) {
      SearchOutcome<T> outcome = predicate.test(val, null);
      logger.debug("Probe {}: {}", val, outcome.isSuccess() ? "success" : "failure");
      if (outcome.isSuccess()) {
        lastSuccess = val;
        lastSuccessResult = outcome.getResult();
        break;
      }
      lastFailure = val;
      long next = val == 0 ? 1 : 2L * val;
      if (next > threshold) {
        throw new BinarySearchLimitException("Search limit " + threshold + " exceeded at " + next);
      }
      val = (int) next;
    }

    // Find the first value that works
    while (lastSuccess - lastFailure > 1) {
      Integer timeout = null;
      if (lastSuccess - lastFailure <= precision) {
        timeout = timeoutBelowPrecision;
      }
      val = lastFailure + (lastSuccess - lastFailure) / 2;
      SearchOutcome<T> outcome = predicate.test(val, timeout);
      logger.debug("Probe {} (timeout {}): {}", val, timeout, outcome.isSuccess() ? "success" : "failure");
      if (outcome.isSuccess()) {
        lastSuccess = val;
        lastSuccessResult = outcome.getResult();
      } else {
        lastFailure = val;
      }
    }
    return new SearchResult<>(lastSuccess, lastSuccessResult);
  }
}
