package org.robincores.scheduler.util;

// timeout is null for an exact probe; running out of time counts as failure
@FunctionalInterface
public interface SearchPredicate<T> {
  SearchOutcome<T> test(int value, Integer timeout);
}
