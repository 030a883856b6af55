package org.robincores.scheduler.util;

// Binary search has exceeded its limit without finding a solution
public class BinarySearchLimitException extends RuntimeException {
  public BinarySearchLimitException(String msg) {
    super(msg);
  }
}
