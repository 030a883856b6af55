package org.robincores.scheduler.source;

// An exception encountered while canonicalizing assembly
public class AsmHelperException extends RuntimeException {
  public AsmHelperException(String msg) {
    super(msg);
  }

  public AsmHelperException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
