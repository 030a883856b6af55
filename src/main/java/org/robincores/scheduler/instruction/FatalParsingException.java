package org.robincores.scheduler.instruction;

// A fatal error happened during instruction parsing; likely a bug in the model or a template
public class FatalParsingException extends RuntimeException {
  public FatalParsingException(String msg) {
    super(msg);
  }
}
