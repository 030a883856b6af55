package org.robincores.scheduler.source;

import java.util.List;

/**
 * Expands a body of assembly in the context of a header (macro and constant definitions),
 * returning only the expanded body lines.
 */
@FunctionalInterface
public interface Preprocessor {
  List<String> unfold(List<String> header, List<String> body);
}
