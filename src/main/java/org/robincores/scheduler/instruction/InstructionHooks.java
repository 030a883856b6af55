package org.robincores.scheduler.instruction;

import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Callbacks run by the dependency graph builder once the whole computation has been parsed.
 * Both default to doing nothing.
 */
public interface InstructionHooks {
  InstructionHooks NONE = new InstructionHooks() {};

  /**
   * May remodel {@code inst} in the context of the computation, e.g. turn an input-output into a
   * plain output in a jointly destructive pattern using {@link Instruction#remodelInOutAsOutput(int)}.
   *
   * @return whether the instruction was changed
   */
  default boolean remodel(Instruction inst, List<Instruction> context, Logger log) {
    return false;
  }

  /**
   * May signal that {@code inst} and a neighbour in {@code context} can be replaced by a single
   * fused instruction.
   *
   * @return whether a fusion was performed
   */
  default boolean fuse(Instruction inst, List<Instruction> context, Logger log) {
    return false;
  }
}
