package org.robincores.scheduler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.robincores.scheduler.instruction.Instruction;
import org.robincores.scheduler.instruction.InstructionRegistry;
import org.robincores.scheduler.instruction.ParsingException;
import org.robincores.scheduler.source.CanonicalSource;
import org.robincores.scheduler.source.Canonicalizer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

// Canonicalizes an assembly file, parses its body into instructions and prints the result
public class Main {
  private static final Logger logger = LogManager.getLogger();

  public static void main(String[] args) {
    if (args.length < 1) {
      System.err.println("Usage: Main <file.s> [config.json]");
      System.exit(1);
    }

    SchedulerConfig config;
    try {
      config = args.length > 1 ? SchedulerConfig.fromFile(Paths.get(args[1])) : new SchedulerConfig();
    } catch (IOException | IllegalArgumentException e) {
      logger.error("Failed to load configuration: {}", e.getMessage());
      System.exit(1);
      return;
    }

    String asmFilename = args[0];
    logger.info("Reading assembly file: {}", asmFilename);
    String asmText;
    try {
      asmText = new String(Files.readAllBytes(Paths.get(asmFilename)), StandardCharsets.UTF_8);
    } catch (IOException e) {
      logger.error("Error reading assembly file: {}", e.getMessage());
      System.exit(1);
      return;
    }

    try {
      System.out.print(String.join("\n", process(asmText, config)) + "\n");
    } catch (ParsingException | RuntimeException e) {
      logger.error("{}: {}", asmFilename, e.getMessage());
      System.exit(2);
    }
  }

  public static List<String> process(String asmText, SchedulerConfig config) throws ParsingException {
    InstructionRegistry registry = config.newRegistry();
    Canonicalizer canonicalizer = config.newCanonicalizer(registry.getSpec().getAliases());
    CanonicalSource src = canonicalizer.canonicalize(config.rename(asmText));

    List<Instruction> body = registry.parseAll(src.getBody());
    logger.info("Parsed {} instruction(s)", body.size());

    int indentation = src.getIndentation() == null ? 4 : src.getIndentation();
    return src.wrap(InstructionRegistry.render(body, indentation), indentation);
  }
}
