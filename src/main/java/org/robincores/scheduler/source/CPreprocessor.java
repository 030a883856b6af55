package org.robincores.scheduler.source;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs header and body through the C preprocessor ({@code <cc> -E -x assembler-with-cpp -}).
 *
 * <p>A marker line is placed between header and body; everything the preprocessor prints after
 * the marker is the expanded body. A failing preprocessor is fatal and is not retried.
 */
public class CPreprocessor implements Preprocessor {
  private static final Logger logger = LogManager.getLogger();

  public static final String MAGIC_STRING = "SCHEDULER_PREPROCESSED_REGION";

  private final String compiler;

  public CPreprocessor(String compiler) {
    this.compiler = compiler;
  }

  public String getCompiler() {
    return compiler;
  }

  @Override
  public List<String> unfold(List<String> header, List<String> body) {
    List<String> code = new ArrayList<>(header);
    code.add(MAGIC_STRING);
    code.addAll(body);
    String input = String.join("\n", code) + "\n";

    List<String> command = List.of(compiler, "-E", "-x", "assembler-with-cpp", "-");
    logger.debug("Running {}", command);
    String output;
    int exit;
    try {
      Process process = new ProcessBuilder(command).start();
      CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
      CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
      try (OutputStream in = process.getOutputStream()) {
        in.write(input.getBytes(StandardCharsets.UTF_8));
      }
      exit = process.waitFor();
      output = stdout.get();
      if (exit != 0) {
        throw new AsmHelperException("Preprocessor " + compiler + " failed with exit code " + exit
            + ":\n" + stderr.get());
      }
    } catch (IOException e) {
      throw new AsmHelperException("Could not run preprocessor " + compiler, e);
    } catch (ExecutionException e) {
      throw new AsmHelperException("Could not read preprocessor output", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AsmHelperException("Interrupted while waiting for preprocessor " + compiler, e);
    }
    return extractBody(Arrays.asList(output.split("\n", -1)));
  }

  /**
   * Returns the lines following the marker line.
   */
  public static List<String> extractBody(List<String> output) {
    int idx = output.indexOf(MAGIC_STRING);
    if (idx < 0) {
      throw new AsmHelperException("Preprocessor output does not contain " + MAGIC_STRING);
    }
    return new ArrayList<>(output.subList(idx + 1, output.size()));
  }

  private static String readAll(InputStream in) {
    try (in) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
