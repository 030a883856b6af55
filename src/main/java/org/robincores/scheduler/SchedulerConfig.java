package org.robincores.scheduler;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.robincores.scheduler.instruction.ArchitectureSpec;
import org.robincores.scheduler.instruction.InstructionRegistry;
import org.robincores.scheduler.source.AsmHelper;
import org.robincores.scheduler.source.CPreprocessor;
import org.robincores.scheduler.source.Canonicalizer;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Options of a scheduling run. The set of options is closed: loading a configuration that names
 * anything else fails, so a misspelt option never goes unnoticed.
 */
public class SchedulerConfig {
  public static final String DEFAULT_ARCH = "/org/robincores/scheduler/instruction/armv7m.json";

  private String arch = DEFAULT_ARCH;
  private String startLabel;
  private String endLabel;
  private String loopLabel;
  private boolean expandMacros = true;
  private boolean resolveAliases = true;
  private boolean preprocess = false;
  private String compiler = "gcc";
  private boolean allowNops = false;
  private RenameFunction renameFunction;

  // Must list every option field above
  private static final Set<String> KEYS = Collections.unmodifiableSet(new TreeSet<>(Arrays.asList(
      "arch", "startLabel", "endLabel", "loopLabel", "expandMacros", "resolveAliases", "preprocess",
      "compiler", "allowNops", "renameFunction")));

  // Function symbol to rename in the emitted source
  public static class RenameFunction {
    private String from;
    private String to;

    public RenameFunction(String from, String to) {
      this.from = from;
      this.to = to;
    }

    public String getFrom() {
      return from;
    }

    public String getTo() {
      return to;
    }
  }

  public SchedulerConfig() {}

  public static Set<String> validKeys() {
    return KEYS;
  }

  public static SchedulerConfig fromJson(Reader reader) {
    JsonElement root;
    try {
      root = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Malformed configuration: " + e.getMessage(), e);
    }
    if (!root.isJsonObject()) {
      throw new IllegalArgumentException("Configuration must be a JSON object");
    }
    JsonObject obj = root.getAsJsonObject();
    Set<String> valid = validKeys();
    for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
      if (!valid.contains(e.getKey())) {
        throw new IllegalArgumentException("Unknown configuration option '" + e.getKey()
            + "'. Valid options: " + String.join(", ", valid));
      }
    }
    SchedulerConfig config;
    try {
      config = new Gson().fromJson(obj, SchedulerConfig.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
    }
    config.validate();
    return config;
  }

  public static SchedulerConfig fromFile(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return fromJson(reader);
    }
  }

  public void validate() {
    if (loopLabel != null && (startLabel != null || endLabel != null)) {
      throw new IllegalArgumentException("A loop label cannot be combined with start/end labels");
    }
    if (arch == null || arch.isEmpty()) {
      throw new IllegalArgumentException("Architecture resource must be set");
    }
    if (preprocess && (compiler == null || compiler.isEmpty())) {
      throw new IllegalArgumentException("Preprocessing requires a compiler executable");
    }
    if (renameFunction != null && (renameFunction.from == null || renameFunction.to == null)) {
      throw new IllegalArgumentException("renameFunction needs both 'from' and 'to'");
    }
  }

  public ArchitectureSpec loadArchitecture() {
    return ArchitectureSpec.fromResource(arch);
  }

  public InstructionRegistry newRegistry() {
    if (DEFAULT_ARCH.equals(arch)) {
      return InstructionRegistry.armv7m();
    }
    return new InstructionRegistry(loadArchitecture());
  }

  public Canonicalizer newCanonicalizer(Map<String, String> defaultAliases) {
    Canonicalizer c = new Canonicalizer();
    c.setStartLabel(startLabel);
    c.setEndLabel(endLabel);
    c.setLoopLabel(loopLabel);
    c.setExpandMacros(expandMacros);
    c.setResolveAliases(resolveAliases);
    c.setAllowNops(allowNops);
    c.setDefaultAliases(defaultAliases);
    if (preprocess) {
      c.setPreprocessor(new CPreprocessor(compiler));
    }
    return c;
  }

  // Applies the function rename, if any, to a whole source file
  public String rename(String source) {
    if (renameFunction == null) {
      return source;
    }
    return AsmHelper.renameFunction(source, renameFunction.from, renameFunction.to);
  }

  public String getArch() {
    return arch;
  }

  public void setArch(String arch) {
    this.arch = arch;
  }

  public String getStartLabel() {
    return startLabel;
  }

  public void setStartLabel(String startLabel) {
    this.startLabel = startLabel;
  }

  public String getEndLabel() {
    return endLabel;
  }

  public void setEndLabel(String endLabel) {
    this.endLabel = endLabel;
  }

  public String getLoopLabel() {
    return loopLabel;
  }

  public void setLoopLabel(String loopLabel) {
    this.loopLabel = loopLabel;
  }

  public boolean isExpandMacros() {
    return expandMacros;
  }

  public void setExpandMacros(boolean expandMacros) {
    this.expandMacros = expandMacros;
  }

  public boolean isResolveAliases() {
    return resolveAliases;
  }

  public void setResolveAliases(boolean resolveAliases) {
    this.resolveAliases = resolveAliases;
  }

  public boolean isPreprocess() {
    return preprocess;
  }

  public void setPreprocess(boolean preprocess) {
    this.preprocess = preprocess;
  }

  public String getCompiler() {
    return compiler;
  }

  public void setCompiler(String compiler) {
    this.compiler = compiler;
  }

  public boolean isAllowNops() {
    return allowNops;
  }

  public void setAllowNops(boolean allowNops) {
    this.allowNops = allowNops;
  }

  public RenameFunction getRenameFunction() {
    return renameFunction;
  }

  public void setRenameFunction(RenameFunction renameFunction) {
    this.renameFunction = renameFunction;
  }
}
