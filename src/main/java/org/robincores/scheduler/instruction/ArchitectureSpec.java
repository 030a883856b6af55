package org.robincores.scheduler.instruction;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Architecture description: name, default register aliases and the ordered instruction templates
public class ArchitectureSpec {
  public static final String ARMV7M = "/org/robincores/scheduler/instruction/armv7m.json";

  String name;
  Map<String, String> aliases = new LinkedHashMap<>();
  List<InstructionTemplate> templates = new ArrayList<>();

  ArchitectureSpec() {}

  public ArchitectureSpec(String name, Map<String, String> aliases, List<InstructionTemplate> templates) {
    this.name = name;
    this.aliases = aliases;
    this.templates = templates;
  }

  public String getName() {
    return name;
  }

  public Map<String, String> getAliases() {
    return aliases == null ? Collections.emptyMap() : Collections.unmodifiableMap(aliases);
  }

  public List<InstructionTemplate> getTemplates() {
    return Collections.unmodifiableList(templates);
  }

  // Throws IllegalArgumentException if the resource is missing or malformed
  public static ArchitectureSpec fromResource(String resourcePath) {
    InputStream inputStream = ArchitectureSpec.class.getResourceAsStream(resourcePath);
    if (inputStream == null) {
      throw new IllegalArgumentException("Architecture description not found: " + resourcePath);
    }
    try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
      return fromJson(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Error reading architecture description " + resourcePath, e);
    }
  }

  public static ArchitectureSpec fromJson(Reader reader) {
    ArchitectureSpec spec;
    try {
      spec = new Gson().fromJson(reader, ArchitectureSpec.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Error parsing architecture description: " + e.getMessage(), e);
    }
    if (spec == null || spec.templates == null || spec.templates.isEmpty()) {
      throw new IllegalArgumentException("Architecture description has no templates");
    }
    for (InstructionTemplate t : spec.templates) {
      t.prepare();
    }
    return spec;
  }
}
