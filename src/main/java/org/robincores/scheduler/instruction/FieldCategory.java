package org.robincores.scheduler.instruction;

import java.util.function.Function;

// Represents the non-register placeholders of a template; repeated ones are indexed as <imm0>, <imm1>
public enum FieldCategory {
  IMMEDIATE("imm", "imm", "#(?:\\w|\\s|/| |-|\\*|\\+|\\(|\\)|=|,)+",
      s -> s.substring(1).strip(), v -> "#" + v),
  DATATYPE("dt", "datatype", "(?:|2|4|8|16)(?:B|H|S|D|b|h|s|d)",
      String::toLowerCase, v -> v.toString().toUpperCase()),
  // At most nine digits, so that every match fits an int
  INDEX("index", "index", "[0-9]{1,9}",
      Integer::valueOf, String::valueOf),
  FLAG("flag", "flag", "eq|ne|cs|hs|cc|lo|mi|pl|vs|vc|hi|ls|ge|lt|gt|le",
      s -> s, Object::toString),
  WIDTH("width", "width", "(?:\\.w|\\.n|)",
      s -> s, v -> v.toString().toLowerCase()),
  BARREL("barrel", "barrel", "(?:lsl|ror|lsr|asr)",
      s -> s, v -> v.toString().toLowerCase());

  private final String key;
  private final String group;
  private final String regex;
  private final Function<String, Object> decoder;
  private final Function<Object, String> encoder;

  FieldCategory(String key, String group, String regex,
                Function<String, Object> decoder, Function<Object, String> encoder) {
    this.key = key;
    this.group = group;
    this.regex = regex;
    this.decoder = decoder;
    this.encoder = encoder;
  }

  // Placeholder key as written in templates, without angle brackets
  public String key() {
    return key;
  }

  // Field name under which matches are reported
  public String group() {
    return group;
  }

  public String regex() {
    return regex;
  }

  public Object decode(String text) {
    return decoder.apply(text);
  }

  public String encode(Object value) {
    return encoder.apply(value);
  }

  public static FieldCategory fromKey(String key) {
    for (FieldCategory c : values()) {
      if (c.key.equals(key)) {
        return c;
      }
    }
    return null;
  }
}
