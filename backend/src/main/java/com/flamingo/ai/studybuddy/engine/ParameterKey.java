package com.flamingo.ai.studybuddy.engine;

import com.flamingo.ai.studybuddy.exception.InvalidParameterException;
import java.util.Arrays;
import java.util.Locale;

/** Tunable generation parameters, with their accepted names and ranges. */
public enum ParameterKey {
  TEMPERATURE("temperature", "temperature", "[0, 2]") {
    @Override
    boolean accepts(double value) {
      return value >= 0.0 && value <= 2.0;
    }
  },
  TOP_P("top_p", "topP", "(0, 1]") {
    @Override
    boolean accepts(double value) {
      return value > 0.0 && value <= 1.0;
    }
  },
  MAX_GEN_LEN("max_gen_len", "maxGenLen", "positive integer") {
    @Override
    boolean accepts(double value) {
      return value >= 1 && value <= Integer.MAX_VALUE && value == Math.rint(value);
    }
  },
  REPETITION_PENALTY("repetition_penalty", "repetitionPenalty", "(0, 2]") {
    @Override
    boolean accepts(double value) {
      return value > 0.0 && value <= 2.0;
    }
  };

  private final String wireName;
  private final String alias;
  private final String range;

  ParameterKey(String wireName, String alias, String range) {
    this.wireName = wireName;
    this.alias = alias;
    this.range = range;
  }

  abstract boolean accepts(double value);

  public String getWireName() {
    return wireName;
  }

  public String getRange() {
    return range;
  }

  /**
   * Validates a value for this key.
   *
   * @throws InvalidParameterException if the value is NaN or outside the accepted range
   */
  public void validate(double value) {
    if (Double.isNaN(value) || !accepts(value)) {
      throw new InvalidParameterException(wireName, value, "must be in " + range);
    }
  }

  /**
   * Resolves a key by its wire name ({@code top_p}) or camel-case alias ({@code topP}).
   *
   * @throws InvalidParameterException if no key matches
   */
  public static ParameterKey fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidParameterException(String.valueOf(name), Double.NaN, "unknown parameter");
    }
    String normalized = name.trim();
    return Arrays.stream(values())
        .filter(
            key ->
                key.wireName.equals(normalized.toLowerCase(Locale.ROOT))
                    || key.alias.equalsIgnoreCase(normalized))
        .findFirst()
        .orElseThrow(
            () -> new InvalidParameterException(normalized, Double.NaN, "unknown parameter"));
  }
}
