package com.flamingo.ai.studybuddy.engine;

/**
 * Immutable sampling configuration applied to one generation.
 *
 * <p>Instances are validated on construction, so an engine never holds an out-of-range value.
 * Changes produce a new instance through {@link #with(ParameterKey, double)}.
 */
public record GenerationParameters(
    float temperature, float topP, int maxGenLen, float repetitionPenalty) {

  public static final float DEFAULT_TEMPERATURE = 0.7f;
  public static final float DEFAULT_TOP_P = 0.95f;
  public static final int DEFAULT_MAX_GEN_LEN = 1024;
  public static final float DEFAULT_REPETITION_PENALTY = 1.1f;

  public GenerationParameters {
    ParameterKey.TEMPERATURE.validate(temperature);
    ParameterKey.TOP_P.validate(topP);
    ParameterKey.MAX_GEN_LEN.validate(maxGenLen);
    ParameterKey.REPETITION_PENALTY.validate(repetitionPenalty);
  }

  public static GenerationParameters defaults() {
    return new GenerationParameters(
        DEFAULT_TEMPERATURE, DEFAULT_TOP_P, DEFAULT_MAX_GEN_LEN, DEFAULT_REPETITION_PENALTY);
  }

  /** Returns a copy with one parameter replaced, validating the new value. */
  public GenerationParameters with(ParameterKey key, double value) {
    key.validate(value);
    return switch (key) {
      case TEMPERATURE ->
          new GenerationParameters((float) value, topP, maxGenLen, repetitionPenalty);
      case TOP_P ->
          new GenerationParameters(temperature, (float) value, maxGenLen, repetitionPenalty);
      case MAX_GEN_LEN ->
          new GenerationParameters(temperature, topP, (int) value, repetitionPenalty);
      case REPETITION_PENALTY ->
          new GenerationParameters(temperature, topP, maxGenLen, (float) value);
    };
  }

  /** Returns the current value of one parameter. */
  public double get(ParameterKey key) {
    return switch (key) {
      case TEMPERATURE -> temperature;
      case TOP_P -> topP;
      case MAX_GEN_LEN -> maxGenLen;
      case REPETITION_PENALTY -> repetitionPenalty;
    };
  }
}
