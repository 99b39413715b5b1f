package com.flamingo.ai.studybuddy.exception;

/** Exception thrown when a generation parameter is unknown or out of range. */
public class InvalidParameterException extends EngineException {

  private final String parameter;
  private final double value;

  public InvalidParameterException(String parameter, double value, String reason) {
    super(
        Double.isNaN(value)
            ? String.format("Invalid parameter '%s': %s", parameter, reason)
            : String.format("Invalid value %s for parameter '%s': %s", value, parameter, reason));
    this.parameter = parameter;
    this.value = value;
  }

  public String getParameter() {
    return parameter;
  }

  public double getValue() {
    return value;
  }
}
