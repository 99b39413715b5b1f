package com.flamingo.ai.studybuddy.exception;

/** Exception thrown when an engine cannot load its model resources. */
public class ModelLoadException extends EngineException {

  private final String modelPath;
  private final String reason;

  public ModelLoadException(String modelPath, String reason) {
    super(String.format("Failed to load model at '%s': %s", modelPath, reason));
    this.modelPath = modelPath;
    this.reason = reason;
  }

  public ModelLoadException(String modelPath, String reason, Throwable cause) {
    super(String.format("Failed to load model at '%s': %s", modelPath, reason), cause);
    this.modelPath = modelPath;
    this.reason = reason;
  }

  public String getModelPath() {
    return modelPath;
  }

  public String getReason() {
    return reason;
  }
}
