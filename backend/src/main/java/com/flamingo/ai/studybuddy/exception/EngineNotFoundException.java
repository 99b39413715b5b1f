package com.flamingo.ai.studybuddy.exception;

import java.util.UUID;

/** Exception thrown when an engine handle is not registered. */
public class EngineNotFoundException extends EngineException {

  private final UUID engineId;

  public EngineNotFoundException(UUID engineId) {
    super("Engine not found: " + engineId);
    this.engineId = engineId;
  }

  public UUID getEngineId() {
    return engineId;
  }
}
