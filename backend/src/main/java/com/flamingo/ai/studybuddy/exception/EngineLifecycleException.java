package com.flamingo.ai.studybuddy.exception;

import com.flamingo.ai.studybuddy.engine.EnginePhase;

/** Exception thrown when an operation is not legal in the engine's current phase. */
public class EngineLifecycleException extends EngineException {

  private final EnginePhase phase;

  public EngineLifecycleException(EnginePhase phase, String message) {
    super(message);
    this.phase = phase;
  }

  public EnginePhase getPhase() {
    return phase;
  }
}
