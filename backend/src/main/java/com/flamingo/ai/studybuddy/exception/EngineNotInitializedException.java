package com.flamingo.ai.studybuddy.exception;

import com.flamingo.ai.studybuddy.engine.EnginePhase;

/** Exception thrown when an operation needs a ready engine but the engine is not ready. */
public class EngineNotInitializedException extends EngineLifecycleException {

  public EngineNotInitializedException(EnginePhase phase, String operation) {
    super(phase, String.format("Engine is not ready for %s (phase: %s)", operation, phase));
  }

  public EngineNotInitializedException(EnginePhase phase, String operation, String reason) {
    super(
        phase,
        String.format(
            "Engine is not ready for %s (phase: %s, reason: %s)", operation, phase, reason));
  }
}
