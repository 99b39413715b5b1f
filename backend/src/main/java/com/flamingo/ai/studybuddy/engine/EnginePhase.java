package com.flamingo.ai.studybuddy.engine;

/** Lifecycle phases of a {@link StreamingEngine}. */
public enum EnginePhase {
  UNINITIALIZED,
  LOADING,
  READY,
  GENERATING,
  CLOSED,
  FAILED;

  /** Whether generation parameters may be changed in this phase. */
  public boolean acceptsParameters() {
    return this == READY || this == GENERATING;
  }

  /** Whether {@code initialize} may be called in this phase. */
  public boolean acceptsInitialize() {
    return this == UNINITIALIZED || this == FAILED;
  }
}
