package com.flamingo.ai.studybuddy.exception;

import com.flamingo.ai.studybuddy.engine.EnginePhase;
import java.util.UUID;

/** Exception thrown when a generation is requested while another one is still running. */
public class GenerationInProgressException extends EngineLifecycleException {

  private final UUID activeGenerationId;

  public GenerationInProgressException(UUID activeGenerationId) {
    super(EnginePhase.GENERATING, "A generation is already in progress: " + activeGenerationId);
    this.activeGenerationId = activeGenerationId;
  }

  public UUID getActiveGenerationId() {
    return activeGenerationId;
  }
}
