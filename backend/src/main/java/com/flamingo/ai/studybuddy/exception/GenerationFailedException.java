package com.flamingo.ai.studybuddy.exception;

import java.util.UUID;

/**
 * Exception thrown when a generation cannot produce a result.
 *
 * <p>Streaming callers never see this type: their failures arrive through {@code
 * CallbackSink#error}. It is raised by the blocking {@code generate} form, by sources to abort a
 * stream, and when a generation cannot be dispatched.
 */
public class GenerationFailedException extends EngineException {

  private final UUID generationId;

  public GenerationFailedException(UUID generationId, String reason) {
    super(reason);
    this.generationId = generationId;
  }

  public GenerationFailedException(UUID generationId, String reason, Throwable cause) {
    super(reason, cause);
    this.generationId = generationId;
  }

  /** The failed generation, or {@code null} if it never started. */
  public UUID getGenerationId() {
    return generationId;
  }
}
