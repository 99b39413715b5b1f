package com.flamingo.ai.studybuddy.engine;

import com.flamingo.ai.studybuddy.exception.EngineLifecycleException;
import com.flamingo.ai.studybuddy.exception.EngineNotInitializedException;
import com.flamingo.ai.studybuddy.exception.GenerationInProgressException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Phase, model path, parameters and active generation of one engine.
 *
 * <p>Every read and every transition goes through this object's monitor. Transitions check the
 * phase they depend on inside the same critical section that changes it, so callers never act on a
 * phase that may have moved since they looked at it.
 */
final class EngineState {

  private EnginePhase phase = EnginePhase.UNINITIALIZED;
  private String failureReason;
  private String modelPath;
  private GenerationParameters parameters;
  private UUID activeGenerationId;

  /** A generation admitted by {@link #beginGeneration()}, with its parameter snapshot. */
  record GenerationTicket(UUID generationId, GenerationParameters parameters) {}

  synchronized void beginLoading(String path, GenerationParameters initialParameters) {
    Objects.requireNonNull(initialParameters, "initialParameters");
    if (!phase.acceptsInitialize()) {
      throw new EngineLifecycleException(
          phase, "Engine cannot be initialized from phase " + phase);
    }
    phase = EnginePhase.LOADING;
    failureReason = null;
    modelPath = path;
    parameters = initialParameters;
  }

  /** LOADING to READY. Returns {@code false} if the engine left LOADING in the meantime. */
  synchronized boolean completeLoading() {
    if (phase != EnginePhase.LOADING) {
      return false;
    }
    phase = EnginePhase.READY;
    return true;
  }

  /** LOADING to FAILED. Returns {@code false} if the engine left LOADING in the meantime. */
  synchronized boolean failLoading(String reason) {
    if (phase != EnginePhase.LOADING) {
      return false;
    }
    phase = EnginePhase.FAILED;
    failureReason = reason;
    return true;
  }

  /**
   * READY to GENERATING under a fresh generation id.
   *
   * @throws GenerationInProgressException if another generation is active
   * @throws EngineNotInitializedException for any other phase
   */
  synchronized GenerationTicket beginGeneration() {
    if (phase == EnginePhase.GENERATING) {
      throw new GenerationInProgressException(activeGenerationId);
    }
    if (phase != EnginePhase.READY) {
      throw phase == EnginePhase.FAILED
          ? new EngineNotInitializedException(phase, "generation", failureReason)
          : new EngineNotInitializedException(phase, "generation");
    }
    phase = EnginePhase.GENERATING;
    activeGenerationId = UUID.randomUUID();
    return new GenerationTicket(activeGenerationId, parameters);
  }

  /**
   * GENERATING to READY, only if {@code generationId} is still the active generation.
   *
   * @return {@code false} if the generation was superseded or the engine closed
   */
  synchronized boolean finishGeneration(UUID generationId) {
    if (!isCurrent(generationId)) {
      return false;
    }
    phase = EnginePhase.READY;
    activeGenerationId = null;
    return true;
  }

  synchronized boolean isCurrent(UUID generationId) {
    return phase == EnginePhase.GENERATING && generationId.equals(activeGenerationId);
  }

  /**
   * Returns to READY and invalidates the active generation.
   *
   * @return the generation that was invalidated, if any
   */
  synchronized Optional<UUID> reset() {
    if (phase != EnginePhase.READY && phase != EnginePhase.GENERATING) {
      throw new EngineNotInitializedException(phase, "reset");
    }
    Optional<UUID> superseded = Optional.ofNullable(activeGenerationId);
    activeGenerationId = null;
    phase = EnginePhase.READY;
    return superseded;
  }

  /** Replaces one parameter; the change applies to generations started afterwards. */
  synchronized GenerationParameters updateParameter(ParameterKey key, double value) {
    if (!phase.acceptsParameters()) {
      throw new EngineNotInitializedException(phase, "setParameter");
    }
    parameters = parameters.with(key, value);
    return parameters;
  }

  /**
   * Moves to CLOSED from any phase.
   *
   * @return {@code false} if the engine was already closed
   */
  synchronized boolean close() {
    if (phase == EnginePhase.CLOSED) {
      return false;
    }
    phase = EnginePhase.CLOSED;
    activeGenerationId = null;
    return true;
  }

  synchronized EnginePhase phase() {
    return phase;
  }

  synchronized GenerationParameters parameters() {
    return parameters;
  }

  synchronized EngineStatus snapshot(UUID engineId, String sourceDescription) {
    String modelInfo =
        modelPath == null ? sourceDescription : sourceDescription + " (model: " + modelPath + ")";
    return new EngineStatus(
        engineId, phase, failureReason, modelPath, parameters, activeGenerationId, modelInfo);
  }
}
