package com.flamingo.ai.studybuddy.engine;

import java.util.UUID;

/**
 * Point-in-time view of an engine, safe to hand to other threads.
 *
 * @param failureReason set only when {@code phase} is {@link EnginePhase#FAILED}
 * @param parameters {@code null} until the engine has been initialized once
 * @param activeGenerationId {@code null} unless a generation is in flight
 */
public record EngineStatus(
    UUID engineId,
    EnginePhase phase,
    String failureReason,
    String modelPath,
    GenerationParameters parameters,
    UUID activeGenerationId,
    String modelInfo) {}
