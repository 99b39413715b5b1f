package com.flamingo.ai.studybuddy.exception;

import java.util.List;
import java.util.UUID;

/** Exception thrown when shutdown cannot join generation tasks within its timeout. */
public class ResourceLeakException extends EngineException {

  private final UUID engineId;
  private final List<UUID> leakedGenerations;

  public ResourceLeakException(UUID engineId, List<UUID> leakedGenerations, long timeoutMs) {
    super(
        String.format(
            "Engine %s shut down with %d generation task(s) still running after %d ms: %s",
            engineId, leakedGenerations.size(), timeoutMs, leakedGenerations));
    this.engineId = engineId;
    this.leakedGenerations = List.copyOf(leakedGenerations);
  }

  public UUID getEngineId() {
    return engineId;
  }

  public List<UUID> getLeakedGenerations() {
    return leakedGenerations;
  }
}
