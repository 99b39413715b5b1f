package com.flamingo.ai.studybuddy.engine;

import java.util.UUID;

/** Text of a settled blocking generation. */
public record GenerationResult(
    UUID generationId, String text, int fragmentCount, GenerationOutcome outcome) {

  public boolean isTruncated() {
    return outcome == GenerationOutcome.TRUNCATED;
  }
}
