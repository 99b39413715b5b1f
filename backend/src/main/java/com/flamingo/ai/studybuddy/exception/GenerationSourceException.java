package com.flamingo.ai.studybuddy.exception;

/** Thrown by a generation source when the upstream model fails mid-stream. */
public class GenerationSourceException extends EngineException {

  private final boolean rateLimited;

  public GenerationSourceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = looksRateLimited(message) || looksRateLimited(causeMessage(cause));
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  private static String causeMessage(Throwable cause) {
    return cause != null ? cause.getMessage() : null;
  }

  private static boolean looksRateLimited(String message) {
    return message != null && (message.contains("429") || message.contains("rate limit"));
  }
}
