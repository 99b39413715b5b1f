package com.flamingo.ai.studybuddy.exception;

/** Base class for every error raised by a streaming engine. */
public abstract class EngineException extends RuntimeException {

  protected EngineException(String message) {
    super(message);
  }

  protected EngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
