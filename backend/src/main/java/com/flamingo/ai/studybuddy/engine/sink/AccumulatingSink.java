package com.flamingo.ai.studybuddy.engine.sink;

import java.util.Optional;

/** Sink that concatenates every fragment, used by the blocking {@code generate} form. */
public final class AccumulatingSink implements CallbackSink {

  private final StringBuffer text = new StringBuffer();
  private volatile String errorMessage;
  private volatile boolean completed;

  @Override
  public void deliver(String fragment) {
    text.append(fragment);
  }

  @Override
  public void error(String message) {
    errorMessage = message;
  }

  @Override
  public void complete() {
    completed = true;
  }

  public String getText() {
    return text.toString();
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public boolean isCompleted() {
    return completed;
  }
}
