package com.flamingo.ai.studybuddy.engine.channel;

import java.util.Objects;

/** One event carried by a {@link TokenChannel}: generated text or a terminal marker. */
public sealed interface Fragment permits Fragment.Text, Fragment.EndOfStream, Fragment.Error {

  /** Whether this fragment ends the stream. */
  default boolean isTerminal() {
    return !(this instanceof Text);
  }

  static Fragment text(String text) {
    return new Text(text);
  }

  static Fragment endOfStream() {
    return EndOfStream.INSTANCE;
  }

  static Fragment error(String message) {
    return new Error(message);
  }

  /** A piece of generated text. */
  record Text(String text) implements Fragment {
    public Text {
      Objects.requireNonNull(text, "text");
    }
  }

  /** Normal end of the stream. */
  final class EndOfStream implements Fragment {
    private static final EndOfStream INSTANCE = new EndOfStream();

    private EndOfStream() {}

    @Override
    public String toString() {
      return "EndOfStream";
    }
  }

  /** Abnormal end of the stream, with a human-readable reason. */
  record Error(String message) implements Fragment {
    public Error {
      message = message == null || message.isBlank() ? "Unknown generation error" : message;
    }
  }
}
