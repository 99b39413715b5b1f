package com.flamingo.ai.studybuddy.engine.source;

import com.flamingo.ai.studybuddy.engine.CancellationToken;
import com.flamingo.ai.studybuddy.engine.GenerationParameters;
import java.util.stream.Stream;

/**
 * Produces generated text for a prompt, one fragment at a time.
 *
 * <p>The returned stream is lazy and ordered; the engine consumes it once on a worker thread and
 * closes it when the generation ends, including when it stops early because of cancellation or the
 * fragment limit. Implementations should stop producing once the token is cancelled. A failure is
 * reported by throwing from the stream; the message becomes the sink's error reason.
 */
@FunctionalInterface
public interface GenerationSource {

  Stream<String> startGeneration(
      String prompt, GenerationParameters parameters, CancellationToken cancellationToken);

  /** Short human-readable description of the backing model. */
  default String describe() {
    return getClass().getSimpleName();
  }
}
