package com.flamingo.ai.studybuddy.engine.source;

import com.flamingo.ai.studybuddy.engine.CancellationToken;
import com.flamingo.ai.studybuddy.engine.GenerationParameters;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;

/**
 * Offline generation source that streams a templated study reply in fixed-size character chunks.
 *
 * <p>Chunks are paced by {@code fragmentDelay}. The wait is on the cancellation token, so a
 * cancelled generation stops without sleeping out the remaining delay.
 */
@Slf4j
public class ScriptedGenerationSource implements GenerationSource {

  private static final int MAX_TOPIC_LENGTH = 80;

  private final int chunkSize;
  private final Duration fragmentDelay;

  public ScriptedGenerationSource(int chunkSize, Duration fragmentDelay) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    this.chunkSize = chunkSize;
    this.fragmentDelay = fragmentDelay == null ? Duration.ZERO : fragmentDelay;
  }

  @Override
  public Stream<String> startGeneration(
      String prompt, GenerationParameters parameters, CancellationToken cancellationToken) {
    String reply = compose(prompt);
    log.debug("Scripted reply of {} characters for prompt of {}", reply.length(), prompt.length());
    Iterator<String> chunks = new ChunkIterator(reply, cancellationToken);
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(chunks, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  @Override
  public String describe() {
    return "scripted (chunk size " + chunkSize + ", delay " + fragmentDelay.toMillis() + " ms)";
  }

  static String compose(String prompt) {
    String topic = prompt.strip().replaceAll("\\s+", " ");
    if (topic.isEmpty()) {
      return "Ask me a question about your study material and I will walk you through it.";
    }
    if (topic.length() > MAX_TOPIC_LENGTH) {
      topic = topic.substring(0, MAX_TOPIC_LENGTH) + "...";
    }
    return "Let's work through \""
        + topic
        + "\" step by step. First, pick out the key terms in the question. "
        + "Next, connect each term to something you already know. "
        + "Finally, explain the idea back in your own words to check your understanding.";
  }

  private final class ChunkIterator implements Iterator<String> {

    private final String reply;
    private final CancellationToken cancellationToken;
    private int position;

    private ChunkIterator(String reply, CancellationToken cancellationToken) {
      this.reply = reply;
      this.cancellationToken = cancellationToken;
    }

    @Override
    public boolean hasNext() {
      return position < reply.length() && !cancellationToken.isCancellationRequested();
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      if (position > 0 && pause()) {
        throw new NoSuchElementException("cancelled");
      }
      int end = Math.min(position + chunkSize, reply.length());
      String chunk = reply.substring(position, end);
      position = end;
      return chunk;
    }

    /** @return {@code true} if cancellation arrived during the pause */
    private boolean pause() {
      if (fragmentDelay.isZero()) {
        return false;
      }
      try {
        return cancellationToken.await(fragmentDelay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while pacing fragments", e);
      }
    }
  }
}
