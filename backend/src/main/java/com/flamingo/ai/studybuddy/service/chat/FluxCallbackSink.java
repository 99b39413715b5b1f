package com.flamingo.ai.studybuddy.service.chat;

import com.flamingo.ai.studybuddy.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.studybuddy.engine.sink.CallbackSink;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Bridges engine callbacks into a Reactor {@link Flux} of SSE chunks.
 *
 * <p>The flux always ends with one {@code done} or {@code error} chunk. A generation that is
 * released without a terminal callback (superseded by a reset) gets an {@code error} chunk on
 * detach.
 */
@Slf4j
public class FluxCallbackSink implements CallbackSink {

  static final String INTERRUPTED_MESSAGE = "Generation was superseded by a reset";

  private final Sinks.Many<StreamChunkResponse> sink =
      Sinks.many().unicast().onBackpressureBuffer();
  private final AtomicInteger tokenCount = new AtomicInteger();
  private final AtomicBoolean terminated = new AtomicBoolean();
  private volatile UUID generationId;

  @Override
  public void attach(UUID generationId) {
    this.generationId = generationId;
    emit(StreamChunkResponse.started(generationId));
  }

  @Override
  public void deliver(String fragment) {
    tokenCount.incrementAndGet();
    emit(StreamChunkResponse.token(fragment));
  }

  @Override
  public void complete() {
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    log.debug("Stream for generation {} complete, {} token(s)", generationId, tokenCount.get());
    emit(StreamChunkResponse.done(generationId, tokenCount.get()));
    sink.tryEmitComplete();
  }

  @Override
  public void error(String message) {
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    String errorId = UUID.randomUUID().toString().substring(0, 8);
    log.debug("Stream for generation {} failed [{}]: {}", generationId, errorId, message);
    emit(StreamChunkResponse.error(errorId, message));
    sink.tryEmitComplete();
  }

  @Override
  public void detach() {
    if (terminated.compareAndSet(false, true)) {
      String errorId = UUID.randomUUID().toString().substring(0, 8);
      log.debug("Stream for generation {} released without a result [{}]", generationId, errorId);
      emit(StreamChunkResponse.error(errorId, INTERRUPTED_MESSAGE));
      sink.tryEmitComplete();
    }
  }

  public Flux<StreamChunkResponse> asFlux() {
    return sink.asFlux();
  }

  public int getTokenCount() {
    return tokenCount.get();
  }

  private void emit(StreamChunkResponse chunk) {
    Sinks.EmitResult result = sink.tryEmitNext(chunk);
    if (result.isFailure()) {
      // the client is gone; the engine learns about it through the cancel hook
      log.trace(
          "Dropped {} chunk for generation {}: {}", chunk.getEventType(), generationId, result);
    }
  }
}
