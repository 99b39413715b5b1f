package com.flamingo.ai.studybuddy.engine.sink;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Scoped ownership of a {@link CallbackSink} for one generation.
 *
 * <p>Acquiring the lease attaches the sink; {@link #close()} detaches it exactly once no matter how
 * often it is called. The lease also guards the sink contract: fragments after a terminal call are
 * dropped and at most one terminal call gets through.
 */
@Slf4j
public final class SinkLease implements AutoCloseable {

  private final UUID generationId;
  private final CallbackSink sink;
  private final AtomicBoolean terminated = new AtomicBoolean();
  private final AtomicBoolean released = new AtomicBoolean();

  private SinkLease(UUID generationId, CallbackSink sink) {
    this.generationId = generationId;
    this.sink = sink;
  }

  /**
   * Attaches the sink for the given generation.
   *
   * @throws RuntimeException whatever {@link CallbackSink#attach(UUID)} throws; the sink is then
   *     not considered attached and will not be detached
   */
  public static SinkLease acquire(UUID generationId, CallbackSink sink) {
    sink.attach(generationId);
    log.trace("Attached sink for generation {}", generationId);
    return new SinkLease(generationId, sink);
  }

  /** @return {@code false} if the fragment was dropped because the lease is no longer open */
  public boolean deliver(String fragment) {
    if (terminated.get() || released.get()) {
      log.trace("Dropping fragment for settled generation {}", generationId);
      return false;
    }
    sink.deliver(fragment);
    return true;
  }

  /** @return {@code true} if this call delivered the terminal signal */
  public boolean complete() {
    if (released.get() || !terminated.compareAndSet(false, true)) {
      return false;
    }
    sink.complete();
    return true;
  }

  /** @return {@code true} if this call delivered the terminal signal */
  public boolean error(String message) {
    if (released.get() || !terminated.compareAndSet(false, true)) {
      return false;
    }
    sink.error(message);
    return true;
  }

  public boolean isTerminated() {
    return terminated.get();
  }

  public boolean isReleased() {
    return released.get();
  }

  /** Detaches the sink. Only the first call has an effect; detach failures are logged. */
  @Override
  public void close() {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    try {
      sink.detach();
      log.trace("Detached sink for generation {}", generationId);
    } catch (RuntimeException e) {
      log.warn("Sink detach failed for generation {}: {}", generationId, e.getMessage(), e);
    }
  }
}
