package com.flamingo.ai.studybuddy.engine;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/** Caller-side reference to one streaming generation. */
public final class GenerationHandle {

  private final UUID engineId;
  private final UUID generationId;
  private final CancellationToken cancellationToken;
  private final AtomicInteger deliveredFragments = new AtomicInteger();
  private final CompletableFuture<GenerationOutcome> outcome = new CompletableFuture<>();

  GenerationHandle(UUID engineId, UUID generationId, CancellationToken cancellationToken) {
    this.engineId = engineId;
    this.generationId = generationId;
    this.cancellationToken = cancellationToken;
  }

  public UUID getEngineId() {
    return engineId;
  }

  public UUID getGenerationId() {
    return generationId;
  }

  CancellationToken getCancellationToken() {
    return cancellationToken;
  }

  public boolean isCancellationRequested() {
    return cancellationToken.isCancellationRequested();
  }

  /** Number of fragments handed to the sink so far. */
  public int getDeliveredFragments() {
    return deliveredFragments.get();
  }

  /** Completes once the delivery loop has exited and the sink has been released. */
  public CompletableFuture<GenerationOutcome> completion() {
    return outcome.copy();
  }

  public boolean isDone() {
    return outcome.isDone();
  }

  /** The outcome, if the generation has already settled. */
  public Optional<GenerationOutcome> getOutcome() {
    return Optional.ofNullable(outcome.getNow(null));
  }

  /**
   * Blocks until the generation settles.
   *
   * @return the outcome, or empty if the timeout elapsed first
   */
  public Optional<GenerationOutcome> awaitOutcome(Duration timeout) throws InterruptedException {
    try {
      return Optional.of(outcome.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
    } catch (TimeoutException e) {
      return Optional.empty();
    } catch (ExecutionException e) {
      // the outcome future is only ever completed normally
      throw new IllegalStateException(e.getCause());
    }
  }

  void recordDelivered() {
    deliveredFragments.incrementAndGet();
  }

  void settle(GenerationOutcome result) {
    outcome.complete(result);
  }

  @Override
  public String toString() {
    return "GenerationHandle[" + generationId + "]";
  }
}
