package com.flamingo.ai.studybuddy.engine;

import com.flamingo.ai.studybuddy.engine.EngineState.GenerationTicket;
import com.flamingo.ai.studybuddy.engine.channel.Fragment;
import com.flamingo.ai.studybuddy.engine.channel.TokenChannel;
import com.flamingo.ai.studybuddy.engine.resource.ModelResourceCheck;
import com.flamingo.ai.studybuddy.engine.sink.AccumulatingSink;
import com.flamingo.ai.studybuddy.engine.sink.CallbackSink;
import com.flamingo.ai.studybuddy.engine.sink.SinkLease;
import com.flamingo.ai.studybuddy.engine.source.GenerationSource;
import com.flamingo.ai.studybuddy.exception.EngineLifecycleException;
import com.flamingo.ai.studybuddy.exception.GenerationFailedException;
import com.flamingo.ai.studybuddy.exception.ModelLoadException;
import com.flamingo.ai.studybuddy.exception.ResourceLeakException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * One engine handle: lifecycle, generation dispatch and teardown.
 *
 * <p>Each streaming generation runs as two tasks. A worker on the worker executor drives the {@link
 * GenerationSource} and pushes fragments into a {@link TokenChannel}; a delivery loop on the
 * delivery executor drains the channel in order and invokes the {@link CallbackSink}. The sink is
 * never called from the worker thread.
 *
 * <p>At most one generation is active per engine. {@link #reset()} and {@link #shutdown()}
 * invalidate the active generation id and fragments drained for an id that is no longer current
 * are discarded. After a reset the old sink gets no terminal call; after a shutdown it gets {@code
 * error("cancelled")}.
 */
@Slf4j
public class StreamingEngine implements AutoCloseable {

  /** Message passed to {@link CallbackSink#error(String)} when a generation is cancelled. */
  public static final String CANCELLED_MESSAGE = "cancelled";

  static final String MISSING_TERMINAL_MESSAGE = "Generation ended without a completion signal";

  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration DEFAULT_GENERATE_TIMEOUT = Duration.ofMinutes(2);

  private final UUID engineId;
  private final GenerationSource generationSource;
  private final ModelResourceCheck resourceCheck;
  private final Executor workerExecutor;
  private final Executor deliveryExecutor;
  private final MeterRegistry meterRegistry;
  private final Duration shutdownTimeout;
  private final Duration generateTimeout;
  private final GenerationParameters defaultParameters;

  private final EngineState state = new EngineState();
  private final Map<UUID, Generation> liveGenerations = new ConcurrentHashMap<>();

  @Builder
  public StreamingEngine(
      UUID engineId,
      GenerationSource generationSource,
      ModelResourceCheck resourceCheck,
      Executor workerExecutor,
      Executor deliveryExecutor,
      MeterRegistry meterRegistry,
      Duration shutdownTimeout,
      Duration generateTimeout,
      GenerationParameters defaultParameters) {
    this.engineId = engineId != null ? engineId : UUID.randomUUID();
    this.generationSource = Objects.requireNonNull(generationSource, "generationSource");
    this.resourceCheck = Objects.requireNonNull(resourceCheck, "resourceCheck");
    this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
    this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
    this.generateTimeout = generateTimeout != null ? generateTimeout : DEFAULT_GENERATE_TIMEOUT;
    this.defaultParameters =
        defaultParameters != null ? defaultParameters : GenerationParameters.defaults();
  }

  public UUID getEngineId() {
    return engineId;
  }

  public EngineStatus getStatus() {
    return state.snapshot(engineId, generationSource.describe());
  }

  public EnginePhase getPhase() {
    return state.phase();
  }

  /** Number of generations whose worker or delivery task has not exited yet. */
  public int getLiveGenerationCount() {
    return liveGenerations.size();
  }

  // ==================== Lifecycle ====================

  public EngineStatus initialize(String modelPath) {
    return initialize(modelPath, defaultParameters);
  }

  /**
   * Loads the model at {@code modelPath} on the calling thread.
   *
   * @throws EngineLifecycleException unless the engine is UNINITIALIZED or FAILED
   * @throws ModelLoadException if the model resources are not reachable; the engine is then FAILED
   */
  public EngineStatus initialize(String modelPath, GenerationParameters parameters) {
    state.beginLoading(modelPath, parameters);
    return load(modelPath);
  }

  /**
   * Enters LOADING on the calling thread and performs the load on the worker executor. Phase
   * errors are still thrown synchronously; load failures complete the future exceptionally.
   */
  public CompletableFuture<EngineStatus> initializeAsync(
      String modelPath, GenerationParameters parameters) {
    state.beginLoading(modelPath, parameters);
    try {
      return CompletableFuture.supplyAsync(() -> load(modelPath), workerExecutor);
    } catch (RejectedExecutionException e) {
      String reason = "loader task rejected: " + e.getMessage();
      state.failLoading(reason);
      return CompletableFuture.failedFuture(new ModelLoadException(modelPath, reason, e));
    }
  }

  private EngineStatus load(String modelPath) {
    log.info("Engine {} loading model from {}", engineId, modelPath);
    String failure = null;
    RuntimeException cause = null;
    if (modelPath == null || modelPath.isBlank()) {
      failure = "model path is empty";
    } else {
      try {
        if (!resourceCheck.exists(modelPath)) {
          failure = "required model files not found";
        }
      } catch (RuntimeException e) {
        failure = "resource check failed: " + e.getMessage();
        cause = e;
      }
    }

    if (failure != null) {
      state.failLoading(failure);
      meterRegistry.counter("engine.loads", "result", "failed").increment();
      log.warn("Engine {} failed to load model from {}: {}", engineId, modelPath, failure);
      throw cause == null
          ? new ModelLoadException(modelPath, failure)
          : new ModelLoadException(modelPath, failure, cause);
    }
    if (!state.completeLoading()) {
      throw new EngineLifecycleException(
          state.phase(), "Engine " + engineId + " was shut down while loading " + modelPath);
    }
    meterRegistry.counter("engine.loads", "result", "ready").increment();
    log.info("Engine {} ready with model {}", engineId, modelPath);
    return getStatus();
  }

  /**
   * Changes one generation parameter. Takes effect for generations started afterwards.
   *
   * @param key wire name ({@code top_p}) or camel-case alias ({@code topP})
   */
  public GenerationParameters setParameter(String key, double value) {
    ParameterKey parameterKey = ParameterKey.fromName(key);
    GenerationParameters updated = state.updateParameter(parameterKey, value);
    log.info("Engine {} parameter {} set to {}", engineId, parameterKey.getWireName(), value);
    return updated;
  }

  /**
   * Returns the engine to READY, cancelling and invalidating any active generation. The
   * invalidated generation's sink is released without a terminal call.
   */
  public void reset() {
    Optional<UUID> superseded = state.reset();
    superseded.map(liveGenerations::get).ifPresent(generation -> generation.token().cancel());
    if (superseded.isPresent()) {
      log.info("Engine {} reset; generation {} superseded", engineId, superseded.get());
    } else {
      log.info("Engine {} reset", engineId);
    }
  }

  /**
   * Closes the engine, cancelling live generations and waiting for their tasks to exit. Each
   * cancelled generation's sink receives {@code error("cancelled")}; a generation whose sink is
   * still attaching gets it before {@code streamGenerate} returns. Idempotent.
   *
   * @throws ResourceLeakException if tasks are still running when the shutdown timeout elapses; the
   *     engine is CLOSED regardless
   */
  public void shutdown() {
    if (!state.close()) {
      log.debug("Engine {} already closed", engineId);
      return;
    }
    List<Generation> pending = List.copyOf(liveGenerations.values());
    log.info("Shutting down engine {} with {} live generation(s)", engineId, pending.size());
    pending.forEach(generation -> generation.token().cancel());

    long deadline = System.nanoTime() + shutdownTimeout.toNanos();
    List<UUID> leaked = new ArrayList<>();
    for (Generation generation : pending) {
      boolean workerJoined = awaitTask(generation.workerDone, deadline);
      if (!workerJoined) {
        // the delivery loop would otherwise wait on a worker that never finishes the channel
        generation.channel.finish();
      }
      boolean deliveryJoined = awaitTask(generation.deliveryDone, deadline);
      if (!workerJoined || !deliveryJoined) {
        leaked.add(generation.id());
      }
    }

    if (!leaked.isEmpty()) {
      meterRegistry.counter("engine.resource.leaks").increment(leaked.size());
      log.error(
          "Engine {} closed with {} task(s) still running after {} ms: {}",
          engineId,
          leaked.size(),
          shutdownTimeout.toMillis(),
          leaked);
      throw new ResourceLeakException(engineId, leaked, shutdownTimeout.toMillis());
    }
    log.info("Engine {} closed", engineId);
  }

  @Override
  public void close() {
    shutdown();
  }

  // ==================== Generation ====================

  /**
   * Generates a complete reply, blocking until the generation settles or the generate timeout
   * elapses.
   *
   * @throws GenerationFailedException if the generation fails, is cancelled, is superseded or times
   *     out
   */
  public String generate(String prompt) {
    return generateResult(prompt).text();
  }

  /** Like {@link #generate(String)}, also reporting the generation id and fragment count. */
  public GenerationResult generateResult(String prompt) {
    AccumulatingSink sink = new AccumulatingSink();
    GenerationHandle handle = streamGenerate(prompt, sink);
    UUID generationId = handle.getGenerationId();

    Optional<GenerationOutcome> outcome;
    try {
      outcome = handle.awaitOutcome(generateTimeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(handle);
      throw new GenerationFailedException(
          generationId, "Interrupted while waiting for generation", e);
    }
    if (outcome.isEmpty()) {
      cancel(handle);
      throw new GenerationFailedException(
          generationId, "Generation timed out after " + generateTimeout.toMillis() + " ms");
    }

    return switch (outcome.get()) {
      case COMPLETED, TRUNCATED -> new GenerationResult(
          generationId, sink.getText(), handle.getDeliveredFragments(), outcome.get());
      case CANCELLED -> throw new GenerationFailedException(generationId, CANCELLED_MESSAGE);
      case FAILED -> throw new GenerationFailedException(
          generationId, sink.getErrorMessage().orElse("Generation failed"));
      case SUPERSEDED -> throw new GenerationFailedException(
          generationId, "Generation was superseded by a reset");
    };
  }

  /**
   * Starts a generation and returns immediately. Fragments, then exactly one of {@code complete}
   * or {@code error}, are delivered to {@code sink} on the delivery executor.
   *
   * @throws com.flamingo.ai.studybuddy.exception.GenerationInProgressException if a generation is
   *     already active
   * @throws com.flamingo.ai.studybuddy.exception.EngineNotInitializedException if the engine is not
   *     READY
   * @throws GenerationFailedException if the sink cannot be attached or a task cannot be scheduled
   */
  public GenerationHandle streamGenerate(String prompt, CallbackSink sink) {
    Objects.requireNonNull(prompt, "prompt");
    Objects.requireNonNull(sink, "sink");

    GenerationTicket ticket = state.beginGeneration();
    UUID generationId = ticket.generationId();
    CancellationToken token = new CancellationToken();
    GenerationHandle handle = new GenerationHandle(engineId, generationId, token);

    SinkLease lease;
    try {
      lease = SinkLease.acquire(generationId, sink);
    } catch (RuntimeException e) {
      state.finishGeneration(generationId);
      handle.settle(GenerationOutcome.FAILED);
      throw new GenerationFailedException(
          generationId, "Sink could not be attached: " + e.getMessage(), e);
    }

    Generation generation =
        new Generation(prompt, ticket.parameters(), handle, new TokenChannel(generationId), lease);
    liveGenerations.put(generationId, generation);
    CompletableFuture.allOf(generation.workerDone, generation.deliveryDone)
        .whenComplete((ignored, error) -> liveGenerations.remove(generationId));
    if (!state.isCurrent(generationId)) {
      // reset or shutdown ran while the sink was attaching; no task is started
      return abandon(generation);
    }

    meterRegistry.counter("engine.generations.started").increment();
    log.debug(
        "Engine {} starting generation {} (prompt length: {}, {})",
        engineId,
        generationId,
        prompt.length(),
        ticket.parameters());

    try {
      workerExecutor.execute(() -> produce(generation));
    } catch (RejectedExecutionException e) {
      generation.workerDone.complete(null);
      throw rollBack(generation, "worker", e);
    }
    try {
      deliveryExecutor.execute(() -> deliver(generation));
    } catch (RejectedExecutionException e) {
      token.cancel();
      throw rollBack(generation, "delivery", e);
    }
    return handle;
  }

  /**
   * Requests cooperative cancellation. The sink then receives {@code error("cancelled")} unless the
   * generation settled first.
   *
   * @return {@code false} if the handle belongs to another engine or has already settled
   */
  public boolean cancel(GenerationHandle handle) {
    if (!engineId.equals(handle.getEngineId())) {
      log.warn(
          "Ignoring cancel for generation {} of engine {}", handle.getGenerationId(), engineId);
      return false;
    }
    if (handle.isDone()) {
      return false;
    }
    handle.getCancellationToken().cancel();
    log.info(
        "Engine {} cancellation requested for generation {}", engineId, handle.getGenerationId());
    return true;
  }

  /** @return {@code false} if no live generation has this id */
  public boolean cancel(UUID generationId) {
    Generation generation = liveGenerations.get(generationId);
    return generation != null && cancel(generation.handle);
  }

  private GenerationHandle abandon(Generation generation) {
    log.debug(
        "Engine {} generation {} invalidated before its tasks started", engineId, generation.id());
    GenerationOutcome outcome = GenerationOutcome.FAILED;
    try {
      outcome = settleInvalidated(generation);
    } catch (RuntimeException e) {
      log.warn("Sink for generation {} failed: {}", generation.id(), e.getMessage(), e);
    } finally {
      generation.channel.finish();
      generation.lease.close();
      generation.workerDone.complete(null);
      recordOutcome(generation, outcome);
      generation.handle.settle(outcome);
      generation.deliveryDone.complete(null);
    }
    return generation.handle;
  }

  private GenerationFailedException rollBack(
      Generation generation, String task, RejectedExecutionException cause) {
    UUID generationId = generation.id();
    log.warn(
        "Engine {} could not schedule {} task for generation {}", engineId, task, generationId);
    state.finishGeneration(generationId);
    generation.channel.finish();
    generation.lease.close();
    generation.deliveryDone.complete(null);
    generation.handle.settle(GenerationOutcome.FAILED);
    return new GenerationFailedException(
        generationId, "Could not schedule " + task + " task: " + cause.getMessage(), cause);
  }

  // ==================== Worker ====================

  private void produce(Generation generation) {
    UUID generationId = generation.id();
    CancellationToken token = generation.token();
    TokenChannel channel = generation.channel;
    int limit = generation.parameters.maxGenLen();
    int produced = 0;

    try (Stream<String> fragments =
        generationSource.startGeneration(generation.prompt, generation.parameters, token)) {
      Iterator<String> iterator = fragments.iterator();
      while (!token.isCancellationRequested() && produced < limit && iterator.hasNext()) {
        String fragment = iterator.next();
        if (fragment == null) {
          continue;
        }
        channel.push(Fragment.text(fragment));
        produced++;
      }

      if (!token.isCancellationRequested() && produced >= limit && iterator.hasNext()) {
        generation.truncated = true;
        log.debug("Generation {} stopped at max_gen_len {}", generationId, limit);
      }
      if (token.isCancellationRequested()) {
        channel.push(Fragment.error(CANCELLED_MESSAGE));
      } else {
        channel.push(Fragment.endOfStream());
      }
    } catch (RuntimeException e) {
      if (token.isCancellationRequested()) {
        log.debug(
            "Generation {} source stopped after cancellation: {}", generationId, e.getMessage());
        channel.push(Fragment.error(CANCELLED_MESSAGE));
      } else {
        log.warn(
            "Generation {} failed after {} fragment(s): {}",
            generationId,
            produced,
            e.getMessage(),
            e);
        channel.push(Fragment.error(describe(e)));
      }
    } finally {
      channel.finish();
      generation.workerDone.complete(null);
    }
  }

  // ==================== Delivery ====================

  private void deliver(Generation generation) {
    UUID generationId = generation.id();
    GenerationOutcome outcome = GenerationOutcome.FAILED;
    try {
      outcome = drain(generation);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      generation.token().cancel();
      outcome = settleTerminal(generation, GenerationOutcome.CANCELLED, CANCELLED_MESSAGE);
    } catch (RuntimeException e) {
      log.warn("Sink for generation {} failed: {}", generationId, e.getMessage(), e);
      generation.token().cancel();
      outcome = settleSinkFailure(generation, e);
    } finally {
      generation.lease.close();
      recordOutcome(generation, outcome);
      generation.handle.settle(outcome);
      generation.deliveryDone.complete(null);
    }
  }

  private GenerationOutcome drain(Generation generation) throws InterruptedException {
    UUID generationId = generation.id();
    while (true) {
      Optional<Fragment> next = generation.channel.pop();
      if (!state.isCurrent(generationId)) {
        log.debug(
            "Generation {} invalidated; discarding {} pending fragment(s)",
            generationId,
            (next.isPresent() ? 1 : 0) + generation.channel.size());
        return settleInvalidated(generation);
      }
      if (next.isEmpty()) {
        return settleTerminal(generation, GenerationOutcome.FAILED, MISSING_TERMINAL_MESSAGE);
      }

      Fragment fragment = next.get();
      if (fragment instanceof Fragment.Text text) {
        if (generation.lease.deliver(text.text())) {
          generation.handle.recordDelivered();
          log.trace(
              "Generation {} delivered fragment {}",
              generationId,
              generation.handle.getDeliveredFragments());
        }
      } else if (fragment instanceof Fragment.Error error) {
        GenerationOutcome outcome =
            generation.token().isCancellationRequested()
                ? GenerationOutcome.CANCELLED
                : GenerationOutcome.FAILED;
        return settleTerminal(generation, outcome, error.message());
      } else {
        if (!state.finishGeneration(generationId)) {
          return settleInvalidated(generation);
        }
        generation.lease.complete();
        return generation.truncated ? GenerationOutcome.TRUNCATED : GenerationOutcome.COMPLETED;
      }
    }
  }

  /** Returns to READY and signals {@code error(message)}, unless the generation was invalidated. */
  private GenerationOutcome settleTerminal(
      Generation generation, GenerationOutcome outcome, String message) {
    if (!state.finishGeneration(generation.id())) {
      return settleInvalidated(generation);
    }
    generation.lease.error(message);
    return outcome;
  }

  /**
   * Settles a generation whose id is no longer current. A shutdown cancels it and the sink gets
   * {@code error("cancelled")}; a reset supersedes it and the sink gets no terminal call.
   */
  private GenerationOutcome settleInvalidated(Generation generation) {
    generation.token().cancel();
    if (state.phase() == EnginePhase.CLOSED) {
      generation.lease.error(CANCELLED_MESSAGE);
      return GenerationOutcome.CANCELLED;
    }
    return GenerationOutcome.SUPERSEDED;
  }

  private GenerationOutcome settleSinkFailure(Generation generation, RuntimeException failure) {
    GenerationOutcome outcome = GenerationOutcome.FAILED;
    String message = "Sink failed: " + describe(failure);
    if (!state.finishGeneration(generation.id())) {
      if (state.phase() != EnginePhase.CLOSED) {
        return GenerationOutcome.SUPERSEDED;
      }
      outcome = GenerationOutcome.CANCELLED;
      message = CANCELLED_MESSAGE;
    }
    try {
      generation.lease.error(message);
    } catch (RuntimeException e) {
      log.warn(
          "Sink for generation {} also rejected the error signal: {}",
          generation.id(),
          e.getMessage(),
          e);
    }
    return outcome;
  }

  private void recordOutcome(Generation generation, GenerationOutcome outcome) {
    long elapsedNanos = System.nanoTime() - generation.startedNanos;
    String tag = outcome.name().toLowerCase(Locale.ROOT);
    meterRegistry.counter("engine.generations.finished", "outcome", tag).increment();
    meterRegistry
        .counter("engine.fragments.delivered")
        .increment(generation.handle.getDeliveredFragments());
    meterRegistry
        .timer("engine.generation.duration", "outcome", tag)
        .record(elapsedNanos, TimeUnit.NANOSECONDS);
    log.debug(
        "Generation {} finished: {} ({} fragment(s), {} ms)",
        generation.id(),
        outcome,
        generation.handle.getDeliveredFragments(),
        TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
  }

  private static String describe(Throwable failure) {
    return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
  }

  private static boolean awaitTask(CompletableFuture<Void> task, long deadlineNanos) {
    long remaining = Math.max(deadlineNanos - System.nanoTime(), 0);
    try {
      task.get(remaining, TimeUnit.NANOSECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return task.isDone();
    } catch (ExecutionException e) {
      // task futures are only ever completed normally
      throw new IllegalStateException(e.getCause());
    }
  }

  /** Per-generation bookkeeping shared by the worker and the delivery loop. */
  private static final class Generation {

    private final String prompt;
    private final GenerationParameters parameters;
    private final GenerationHandle handle;
    private final TokenChannel channel;
    private final SinkLease lease;
    private final CompletableFuture<Void> workerDone = new CompletableFuture<>();
    private final CompletableFuture<Void> deliveryDone = new CompletableFuture<>();
    private final long startedNanos = System.nanoTime();
    private volatile boolean truncated;

    private Generation(
        String prompt,
        GenerationParameters parameters,
        GenerationHandle handle,
        TokenChannel channel,
        SinkLease lease) {
      this.prompt = prompt;
      this.parameters = parameters;
      this.handle = handle;
      this.channel = channel;
      this.lease = lease;
    }

    private UUID id() {
      return handle.getGenerationId();
    }

    private CancellationToken token() {
      return handle.getCancellationToken();
    }
  }
}
