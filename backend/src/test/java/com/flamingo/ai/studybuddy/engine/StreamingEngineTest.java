package com.flamingo.ai.studybuddy.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.studybuddy.engine.source.GenerationSource;
import com.flamingo.ai.studybuddy.exception.EngineLifecycleException;
import com.flamingo.ai.studybuddy.exception.EngineNotInitializedException;
import com.flamingo.ai.studybuddy.exception.GenerationFailedException;
import com.flamingo.ai.studybuddy.exception.GenerationInProgressException;
import com.flamingo.ai.studybuddy.exception.InvalidParameterException;
import com.flamingo.ai.studybuddy.exception.ModelLoadException;
import com.flamingo.ai.studybuddy.exception.ResourceLeakException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StreamingEngine")
class StreamingEngineTest {

  private static final String MODEL_PATH = "/models/tiny-llama";
  private static final Duration WAIT = Duration.ofSeconds(5);

  private ExecutorService workerExecutor;
  private ExecutorService deliveryExecutor;
  private SimpleMeterRegistry meterRegistry;
  private GatedSource gatedSource;

  @BeforeEach
  void setUp() {
    workerExecutor = Executors.newCachedThreadPool(named("test-worker-"));
    deliveryExecutor = Executors.newCachedThreadPool(named("test-delivery-"));
    meterRegistry = new SimpleMeterRegistry();
    gatedSource = new GatedSource();
  }

  @AfterEach
  void tearDown() {
    workerExecutor.shutdownNow();
    deliveryExecutor.shutdownNow();
  }

  private StreamingEngine.StreamingEngineBuilder engineBuilder(GenerationSource source) {
    return StreamingEngine.builder()
        .generationSource(source)
        .resourceCheck(MODEL_PATH::equals)
        .workerExecutor(workerExecutor)
        .deliveryExecutor(deliveryExecutor)
        .meterRegistry(meterRegistry)
        .shutdownTimeout(Duration.ofSeconds(2))
        .generateTimeout(WAIT);
  }

  private StreamingEngine readyEngine(GenerationSource source) {
    StreamingEngine engine = engineBuilder(source).build();
    engine.initialize(MODEL_PATH);
    return engine;
  }

  private static GenerationSource fixed(String... fragments) {
    return (prompt, parameters, token) -> Stream.of(fragments);
  }

  private static ThreadFactory named(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static GenerationOutcome awaitOutcome(GenerationHandle handle) throws Exception {
    return handle.completion().get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("initialize with a reachable model moves to READY")
    void shouldBecomeReady_whenModelExists() {
      StreamingEngine engine = engineBuilder(gatedSource).build();

      EngineStatus status = engine.initialize(MODEL_PATH);

      assertThat(status.phase()).isEqualTo(EnginePhase.READY);
      assertThat(status.modelPath()).isEqualTo(MODEL_PATH);
      assertThat(status.parameters()).isEqualTo(GenerationParameters.defaults());
      assertThat(status.modelInfo()).contains(MODEL_PATH);
    }

    @Test
    @DisplayName("initialize with a missing model fails and leaves the engine FAILED")
    void shouldFail_whenModelMissing() {
      StreamingEngine engine = engineBuilder(gatedSource).build();

      assertThatThrownBy(() -> engine.initialize("/models/missing"))
          .isInstanceOf(ModelLoadException.class)
          .hasMessageContaining("/models/missing");

      EngineStatus status = engine.getStatus();
      assertThat(status.phase()).isEqualTo(EnginePhase.FAILED);
      assertThat(status.failureReason()).isEqualTo("required model files not found");
      assertThatThrownBy(() -> engine.streamGenerate("hi", new RecordingSink()))
          .isInstanceOf(EngineNotInitializedException.class)
          .hasMessageContaining("required model files not found");
    }

    @Test
    @DisplayName("a FAILED engine can be initialized again")
    void shouldRecover_whenReinitializedAfterFailure() {
      StreamingEngine engine = engineBuilder(fixed("ok")).build();
      assertThatThrownBy(() -> engine.initialize("/models/missing"))
          .isInstanceOf(ModelLoadException.class);

      engine.initialize(MODEL_PATH);

      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
      assertThat(engine.getStatus().failureReason()).isNull();
      assertThat(engine.generate("hello")).isEqualTo("ok");
    }

    @Test
    @DisplayName("a resource check that throws is reported as a load failure")
    void shouldFail_whenResourceCheckThrows() {
      StreamingEngine engine =
          engineBuilder(gatedSource)
              .resourceCheck(
                  path -> {
                    throw new IllegalStateException("disk unavailable");
                  })
              .build();

      assertThatThrownBy(() -> engine.initialize(MODEL_PATH))
          .isInstanceOf(ModelLoadException.class)
          .hasCauseInstanceOf(IllegalStateException.class);
      assertThat(engine.getStatus().failureReason()).contains("disk unavailable");
    }

    @Test
    @DisplayName("an empty model path fails without consulting the resource check")
    void shouldFail_whenModelPathBlank() {
      AtomicInteger checks = new AtomicInteger();
      StreamingEngine engine =
          engineBuilder(gatedSource)
              .resourceCheck(
                  path -> {
                    checks.incrementAndGet();
                    return true;
                  })
              .build();

      assertThatThrownBy(() -> engine.initialize("  ")).isInstanceOf(ModelLoadException.class);
      assertThat(checks).hasValue(0);
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.FAILED);
    }

    @Test
    @DisplayName("initialize is rejected once the engine is READY")
    void shouldRejectInitialize_whenAlreadyReady() {
      StreamingEngine engine = readyEngine(gatedSource);

      assertThatThrownBy(() -> engine.initialize(MODEL_PATH))
          .isInstanceOf(EngineLifecycleException.class);
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
    }

    @Test
    @DisplayName("initializeAsync is LOADING until the check returns")
    void shouldExposeLoadingPhase_whenInitializingAsync() throws Exception {
      CountDownLatch release = new CountDownLatch(1);
      StreamingEngine engine =
          engineBuilder(gatedSource)
              .resourceCheck(
                  path -> {
                    try {
                      return release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                      Thread.currentThread().interrupt();
                      return false;
                    }
                  })
              .build();

      CompletableFuture<EngineStatus> loading =
          engine.initializeAsync(MODEL_PATH, GenerationParameters.defaults());

      assertThat(engine.getPhase()).isEqualTo(EnginePhase.LOADING);
      assertThatThrownBy(() -> engine.streamGenerate("hi", new RecordingSink()))
          .isInstanceOf(EngineNotInitializedException.class);

      release.countDown();
      assertThat(loading.get(5, TimeUnit.SECONDS).phase()).isEqualTo(EnginePhase.READY);
    }

    @Test
    @DisplayName("generate before initialize fails with NotInitialized")
    void shouldRejectGenerate_whenUninitialized() {
      StreamingEngine engine = engineBuilder(gatedSource).build();

      assertThatThrownBy(() -> engine.generate("hello"))
          .isInstanceOf(EngineNotInitializedException.class);
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.UNINITIALIZED);
    }

    @Test
    @DisplayName("shutdown twice is a no-op the second time")
    void shouldBeIdempotent_whenShutdownTwice() {
      StreamingEngine engine = readyEngine(gatedSource);

      engine.shutdown();
      engine.close();

      assertThat(engine.getPhase()).isEqualTo(EnginePhase.CLOSED);
      assertThatThrownBy(() -> engine.streamGenerate("hi", new RecordingSink()))
          .isInstanceOf(EngineNotInitializedException.class);
      assertThatThrownBy(() -> engine.initialize(MODEL_PATH))
          .isInstanceOf(EngineLifecycleException.class);
    }
  }

  @Nested
  @DisplayName("Streaming")
  class Streaming {

    @Test
    @DisplayName("generate returns the concatenated reply and leaves the engine READY")
    void shouldReturnFullText_whenGenerating() {
      StreamingEngine engine = readyEngine(fixed("Hel", "lo", " there"));

      String reply = engine.generate("hello");

      assertThat(reply).isEqualTo("Hello there");
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
      assertThat(engine.getStatus().activeGenerationId()).isNull();
    }

    @Test
    @DisplayName("fragments reach the sink in order, once each, followed by one complete")
    void shouldDeliverInOrder_whenStreaming() throws Exception {
      List<String> produced = IntStream.range(0, 200).mapToObj(i -> "f" + i + " ").toList();
      StreamingEngine engine =
          readyEngine((prompt, parameters, token) -> produced.stream());
      RecordingSink sink = new RecordingSink();

      GenerationHandle handle = engine.streamGenerate("count", sink);

      assertThat(awaitOutcome(handle)).isEqualTo(GenerationOutcome.COMPLETED);
      assertThat(sink.fragments()).containsExactlyElementsOf(produced);
      assertThat(sink.completeCount()).isEqualTo(1);
      assertThat(sink.errorCount()).isZero();
      assertThat(sink.attachCount()).isEqualTo(1);
      assertThat(sink.detachCount()).isEqualTo(1);
      assertThat(sink.attachedGenerationId()).isEqualTo(handle.getGenerationId());
      assertThat(handle.getDeliveredFragments()).isEqualTo(200);
      assertThat(meterRegistry.counter("engine.fragments.delivered").count()).isEqualTo(200.0);
    }

    @Test
    @DisplayName("the sink is never called on the worker thread")
    void shouldDeliverOnDeliveryThread_whenStreaming() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      RecordingSink sink = new RecordingSink();

      GenerationHandle handle = engine.streamGenerate("threads", sink);
      gatedSource.emit("a", "b", "c");
      gatedSource.end();

      assertThat(awaitOutcome(handle)).isEqualTo(GenerationOutcome.COMPLETED);
      assertThat(gatedSource.producerThreads()).allMatch(name -> name.startsWith("test-worker-"));
      assertThat(sink.callbackThreads()).allMatch(name -> name.startsWith("test-delivery-"));
    }

    @Test
    @DisplayName("a second generation is rejected while one is running; the first still completes")
    void shouldRejectSecondGeneration_whenAlreadyGenerating() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      RecordingSink sinkA = new RecordingSink();
      RecordingSink sinkB = new RecordingSink();

      GenerationHandle first = engine.streamGenerate("x", sinkA);

      assertThatThrownBy(() -> engine.streamGenerate("y", sinkB))
          .isInstanceOf(GenerationInProgressException.class)
          .hasMessageContaining(first.getGenerationId().toString());
      assertThat(sinkB.attachCount()).isZero();

      gatedSource.emit("one", "two");
      gatedSource.end();

      assertThat(awaitOutcome(first)).isEqualTo(GenerationOutcome.COMPLETED);
      assertThat(sinkA.text()).isEqualTo("onetwo");
      assertThat(sinkA.completeCount()).isEqualTo(1);
      assertThat(gatedSource.seenParameters()).hasSize(1);
    }

    @Test
    @DisplayName("null fragments from the source are skipped")
    void shouldSkipNullFragments() {
      StreamingEngine engine =
          readyEngine((prompt, parameters, token) -> Stream.of("a", null, "b"));

      assertThat(engine.generate("nulls")).isEqualTo("ab");
    }

    @Test
    @DisplayName("generation stops at max_gen_len and completes normally")
    void shouldTruncate_whenMaxGenLenReached() throws Exception {
      StreamingEngine engine = readyEngine(fixed("1", "2", "3", "4", "5", "6"));
      engine.setParameter("max_gen_len", 3);
      RecordingSink sink = new RecordingSink();

      GenerationHandle handle = engine.streamGenerate("long", sink);

      assertThat(awaitOutcome(handle)).isEqualTo(GenerationOutcome.TRUNCATED);
      assertThat(sink.fragments()).containsExactly("1", "2", "3");
      assertThat(sink.completeCount()).isEqualTo(1);
      assertThat(engine.generateResult("long").isTruncated()).isTrue();
    }

    @Test
    @DisplayName("a source that ends exactly at max_gen_len completes without truncation")
    void shouldComplete_whenSourceEndsExactlyAtMaxGenLen() throws Exception {
      StreamingEngine engine = readyEngine(fixed("1", "2", "3"));
      engine.setParameter("max_gen_len", 3);
      RecordingSink sink = new RecordingSink();

      GenerationHandle handle = engine.streamGenerate("exact", sink);

      assertThat(awaitOutcome(handle)).isEqualTo(GenerationOutcome.COMPLETED);
      assertThat(sink.text()).isEqualTo("123");
      GenerationResult result = engine.generateResult("exact");
      assertThat(result.outcome()).isEqualTo(GenerationOutcome.COMPLETED);
      assertThat(result.isTruncated()).isFalse();
    }

    @Test
    @DisplayName("a failing source reports error to the sink and the engine stays usable")
    void shouldReportErrorAndRecover_whenSourceFails() throws Exception {
      AtomicInteger calls = new AtomicInteger();
      GenerationSource source =
          (prompt, parameters, token) -> {
            if (calls.incrementAndGet() == 1) {
              return Stream.concat(
                  Stream.of("a", "b"),
                  Stream.<String>generate(
                          () -> {
                            throw new IllegalStateException("model crashed");
                          })
                      .limit(1));
            }
            return Stream.of("fine");
          };
      StreamingEngine engine = readyEngine(source);
      RecordingSink sink = new RecordingSink();

      GenerationHandle handle = engine.streamGenerate("boom", sink);

      assertThat(awaitOutcome(handle)).isEqualTo(GenerationOutcome.FAILED);
      assertThat(sink.fragments()).containsExactly("a", "b");
      assertThat(sink.errorMessage()).isEqualTo("model crashed");
      assertThat(sink.completeCount()).isZero();
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
      assertThat(engine.generate("again")).isEqualTo("fine");
    }

    @Test
    @DisplayName("generate surfaces a source failure as GenerationFailedException")
    void shouldThrow_whenSynchronousGenerationFails() {
      StreamingEngine engine =
          readyEngine(
              (prompt, parameters, token) -> {
                throw new IllegalStateException("no weights");
              });

      assertThatThrownBy(() -> engine.generate("hello"))
          .isInstanceOf(GenerationFailedException.class)
          .hasMessage("no weights");
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
    }

    @Test
    @DisplayName("parameter changes apply to the next generation, not the running one")
    void shouldSnapshotParameters_whenGenerationStarts() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      GenerationHandle first = engine.streamGenerate("first", new RecordingSink());

      engine.setParameter("temperature", 1.5);
      gatedSource.end();
      awaitOutcome(first);
      gatedSource.end();
      engine.generate("second");

      assertThat(gatedSource.seenParameters())
          .extracting(GenerationParameters::temperature)
          .containsExactly(GenerationParameters.DEFAULT_TEMPERATURE, 1.5f);
    }

    @Test
    @DisplayName("a sink that throws fails the generation and is still detached")
    void shouldFailGeneration_whenSinkThrows() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      RecordingSink sink = new RecordingSink().failOnDeliver(new IllegalStateException("ui gone"));

      GenerationHandle handle = engine.streamGenerate("x", sink);
      gatedSource.emit("a");

      assertThat(awaitOutcome(handle)).isEqualTo(GenerationOutcome.FAILED);
      assertThat(handle.isCancellationRequested()).isTrue();
      assertThat(sink.errorMessage()).contains("ui gone");
      assertThat(sink.detachCount()).isEqualTo(1);
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
    }

    @Test
    @DisplayName("a sink that cannot attach rolls the engine back to READY")
    void shouldRollBack_whenSinkAttachFails() {
      StreamingEngine engine = readyEngine(gatedSource);
      RecordingSink sink = new RecordingSink().failOnAttach(new IllegalStateException("no ui"));

      assertThatThrownBy(() -> engine.streamGenerate("x", sink))
          .isInstanceOf(GenerationFailedException.class)
          .hasMessageContaining("no ui");
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
      assertThat(sink.detachCount()).isZero();
      assertThat(gatedSource.seenParameters()).isEmpty();
    }

    @Test
    @DisplayName("a rejected worker task rolls the engine back and releases the sink")
    void shouldRollBack_whenWorkerRejected() {
      StreamingEngine engine =
          engineBuilder(gatedSource)
              .workerExecutor(
                  command -> {
                    throw new RejectedExecutionException("pool full");
                  })
              .build();
      engine.initialize(MODEL_PATH);
      RecordingSink sink = new RecordingSink();

      assertThatThrownBy(() -> engine.streamGenerate("x", sink))
          .isInstanceOf(GenerationFailedException.class)
          .hasMessageContaining("pool full");
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
      assertThat(sink.attachCount()).isEqualTo(1);
      assertThat(sink.detachCount()).isEqualTo(1);
      assertThat(engine.getLiveGenerationCount()).isZero();
    }
  }

  @Nested
  @DisplayName("Cancellation and reset")
  class Cancellation {

    @Test
    @DisplayName("cancel mid-stream delivers some fragments then error(cancelled)")
    void shouldReportCancelled_whenCancelledMidStream() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      RecordingSink sink = new RecordingSink();

      GenerationHandle handle = engine.streamGenerate("long answer", sink);
      gatedSource.emit("a", "b");
      assertThat(sink.awaitFragments(2, WAIT)).isTrue();

      assertThat(engine.cancel(handle)).isTrue();

      assertThat(sink.awaitTerminal(WAIT)).isTrue();
      assertThat(sink.errorMessage()).isEqualTo(StreamingEngine.CANCELLED_MESSAGE);
      assertThat(sink.fragments()).containsExactly("a", "b");
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
      assertThat(awaitOutcome(handle)).isEqualTo(GenerationOutcome.CANCELLED);
      assertThat(engine.cancel(handle)).isFalse();
    }

    @Test
    @DisplayName("cancel by generation id")
    void shouldCancel_whenGivenGenerationId() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      RecordingSink sink = new RecordingSink();
      GenerationHandle handle = engine.streamGenerate("x", sink);

      assertThat(engine.cancel(handle.getGenerationId())).isTrue();

      assertThat(awaitOutcome(handle)).isEqualTo(GenerationOutcome.CANCELLED);
      assertThat(engine.cancel(handle.getGenerationId())).isFalse();
    }

    @Test
    @DisplayName("generate reports cancellation when the caller's generation is cancelled")
    void shouldThrowCancelled_whenBlockingGenerationCancelled() throws Exception {
      CountDownLatch started = new CountDownLatch(1);
      GenerationSource source =
          (prompt, parameters, token) -> {
            started.countDown();
            return gatedSource.startGeneration(prompt, parameters, token);
          };
      StreamingEngine engine = readyEngine(source);

      CompletableFuture<String> reply = CompletableFuture.supplyAsync(() -> engine.generate("x"));
      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
      engine.cancel(engine.getStatus().activeGenerationId());

      assertThatThrownBy(() -> reply.get(5, TimeUnit.SECONDS))
          .hasCauseInstanceOf(GenerationFailedException.class)
          .hasMessageContaining(StreamingEngine.CANCELLED_MESSAGE);
    }

    @Test
    @DisplayName("after reset, the old sink gets no further fragments and no terminal call")
    void shouldDiscardOldGeneration_whenReset() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      RecordingSink oldSink = new RecordingSink();

      GenerationHandle old = engine.streamGenerate("old", oldSink);
      gatedSource.emit("stale-1");
      assertThat(oldSink.awaitFragments(1, WAIT)).isTrue();

      engine.reset();

      assertThat(engine.getPhase()).isEqualTo(EnginePhase.READY);
      assertThat(awaitOutcome(old)).isEqualTo(GenerationOutcome.SUPERSEDED);
      assertThat(oldSink.completeCount()).isZero();
      assertThat(oldSink.errorCount()).isZero();
      assertThat(oldSink.detachCount()).isEqualTo(1);

      RecordingSink newSink = new RecordingSink();
      GenerationHandle fresh = engine.streamGenerate("new", newSink);
      gatedSource.emit("fresh");
      gatedSource.end();

      assertThat(awaitOutcome(fresh)).isEqualTo(GenerationOutcome.COMPLETED);
      assertThat(newSink.fragments()).containsExactly("fresh");
      assertThat(oldSink.fragments()).containsExactly("stale-1");
    }

    @Test
    @DisplayName("reset is rejected before initialize")
    void shouldRejectReset_whenUninitialized() {
      StreamingEngine engine = engineBuilder(gatedSource).build();

      assertThatThrownBy(engine::reset).isInstanceOf(EngineNotInitializedException.class);
    }
  }

  @Nested
  @DisplayName("Shutdown")
  class Shutdown {

    @Test
    @DisplayName("shutdown during a generation joins its tasks and sends cancelled to the sink")
    void shouldJoinTasks_whenShutdownDuringGeneration() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      RecordingSink sink = new RecordingSink();
      GenerationHandle handle = engine.streamGenerate("x", sink);
      gatedSource.emit("a");
      assertThat(sink.awaitFragments(1, WAIT)).isTrue();

      engine.shutdown();

      assertThat(engine.getPhase()).isEqualTo(EnginePhase.CLOSED);
      assertThat(handle.isDone()).isTrue();
      assertThat(handle.getOutcome()).contains(GenerationOutcome.CANCELLED);
      assertThat(sink.detachCount()).isEqualTo(1);
      assertThat(sink.completeCount()).isZero();
      assertThat(sink.errorCount()).isEqualTo(1);
      assertThat(sink.errorMessage()).isEqualTo("cancelled");
    }

    @Test
    @DisplayName("shutdown while the sink is attaching cancels the generation before it starts")
    void shouldCancelGeneration_whenShutdownDuringAttach() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      CountDownLatch attaching = new CountDownLatch(1);
      CountDownLatch releaseAttach = new CountDownLatch(1);
      RecordingSink sink = new RecordingSink().blockOnAttach(attaching, releaseAttach);
      CompletableFuture<GenerationHandle> started =
          CompletableFuture.supplyAsync(() -> engine.streamGenerate("x", sink));
      assertThat(attaching.await(5, TimeUnit.SECONDS)).isTrue();

      engine.shutdown();
      releaseAttach.countDown();
      GenerationHandle handle = started.get(5, TimeUnit.SECONDS);

      assertThat(handle.isDone()).isTrue();
      assertThat(handle.getOutcome()).contains(GenerationOutcome.CANCELLED);
      assertThat(handle.isCancellationRequested()).isTrue();
      assertThat(gatedSource.seenParameters()).isEmpty();
      assertThat(sink.errorCount()).isEqualTo(1);
      assertThat(sink.errorMessage()).isEqualTo("cancelled");
      assertThat(sink.completeCount()).isZero();
      assertThat(sink.detachCount()).isEqualTo(1);
      assertThat(engine.getPhase()).isEqualTo(EnginePhase.CLOSED);
      assertThat(engine.getLiveGenerationCount()).isZero();
    }

    @Test
    @DisplayName("a worker that ignores cancellation is reported as a resource leak")
    void shouldReportLeak_whenWorkerDoesNotStop() throws Exception {
      CountDownLatch release = new CountDownLatch(1);
      CountDownLatch started = new CountDownLatch(1);
      GenerationSource stuck =
          (prompt, parameters, token) -> {
            Iterator<String> never =
                new Iterator<>() {
                  @Override
                  public boolean hasNext() {
                    started.countDown();
                    try {
                      release.await();
                    } catch (InterruptedException e) {
                      Thread.currentThread().interrupt();
                    }
                    return false;
                  }

                  @Override
                  public String next() {
                    throw new NoSuchElementException();
                  }
                };
            return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(never, Spliterator.ORDERED), false);
          };
      StreamingEngine engine =
          engineBuilder(stuck).shutdownTimeout(Duration.ofMillis(200)).build();
      engine.initialize(MODEL_PATH);
      RecordingSink sink = new RecordingSink();
      GenerationHandle handle = engine.streamGenerate("x", sink);
      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

      try {
        assertThatThrownBy(engine::shutdown)
            .isInstanceOf(ResourceLeakException.class)
            .satisfies(
                e ->
                    assertThat(((ResourceLeakException) e).getLeakedGenerations())
                        .containsExactly(handle.getGenerationId()));
        assertThat(engine.getPhase()).isEqualTo(EnginePhase.CLOSED);
        assertThat(meterRegistry.counter("engine.resource.leaks").count()).isEqualTo(1.0);

        engine.shutdown();
      } finally {
        release.countDown();
      }
      assertThat(sink.awaitDetach(WAIT)).isTrue();
      assertThat(sink.detachCount()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Parameters")
  class Parameters {

    @Test
    @DisplayName("an out-of-range temperature is rejected and the value is unchanged")
    void shouldRejectOutOfRangeTemperature() {
      StreamingEngine engine = readyEngine(gatedSource);

      assertThatThrownBy(() -> engine.setParameter("temperature", 5.0))
          .isInstanceOf(InvalidParameterException.class)
          .hasMessageContaining("temperature");

      assertThat(engine.getStatus().parameters().temperature())
          .isEqualTo(GenerationParameters.DEFAULT_TEMPERATURE);
    }

    @Test
    @DisplayName("an unknown key is rejected")
    void shouldRejectUnknownKey() {
      StreamingEngine engine = readyEngine(gatedSource);

      assertThatThrownBy(() -> engine.setParameter("top_k", 40))
          .isInstanceOf(InvalidParameterException.class)
          .hasMessageContaining("top_k");
    }

    @Test
    @DisplayName("camel-case aliases are accepted")
    void shouldAcceptAlias() {
      StreamingEngine engine = readyEngine(gatedSource);

      GenerationParameters updated = engine.setParameter("topP", 0.5);

      assertThat(updated.topP()).isEqualTo(0.5f);
      assertThat(engine.getStatus().parameters().topP()).isEqualTo(0.5f);
    }

    @Test
    @DisplayName("parameters can change while a generation runs")
    void shouldAcceptParameter_whenGenerating() throws Exception {
      StreamingEngine engine = readyEngine(gatedSource);
      GenerationHandle handle = engine.streamGenerate("x", new RecordingSink());

      engine.setParameter("repetition_penalty", 1.3);

      assertThat(engine.getPhase()).isEqualTo(EnginePhase.GENERATING);
      gatedSource.end();
      assertThat(awaitOutcome(handle)).isEqualTo(GenerationOutcome.COMPLETED);
      assertThat(engine.getStatus().parameters().repetitionPenalty()).isEqualTo(1.3f);
    }

    @Test
    @DisplayName("parameters are rejected before initialize")
    void shouldRejectParameter_whenUninitialized() {
      StreamingEngine engine = engineBuilder(gatedSource).build();

      assertThatThrownBy(() -> engine.setParameter("temperature", 0.5))
          .isInstanceOf(EngineNotInitializedException.class);
    }
  }
}
