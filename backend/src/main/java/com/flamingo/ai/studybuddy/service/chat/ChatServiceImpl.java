package com.flamingo.ai.studybuddy.service.chat;

import com.flamingo.ai.studybuddy.api.dto.response.GenerateResponse;
import com.flamingo.ai.studybuddy.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.studybuddy.engine.GenerationHandle;
import com.flamingo.ai.studybuddy.engine.GenerationResult;
import com.flamingo.ai.studybuddy.engine.StreamingEngine;
import com.flamingo.ai.studybuddy.service.engine.EngineService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/** Implementation of ChatService on top of the engine registry. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

  private final EngineService engineService;
  private final MeterRegistry meterRegistry;

  @Override
  public Flux<StreamChunkResponse> streamChat(UUID engineId, String userMessage) {
    StreamingEngine engine = engineService.getEngine(engineId);
    FluxCallbackSink sink = new FluxCallbackSink();

    GenerationHandle handle = engine.streamGenerate(userMessage, sink);
    meterRegistry.counter("chat.streams.started").increment();
    log.debug("Streaming generation {} on engine {}", handle.getGenerationId(), engineId);

    return sink.asFlux()
        .doOnCancel(
            () -> {
              if (engine.cancel(handle)) {
                meterRegistry.counter("chat.streams.abandoned").increment();
                log.info(
                    "Client left generation {} on engine {}; cancelling",
                    handle.getGenerationId(),
                    engineId);
              }
            });
  }

  @Override
  @Timed(value = "chat.generate", description = "Time to generate a complete reply")
  public GenerateResponse generate(UUID engineId, String userMessage) {
    StreamingEngine engine = engineService.getEngine(engineId);
    GenerationResult result = engine.generateResult(userMessage);
    meterRegistry.counter("chat.generations.completed").increment();
    log.debug(
        "Generation {} on engine {} returned {} fragment(s)",
        result.generationId(),
        engineId,
        result.fragmentCount());
    return GenerateResponse.fromResult(result);
  }

  @Override
  public boolean cancelGeneration(UUID engineId, UUID generationId) {
    boolean cancelled = engineService.getEngine(engineId).cancel(generationId);
    if (cancelled) {
      meterRegistry.counter("chat.generations.cancelled").increment();
    }
    return cancelled;
  }
}
