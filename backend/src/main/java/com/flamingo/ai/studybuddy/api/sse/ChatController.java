package com.flamingo.ai.studybuddy.api.sse;

import com.flamingo.ai.studybuddy.api.dto.request.ChatRequest;
import com.flamingo.ai.studybuddy.api.dto.response.GenerateResponse;
import com.flamingo.ai.studybuddy.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.studybuddy.service.chat.ChatService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for prompting engines, with SSE streaming support. */
@RestController
@RequestMapping("/api/engines/{engineId}")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

  private final ChatService chatService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams a reply using Server-Sent Events. Closing the connection cancels the generation.
   *
   * @param engineId the engine ID
   * @param request the chat request containing the user message
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamChunkResponse> streamChat(
      @PathVariable UUID engineId, @Valid @RequestBody ChatRequest request) {

    Flux<StreamChunkResponse> stream = chatService.streamChat(engineId, request.getMessage());
    log.info("Starting chat stream for engine {}", engineId);
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return stream
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream completed for engine {}", engineId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Chat stream error for engine {}: {}", engineId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream cancelled for engine {}", engineId);
            });
  }

  /**
   * Generates a complete reply.
   *
   * @param engineId the engine ID
   * @param request the chat request containing the user message
   * @return the generated text with its generation id
   */
  @PostMapping("/chat")
  public ResponseEntity<GenerateResponse> chat(
      @PathVariable UUID engineId, @Valid @RequestBody ChatRequest request) {
    return ResponseEntity.ok(chatService.generate(engineId, request.getMessage()));
  }

  /**
   * Cancels a live generation.
   *
   * @return 202 if cancellation was requested, 404 if the generation is not live
   */
  @DeleteMapping("/generations/{generationId}")
  public ResponseEntity<Void> cancelGeneration(
      @PathVariable UUID engineId, @PathVariable UUID generationId) {
    log.info("Cancel requested for generation {} on engine {}", generationId, engineId);
    return chatService.cancelGeneration(engineId, generationId)
        ? ResponseEntity.accepted().build()
        : ResponseEntity.notFound().build();
  }
}
