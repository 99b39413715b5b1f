package com.flamingo.ai.studybuddy.service.chat;

import com.flamingo.ai.studybuddy.api.dto.response.GenerateResponse;
import com.flamingo.ai.studybuddy.api.dto.response.StreamChunkResponse;
import java.util.UUID;
import reactor.core.publisher.Flux;

/** Service for prompting engines over HTTP. */
public interface ChatService {

  /**
   * Streams a reply for the given message. Lifecycle errors are thrown before the flux is
   * returned; generation errors arrive as an {@code error} chunk.
   *
   * @param engineId the engine ID
   * @param userMessage the user's message
   * @return a Flux of stream chunk responses; cancelling it cancels the generation
   */
  Flux<StreamChunkResponse> streamChat(UUID engineId, String userMessage);

  /**
   * Generates a complete reply, blocking until it settles.
   *
   * @param engineId the engine ID
   * @param userMessage the user's message
   * @return the generated reply
   */
  GenerateResponse generate(UUID engineId, String userMessage);

  /**
   * Requests cancellation of a live generation.
   *
   * @return false if the engine has no live generation with this id
   */
  boolean cancelGeneration(UUID engineId, UUID generationId);
}
