package com.flamingo.ai.studybuddy.api.dto.response;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for SSE streaming chunks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamChunkResponse {

  public static final String STARTED = "started";
  public static final String TOKEN = "token";
  public static final String DONE = "done";
  public static final String ERROR = "error";

  /** Event type: started, token, done, error. */
  private String eventType;

  /** Event data (JSON object). */
  private Object data;

  /** Creates a started event carrying the id a client needs to cancel the generation. */
  public static StreamChunkResponse started(UUID generationId) {
    return StreamChunkResponse.builder()
        .eventType(STARTED)
        .data(new StartedData(generationId))
        .build();
  }

  /** Creates a token event. */
  public static StreamChunkResponse token(String content) {
    return StreamChunkResponse.builder().eventType(TOKEN).data(new TokenData(content)).build();
  }

  /** Creates a done event. */
  public static StreamChunkResponse done(UUID generationId, int fragmentCount) {
    return StreamChunkResponse.builder()
        .eventType(DONE)
        .data(new DoneData(generationId, fragmentCount))
        .build();
  }

  /** Creates an error event. */
  public static StreamChunkResponse error(String errorId, String message) {
    return StreamChunkResponse.builder()
        .eventType(ERROR)
        .data(new ErrorData(errorId, message))
        .build();
  }

  /** Started event data. */
  @Data
  @AllArgsConstructor
  public static class StartedData {
    private UUID generationId;
  }

  /** Token event data. */
  @Data
  @AllArgsConstructor
  public static class TokenData {
    private String content;
  }

  /** Done event data. */
  @Data
  @AllArgsConstructor
  public static class DoneData {
    private UUID generationId;
    private int fragmentCount;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String errorId;
    private String message;
  }
}
