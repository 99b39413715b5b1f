package com.flamingo.ai.studybuddy.api.dto.response;

import com.flamingo.ai.studybuddy.engine.EnginePhase;
import com.flamingo.ai.studybuddy.engine.EngineStatus;
import com.flamingo.ai.studybuddy.engine.GenerationParameters;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for engine status. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineResponse {

  private UUID id;
  private EnginePhase phase;
  private String failureReason;
  private String modelPath;
  private String modelInfo;
  private UUID activeGenerationId;
  private Float temperature;
  private Float topP;
  private Integer maxGenLen;
  private Float repetitionPenalty;

  /** Creates an EngineResponse from a status snapshot; parameters stay null before initialize. */
  public static EngineResponse fromStatus(EngineStatus status) {
    EngineResponseBuilder builder =
        EngineResponse.builder()
            .id(status.engineId())
            .phase(status.phase())
            .failureReason(status.failureReason())
            .modelPath(status.modelPath())
            .modelInfo(status.modelInfo())
            .activeGenerationId(status.activeGenerationId());
    GenerationParameters parameters = status.parameters();
    if (parameters != null) {
      builder
          .temperature(parameters.temperature())
          .topP(parameters.topP())
          .maxGenLen(parameters.maxGenLen())
          .repetitionPenalty(parameters.repetitionPenalty());
    }
    return builder.build();
  }
}
