package com.flamingo.ai.studybuddy.api.dto.response;

import com.flamingo.ai.studybuddy.engine.GenerationResult;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a blocking generation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateResponse {

  private UUID generationId;
  private String text;
  private int fragmentCount;

  /** True if the reply stopped at max_gen_len. */
  private boolean truncated;

  public static GenerateResponse fromResult(GenerationResult result) {
    return GenerateResponse.builder()
        .generationId(result.generationId())
        .text(result.text())
        .fragmentCount(result.fragmentCount())
        .truncated(result.isTruncated())
        .build();
  }
}
