package com.flamingo.ai.studybuddy.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for loading a model into an engine. Omitted parameters use configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InitializeEngineRequest {

  /** Model directory. If null, the configured default path is used. */
  @Size(max = 4096, message = "Model path must not exceed 4096 characters")
  private String modelPath;

  @DecimalMin(value = "0.0", message = "temperature must be between 0 and 2")
  @DecimalMax(value = "2.0", message = "temperature must be between 0 and 2")
  private Float temperature;

  @DecimalMin(value = "0.0", inclusive = false, message = "topP must be in (0, 1]")
  @DecimalMax(value = "1.0", message = "topP must be in (0, 1]")
  private Float topP;

  @Positive(message = "maxGenLen must be positive")
  private Integer maxGenLen;

  @DecimalMin(value = "0.0", inclusive = false, message = "repetitionPenalty must be in (0, 2]")
  @DecimalMax(value = "2.0", message = "repetitionPenalty must be in (0, 2]")
  private Float repetitionPenalty;
}
