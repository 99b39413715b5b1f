package com.flamingo.ai.studybuddy.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for changing one generation parameter. Range checks happen in the engine. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetParameterRequest {

  @NotNull(message = "Value is required")
  private Double value;
}
