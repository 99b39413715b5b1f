package com.flamingo.ai.studybuddy.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for sending a prompt to an engine. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

  @NotBlank(message = "Message is required")
  @Size(max = 10000, message = "Message must not exceed 10000 characters")
  private String message;
}
