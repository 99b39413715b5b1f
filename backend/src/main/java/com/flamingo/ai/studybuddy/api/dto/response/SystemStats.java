package com.flamingo.ai.studybuddy.api.dto.response;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for system-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private long totalEngines;
  private Map<String, Long> enginesByPhase;
  private long liveGenerations;
  private String generationSource;
  private LocalDateTime timestamp;
}
