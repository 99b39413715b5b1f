package com.flamingo.ai.studybuddy.service.health;

import com.flamingo.ai.studybuddy.api.dto.response.SystemStats;

/** Service for system health checks and statistics. */
public interface HealthService {

  /**
   * Gets system-wide statistics.
   *
   * @return engine counts by phase and live generation count
   */
  SystemStats getSystemStats();
}
