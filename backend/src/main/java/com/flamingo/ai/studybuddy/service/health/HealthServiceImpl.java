package com.flamingo.ai.studybuddy.service.health;

import com.flamingo.ai.studybuddy.api.dto.response.SystemStats;
import com.flamingo.ai.studybuddy.engine.EnginePhase;
import com.flamingo.ai.studybuddy.engine.StreamingEngine;
import com.flamingo.ai.studybuddy.service.engine.EngineService;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Implementation of HealthService reading from the engine registry. */
@Service
@RequiredArgsConstructor
public class HealthServiceImpl implements HealthService {

  private final EngineService engineService;

  @Override
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    List<StreamingEngine> engines = engineService.getAllEngines();
    Map<String, Long> byPhase =
        engines.stream()
            .map(StreamingEngine::getPhase)
            .map(EnginePhase::name)
            .collect(
                Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
    long liveGenerations =
        engines.stream().mapToLong(StreamingEngine::getLiveGenerationCount).sum();

    return SystemStats.builder()
        .totalEngines(engines.size())
        .enginesByPhase(byPhase)
        .liveGenerations(liveGenerations)
        .generationSource(engineService.describeSource())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
