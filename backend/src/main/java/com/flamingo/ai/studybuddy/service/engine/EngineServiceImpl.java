package com.flamingo.ai.studybuddy.service.engine;

import com.flamingo.ai.studybuddy.api.dto.request.InitializeEngineRequest;
import com.flamingo.ai.studybuddy.config.EngineConfig;
import com.flamingo.ai.studybuddy.engine.EngineStatus;
import com.flamingo.ai.studybuddy.engine.GenerationParameters;
import com.flamingo.ai.studybuddy.engine.StreamingEngine;
import com.flamingo.ai.studybuddy.exception.EngineNotFoundException;
import com.flamingo.ai.studybuddy.exception.ResourceLeakException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the EngineService backed by an in-memory registry. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngineServiceImpl implements EngineService {

  private final StreamingEngineFactory engineFactory;
  private final EngineConfig engineConfig;
  private final MeterRegistry meterRegistry;

  private final Map<UUID, StreamingEngine> engines = new ConcurrentHashMap<>();

  @Override
  @Timed(value = "engine.create", description = "Time to create an engine")
  public StreamingEngine createEngine() {
    StreamingEngine engine = engineFactory.create();
    engines.put(engine.getEngineId(), engine);
    meterRegistry.counter("engine.created").increment();
    log.info("Created engine {} ({} registered)", engine.getEngineId(), engines.size());
    return engine;
  }

  @Override
  public StreamingEngine getEngine(UUID engineId) {
    StreamingEngine engine = engines.get(engineId);
    if (engine == null) {
      throw new EngineNotFoundException(engineId);
    }
    return engine;
  }

  @Override
  public List<StreamingEngine> getAllEngines() {
    return List.copyOf(engines.values());
  }

  @Override
  @Timed(value = "engine.initialize", description = "Time to load a model into an engine")
  public EngineStatus initialize(UUID engineId, InitializeEngineRequest request) {
    StreamingEngine engine = getEngine(engineId);
    String modelPath =
        request.getModelPath() != null
            ? request.getModelPath()
            : engineConfig.getModel().getDefaultPath();
    return engine.initialize(modelPath, mergeWithDefaults(request));
  }

  @Override
  public EngineStatus setParameter(UUID engineId, String key, double value) {
    StreamingEngine engine = getEngine(engineId);
    engine.setParameter(key, value);
    return engine.getStatus();
  }

  @Override
  public EngineStatus reset(UUID engineId) {
    StreamingEngine engine = getEngine(engineId);
    engine.reset();
    return engine.getStatus();
  }

  @Override
  @Timed(value = "engine.remove", description = "Time to shut down and remove an engine")
  public void removeEngine(UUID engineId) {
    StreamingEngine engine = engines.remove(engineId);
    if (engine == null) {
      throw new EngineNotFoundException(engineId);
    }
    log.info("Removing engine {}", engineId);
    engine.shutdown();
    meterRegistry.counter("engine.removed").increment();
  }

  @Override
  public String describeSource() {
    return engineFactory.describeSource();
  }

  /** Closes every registered engine when the application context stops. */
  @PreDestroy
  public void shutdownAll() {
    List<StreamingEngine> closing = new ArrayList<>(engines.values());
    engines.clear();
    if (!closing.isEmpty()) {
      log.info("Shutting down {} engine(s)", closing.size());
    }
    for (StreamingEngine engine : closing) {
      try {
        engine.shutdown();
      } catch (ResourceLeakException e) {
        // keep closing the remaining engines
        log.error("Engine {} leaked tasks on shutdown: {}", engine.getEngineId(), e.getMessage());
      }
    }
  }

  private GenerationParameters mergeWithDefaults(InitializeEngineRequest request) {
    EngineConfig.Defaults defaults = engineConfig.getDefaults();
    return new GenerationParameters(
        request.getTemperature() != null ? request.getTemperature() : defaults.getTemperature(),
        request.getTopP() != null ? request.getTopP() : defaults.getTopP(),
        request.getMaxGenLen() != null ? request.getMaxGenLen() : defaults.getMaxGenLen(),
        request.getRepetitionPenalty() != null
            ? request.getRepetitionPenalty()
            : defaults.getRepetitionPenalty());
  }
}
