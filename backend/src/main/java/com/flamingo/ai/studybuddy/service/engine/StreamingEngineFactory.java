package com.flamingo.ai.studybuddy.service.engine;

import com.flamingo.ai.studybuddy.config.EngineConfig;
import com.flamingo.ai.studybuddy.engine.StreamingEngine;
import com.flamingo.ai.studybuddy.engine.resource.ModelResourceCheck;
import com.flamingo.ai.studybuddy.engine.source.GenerationSource;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Builds engines wired to the shared generation source, resource check and thread pools. */
@Component
public class StreamingEngineFactory {

  private final EngineConfig engineConfig;
  private final GenerationSource generationSource;
  private final ModelResourceCheck modelResourceCheck;
  private final Executor workerExecutor;
  private final Executor deliveryExecutor;
  private final MeterRegistry meterRegistry;

  public StreamingEngineFactory(
      EngineConfig engineConfig,
      GenerationSource generationSource,
      ModelResourceCheck modelResourceCheck,
      @Qualifier("generationWorkerExecutor") Executor workerExecutor,
      @Qualifier("tokenDeliveryExecutor") Executor deliveryExecutor,
      MeterRegistry meterRegistry) {
    this.engineConfig = engineConfig;
    this.generationSource = generationSource;
    this.modelResourceCheck = modelResourceCheck;
    this.workerExecutor = workerExecutor;
    this.deliveryExecutor = deliveryExecutor;
    this.meterRegistry = meterRegistry;
  }

  public StreamingEngine create() {
    return StreamingEngine.builder()
        .generationSource(generationSource)
        .resourceCheck(modelResourceCheck)
        .workerExecutor(workerExecutor)
        .deliveryExecutor(deliveryExecutor)
        .meterRegistry(meterRegistry)
        .shutdownTimeout(Duration.ofMillis(engineConfig.getShutdownTimeoutMs()))
        .generateTimeout(Duration.ofMillis(engineConfig.getGenerateTimeoutMs()))
        .defaultParameters(engineConfig.getDefaults().toParameters())
        .build();
  }

  public String describeSource() {
    return generationSource.describe();
  }
}
