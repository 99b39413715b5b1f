package com.flamingo.ai.studybuddy.service.engine;

import com.flamingo.ai.studybuddy.api.dto.request.InitializeEngineRequest;
import com.flamingo.ai.studybuddy.engine.EngineStatus;
import com.flamingo.ai.studybuddy.engine.StreamingEngine;
import java.util.List;
import java.util.UUID;

/** Registry of engine handles and their lifecycle operations. */
public interface EngineService {

  /** Creates a new, uninitialized engine and registers it. */
  StreamingEngine createEngine();

  /**
   * Looks up an engine.
   *
   * @throws com.flamingo.ai.studybuddy.exception.EngineNotFoundException if no engine has this id
   */
  StreamingEngine getEngine(UUID engineId);

  List<StreamingEngine> getAllEngines();

  /** Loads a model into the engine, filling omitted parameters from configuration. */
  EngineStatus initialize(UUID engineId, InitializeEngineRequest request);

  EngineStatus setParameter(UUID engineId, String key, double value);

  EngineStatus reset(UUID engineId);

  /**
   * Shuts the engine down and removes it from the registry. The engine is removed even if shutdown
   * reports leaked tasks.
   */
  void removeEngine(UUID engineId);

  /** Description of the generation source engines are built with. */
  String describeSource();
}
