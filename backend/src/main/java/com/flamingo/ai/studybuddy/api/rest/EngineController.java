package com.flamingo.ai.studybuddy.api.rest;

import com.flamingo.ai.studybuddy.api.dto.request.InitializeEngineRequest;
import com.flamingo.ai.studybuddy.api.dto.request.SetParameterRequest;
import com.flamingo.ai.studybuddy.api.dto.response.EngineResponse;
import com.flamingo.ai.studybuddy.engine.StreamingEngine;
import com.flamingo.ai.studybuddy.service.engine.EngineService;
import jakarta.validation.Valid;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for engine lifecycle management. */
@RestController
@RequestMapping("/api/engines")
@RequiredArgsConstructor
public class EngineController {

  private final EngineService engineService;

  /** Creates a new, uninitialized engine. */
  @PostMapping
  public ResponseEntity<EngineResponse> createEngine() {
    StreamingEngine engine = engineService.createEngine();
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(EngineResponse.fromStatus(engine.getStatus()));
  }

  /** Gets all engines. */
  @GetMapping
  public ResponseEntity<List<EngineResponse>> getAllEngines() {
    List<EngineResponse> responses =
        engineService.getAllEngines().stream()
            .map(StreamingEngine::getStatus)
            .map(EngineResponse::fromStatus)
            .sorted(Comparator.comparing(response -> response.getId().toString()))
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets an engine by ID. */
  @GetMapping("/{engineId}")
  public ResponseEntity<EngineResponse> getEngine(@PathVariable UUID engineId) {
    return ResponseEntity.ok(
        EngineResponse.fromStatus(engineService.getEngine(engineId).getStatus()));
  }

  /** Loads a model into the engine. */
  @PostMapping("/{engineId}/initialize")
  public ResponseEntity<EngineResponse> initialize(
      @PathVariable UUID engineId, @Valid @RequestBody InitializeEngineRequest request) {
    return ResponseEntity.ok(
        EngineResponse.fromStatus(engineService.initialize(engineId, request)));
  }

  /** Changes one generation parameter, for example {@code temperature} or {@code top_p}. */
  @PutMapping("/{engineId}/parameters/{key}")
  public ResponseEntity<EngineResponse> setParameter(
      @PathVariable UUID engineId,
      @PathVariable String key,
      @Valid @RequestBody SetParameterRequest request) {
    return ResponseEntity.ok(
        EngineResponse.fromStatus(engineService.setParameter(engineId, key, request.getValue())));
  }

  /** Cancels any active generation and returns the engine to READY. */
  @PostMapping("/{engineId}/reset")
  public ResponseEntity<EngineResponse> reset(@PathVariable UUID engineId) {
    return ResponseEntity.ok(EngineResponse.fromStatus(engineService.reset(engineId)));
  }

  /** Shuts the engine down and removes it. */
  @DeleteMapping("/{engineId}")
  public ResponseEntity<Void> deleteEngine(@PathVariable UUID engineId) {
    engineService.removeEngine(engineId);
    return ResponseEntity.noContent().build();
  }
}
