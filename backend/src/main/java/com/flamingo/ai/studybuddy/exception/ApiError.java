package com.flamingo.ai.studybuddy.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String ENGINE_NOT_FOUND = "ENGINE_001";
  public static final String ENGINE_STATE_CONFLICT = "ENGINE_002";
  public static final String INVALID_PARAMETER = "ENGINE_003";
  public static final String RESOURCE_LEAK = "ENGINE_004";
  public static final String MODEL_LOAD_FAILED = "MODEL_001";
  public static final String GENERATION_FAILED = "GENERATION_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Engine phase at the time of a state conflict, if relevant. */
  private final String phase;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
