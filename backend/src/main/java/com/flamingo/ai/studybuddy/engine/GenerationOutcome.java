package com.flamingo.ai.studybuddy.engine;

/** How a generation ended. */
public enum GenerationOutcome {
  /** The source reached its end; the sink received {@code complete()}. */
  COMPLETED,
  /** The fragment limit was reached; the sink received {@code complete()}. */
  TRUNCATED,
  /** Cancellation was observed; the sink received {@code error("cancelled")}. */
  CANCELLED,
  /** The source or the sink failed; the sink received {@code error(reason)} where possible. */
  FAILED,
  /** A reset or shutdown invalidated the generation; remaining fragments were discarded. */
  SUPERSEDED
}
