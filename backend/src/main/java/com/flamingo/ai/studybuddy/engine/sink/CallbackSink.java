package com.flamingo.ai.studybuddy.engine.sink;

import java.util.UUID;

/**
 * Consumer of one generation's output.
 *
 * <p>The engine calls {@link #deliver(String)} zero or more times, then exactly one of {@link
 * #error(String)} or {@link #complete()}, unless the generation is superseded by a reset, in which
 * case neither terminal method is called. A shutdown ends the generation with {@code
 * error("cancelled")}. Fragment and terminal calls happen on the engine's delivery thread, never on
 * the generation worker, and never concurrently. The one exception is a shutdown or reset that
 * lands while {@link #attach(UUID)} is running: the terminal call, if any, then arrives on the
 * thread that called {@code streamGenerate}.
 *
 * <p>Implementations that hold resources across a thread or runtime boundary acquire them in
 * {@link #attach(UUID)} and give them back in {@link #detach()}. The engine calls {@code attach}
 * before the worker starts and {@code detach} exactly once after the last other call, on every exit
 * path.
 */
public interface CallbackSink {

  void deliver(String fragment);

  void error(String message);

  void complete();

  /** Called once before generation starts. A thrown exception aborts the generation. */
  default void attach(UUID generationId) {}

  /** Called once when the engine no longer needs this sink. */
  default void detach() {}
}
