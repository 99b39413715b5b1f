package com.flamingo.ai.studybuddy.engine;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Cooperative cancellation flag for one generation.
 *
 * <p>Cancelling only requests a stop: workers check {@link #isCancellationRequested()} between
 * fragments, and sources that wait can use {@link #await(Duration)} to wake up early.
 */
@Slf4j
public final class CancellationToken {

  private final CountDownLatch cancelled = new CountDownLatch(1);
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  /** Requests cancellation. Listeners run once, on the first call. */
  public void cancel() {
    synchronized (this) {
      if (cancelled.getCount() == 0) {
        return;
      }
      cancelled.countDown();
    }
    for (Runnable listener : listeners) {
      runListener(listener);
    }
  }

  public boolean isCancellationRequested() {
    return cancelled.getCount() == 0;
  }

  /**
   * Registers a callback run when cancellation is requested. Runs immediately if the token is
   * already cancelled.
   */
  public void onCancel(Runnable listener) {
    synchronized (this) {
      if (cancelled.getCount() != 0) {
        listeners.add(listener);
        return;
      }
    }
    runListener(listener);
  }

  /**
   * Waits up to {@code timeout} for cancellation.
   *
   * @return {@code true} if cancellation was requested before the timeout elapsed
   */
  public boolean await(Duration timeout) throws InterruptedException {
    return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  private void runListener(Runnable listener) {
    try {
      listener.run();
    } catch (RuntimeException e) {
      log.warn("Cancellation listener failed: {}", e.getMessage(), e);
    }
  }
}
