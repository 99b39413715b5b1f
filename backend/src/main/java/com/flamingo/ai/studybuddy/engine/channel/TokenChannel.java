package com.flamingo.ai.studybuddy.engine.channel;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Unbounded FIFO hand-off between the generation worker and the delivery loop.
 *
 * <p>The producer pushes fragments and calls {@link #finish()} once it is done; the consumer pops
 * until it receives a terminal fragment or an empty result. Pushes are buffered, so a consumer that
 * starts draining late still observes every fragment from the first push onward. After {@code
 * finish()} no further fragments are accepted, but those already queued remain poppable.
 *
 * <p>Each channel belongs to exactly one generation, identified by {@link #getGenerationId()}.
 */
@Slf4j
public final class TokenChannel {

  private final UUID generationId;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Deque<Fragment> queue = new ArrayDeque<>();
  private boolean finished;

  public TokenChannel(UUID generationId) {
    this.generationId = Objects.requireNonNull(generationId, "generationId");
  }

  public UUID getGenerationId() {
    return generationId;
  }

  /**
   * Appends a fragment.
   *
   * @return {@code false} if the channel was already finished and the fragment was dropped
   */
  public boolean push(Fragment fragment) {
    Objects.requireNonNull(fragment, "fragment");
    lock.lock();
    try {
      if (finished) {
        log.trace("Dropping {} pushed to finished channel {}", fragment, generationId);
        return false;
      }
      queue.addLast(fragment);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the next fragment, blocking until one is available or the channel is finished.
   *
   * @return the next fragment, or empty once the channel is finished and fully drained
   */
  public Optional<Fragment> pop() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty() && !finished) {
        notEmpty.await();
      }
      return Optional.ofNullable(queue.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the next fragment, waiting at most the given time.
   *
   * @return the next fragment, or empty if none arrived in time or the channel is drained; use
   *     {@link #isDrained()} to tell the two apart
   */
  public Optional<Fragment> poll(long timeout, TimeUnit unit) throws InterruptedException {
    long remaining = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty() && !finished) {
        if (remaining <= 0) {
          return Optional.empty();
        }
        remaining = notEmpty.awaitNanos(remaining);
      }
      return Optional.ofNullable(queue.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks the channel finished and wakes every waiting consumer. Idempotent.
   *
   * @return {@code true} only for the call that actually finished the channel
   */
  public boolean finish() {
    lock.lock();
    try {
      if (finished) {
        return false;
      }
      finished = true;
      notEmpty.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isFinished() {
    lock.lock();
    try {
      return finished;
    } finally {
      lock.unlock();
    }
  }

  /** Whether the channel is finished and has nothing left to pop. */
  public boolean isDrained() {
    lock.lock();
    try {
      return finished && queue.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }
}
