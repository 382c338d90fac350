package com.flamingo.ai.chunkgate.completion;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and long-running work. Work observes the
 * flag at its own checkpoints; requesting cancellation never interrupts threads.
 */
public final class CancellationSignal {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** Creates a signal that nobody holds a reference to cancel. */
  public static CancellationSignal none() {
    return new CancellationSignal();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancellationRequested() {
    return cancelled.get();
  }

  /**
   * Throws if cancellation was requested.
   *
   * @throws CancellationException when {@link #cancel()} has been called
   */
  public void throwIfCancellationRequested() {
    if (cancelled.get()) {
      throw new CancellationException("Operation was cancelled");
    }
  }
}
