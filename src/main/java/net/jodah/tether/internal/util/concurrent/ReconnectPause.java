package net.jodah.tether.internal.util.concurrent;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import net.jodah.tether.util.Duration;

/**
 * The pause between reconnect attempts. Cancelling the pause wakes every pausing thread and makes
 * later pauses return immediately, so that closing a connection ends its reconnect loop at once.
 */
public class ReconnectPause {
  private final CountDownLatch cancelled = new CountDownLatch(1);

  /**
   * Pauses for the {@code duration}, returning true if it elapsed or false if the pause was
   * cancelled. An infinite duration pauses until cancelled.
   *
   * @throws InterruptedException if the calling thread is interrupted while pausing
   */
  public boolean pause(Duration duration) throws InterruptedException {
    if (!duration.finite) {
      cancelled.await();
      return false;
    }
    return !cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Cuts short current and future pauses.
   */
  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }
}
