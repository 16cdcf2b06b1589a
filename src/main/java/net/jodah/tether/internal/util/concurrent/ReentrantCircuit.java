package net.jodah.tether.internal.util.concurrent;

import java.util.concurrent.locks.AbstractQueuedSynchronizer;

/**
 * Gates callers on recovery. Callers pass while the circuit is closed and block while it is open,
 * and every blocked caller is released when it closes. Opening an open circuit, or closing a closed
 * one, has no effect.
 */
public class ReentrantCircuit {
  private final Sync sync = new Sync();

  /**
   * Synchronization state of 0 = closed, 1 = open.
   */
  private static final class Sync extends AbstractQueuedSynchronizer {
    private static final long serialVersionUID = -7639146702290099744L;

    /**
     * Closes the circuit.
     */
    @Override
    protected boolean tryReleaseShared(int ignored) {
      setState(0);
      return true;
    }

    /**
     * Passes only while the circuit is closed.
     */
    @Override
    protected int tryAcquireShared(int ignored) {
      return isClosed() ? 1 : -1;
    }

    boolean isClosed() {
      return getState() == 0;
    }

    void open() {
      setState(1);
    }
  }

  /**
   * Waits until the circuit is closed or {@code nanos} elapse, returning true if the circuit is
   * closed else false. {@code Long.MAX_VALUE} waits until the circuit closes.
   */
  public boolean await(long nanos) throws InterruptedException {
    if (nanos == Long.MAX_VALUE) {
      sync.acquireSharedInterruptibly(0);
      return true;
    }
    return sync.tryAcquireSharedNanos(0, Math.max(0, nanos));
  }

  /**
   * Closes the circuit, releasing any waiting threads.
   */
  public void close() {
    sync.releaseShared(1);
  }

  /**
   * Returns whether the circuit is closed.
   */
  public boolean isClosed() {
    return sync.isClosed();
  }

  /**
   * Opens the circuit.
   */
  public void open() {
    sync.open();
  }

  @Override
  public String toString() {
    return isClosed() ? "closed" : "open";
  }
}
