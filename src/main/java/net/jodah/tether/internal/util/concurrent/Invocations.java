package net.jodah.tether.internal.util.concurrent;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import net.jodah.tether.AmqpException.OperationTimeoutException;
import net.jodah.tether.util.Duration;

/**
 * Performs blocking calls with an optional time bound. Timed calls are run on a shared pool of
 * daemon threads while the caller waits for at most the timeout. A call that times out is not
 * interrupted, since the request may already be on the wire.
 */
public final class Invocations {
  static final ExecutorService TIMED_EXECUTOR = Executors.newCachedThreadPool(new NamedThreadFactory(
      "tether-invocation-%s"));

  private Invocations() {
  }

  /**
   * Calls the {@code callable}, waiting at most {@code timeout}. A null or infinite timeout waits
   * indefinitely on the calling thread.
   *
   * @throws OperationTimeoutException if the {@code timeout} elapses
   * @throws InterruptedIOException if the calling thread is interrupted while waiting
   * @throws IOException if the call fails with an IOException
   * @throws RuntimeException if the call fails with a RuntimeException
   */
  public static <T> T call(Callable<T> callable, Duration timeout) throws IOException {
    if (timeout == null || !timeout.finite) {
      try {
        return callable.call();
      } catch (IOException e) {
        throw e;
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new IOException(e);
      }
    }

    Future<T> future = TIMED_EXECUTOR.submit(callable);
    try {
      return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(false);
      throw new OperationTimeoutException(String.format("%s timed out after %s", callable, timeout));
    } catch (InterruptedException e) {
      future.cancel(false);
      Thread.currentThread().interrupt();
      throw new InterruptedIOException(String.format("Interrupted while waiting for %s", callable));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException)
        throw (IOException) cause;
      if (cause instanceof RuntimeException)
        throw (RuntimeException) cause;
      if (cause instanceof Error)
        throw (Error) cause;
      throw new IOException(cause);
    }
  }

  /**
   * Returns the nanos remaining until the {@code deadline}, or {@code Long.MAX_VALUE} if there is
   * no deadline.
   */
  public static long remaining(long deadline) {
    return deadline == -1 ? Long.MAX_VALUE : deadline - System.nanoTime();
  }

  /**
   * Returns the deadline in nanos for the {@code timeout}, or -1 for no deadline.
   */
  public static long deadline(Duration timeout) {
    return timeout == null || !timeout.finite ? -1 : System.nanoTime() + timeout.toNanos();
  }

  /**
   * Returns the time remaining until the {@code deadline} as a Duration, or null if there is no
   * deadline.
   */
  public static Duration remainingTimeout(long deadline) {
    return deadline == -1 ? null : Duration.nanos(Math.max(0, remaining(deadline)));
  }
}
