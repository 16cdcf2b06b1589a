package net.jodah.tether.internal.util.concurrent;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates daemon threads for recovery, timed invocations and consumer dispatch. Threads are named by
 * formatting a sequence number into the {@code nameFormat}, and failures that escape a thread are
 * logged rather than printed.
 */
public class NamedThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(NamedThreadFactory.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER = new UncaughtExceptionHandler() {
    @Override
    public void uncaughtException(Thread thread, Throwable failure) {
      LOG.error("Uncaught failure in thread {}", thread.getName(), failure);
    }
  };

  private final AtomicInteger sequence = new AtomicInteger(1);
  private final String nameFormat;

  public NamedThreadFactory(String nameFormat) {
    this.nameFormat = nameFormat;
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, String.format(nameFormat, sequence.getAndIncrement()));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
    return thread;
  }
}
