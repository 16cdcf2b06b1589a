package net.jodah.tether.internal;

import java.util.concurrent.ThreadLocalRandom;

import net.jodah.tether.config.RecoveryPolicy;
import net.jodah.tether.util.Duration;

/**
 * Statistics to track the usage of a RecoveryPolicy across the attempts of one reconnect cycle.
 */
public final class RecoveryStats {
  private final int maxAttempts;
  private final long maxDuration;
  private final long interval;
  private final long jitter;
  private long startTime;

  // Backoff stats
  private double intervalMultiplier = -1;
  private long maxInterval;

  // Mutable state
  private int attemptCount;
  private long waitTime;

  public RecoveryStats(RecoveryPolicy policy) {
    maxAttempts = policy.getMaxAttempts();
    interval = policy.getInterval() == null ? 0 : policy.getInterval().toNanos();
    jitter = policy.getJitter() == null ? 0 : policy.getJitter().toNanos();
    if (policy.getMaxDuration() == null) {
      maxDuration = -1;
      waitTime = interval;
    } else {
      maxDuration = policy.getMaxDuration().toNanos();
      waitTime = Math.min(interval, maxDuration);
    }

    if (policy.getMaxInterval() != null) {
      intervalMultiplier = policy.getIntervalMultiplier();
      maxInterval = policy.getMaxInterval().toNanos();
    }
  }

  public int getAttemptCount() {
    return attemptCount;
  }

  /**
   * Returns the amount of time to wait before the next attempt, including any jitter. The wait time
   * is calculated each time {@link #incrementAttempts()} is called.
   */
  public Duration getWaitTime() {
    long wait = waitTime;
    if (jitter > 0)
      wait += ThreadLocalRandom.current().nextLong(jitter + 1);
    return Duration.nanos(Math.max(0, wait));
  }

  /**
   * Increments the attempts and recalculates the wait time.
   */
  public void incrementAttempts() {
    attemptCount++;
    long now = System.nanoTime();

    // First time
    if (startTime == 0)
      startTime = now;
    else if (intervalMultiplier != -1)
      waitTime = Math.min(maxInterval, (long) (waitTime * intervalMultiplier));

    if (maxDuration != -1)
      waitTime = Math.min(waitTime, maxDuration - (now - startTime));
  }

  /**
   * Returns true if the max attempts or max duration for the policy have been exceeded else false.
   */
  public boolean isPolicyExceeded() {
    boolean withinMaxAttempts = maxAttempts == -1 || attemptCount < maxAttempts;
    boolean withinMaxDuration = maxDuration == -1 || startTime == 0
        || System.nanoTime() - startTime < maxDuration;
    return !withinMaxAttempts || !withinMaxDuration;
  }
}
