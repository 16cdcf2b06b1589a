package net.jodah.tether.config;

import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.util.Duration;

/**
 * Policy that defines how reconnection should be performed after the link to the broker is lost.
 */
public class RecoveryPolicy {
  private int maxAttempts;
  private Duration maxDuration;
  private Duration interval;
  private Duration maxInterval;
  private int intervalMultiplier;
  private Duration jitter;

  /**
   * Creates a recovery policy that always recovers.
   */
  public RecoveryPolicy() {
    maxAttempts = -1;
  }

  private RecoveryPolicy(RecoveryPolicy policy) {
    maxAttempts = policy.maxAttempts;
    maxDuration = policy.maxDuration;
    interval = policy.interval;
    maxInterval = policy.maxInterval;
    intervalMultiplier = policy.intervalMultiplier;
    jitter = policy.jitter;
  }

  /**
   * Returns whether the policy allows any attempts based on the configured maxAttempts and
   * maxDuration.
   */
  public boolean allowsAttempts() {
    return (maxAttempts == -1 || maxAttempts > 0)
        && (maxDuration == null || maxDuration.length > 0);
  }

  /**
   * Returns a copy of the policy.
   */
  public RecoveryPolicy copy() {
    return new RecoveryPolicy(this);
  }

  /**
   * Returns the interval between attempts.
   *
   * @see #withInterval(Duration)
   * @see #withBackoff(Duration, Duration)
   */
  public Duration getInterval() {
    return interval;
  }

  /**
   * Returns the interval multiplier for backoff attempts.
   */
  public int getIntervalMultiplier() {
    return intervalMultiplier;
  }

  /**
   * Returns the max random amount of time added to each interval.
   */
  public Duration getJitter() {
    return jitter;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Duration getMaxDuration() {
    return maxDuration;
  }

  public Duration getMaxInterval() {
    return maxInterval;
  }

  /**
   * Returns whether backoff intervals have been set.
   */
  public boolean isBackoff() {
    return maxInterval != null;
  }

  /**
   * Sets the {@code interval} to pause for between attempts, exponentially backing of to the
   * {@code maxInterval} multiplying successive intervals by a factor of 2.
   *
   * @throws NullPointerException if {@code interval} or {@code maxInterval} are null
   * @throws IllegalArgumentException if {@code interval} is <= 0 or {@code interval} is >=
   *           {@code maxInterval}
   */
  public RecoveryPolicy withBackoff(Duration interval, Duration maxInterval) {
    return withBackoff(interval, maxInterval, 2);
  }

  /**
   * Sets the {@code interval} to pause for between attempts, exponentially backing of to the
   * {@code maxInterval} multiplying successive intervals by the {@code intervalMultiplier}.
   *
   * @throws NullPointerException if {@code interval} or {@code maxInterval} are null
   * @throws IllegalArgumentException if {@code interval} is <= 0, {@code interval} is >=
   *           {@code maxInterval} or the {@code intervalMultiplier} is <= 1
   */
  public RecoveryPolicy withBackoff(Duration interval, Duration maxInterval, int intervalMultiplier) {
    Assert.notNull(interval, "interval");
    Assert.notNull(maxInterval, "maxInterval");
    Assert.isTrue(interval.length > 0, "The interval must be greater than 0");
    Assert.isTrue(interval.toNanos() < maxInterval.toNanos(),
        "The interval must be less than the maxInterval");
    Assert.isTrue(intervalMultiplier > 1, "The intervalMultiplier must be greater than 1");
    this.interval = interval;
    this.maxInterval = maxInterval;
    this.intervalMultiplier = intervalMultiplier;
    return this;
  }

  /**
   * Sets the {@code interval} to pause for between attempts.
   *
   * @throws NullPointerException if {@code interval} is null
   * @throws IllegalStateException if backoff intervals have already been set via
   *           {@link #withBackoff(Duration, Duration)}
   */
  public RecoveryPolicy withInterval(Duration interval) {
    Assert.notNull(interval, "interval");
    Assert.state(maxInterval == null, "Backoff intervals have already been set");
    this.interval = interval;
    return this;
  }

  /**
   * Sets the max random amount of time to add to each interval, so that many clients losing the
   * same broker do not reconnect in lockstep.
   *
   * @throws NullPointerException if {@code jitter} is null
   */
  public RecoveryPolicy withJitter(Duration jitter) {
    this.jitter = Assert.notNull(jitter, "jitter");
    return this;
  }

  /**
   * Sets the max number of attempts to perform. -1 indicates to always attempt.
   */
  public RecoveryPolicy withMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  /**
   * Sets the max duration to perform attempts for.
   *
   * @throws NullPointerException if {@code maxDuration} is null
   */
  public RecoveryPolicy withMaxDuration(Duration maxDuration) {
    this.maxDuration = Assert.notNull(maxDuration, "maxDuration");
    return this;
  }

  @Override
  public String toString() {
    return String.format("RecoveryPolicy[maxAttempts=%s, maxDuration=%s, interval=%s, maxInterval=%s]",
        maxAttempts, maxDuration, interval, maxInterval);
  }
}
