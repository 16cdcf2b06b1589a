package net.jodah.tether.config;

import net.jodah.tether.util.Duration;

/**
 * Factory methods for recovery policies.
 */
public final class RecoveryPolicies {
  /** Interval used between reconnect attempts when none is configured. */
  public static final Duration DEFAULT_INTERVAL = Duration.seconds(5);

  private RecoveryPolicies() {
  }

  /**
   * Returns a RecoveryPolicy that never recovers.
   */
  public static RecoveryPolicy recoverNever() {
    return new RecoveryPolicy().withMaxAttempts(0);
  }

  /**
   * Returns a RecoveryPolicy that always recovers, waiting the {@link #DEFAULT_INTERVAL} between
   * attempts.
   */
  public static RecoveryPolicy recoverAlways() {
    return new RecoveryPolicy().withMaxAttempts(-1).withInterval(DEFAULT_INTERVAL);
  }
}
