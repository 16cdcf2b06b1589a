package net.jodah.tether;

import net.jodah.tether.util.Duration;

/**
 * Options for publishing a message. Messages are mandatory by default, so that unroutable messages
 * are returned rather than silently dropped.
 */
public class PublishOptions {
  private boolean mandatory = true;
  private boolean immediate;
  private Duration timeout;

  /**
   * Returns the timeout to wait for the publish, and its confirmation if enabled, or null to use
   * the configured operation timeout.
   */
  public Duration getTimeout() {
    return timeout;
  }

  public boolean isImmediate() {
    return immediate;
  }

  public boolean isMandatory() {
    return mandatory;
  }

  public PublishOptions withImmediate(boolean immediate) {
    this.immediate = immediate;
    return this;
  }

  public PublishOptions withMandatory(boolean mandatory) {
    this.mandatory = mandatory;
    return this;
  }

  public PublishOptions withTimeout(Duration timeout) {
    this.timeout = timeout;
    return this;
  }
}
