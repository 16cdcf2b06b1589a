package net.jodah.tether.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;

import net.jodah.tether.event.ChannelListener;
import net.jodah.tether.event.ConnectionListener;
import net.jodah.tether.event.ConsumerListener;
import net.jodah.tether.util.Duration;

/**
 * Tether configuration. Changes are reflected in the resources created with this configuration.
 * A Config may inherit from a parent, in which case any setting that is not set locally is read
 * from the parent.
 */
public class Config {
  private final Config parent;
  private RecoveryPolicy recoveryPolicy;
  private Duration operationTimeout;
  private Boolean publisherConfirms;
  private Collection<ConnectionListener> connectionListeners;
  private Collection<ChannelListener> channelListeners;
  private Collection<ConsumerListener> consumerListeners;

  public Config() {
    parent = null;
  }

  /**
   * Creates a new Config object that inherits configuration from the {@code parent}.
   */
  public Config(Config parent) {
    this.parent = parent;
  }

  public Collection<ChannelListener> getChannelListeners() {
    return channelListeners != null ? channelListeners : parent != null ? parent.getChannelListeners()
      : Collections.<ChannelListener>emptyList();
  }

  public Collection<ConnectionListener> getConnectionListeners() {
    return connectionListeners != null ? connectionListeners : parent != null ? parent.getConnectionListeners()
      : Collections.<ConnectionListener>emptyList();
  }

  public Collection<ConsumerListener> getConsumerListeners() {
    return consumerListeners != null ? consumerListeners : parent != null ? parent.getConsumerListeners()
      : Collections.<ConsumerListener>emptyList();
  }

  /**
   * Returns the timeout applied to channel operations that are not given an explicit timeout, or
   * null to wait indefinitely.
   */
  public Duration getOperationTimeout() {
    return operationTimeout != null ? operationTimeout : parent != null ? parent.getOperationTimeout() : null;
  }

  /**
   * Returns the policy that governs reconnection. Defaults to
   * {@link RecoveryPolicies#recoverAlways()}.
   */
  public RecoveryPolicy getRecoveryPolicy() {
    return recoveryPolicy != null ? recoveryPolicy : parent != null ? parent.getRecoveryPolicy()
      : RecoveryPolicies.recoverAlways();
  }

  /**
   * Returns whether channels are put in publisher confirm mode so that each publish waits for the
   * broker's acknowledgement. Defaults to true.
   */
  public boolean isPublisherConfirms() {
    Boolean result = publisherConfirms != null ? publisherConfirms : parent != null ? Boolean.valueOf(parent.isPublisherConfirms())
      : null;
    return result == null || result.booleanValue();
  }

  public Config withChannelListeners(ChannelListener... channelListeners) {
    this.channelListeners = Arrays.asList(channelListeners);
    return this;
  }

  public Config withConnectionListeners(ConnectionListener... connectionListeners) {
    this.connectionListeners = Arrays.asList(connectionListeners);
    return this;
  }

  public Config withConsumerListeners(ConsumerListener... consumerListeners) {
    this.consumerListeners = Arrays.asList(consumerListeners);
    return this;
  }

  /**
   * Sets the timeout applied to channel operations that are not given an explicit timeout.
   */
  public Config withOperationTimeout(Duration operationTimeout) {
    this.operationTimeout = operationTimeout;
    return this;
  }

  public Config withPublisherConfirms(boolean enabled) {
    publisherConfirms = Boolean.valueOf(enabled);
    return this;
  }

  /**
   * Sets the policy to use for reconnecting after an unexpected loss of the link to the broker.
   */
  public Config withRecoveryPolicy(RecoveryPolicy recoveryPolicy) {
    this.recoveryPolicy = recoveryPolicy;
    return this;
  }
}
