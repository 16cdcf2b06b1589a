package net.jodah.tether.event;

import net.jodah.tether.Channel;

/**
 * Listens for consumer related events.
 */
public interface ConsumerListener {
  /**
   * Called when restarting the consumer identified by {@code consumerTag} on the {@code channel}
   * is started.
   */
  void onRecoveryStarted(String consumerTag, Channel channel);

  /**
   * Called when the consumer identified by {@code consumerTag} has been restarted on the
   * {@code channel}.
   */
  void onRecoveryCompleted(String consumerTag, Channel channel);

  /**
   * Called when the consumer identified by {@code consumerTag} fails to restart on the
   * {@code channel}.
   */
  void onRecoveryFailure(String consumerTag, Channel channel, Throwable failure);
}
