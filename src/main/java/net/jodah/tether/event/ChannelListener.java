package net.jodah.tether.event;

import net.jodah.tether.Channel;

/**
 * Listens for {@link Channel} related events.
 */
public interface ChannelListener {
  /**
   * Called when the {@code channel} is successfully opened.
   */
  void onCreate(Channel channel);

  /**
   * Called when opening a channel fails.
   */
  void onCreateFailure(Throwable failure);

  /**
   * Called when reopening of the {@code channel} is started.
   */
  void onRecoveryStarted(Channel channel);

  /**
   * Called when the {@code channel} has been reopened and its recorded topology, QoS and consumers
   * have been restored.
   */
  void onRecoveryCompleted(Channel channel);

  /**
   * Called when the {@code channel} could not be restored and has been closed.
   */
  void onRecoveryFailure(Channel channel, Throwable failure);
}
