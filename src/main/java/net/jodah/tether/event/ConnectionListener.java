package net.jodah.tether.event;

import net.jodah.tether.Connection;

/**
 * Listens for {@link Connection} related events.
 */
public interface ConnectionListener {
  /**
   * Called when the {@code connection} is successfully created.
   */
  void onCreate(Connection connection);

  /**
   * Called when connection creation fails.
   */
  void onCreateFailure(Throwable failure);

  /**
   * Called when the link of the {@code connection} is lost unexpectedly and reconnection is
   * started.
   */
  void onRecoveryStarted(Connection connection);

  /**
   * Called when the link of the {@code connection} is re-established, but before its channels and
   * their topology are restored.
   */
  void onRecovery(Connection connection);

  /**
   * Called when recovery of the {@code connection} and its channels is completed. Note: The
   * success or failure of an individual channel's recovery can be tracked with a
   * {@link ChannelListener}.
   */
  void onRecoveryCompleted(Connection connection);

  /**
   * Called when the {@code connection} gives up reconnecting because its recovery policy was
   * exceeded.
   */
  void onRecoveryFailure(Connection connection, Throwable failure);
}
