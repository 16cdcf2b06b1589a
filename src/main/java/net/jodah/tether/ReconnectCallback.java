package net.jodah.tether;

/**
 * Called once per successful reconnect, after every channel has been restored.
 */
public interface ReconnectCallback {
  void onReconnect(Connection connection);
}
