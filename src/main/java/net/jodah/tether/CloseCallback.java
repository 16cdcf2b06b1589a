package net.jodah.tether;

/**
 * Called when a channel is closed for good. The cause is null when the channel was closed by the
 * application.
 */
public interface CloseCallback {
  void onClose(Channel channel, Throwable cause);
}
