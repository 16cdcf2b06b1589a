package net.jodah.tether;

/**
 * Called when the broker returns a published message as unroutable.
 */
public interface ReturnCallback {
  void onReturn(Channel channel, ReturnedMessage message);
}
