package net.jodah.tether.event;

import net.jodah.tether.Channel;

/**
 * No-op channel listener for sub-classing.
 */
public abstract class DefaultChannelListener implements ChannelListener {
  @Override
  public void onCreate(Channel channel) {
  }

  @Override
  public void onCreateFailure(Throwable failure) {
  }

  @Override
  public void onRecoveryCompleted(Channel channel) {
  }

  @Override
  public void onRecoveryFailure(Channel channel, Throwable failure) {
  }

  @Override
  public void onRecoveryStarted(Channel channel) {
  }
}
