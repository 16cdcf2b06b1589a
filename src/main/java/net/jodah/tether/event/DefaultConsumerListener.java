package net.jodah.tether.event;

import net.jodah.tether.Channel;

/**
 * No-op consumer listener for sub-classing.
 */
public abstract class DefaultConsumerListener implements ConsumerListener {
  @Override
  public void onRecoveryCompleted(String consumerTag, Channel channel) {
  }

  @Override
  public void onRecoveryFailure(String consumerTag, Channel channel, Throwable failure) {
  }

  @Override
  public void onRecoveryStarted(String consumerTag, Channel channel) {
  }
}
