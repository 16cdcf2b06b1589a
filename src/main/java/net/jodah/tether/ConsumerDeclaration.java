package net.jodah.tether;

import java.io.IOException;

import net.jodah.tether.event.ConsumerListener;
import net.jodah.tether.internal.RestorationLedger.Entry;
import net.jodah.tether.internal.RestorationLedger.Phase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restores a consumer with its original handler, options and consumer tag.
 */
class ConsumerDeclaration implements Entry<com.rabbitmq.client.Channel> {
  private static final Logger log = LoggerFactory.getLogger(ConsumerDeclaration.class);
  final Queue queue;
  final String consumerTag;
  final MessageHandler handler;
  final ConsumeOptions options;

  ConsumerDeclaration(Queue queue, String consumerTag, MessageHandler handler, ConsumeOptions options) {
    this.queue = queue;
    this.consumerTag = consumerTag;
    this.handler = handler;
    this.options = options.copy().withConsumerTag(consumerTag);
  }

  @Override
  public boolean dependsOn(Object entity) {
    return entity == queue;
  }

  @Override
  public Phase getPhase() {
    return Phase.CONSUMER;
  }

  @Override
  public void restore(com.rabbitmq.client.Channel channel) throws IOException {
    Channel owner = queue.getChannel();
    for (ConsumerListener listener : owner.config.getConsumerListeners())
      try {
        listener.onRecoveryStarted(consumerTag, owner);
      } catch (Exception e) {
        log.error("Consumer listener {} failed for consumer {}", listener, consumerTag, e);
      }

    try {
      queue.consumeOperation(handler, options).call(channel);
    } catch (IOException e) {
      for (ConsumerListener listener : owner.config.getConsumerListeners())
        try {
          listener.onRecoveryFailure(consumerTag, owner, e);
        } catch (Exception le) {
          log.error("Consumer listener {} failed for consumer {}", listener, consumerTag, le);
        }
      throw e;
    }

    for (ConsumerListener listener : owner.config.getConsumerListeners())
      try {
        listener.onRecoveryCompleted(consumerTag, owner);
      } catch (Exception e) {
        log.error("Consumer listener {} failed for consumer {}", listener, consumerTag, e);
      }
  }

  @Override
  public String toString() {
    return "ConsumerDeclaration [queue=" + queue.getName() + ", consumerTag=" + consumerTag + "]";
  }
}
