package net.jodah.tether;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Adapts deliveries from a raw channel to a {@link MessageHandler}.
 */
class ConsumerDelegate implements Consumer {
  private static final Logger log = LoggerFactory.getLogger(ConsumerDelegate.class);
  private final Queue queue;
  private final com.rabbitmq.client.Channel channel;
  private final MessageHandler handler;
  private final boolean noAck;

  ConsumerDelegate(Queue queue, com.rabbitmq.client.Channel channel, MessageHandler handler,
      boolean noAck) {
    this.queue = queue;
    this.channel = channel;
    this.handler = handler;
    this.noAck = noAck;
  }

  @Override
  public void handleCancel(String consumerTag) {
    log.warn("Consumer {} of {} was cancelled by the broker", consumerTag, queue);
    queue.onConsumerCancelled(consumerTag);
  }

  @Override
  public void handleCancelOk(String consumerTag) {
    log.debug("Consumer {} of {} was cancelled", consumerTag, queue);
  }

  @Override
  public void handleConsumeOk(String consumerTag) {
    log.debug("Consumer {} of {} was registered", consumerTag, queue);
  }

  @Override
  public void handleDelivery(String consumerTag, Envelope envelope, BasicProperties properties,
      byte[] body) {
    IncomingMessage message = new IncomingMessage(channel, consumerTag, envelope, properties, body,
        noAck, -1);
    try {
      handler.handle(message);
    } catch (Exception e) {
      log.error("Message handler {} failed to handle {} from {}", handler, message, queue, e);
    }
  }

  @Override
  public void handleRecoverOk(String consumerTag) {
  }

  @Override
  public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
    log.debug("Consumer {} of {} was shut down: {}", consumerTag, queue, sig.getMessage());
  }

  @Override
  public String toString() {
    return String.format("consumer of %s with %s", queue, handler);
  }
}
