package net.jodah.tether;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import net.jodah.tether.AmqpException.DeserializationException;
import net.jodah.tether.internal.util.Exceptions;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * A message delivered by the broker, either to a consumer or in reply to a get. Settlement
 * ({@link #ack()}, {@link #nack(boolean)}, {@link #reject(boolean)}) happens at most once and is
 * performed on the underlying channel the message was delivered on.
 */
public class IncomingMessage {
  private final com.rabbitmq.client.Channel delegate;
  private final Envelope envelope;
  private final AMQP.BasicProperties properties;
  private final byte[] body;
  private final String consumerTag;
  private final boolean noAck;
  private final int messageCount;
  private final AtomicBoolean processed = new AtomicBoolean();

  IncomingMessage(com.rabbitmq.client.Channel delegate, String consumerTag, Envelope envelope,
      AMQP.BasicProperties properties, byte[] body, boolean noAck, int messageCount) {
    this.delegate = delegate;
    this.consumerTag = consumerTag;
    this.envelope = envelope;
    this.properties = properties == null ? new AMQP.BasicProperties() : properties;
    this.body = body == null ? new byte[0] : body;
    this.noAck = noAck;
    this.messageCount = messageCount;
  }

  /**
   * Acknowledges the message.
   *
   * @throws IllegalStateException if the message was consumed without acknowledgement or has
   *           already been settled
   * @throws AmqpException.ChannelClosedException if the channel the message arrived on is closed
   */
  public void ack() throws IOException {
    markProcessed();
    try {
      delegate.basicAck(envelope.getDeliveryTag(), false);
    } catch (ShutdownSignalException e) {
      throw Exceptions.translate(e, delegate);
    }
  }

  /**
   * Negatively acknowledges the message, asking the broker to {@code requeue} it or not.
   *
   * @throws IllegalStateException if the message was consumed without acknowledgement or has
   *           already been settled
   * @throws AmqpException.ChannelClosedException if the channel the message arrived on is closed
   */
  public void nack(boolean requeue) throws IOException {
    markProcessed();
    try {
      delegate.basicNack(envelope.getDeliveryTag(), false, requeue);
    } catch (ShutdownSignalException e) {
      throw Exceptions.translate(e, delegate);
    }
  }

  /**
   * Rejects the message, asking the broker to {@code requeue} it or not.
   *
   * @throws IllegalStateException if the message was consumed without acknowledgement or has
   *           already been settled
   * @throws AmqpException.ChannelClosedException if the channel the message arrived on is closed
   */
  public void reject(boolean requeue) throws IOException {
    markProcessed();
    try {
      delegate.basicReject(envelope.getDeliveryTag(), requeue);
    } catch (ShutdownSignalException e) {
      throw Exceptions.translate(e, delegate);
    }
  }

  public byte[] getBody() {
    return body;
  }

  /**
   * Returns the body decoded as UTF-8.
   *
   * @throws DeserializationException if the body is not valid UTF-8
   */
  public String getBodyAsString() throws DeserializationException {
    try {
      return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(body)).toString();
    } catch (CharacterCodingException e) {
      throw new DeserializationException("Message body is not valid UTF-8", e);
    }
  }

  /**
   * Returns the tag of the consumer the message was delivered to, or null for a message obtained
   * by a get.
   */
  public String getConsumerTag() {
    return consumerTag;
  }

  public String getContentType() {
    return properties.getContentType();
  }

  public String getCorrelationId() {
    return properties.getCorrelationId();
  }

  public long getDeliveryTag() {
    return envelope.getDeliveryTag();
  }

  public String getExchange() {
    return envelope.getExchange();
  }

  public Map<String, Object> getHeaders() {
    return properties.getHeaders();
  }

  public String getMessageId() {
    return properties.getMessageId();
  }

  /**
   * Returns the number of messages remaining in the queue for a message obtained by a get, else -1.
   */
  public int getMessageCount() {
    return messageCount;
  }

  public AMQP.BasicProperties getProperties() {
    return properties;
  }

  public String getReplyTo() {
    return properties.getReplyTo();
  }

  public String getRoutingKey() {
    return envelope.getRoutingKey();
  }

  /**
   * Returns whether the channel the message was delivered on is still open, and so whether the
   * message can still be settled.
   */
  public boolean isChannelOpen() {
    return delegate.isOpen();
  }

  /**
   * Returns whether the message was consumed without acknowledgement.
   */
  public boolean isNoAck() {
    return noAck;
  }

  /**
   * Returns whether the message has been settled.
   */
  public boolean isProcessed() {
    return processed.get();
  }

  public boolean isRedelivered() {
    return envelope.isRedeliver();
  }

  @Override
  public String toString() {
    return String.format("IncomingMessage[deliveryTag=%s, exchange=%s, routingKey=%s, messageId=%s]",
        envelope.getDeliveryTag(), envelope.getExchange(), envelope.getRoutingKey(),
        properties.getMessageId());
  }

  private void markProcessed() {
    if (noAck)
      throw new IllegalStateException("Cannot settle a message that was consumed without acknowledgement");
    if (!processed.compareAndSet(false, true))
      throw new IllegalStateException("Message has already been processed");
  }
}
