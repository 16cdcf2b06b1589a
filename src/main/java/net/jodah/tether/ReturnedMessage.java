package net.jodah.tether;

import com.rabbitmq.client.AMQP;

/**
 * A published message that the broker returned as unroutable.
 */
public class ReturnedMessage {
  private final int replyCode;
  private final String replyText;
  private final String exchange;
  private final String routingKey;
  private final AMQP.BasicProperties properties;
  private final byte[] body;

  public ReturnedMessage(int replyCode, String replyText, String exchange, String routingKey,
      AMQP.BasicProperties properties, byte[] body) {
    this.replyCode = replyCode;
    this.replyText = replyText;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.properties = properties;
    this.body = body;
  }

  public byte[] getBody() {
    return body;
  }

  public String getCorrelationId() {
    return properties == null ? null : properties.getCorrelationId();
  }

  public String getExchange() {
    return exchange;
  }

  public String getMessageId() {
    return properties == null ? null : properties.getMessageId();
  }

  public AMQP.BasicProperties getProperties() {
    return properties;
  }

  public int getReplyCode() {
    return replyCode;
  }

  public String getReplyText() {
    return replyText;
  }

  public String getRoutingKey() {
    return routingKey;
  }

  @Override
  public String toString() {
    return String.format("ReturnedMessage[%s %s, exchange=%s, routingKey=%s]", replyCode, replyText,
        exchange, routingKey);
  }
}
