package net.jodah.tether;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

import net.jodah.tether.internal.util.Assert;

import com.rabbitmq.client.AMQP;

/**
 * An outgoing message: a body plus the AMQP properties to publish it with.
 */
public class Message {
  private final byte[] body;
  private String contentType;
  private String contentEncoding;
  private Map<String, Object> headers;
  private boolean persistent;
  private Integer priority;
  private String correlationId;
  private String replyTo;
  private String expiration;
  private String messageId;
  private Date timestamp;
  private String type;
  private String userId;
  private String appId;

  /**
   * @throws NullPointerException if {@code body} is null
   */
  public Message(byte[] body) {
    this.body = Assert.notNull(body, "body");
  }

  /**
   * Creates a message with the UTF-8 encoding of the {@code body}.
   *
   * @throws NullPointerException if {@code body} is null
   */
  public static Message of(String body) {
    return new Message(Assert.notNull(body, "body").getBytes(StandardCharsets.UTF_8)).withContentType(
        "text/plain").withContentEncoding("utf-8");
  }

  public byte[] getBody() {
    return body;
  }

  public String getContentType() {
    return contentType;
  }

  public String getCorrelationId() {
    return correlationId;
  }

  public Map<String, Object> getHeaders() {
    return headers;
  }

  public String getMessageId() {
    return messageId;
  }

  public String getReplyTo() {
    return replyTo;
  }

  public boolean isPersistent() {
    return persistent;
  }

  /**
   * Returns the AMQP properties for the message.
   */
  public AMQP.BasicProperties toProperties() {
    return new AMQP.BasicProperties.Builder().contentType(contentType)
        .contentEncoding(contentEncoding)
        .headers(headers)
        .deliveryMode(persistent ? 2 : 1)
        .priority(priority)
        .correlationId(correlationId)
        .replyTo(replyTo)
        .expiration(expiration)
        .messageId(messageId)
        .timestamp(timestamp)
        .type(type)
        .userId(userId)
        .appId(appId)
        .build();
  }

  public Message withAppId(String appId) {
    this.appId = appId;
    return this;
  }

  public Message withContentEncoding(String contentEncoding) {
    this.contentEncoding = contentEncoding;
    return this;
  }

  public Message withContentType(String contentType) {
    this.contentType = contentType;
    return this;
  }

  public Message withCorrelationId(String correlationId) {
    this.correlationId = correlationId;
    return this;
  }

  /**
   * Sets the expiration, in milliseconds, after which the broker may discard the message.
   */
  public Message withExpiration(long millis) {
    this.expiration = String.valueOf(millis);
    return this;
  }

  /**
   * Adds the header {@code name} with the {@code value}.
   */
  public Message withHeader(String name, Object value) {
    if (headers == null)
      headers = new LinkedHashMap<String, Object>();
    headers.put(name, value);
    return this;
  }

  public Message withHeaders(Map<String, Object> headers) {
    this.headers = headers == null ? null : new LinkedHashMap<String, Object>(headers);
    return this;
  }

  public Message withMessageId(String messageId) {
    this.messageId = messageId;
    return this;
  }

  /**
   * Sets whether the broker should persist the message to disk.
   */
  public Message withPersistent(boolean persistent) {
    this.persistent = persistent;
    return this;
  }

  public Message withPriority(int priority) {
    this.priority = Integer.valueOf(priority);
    return this;
  }

  public Message withReplyTo(String replyTo) {
    this.replyTo = replyTo;
    return this;
  }

  public Message withTimestamp(Date timestamp) {
    this.timestamp = timestamp;
    return this;
  }

  public Message withType(String type) {
    this.type = type;
    return this;
  }

  public Message withUserId(String userId) {
    this.userId = userId;
    return this;
  }

  @Override
  public String toString() {
    return String.format("Message[messageId=%s, correlationId=%s, %s bytes]", messageId, correlationId,
        body.length);
  }
}
