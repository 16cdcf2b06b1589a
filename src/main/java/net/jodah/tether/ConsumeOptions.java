package net.jodah.tether;

import java.util.Map;

/**
 * Options for starting a consumer.
 */
public class ConsumeOptions {
  private boolean noAck;
  private boolean exclusive;
  private String consumerTag;
  private Map<String, Object> arguments;

  public ConsumeOptions() {
  }

  private ConsumeOptions(ConsumeOptions options) {
    noAck = options.noAck;
    exclusive = options.exclusive;
    consumerTag = options.consumerTag;
    arguments = options.arguments;
  }

  public ConsumeOptions copy() {
    return new ConsumeOptions(this);
  }

  public Map<String, Object> getArguments() {
    return arguments;
  }

  /**
   * Returns the requested consumer tag, or null to let the broker generate one.
   */
  public String getConsumerTag() {
    return consumerTag;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  /**
   * Returns whether messages are considered settled as soon as they are delivered.
   */
  public boolean isNoAck() {
    return noAck;
  }

  public ConsumeOptions withArguments(Map<String, Object> arguments) {
    this.arguments = arguments;
    return this;
  }

  public ConsumeOptions withConsumerTag(String consumerTag) {
    this.consumerTag = consumerTag;
    return this;
  }

  public ConsumeOptions withExclusive(boolean exclusive) {
    this.exclusive = exclusive;
    return this;
  }

  public ConsumeOptions withNoAck(boolean noAck) {
    this.noAck = noAck;
    return this;
  }
}
