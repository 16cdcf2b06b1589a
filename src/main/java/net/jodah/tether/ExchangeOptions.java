package net.jodah.tether;

import java.util.Map;

/**
 * Options for declaring an exchange. All flags default to false.
 */
public class ExchangeOptions {
  private boolean durable;
  private boolean autoDelete;
  private boolean internal;
  private boolean passive;
  private Map<String, Object> arguments;
  private boolean robust = true;

  public Map<String, Object> getArguments() {
    return arguments;
  }

  public boolean isAutoDelete() {
    return autoDelete;
  }

  public boolean isDurable() {
    return durable;
  }

  /**
   * Returns whether the exchange is internal, in which case it cannot be published to directly.
   */
  public boolean isInternal() {
    return internal;
  }

  /**
   * Returns whether the declaration only verifies that the exchange exists.
   */
  public boolean isPassive() {
    return passive;
  }

  /**
   * Returns whether a robust channel restores the exchange after it is reopened. Defaults to true.
   */
  public boolean isRobust() {
    return robust;
  }

  public ExchangeOptions withArguments(Map<String, Object> arguments) {
    this.arguments = arguments;
    return this;
  }

  public ExchangeOptions withAutoDelete(boolean autoDelete) {
    this.autoDelete = autoDelete;
    return this;
  }

  public ExchangeOptions withDurable(boolean durable) {
    this.durable = durable;
    return this;
  }

  public ExchangeOptions withInternal(boolean internal) {
    this.internal = internal;
    return this;
  }

  public ExchangeOptions withPassive(boolean passive) {
    this.passive = passive;
    return this;
  }

  /**
   * Sets whether a robust channel restores the exchange after it is reopened. When false, the caller is
   * responsible for declaring it again.
   */
  public ExchangeOptions withRobust(boolean robust) {
    this.robust = robust;
    return this;
  }
}
