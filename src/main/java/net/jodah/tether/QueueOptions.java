package net.jodah.tether;

import java.util.Map;

/**
 * Options for declaring a queue. All flags default to false.
 */
public class QueueOptions {
  private boolean durable;
  private boolean exclusive;
  private boolean autoDelete;
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

  public boolean isExclusive() {
    return exclusive;
  }

  /**
   * Returns whether the declaration only verifies that the queue exists.
   */
  public boolean isPassive() {
    return passive;
  }

  /**
   * Returns whether a robust channel restores the queue after it is reopened. Defaults to true.
   */
  public boolean isRobust() {
    return robust;
  }

  public QueueOptions withArguments(Map<String, Object> arguments) {
    this.arguments = arguments;
    return this;
  }

  public QueueOptions withAutoDelete(boolean autoDelete) {
    this.autoDelete = autoDelete;
    return this;
  }

  public QueueOptions withDurable(boolean durable) {
    this.durable = durable;
    return this;
  }

  public QueueOptions withExclusive(boolean exclusive) {
    this.exclusive = exclusive;
    return this;
  }

  public QueueOptions withPassive(boolean passive) {
    this.passive = passive;
    return this;
  }

  /**
   * Sets whether a robust channel restores the queue after it is reopened. When false, the caller is
   * responsible for declaring it again.
   */
  public QueueOptions withRobust(boolean robust) {
    this.robust = robust;
    return this;
  }
}
