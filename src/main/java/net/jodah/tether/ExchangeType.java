package net.jodah.tether;

/**
 * Exchange types, including those provided by common broker plugins.
 */
public enum ExchangeType {
  DIRECT("direct"), FANOUT("fanout"), TOPIC("topic"), HEADERS("headers"),
  X_DELAYED_MESSAGE("x-delayed-message"), X_CONSISTENT_HASH("x-consistent-hash"),
  X_MODULUS_HASH("x-modulus-hash");

  private final String value;

  private ExchangeType(String value) {
    this.value = value;
  }

  /** Returns the type name sent to the broker. */
  public String getValue() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
