package net.jodah.tether;

import net.jodah.tether.internal.util.Assert;

/**
 * Identifies an exchange by name, either directly or through an {@link Exchange} handle. Used
 * wherever an operation accepts an exchange as an argument.
 */
public abstract class ExchangeRef {
  private ExchangeRef() {
  }

  /**
   * Returns a reference to the exchange with the {@code name}.
   *
   * @throws NullPointerException if {@code name} is null
   */
  public static ExchangeRef named(final String name) {
    Assert.notNull(name, "name");
    return new ExchangeRef() {
      @Override
      public String getName() {
        return name;
      }
    };
  }

  /**
   * Returns a reference to the {@code exchange}.
   *
   * @throws NullPointerException if {@code exchange} is null
   */
  public static ExchangeRef of(final Exchange exchange) {
    Assert.notNull(exchange, "exchange");
    return new ExchangeRef() {
      @Override
      public String getName() {
        return exchange.getName();
      }
    };
  }

  public abstract String getName();

  @Override
  public String toString() {
    return getName();
  }
}
