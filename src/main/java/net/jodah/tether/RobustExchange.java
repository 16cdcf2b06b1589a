package net.jodah.tether;

import java.util.Map;

/**
 * An exchange whose declaration and bindings are restored when its {@link RobustChannel} is
 * reopened.
 */
public class RobustExchange extends Exchange {
  private final RobustChannel robustChannel;

  RobustExchange(RobustChannel channel, String name, String type, ExchangeOptions options) {
    super(channel, name, type, options);
    robustChannel = channel;
  }

  @Override
  void onBound(String source, String routingKey, Map<String, Object> arguments) {
    if (!options.isRobust())
      return;
    Binding binding = new Binding(this, source, routingKey, arguments);
    robustChannel.ledger.record(binding, binding);
  }

  @Override
  void onDeclared() {
    if (options.isRobust())
      robustChannel.ledger.record(this, new ExchangeDeclaration(this));
  }

  @Override
  void onDeleted() {
    robustChannel.ledger.remove(this);
    robustChannel.ledger.removeDependents(this);
  }

  @Override
  void onUnbound(String source, String routingKey, Map<String, Object> arguments) {
    robustChannel.ledger.remove(new Binding(this, source, routingKey, arguments));
  }
}
