package net.jodah.tether;

import java.util.Map;

/**
 * A queue whose declaration, bindings and consumers are restored when its {@link RobustChannel} is
 * reopened. Consumers keep their consumer tags across recovery.
 */
public class RobustQueue extends Queue {
  private final RobustChannel robustChannel;

  RobustQueue(RobustChannel channel, String name, QueueOptions options) {
    super(channel, name, options);
    robustChannel = channel;
  }

  @Override
  void onBound(String exchange, String routingKey, Map<String, Object> arguments) {
    if (!options.isRobust())
      return;
    Binding binding = new Binding(this, exchange, routingKey, arguments);
    robustChannel.ledger.record(binding, binding);
  }

  @Override
  void onCancelled(String consumerTag) {
    robustChannel.ledger.remove(consumerTag);
  }

  @Override
  void onConsumerCancelled(String consumerTag) {
    if (robustChannel.ledger.remove(consumerTag) != null)
      robustChannel.log.info("Stopped restoring consumer {} of {} since the broker cancelled it",
          consumerTag, this);
  }

  @Override
  void onConsumed(String consumerTag, MessageHandler handler, ConsumeOptions consumeOptions) {
    if (!options.isRobust())
      return;
    robustChannel.ledger.record(consumerTag, new ConsumerDeclaration(this, consumerTag, handler,
        consumeOptions));
  }

  @Override
  void onDeclared() {
    if (options.isRobust())
      robustChannel.ledger.record(this, new QueueDeclaration(this));
  }

  @Override
  void onDeleted() {
    robustChannel.ledger.remove(this);
    robustChannel.ledger.removeDependents(this);
  }

  @Override
  void onUnbound(String exchange, String routingKey, Map<String, Object> arguments) {
    robustChannel.ledger.remove(new Binding(this, exchange, routingKey, arguments));
  }
}
