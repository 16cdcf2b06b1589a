package net.jodah.tether;

import java.io.IOException;
import java.util.Map;

import net.jodah.tether.internal.RestorationLedger.Entry;
import net.jodah.tether.internal.RestorationLedger.Phase;

/**
 * Restores a binding from a source exchange to a destination queue or exchange. A binding serves as
 * its own ledger key: two bindings are equal when they have the same destination, source, routing
 * key and arguments. A queue binding made with the queue's own name as its routing key follows the
 * queue's name when an anonymous queue is renamed on recovery.
 *
 * <p>
 * The source is held by name, so deleting any exchange handle with that name on the channel also
 * forgets the binding, as the broker does when the exchange is deleted.
 */
class Binding implements Entry<com.rabbitmq.client.Channel> {
  final Object destination;
  final String source;
  private final String routingKey;
  private final boolean routedByQueueName;
  final Map<String, Object> arguments;

  Binding(Queue destination, String source, String routingKey, Map<String, Object> arguments) {
    this.destination = destination;
    this.source = source;
    this.routingKey = routingKey;
    this.arguments = arguments;
    routedByQueueName = destination.isAnonymous() && routingKey.equals(destination.getName());
  }

  Binding(Exchange destination, String source, String routingKey, Map<String, Object> arguments) {
    this.destination = destination;
    this.source = source;
    this.routingKey = routingKey;
    this.arguments = arguments;
    routedByQueueName = false;
  }

  @Override
  public boolean dependsOn(Object entity) {
    if (entity == destination)
      return true;
    return entity instanceof Exchange && ((Exchange) entity).getName().equals(source);
  }

  @Override
  public Phase getPhase() {
    return Phase.BINDING;
  }

  String getRoutingKey() {
    return routedByQueueName ? ((Queue) destination).getName() : routingKey;
  }

  @Override
  public void restore(com.rabbitmq.client.Channel channel) throws IOException {
    if (destination instanceof Queue)
      ((Queue) destination).bindOperation(source, getRoutingKey(), arguments).call(channel);
    else
      ((Exchange) destination).bindOperation(source, routingKey, arguments).call(channel);
  }

  /** Excludes the routing key, which can follow a queue rename. */
  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((arguments == null) ? 0 : arguments.hashCode());
    result = prime * result + System.identityHashCode(destination);
    result = prime * result + ((source == null) ? 0 : source.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Binding other = (Binding) obj;
    if (destination != other.destination)
      return false;
    if (arguments == null) {
      if (other.arguments != null)
        return false;
    } else if (!arguments.equals(other.arguments))
      return false;
    if (!getRoutingKey().equals(other.getRoutingKey()))
      return false;
    if (source == null) {
      if (other.source != null)
        return false;
    } else if (!source.equals(other.source))
      return false;
    return true;
  }

  @Override
  public String toString() {
    return "Binding [source=" + source + ", destination=" + destination + ", routingKey="
        + getRoutingKey() + "]";
  }
}
