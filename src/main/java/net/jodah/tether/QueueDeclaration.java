package net.jodah.tether;

import java.io.IOException;

import net.jodah.tether.internal.RestorationLedger.Entry;
import net.jodah.tether.internal.RestorationLedger.Phase;

/**
 * Restores a queue declaration. Anonymous queues are declared anonymously again, taking the newly
 * assigned name. Passive declarations re-verify that the queue still exists.
 */
class QueueDeclaration implements Entry<com.rabbitmq.client.Channel> {
  final Queue queue;

  QueueDeclaration(Queue queue) {
    this.queue = queue;
  }

  @Override
  public boolean dependsOn(Object entity) {
    return entity == queue;
  }

  @Override
  public Phase getPhase() {
    return Phase.DECLARATION;
  }

  @Override
  public void restore(com.rabbitmq.client.Channel channel) throws IOException {
    queue.declareOperation().call(channel);
  }

  @Override
  public String toString() {
    return "QueueDeclaration [name=" + queue.getName() + "]";
  }
}
