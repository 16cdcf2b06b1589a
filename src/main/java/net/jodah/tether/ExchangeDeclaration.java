package net.jodah.tether;

import java.io.IOException;

import net.jodah.tether.internal.RestorationLedger.Entry;
import net.jodah.tether.internal.RestorationLedger.Phase;

/**
 * Restores an exchange declaration.
 */
class ExchangeDeclaration implements Entry<com.rabbitmq.client.Channel> {
  final Exchange exchange;

  ExchangeDeclaration(Exchange exchange) {
    this.exchange = exchange;
  }

  @Override
  public boolean dependsOn(Object entity) {
    return entity == exchange;
  }

  @Override
  public Phase getPhase() {
    return Phase.DECLARATION;
  }

  @Override
  public void restore(com.rabbitmq.client.Channel channel) throws IOException {
    exchange.declareOperation().call(channel);
  }

  @Override
  public String toString() {
    return "ExchangeDeclaration [name=" + exchange.getName() + "]";
  }
}
