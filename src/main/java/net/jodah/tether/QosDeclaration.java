package net.jodah.tether;

import java.io.IOException;

import net.jodah.tether.internal.RestorationLedger.Entry;
import net.jodah.tether.internal.RestorationLedger.Phase;

/**
 * Restores a channel's QoS. Only the latest QoS is kept.
 */
class QosDeclaration implements Entry<com.rabbitmq.client.Channel> {
  static final String KEY = "basic.qos";
  final int prefetchCount;
  final int prefetchSize;

  QosDeclaration(int prefetchCount, int prefetchSize) {
    this.prefetchCount = prefetchCount;
    this.prefetchSize = prefetchSize;
  }

  @Override
  public boolean dependsOn(Object entity) {
    return false;
  }

  @Override
  public Phase getPhase() {
    return Phase.QOS;
  }

  @Override
  public void restore(com.rabbitmq.client.Channel channel) throws IOException {
    Channel.qosOperation(prefetchCount, prefetchSize).call(channel);
  }

  @Override
  public String toString() {
    return "QosDeclaration [prefetchCount=" + prefetchCount + ", prefetchSize=" + prefetchSize + "]";
  }
}
