package net.jodah.tether.internal.util.concurrent;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertTrue;

import org.testng.annotations.Test;

@Test
public class NamedThreadFactoryTest {
  public void shouldCreateNumberedDaemonThreads() {
    NamedThreadFactory factory = new NamedThreadFactory("orders-consumer-%s");
    Runnable noop = new Runnable() {
      @Override
      public void run() {
      }
    };

    Thread first = factory.newThread(noop);
    Thread second = factory.newThread(noop);

    assertEquals(first.getName(), "orders-consumer-1");
    assertEquals(second.getName(), "orders-consumer-2");
    assertTrue(first.isDaemon());
    assertNotNull(first.getUncaughtExceptionHandler());
  }
}
