package net.jodah.tether.internal.util.concurrent;

import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import net.jodah.concurrentunit.Waiter;
import net.jodah.tether.util.Duration;

import org.testng.annotations.Test;

@Test
public class ReconnectPauseTest {
  public void shouldElapseWhenNotCancelled() throws Throwable {
    ReconnectPause pause = new ReconnectPause();
    long start = System.nanoTime();

    assertTrue(pause.pause(Duration.millis(50)));
    assertTrue(System.nanoTime() - start >= Duration.millis(50).toNanos());
    assertFalse(pause.isCancelled());
  }

  public void shouldWakePausingThreadsWhenCancelled() throws Throwable {
    final ReconnectPause pause = new ReconnectPause();
    final Waiter waiter = new Waiter();

    for (final Duration duration : new Duration[] { Duration.mins(1), Duration.inf() })
      new Thread(new Runnable() {
        @Override
        public void run() {
          try {
            waiter.assertFalse(pause.pause(duration));
            waiter.resume();
          } catch (InterruptedException e) {
            waiter.fail(e);
          }
        }
      }).start();

    Thread.sleep(100);
    pause.cancel();
    waiter.await(1000, 2);
  }

  public void shouldNotPauseOnceCancelled() throws Throwable {
    ReconnectPause pause = new ReconnectPause();
    pause.cancel();
    pause.cancel();

    assertTrue(pause.isCancelled());
    assertFalse(pause.pause(Duration.hours(1)));
  }
}
