package net.jodah.tether;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import net.jodah.tether.AmqpException.OperationTimeoutException;
import net.jodah.tether.util.Duration;

import org.testng.annotations.Test;

@Test
public class QueueIteratorTest extends AbstractFunctionalTest {
  public void shouldIterateAcrossConnectionLoss() throws Throwable {
    Channel channel = createRobustConnection().channel();
    Queue queue = channel.declareQueue("work", new QueueOptions().withDurable(true));
    QueueIterator iterator = queue.iterator();
    iterator.open();

    for (int i = 0; i < 5; i++)
      channel.getDefaultExchange().publish(Message.of("0-" + i), "work");
    IncomingMessage first = iterator.poll(Duration.seconds(5));
    assertEquals(first.getBodyAsString(), "0-0");
    first.ack();

    // The rest of the first batch is still buffered, unacked, when the link drops
    for (int i = 0; i < 100 && broker.messageCount("work") != 0; i++)
      Thread.sleep(10);
    loseConnection();
    awaitRecovery();

    for (int i = 0; i < 5; i++)
      channel.getDefaultExchange().publish(Message.of("1-" + i), "work");

    List<String> received = new ArrayList<String>();
    for (int i = 0; i < 9; i++) {
      IncomingMessage message = iterator.poll(Duration.seconds(5));
      received.add(message.getBodyAsString());
      message.ack();
    }

    assertEquals(received, Arrays.asList("0-1", "0-2", "0-3", "0-4", "1-0", "1-1", "1-2", "1-3", "1-4"));
    try {
      iterator.poll(Duration.millis(100));
      fail();
    } catch (OperationTimeoutException expected) {
    }

    iterator.close();
    assertEquals(broker.messageCount("work"), 0);
  }

  public void shouldIterateAcrossConnectionLossAfterDrainingBatch() throws Throwable {
    Channel channel = createRobustConnection().channel();
    Queue queue = channel.declareQueue("work", new QueueOptions().withDurable(true));
    QueueIterator iterator = queue.iterator();

    for (int i = 0; i < 5; i++)
      channel.getDefaultExchange().publish(Message.of("0-" + i), "work");
    for (int i = 0; i < 5; i++) {
      IncomingMessage message = iterator.next();
      assertEquals(message.getBodyAsString(), "0-" + i);
      message.ack();
    }

    loseConnection();
    awaitRecovery();

    for (int i = 0; i < 5; i++)
      channel.getDefaultExchange().publish(Message.of("1-" + i), "work");
    for (int i = 0; i < 5; i++) {
      IncomingMessage message = iterator.poll(Duration.seconds(5));
      assertEquals(message.getBodyAsString(), "1-" + i);
      message.ack();
    }

    iterator.close();
  }

  public void shouldRequeueBufferedMessagesOnClose() throws Throwable {
    Channel channel = createRobustConnection().channel();
    Queue queue = channel.declareQueue("work");
    QueueIterator iterator = queue.iterator();
    iterator.open();
    for (int i = 0; i < 3; i++)
      broker.enqueue("work", "m" + i);

    IncomingMessage first = iterator.next();
    assertEquals(first.getBodyAsString(), "m0");
    first.ack();
    iterator.close();

    for (int i = 0; i < 100 && broker.messageCount("work") != 2; i++)
      Thread.sleep(50);
    assertEquals(broker.messageCount("work"), 2);
    assertTrue(broker.consumerTags("work").isEmpty());
    assertTrue(iterator.isClosed());
    assertFalse(iterator.hasNext());

    // Closing again has no effect
    iterator.close();
  }

  public void shouldTimeOutPollingEmptyQueue() throws Throwable {
    Queue queue = createRobustConnection().channel().declareQueue("empty");
    QueueIterator iterator = queue.iterator();

    try {
      iterator.poll(Duration.millis(50));
      fail();
    } catch (OperationTimeoutException expected) {
    }

    assertEquals(broker.consumerTags("empty"), Arrays.asList(iterator.getConsumerTag()));
    iterator.close();
  }

  public void shouldStopWhenChannelCloses() throws Throwable {
    Channel channel = createRobustConnection().channel();
    QueueIterator iterator = channel.declareQueue("work").iterator();
    iterator.open();

    channel.close();
    assertFalse(iterator.hasNext());

    try {
      iterator.next();
      fail();
    } catch (NoSuchElementException expected) {
    }
  }

  public void hasNextShouldNotConsume() throws Throwable {
    Queue queue = createRobustConnection().channel().declareQueue("work");
    QueueIterator iterator = queue.iterator();
    broker.enqueue("work", "only");

    assertTrue(iterator.hasNext());
    assertTrue(iterator.hasNext());
    assertEquals(iterator.next().getBodyAsString(), "only");

    try {
      iterator.poll(Duration.millis(50));
      fail();
    } catch (OperationTimeoutException expected) {
    }
  }
}
