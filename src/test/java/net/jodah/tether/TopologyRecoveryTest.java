package net.jodah.tether;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotSame;
import static org.testng.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import net.jodah.concurrentunit.Waiter;
import net.jodah.tether.event.DefaultConsumerListener;

import org.mockito.InOrder;
import org.testng.annotations.Test;

import com.rabbitmq.client.Consumer;

@Test
public class TopologyRecoveryTest extends AbstractFunctionalTest {
  public void shouldRestoreTopologyInOrder() throws Throwable {
    RobustChannel channel = (RobustChannel) createRobustConnection().channel();
    Exchange exchange = channel.declareExchange("x", ExchangeType.DIRECT);
    Queue queue = channel.declareQueue("q");
    queue.bind(ExchangeRef.of(exchange), "rk");
    channel.setQos(1);
    String tag = queue.consume(new MessageHandler() {
      @Override
      public void handle(IncomingMessage message) {
      }
    });
    assertEquals(channel.getRestorableCount(), 5);
    com.rabbitmq.client.Channel previous = rawChannel(channel);

    loseConnection();
    awaitRecovery();

    com.rabbitmq.client.Channel raw = rawChannel(channel);
    assertNotSame(raw, previous);
    InOrder inOrder = inOrder(raw);
    inOrder.verify(raw).exchangeDeclare(eq("x"), eq("direct"), anyBoolean(), anyBoolean(),
        anyBoolean(), any());
    inOrder.verify(raw).queueDeclare(eq("q"), anyBoolean(), anyBoolean(), anyBoolean(), any());
    inOrder.verify(raw).queueBind(eq("q"), eq("x"), eq("rk"), any());
    inOrder.verify(raw).basicQos(0, 1, false);
    inOrder.verify(raw).basicConsume(eq("q"), anyBoolean(), eq(tag), anyBoolean(), anyBoolean(),
        any(), any(Consumer.class));
    assertEquals(broker.consumerTags("q"), Arrays.asList(tag));
    assertEquals(channel.getRestorableCount(), 5);
  }

  public void shouldDeliverToRestoredConsumers() throws Throwable {
    Channel channel = createRobustConnection().channel();
    Queue queue = channel.declareQueue("q");
    final Waiter waiter = new Waiter();
    queue.consume(new MessageHandler() {
      @Override
      public void handle(IncomingMessage message) throws Exception {
        waiter.assertEquals(message.getBodyAsString(), "after");
        message.ack();
        waiter.resume();
      }
    });

    loseConnection();
    awaitRecovery();
    broker.enqueue("q", "after");
    waiter.await(5000);
  }

  public void shouldRenameAnonymousQueuesOnRecovery() throws Throwable {
    Channel channel = createRobustConnection().channel();
    Exchange exchange = channel.declareExchange("x", ExchangeType.DIRECT);
    Queue queue = channel.declareQueue();
    assertEquals(queue.getName(), "amq.gen-1");
    queue.bind(ExchangeRef.of(exchange));
    String tag = queue.consume(new MessageHandler() {
      @Override
      public void handle(IncomingMessage message) {
      }
    });

    loseConnection();
    awaitRecovery();

    assertEquals(queue.getName(), "amq.gen-2");
    assertFalse(broker.hasQueue("amq.gen-1"));
    assertTrue(broker.isBound("x", "amq.gen-2", "amq.gen-2"));
    assertEquals(broker.consumerTags("amq.gen-2"), Arrays.asList(tag));
  }

  public void shouldNotRestoreRemovedTopology() throws Throwable {
    RobustChannel channel = (RobustChannel) createRobustConnection().channel();
    Exchange exchange = channel.declareExchange("x", ExchangeType.DIRECT);
    Queue kept = channel.declareQueue("kept");
    kept.bind(ExchangeRef.of(exchange), "kept-key");
    String tag = kept.consume(new MessageHandler() {
      @Override
      public void handle(IncomingMessage message) {
      }
    });
    Queue temp = channel.declareQueue("temp");
    temp.bind(ExchangeRef.of(exchange), "temp-key");
    temp.consume(new MessageHandler() {
      @Override
      public void handle(IncomingMessage message) {
      }
    });
    assertEquals(channel.getRestorableCount(), 7);

    kept.unbind(ExchangeRef.of(exchange), "kept-key");
    kept.cancel(tag);
    temp.delete(false, false, null);
    assertEquals(channel.getRestorableCount(), 2);

    loseConnection();
    awaitRecovery();

    List<String> operations = mockChannel(channel).operations;
    assertEquals(operations, Arrays.asList("exchangeDeclare", "queueDeclare"));
    assertFalse(broker.hasQueue("temp"));
    assertFalse(broker.isBound("x", "kept", "kept-key"));
  }

  public void shouldNotRestoreNonRobustEntities() throws Throwable {
    RobustChannel channel = (RobustChannel) createRobustConnection().channel();
    Exchange exchange = channel.declareExchange("transient-x", ExchangeType.FANOUT,
        new ExchangeOptions().withRobust(false));
    Queue queue = channel.declareQueue("transient-q", new QueueOptions().withRobust(false));
    queue.bind(ExchangeRef.of(exchange), "");
    queue.consume(new MessageHandler() {
      @Override
      public void handle(IncomingMessage message) {
      }
    });
    assertEquals(channel.getRestorableCount(), 0);

    loseConnection();
    awaitRecovery();

    assertTrue(channel.isOpen());
    assertTrue(mockChannel(channel).operations.isEmpty());
    assertTrue(broker.consumerTags("transient-q").isEmpty());
  }

  public void shouldRestoreOnlyLatestQos() throws Throwable {
    RobustChannel channel = (RobustChannel) createRobustConnection().channel();
    channel.setQos(1);
    channel.setQos(5);
    assertEquals(channel.getRestorableCount(), 1);

    loseConnection();
    awaitRecovery();

    assertEquals(mockChannel(channel).operations, Collections.singletonList("basicQos"));
    assertEquals(mockChannel(channel).prefetchCount, 5);
  }

  public void shouldForgetConsumersCancelledByBroker() throws Throwable {
    RobustChannel channel = (RobustChannel) createRobustConnection().channel();
    Queue queue = channel.declareQueue("doomed");
    queue.consume(new MessageHandler() {
      @Override
      public void handle(IncomingMessage message) {
      }
    });
    assertEquals(channel.getRestorableCount(), 2);

    broker.deleteQueue("doomed");
    for (int i = 0; i < 100 && channel.getRestorableCount() != 1; i++)
      Thread.sleep(50);

    assertEquals(channel.getRestorableCount(), 1);
    assertTrue(channel.isOpen());
  }

  public void shouldForgetBindingsOfDeletedExchanges() throws Throwable {
    RobustChannel channel = (RobustChannel) createRobustConnection().channel();
    Exchange source = channel.declareExchange("source", ExchangeType.FANOUT);
    Exchange destination = channel.declareExchange("destination", ExchangeType.DIRECT);
    Queue queue = channel.declareQueue("q");
    destination.bind(ExchangeRef.of(source), "");
    queue.bind(ExchangeRef.of(source), "");
    assertEquals(channel.getRestorableCount(), 5);

    source.delete();
    assertEquals(channel.getRestorableCount(), 2);

    loseConnection();
    awaitRecovery();

    assertFalse(broker.hasExchange("source"));
    assertEquals(mockChannel(channel).operations, Arrays.asList("exchangeDeclare", "queueDeclare"));
  }

  public void shouldForgetBindingsWhenExchangeIsDeletedThroughAnotherHandle() throws Throwable {
    RobustChannel channel = (RobustChannel) createRobustConnection().channel();
    channel.declareExchange("source", ExchangeType.FANOUT);
    Queue queue = channel.declareQueue("q");
    queue.bind(ExchangeRef.named("source"), "");
    Exchange other = channel.getExchange("source");
    assertEquals(channel.getRestorableCount(), 4);

    other.delete();
    assertEquals(channel.getRestorableCount(), 2);

    loseConnection();
    awaitRecovery();
    assertFalse(mockChannel(channel).operations.contains("queueBind"));
  }

  public void shouldNotifyConsumerListeners() throws Throwable {
    final List<String> events = new CopyOnWriteArrayList<String>();
    config.withConsumerListeners(new DefaultConsumerListener() {
      @Override
      public void onRecoveryStarted(String consumerTag, Channel channel) {
        events.add("started " + consumerTag);
      }

      @Override
      public void onRecoveryCompleted(String consumerTag, Channel channel) {
        events.add("completed " + consumerTag);
      }
    });

    Channel channel = createRobustConnection().channel();
    String tag = channel.declareQueue("q").consume(new MessageHandler() {
      @Override
      public void handle(IncomingMessage message) {
      }
    }, new ConsumeOptions().withConsumerTag("orders-consumer"));
    assertEquals(tag, "orders-consumer");

    loseConnection();
    awaitRecovery();

    assertEquals(events, Arrays.asList("started orders-consumer", "completed orders-consumer"));
  }
}
