package net.jodah.tether;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.util.concurrent.atomic.AtomicReference;

import net.jodah.concurrentunit.Waiter;
import net.jodah.tether.AmqpException.ChannelClosedException;
import net.jodah.tether.AmqpException.ConnectionException;
import net.jodah.tether.AmqpException.MessageNackedException;
import net.jodah.tether.AmqpException.MessageReturnedException;
import net.jodah.tether.AmqpException.OperationTimeoutException;
import net.jodah.tether.AmqpException.PolicyException;
import net.jodah.tether.AmqpException.QueueEmptyException;
import net.jodah.tether.util.Duration;

import org.testng.annotations.Test;

import com.rabbitmq.client.ConfirmListener;

@Test
public class ChannelTest extends AbstractFunctionalTest {
  public void shouldPublishAndGet() throws Throwable {
    Channel channel = createConnection().channel();
    Queue queue = channel.declareQueue("orders");
    channel.getDefaultExchange().publish(Message.of("order-1").withMessageId("1"), "orders");

    IncomingMessage message = queue.get();
    assertEquals(message.getBodyAsString(), "order-1");
    assertEquals(message.getMessageId(), "1");
    assertEquals(message.getRoutingKey(), "orders");
    assertEquals(message.getMessageCount(), 0);
    message.ack();
    assertTrue(message.isProcessed());
    assertEquals(broker.messageCount("orders"), 0);
  }

  public void shouldRefusePublishToInternalExchange() throws Throwable {
    Channel channel = createConnection().channel();
    Exchange exchange = channel.declareExchange("internal", ExchangeType.FANOUT,
        new ExchangeOptions().withInternal(true));

    try {
      exchange.publish(Message.of("x"), "");
      fail();
    } catch (PolicyException expected) {
    }

    assertFalse(mockChannel(channel).operations.contains("basicPublish"));
    assertTrue(channel.isOpen());
  }

  public void shouldFailGetOnEmptyQueue() throws Throwable {
    Channel channel = createConnection().channel();
    Queue queue = channel.declareQueue("empty");

    try {
      queue.get();
      fail();
    } catch (QueueEmptyException expected) {
    }

    assertNull(queue.get(false, false, null));
    assertTrue(channel.isOpen());
  }

  public void shouldFailOperationsAfterClose() throws Throwable {
    Channel channel = createConnection().channel();
    final Waiter waiter = new Waiter();
    channel.addCloseCallback(new CloseCallback() {
      @Override
      public void onClose(Channel channel, Throwable cause) {
        waiter.assertEquals(cause, null);
        waiter.resume();
      }
    });

    channel.close();
    waiter.await(1000);
    assertTrue(channel.isClosed());
    assertTrue(connection.getChannels().isEmpty());

    try {
      channel.declareQueue("late");
      fail();
    } catch (ChannelClosedException expected) {
      assertEquals(expected.getReplyCode(), 0);
    }

    // Closing again has no effect
    channel.close();
  }

  public void shouldCloseOnBrokerError() throws Throwable {
    Channel channel = createConnection().channel();
    channel.declareQueue("orders", new QueueOptions().withDurable(true));

    try {
      channel.declareQueue("orders", new QueueOptions().withDurable(false));
      fail();
    } catch (ChannelClosedException expected) {
      assertEquals(expected.getReplyCode(), 406);
    }

    assertTrue(channel.isClosed());
    try {
      channel.declareQueue("other");
      fail();
    } catch (ChannelClosedException expected) {
      assertEquals(expected.getReplyCode(), 406);
    }
  }

  public void shouldFailPassiveDeclarationOfMissingQueue() throws Throwable {
    Channel channel = createConnection().channel();

    try {
      channel.getQueue("missing");
      fail();
    } catch (ChannelClosedException expected) {
      assertEquals(expected.getReplyCode(), 404);
    }

    try {
      connection.channel().getExchange("missing");
      fail();
    } catch (ChannelClosedException expected) {
      assertEquals(expected.getReplyCode(), 404);
    }
  }

  public void shouldRouteThroughBoundExchanges() throws Throwable {
    Channel channel = createConnection().channel();
    Exchange fanout = channel.declareExchange("events", ExchangeType.FANOUT);
    Exchange direct = channel.declareExchange("routed", ExchangeType.DIRECT);
    Queue queue = channel.declareQueue("audit");
    direct.bind(ExchangeRef.of(fanout), "");
    queue.bind(ExchangeRef.of(direct), "audit-key");

    fanout.publish(Message.of("event"), "audit-key");
    assertEquals(queue.get().getBodyAsString(), "event");

    queue.unbind(ExchangeRef.of(direct), "audit-key");
    assertFalse(broker.isBound("routed", "audit", "audit-key"));
  }

  public void shouldPurgeAndDelete() throws Throwable {
    Channel channel = createConnection().channel();
    Queue queue = channel.declareQueue("work");
    for (int i = 0; i < 3; i++)
      channel.getDefaultExchange().publish(Message.of("m" + i), "work");

    assertEquals(queue.purge(), 3);
    channel.getDefaultExchange().publish(Message.of("m"), "work");
    assertEquals(queue.delete(false, false, null), 1);
    assertFalse(broker.hasQueue("work"));
  }

  public void shouldNotifyReturnCallbacks() throws Throwable {
    Channel channel = createConnection().channel();
    final AtomicReference<ReturnedMessage> returned = new AtomicReference<ReturnedMessage>();
    channel.addReturnCallback(new ReturnCallback() {
      @Override
      public void onReturn(Channel channel, ReturnedMessage message) {
        returned.set(message);
      }
    });

    channel.getDefaultExchange().publish(Message.of("lost").withMessageId("m-1"), "nowhere");
    assertEquals(returned.get().getReplyCode(), 312);
    assertEquals(returned.get().getRoutingKey(), "nowhere");
    assertEquals(returned.get().getMessageId(), "m-1");
  }

  public void shouldConfirmPublishes() throws Throwable {
    config.withPublisherConfirms(true);
    Channel channel = createConnection().channel();
    channel.declareQueue("confirmed");

    channel.getDefaultExchange().publish(Message.of("one"), "confirmed");
    assertEquals(broker.messageCount("confirmed"), 1);
    assertTrue(mockChannel(channel).confirmMode);
  }

  public void shouldFailNackedPublishes() throws Throwable {
    config.withPublisherConfirms(true);
    Channel channel = createConnection().channel();
    channel.declareQueue("confirmed");
    broker.nackNext.set(true);

    try {
      channel.getDefaultExchange().publish(Message.of("one"), "confirmed");
      fail();
    } catch (MessageNackedException expected) {
      assertEquals(expected.getDeliveryTag(), 1);
    }

    // The next publish is unaffected
    channel.getDefaultExchange().publish(Message.of("two"), "confirmed");
  }

  public void shouldFailReturnedMandatoryPublishes() throws Throwable {
    config.withPublisherConfirms(true);
    Channel channel = createConnection().channel();

    try {
      channel.getDefaultExchange().publish(Message.of("lost"), "nowhere");
      fail();
    } catch (MessageReturnedException expected) {
      assertEquals(expected.getReturnedMessage().getReplyCode(), 312);
    }

    // Not mandatory, so not returned
    channel.getDefaultExchange().publish(Message.of("lost"), "nowhere",
        new PublishOptions().withMandatory(false));
  }

  public void shouldFailOnlyTheReturnedPublishWhenConfirmsArriveOutOfOrder() throws Throwable {
    config.withPublisherConfirms(true);
    final Channel channel = createConnection().channel();
    channel.declareQueue("orders");
    broker.confirming = false;
    final Waiter waiter = new Waiter();
    channel.addReturnCallback(new ReturnCallback() {
      @Override
      public void onReturn(Channel channel, ReturnedMessage message) {
        waiter.assertEquals(message.getRoutingKey(), "nowhere");
        waiter.resume();
      }
    });

    new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          channel.getDefaultExchange().publish(Message.of("routable"), "orders");
          waiter.resume();
        } catch (Throwable e) {
          waiter.fail(e);
        }
      }
    }).start();
    for (int i = 0; i < 100 && broker.messageCount("orders") == 0; i++)
      Thread.sleep(10);

    new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          channel.getDefaultExchange().publish(Message.of("unroutable"), "nowhere");
          waiter.fail("Expected the publish to be returned");
        } catch (MessageReturnedException expected) {
          waiter.assertEquals(expected.getReturnedMessage().getReplyCode(), 312);
          waiter.resume();
        } catch (Throwable e) {
          waiter.fail(e);
        }
      }
    }).start();

    // Wait for the return, then confirm the unroutable publish before the routable one
    waiter.await(5000);
    for (ConfirmListener listener : mockChannel(channel).confirmListeners)
      listener.handleAck(2, false);
    for (ConfirmListener listener : mockChannel(channel).confirmListeners)
      listener.handleAck(1, false);
    waiter.await(5000, 2);
  }

  public void shouldTimeOutUnconfirmedPublishes() throws Throwable {
    config.withPublisherConfirms(true);
    Channel channel = createConnection().channel();
    channel.declareQueue("slow");
    broker.confirming = false;

    try {
      channel.getDefaultExchange().publish(Message.of("one"), "slow",
          new PublishOptions().withTimeout(Duration.millis(50)));
      fail();
    } catch (OperationTimeoutException expected) {
    }

    assertTrue(channel.isOpen());
  }

  public void shouldApplyQos() throws Throwable {
    Channel channel = createConnection().channel();
    channel.setQos(5);
    assertEquals(channel.getPrefetchCount(), 5);
    assertEquals(mockChannel(channel).prefetchCount, 5);
  }

  public void plainConnectionShouldCloseChannelsWhenLost() throws Throwable {
    Channel channel = createConnection().channel();
    final Waiter waiter = new Waiter();
    channel.addCloseCallback(new CloseCallback() {
      @Override
      public void onClose(Channel channel, Throwable cause) {
        waiter.assertTrue(cause != null);
        waiter.resume();
      }
    });

    loseConnection();
    waiter.await(1000);
    assertTrue(connection.isClosed());
    assertTrue(channel.isClosed());
    assertEquals(connectAttempts.get(), 1);

    try {
      connection.channel();
      fail();
    } catch (ConnectionException expected) {
    }
  }

  public void shouldCloseChannelsWithConnection() throws Throwable {
    Connection connection = createConnection();
    Channel channel1 = connection.channel();
    Channel channel2 = connection.channel();
    assertEquals(connection.getChannels().size(), 2);

    connection.close();
    assertTrue(channel1.isClosed());
    assertTrue(channel2.isClosed());
    assertTrue(connection.isClosed());
  }
}
