package net.jodah.tether;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import net.jodah.tether.MockBroker.MockChannel;
import net.jodah.tether.config.Config;
import net.jodah.tether.config.RecoveryPolicy;
import net.jodah.tether.internal.util.concurrent.Invocations;
import net.jodah.tether.util.Duration;

import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;

import com.rabbitmq.client.Address;
import com.rabbitmq.client.ConnectionFactory;

/**
 * Runs connections and channels against a {@link MockBroker} reached through a mocked connection
 * factory.
 */
public abstract class AbstractFunctionalTest {
  protected MockBroker broker;
  protected ConnectionFactory factory;
  protected ConnectionOptions options;
  protected Config config;
  protected Connection connection;
  protected final AtomicInteger connectAttempts = new AtomicInteger();
  protected final AtomicInteger failingConnects = new AtomicInteger();

  @BeforeMethod
  protected void beforeMethod() throws Exception {
    broker = new MockBroker();
    connectAttempts.set(0);
    failingConnects.set(0);
    connection = null;
    config = new Config().withRecoveryPolicy(new RecoveryPolicy().withInterval(Duration.millis(10)))
        .withPublisherConfirms(false);

    factory = mock(ConnectionFactory.class);
    when(factory.clone()).thenReturn(factory);
    when(factory.newConnection(any(ExecutorService.class), any(Address[].class), anyString())).thenAnswer(
        new Answer<com.rabbitmq.client.Connection>() {
          @Override
          public com.rabbitmq.client.Connection answer(InvocationOnMock invocation) throws Throwable {
            connectAttempts.incrementAndGet();
            if (failingConnects.getAndDecrement() > 0)
              throw new ConnectException("Connection refused");
            return broker.newSession().connection;
          }
        });
    options = new ConnectionOptions(factory).withAddresses(new Address("test-host", 5672));
  }

  @AfterMethod
  protected void afterMethod() throws Exception {
    broker.interceptor = null;
    if (connection != null)
      connection.close();
    broker.shutdown();
  }

  protected Connection createConnection() throws IOException {
    connection = Connections.create(options, config);
    return connection;
  }

  protected RobustConnection createRobustConnection() throws IOException {
    connection = Connections.createRobust(options, config);
    return (RobustConnection) connection;
  }

  /**
   * Waits for the connection to finish reconnecting.
   */
  protected void awaitRecovery() throws IOException {
    connection.ready(Duration.seconds(5));
  }

  /**
   * Waits for the {@code channel} to be open again after recovery.
   */
  protected void awaitRecovery(Channel channel) throws IOException {
    ((RobustChannel) channel).awaitOpen(Invocations.deadline(Duration.seconds(5)));
  }

  /**
   * Closes the {@code channel}'s current raw channel as the broker would after a channel level
   * error with the {@code replyCode}.
   */
  protected void closeByBroker(Channel channel, int replyCode) {
    mockChannel(channel).closeWithError(replyCode, "closed by broker");
  }

  protected void loseConnection() {
    broker.lastSession().lose();
  }

  protected void loseConnectionSilently() {
    broker.lastSession().loseSilently();
  }

  protected MockChannel mockChannel(Channel channel) {
    return broker.channelFor(rawChannel(channel));
  }

  protected com.rabbitmq.client.Channel rawChannel(Channel channel) {
    return channel.current.channel;
  }
}
