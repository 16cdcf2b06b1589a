package net.jodah.tether;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import net.jodah.tether.AmqpException.ChannelClosedException;
import net.jodah.tether.AmqpException.MessageNackedException;
import net.jodah.tether.AmqpException.MessageReturnedException;
import net.jodah.tether.AmqpException.OperationTimeoutException;
import net.jodah.tether.config.Config;
import net.jodah.tether.event.ChannelListener;
import net.jodah.tether.internal.PendingCalls;
import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.internal.util.CallbackRegistry;
import net.jodah.tether.internal.util.Exceptions;
import net.jodah.tether.internal.util.concurrent.Invocations;
import net.jodah.tether.util.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.ReturnListener;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * A logical stream multiplexed over a connection, through which exchanges and queues are declared
 * and messages are published and consumed. A channel is opened once and, once closed, stays
 * closed. See {@link RobustChannel} for a channel that survives the loss of its connection.
 */
public class Channel {
  public enum State {
    OPENING, OPEN, CLOSED
  }

  /** Header carrying the publish sequence number of a confirmed publish, echoed by basic.return. */
  public static final String PUBLISH_SEQUENCE_HEADER = "x-publish-sequence";

  final Logger log = LoggerFactory.getLogger(getClass());
  final Connection connection;
  final Config config;
  final int id;
  final CallbackRegistry<CloseCallback> closeCallbacks = new CallbackRegistry<CloseCallback>();
  final CallbackRegistry<ReturnCallback> returnCallbacks = new CallbackRegistry<ReturnCallback>();
  final PendingCalls<Long, Void> confirmations = new PendingCalls<Long, Void>();
  final Object stateLock = new Object();
  volatile State state = State.OPENING;
  volatile Delegate current;
  private final Map<Long, ReturnedMessage> returnsAwaitingConfirm = new ConcurrentHashMap<Long, ReturnedMessage>();
  private final AtomicBoolean closeNotified = new AtomicBoolean();
  private final Object publishLock = new Object();
  private final Exchange defaultExchange;
  private volatile ShutdownSignalException closeReason;
  private volatile int prefetchCount;
  private volatile int prefetchSize;

  /**
   * A raw channel along with the session it was opened on.
   */
  static final class Delegate {
    final com.rabbitmq.client.Channel channel;
    final TransportSession session;

    Delegate(com.rabbitmq.client.Channel channel, TransportSession session) {
      this.channel = channel;
      this.session = session;
    }
  }

  Channel(Connection connection, Config config, int id) {
    this.connection = connection;
    this.config = config;
    this.id = id;
    defaultExchange = new Exchange(this, "", ExchangeType.DIRECT.getValue(),
        new ExchangeOptions().withDurable(true));
  }

  /**
   * Adds a strongly held {@code callback} to be notified when the channel closes for good.
   */
  public void addCloseCallback(CloseCallback callback) {
    closeCallbacks.add(callback);
  }

  /**
   * Adds a {@code callback} to be notified when the channel closes for good, holding it weakly if
   * {@code weak} is true.
   */
  public void addCloseCallback(CloseCallback callback, boolean weak) {
    closeCallbacks.add(callback, weak);
  }

  /**
   * Adds a strongly held {@code callback} to be notified when the broker returns a message
   * published on this channel.
   */
  public void addReturnCallback(ReturnCallback callback) {
    returnCallbacks.add(callback);
  }

  /**
   * Adds a {@code callback} to be notified when the broker returns a message published on this
   * channel, holding it weakly if {@code weak} is true.
   */
  public void addReturnCallback(ReturnCallback callback, boolean weak) {
    returnCallbacks.add(callback, weak);
  }

  /**
   * Closes the channel. Closing a closed channel has no effect.
   *
   * @throws IOException if the broker fails to acknowledge the close
   */
  public void close() throws IOException {
    Delegate delegate = current;
    if (!closed(null))
      return;
    log.info("Closing {}", this);
    if (delegate != null && delegate.channel.isOpen()) {
      try {
        delegate.channel.close();
      } catch (ShutdownSignalException e) {
        log.debug("{} was already closed", this);
      } catch (TimeoutException e) {
        throw new OperationTimeoutException(String.format("Timed out closing %s", this));
      } catch (IOException e) {
        if (Exceptions.extractCause(e, ShutdownSignalException.class) == null)
          throw e;
        log.debug("{} was already closed", this);
      }
    }
  }

  /**
   * Declares an exchange of the {@code type} with default options.
   */
  public Exchange declareExchange(String name, ExchangeType type) throws IOException {
    return declareExchange(name, type.getValue(), new ExchangeOptions(), null);
  }

  public Exchange declareExchange(String name, ExchangeType type, ExchangeOptions options)
      throws IOException {
    return declareExchange(name, type.getValue(), options, null);
  }

  /**
   * Declares an exchange of the {@code type}, which may be a type provided by a broker plugin.
   *
   * @throws NullPointerException if {@code name}, {@code type} or {@code options} are null
   * @throws ChannelClosedException if the channel is closed or the broker refuses the declaration
   * @throws OperationTimeoutException if the {@code timeout} elapses
   */
  public Exchange declareExchange(String name, String type, ExchangeOptions options, Duration timeout)
      throws IOException {
    Exchange exchange = newExchange(Assert.notNull(name, "name"), Assert.notNull(type, "type"),
        Assert.notNull(options, "options"));
    exchange.declare(timeout);
    return exchange;
  }

  /**
   * Declares a server-named, exclusive, auto-deleted queue.
   */
  public Queue declareQueue() throws IOException {
    return declareQueue("", new QueueOptions().withExclusive(true).withAutoDelete(true), null);
  }

  /**
   * Declares a queue with default options.
   */
  public Queue declareQueue(String name) throws IOException {
    return declareQueue(name, new QueueOptions(), null);
  }

  public Queue declareQueue(String name, QueueOptions options) throws IOException {
    return declareQueue(name, options, null);
  }

  /**
   * Declares a queue. An empty {@code name} asks the broker to assign one, which is then used by
   * the returned Queue.
   *
   * @throws NullPointerException if {@code name} or {@code options} are null
   * @throws ChannelClosedException if the channel is closed or the broker refuses the declaration
   * @throws OperationTimeoutException if the {@code timeout} elapses
   */
  public Queue declareQueue(String name, QueueOptions options, Duration timeout) throws IOException {
    Queue queue = newQueue(Assert.notNull(name, "name"), Assert.notNull(options, "options"));
    queue.declare(timeout);
    return queue;
  }

  public int getChannelNumber() {
    Delegate delegate = current;
    return delegate == null ? -1 : delegate.channel.getChannelNumber();
  }

  public Connection getConnection() {
    return connection;
  }

  /**
   * Returns the nameless direct exchange that every queue is bound to by its name.
   */
  public Exchange getDefaultExchange() {
    return defaultExchange;
  }

  /**
   * Returns the existing exchange with the {@code name}, verifying that it exists.
   *
   * @throws ChannelClosedException with reply code 404 if the exchange does not exist
   */
  public Exchange getExchange(String name) throws IOException {
    return declareExchange(name, ExchangeType.DIRECT.getValue(), new ExchangeOptions().withPassive(true),
        null);
  }

  /**
   * Returns the existing queue with the {@code name}, verifying that it exists.
   *
   * @throws ChannelClosedException with reply code 404 if the queue does not exist
   */
  public Queue getQueue(String name) throws IOException {
    return declareQueue(name, new QueueOptions().withPassive(true), null);
  }

  public int getPrefetchCount() {
    return prefetchCount;
  }

  public int getPrefetchSize() {
    return prefetchSize;
  }

  public State getState() {
    return state;
  }

  public boolean isClosed() {
    return state == State.CLOSED;
  }

  public boolean isOpen() {
    return state == State.OPEN;
  }

  /**
   * Opens the channel on the connection's current session. Opening an open channel has no effect.
   *
   * @throws ChannelClosedException if the channel has been closed
   * @throws AmqpException.ConnectionException if the connection is closed or its link is dead
   */
  public synchronized void open() throws IOException {
    if (state == State.CLOSED)
      throw closedException();
    if (current != null)
      return;
    TransportSession session = connection.currentSession();
    attach(connection.openDelegate(session), session);
    synchronized (stateLock) {
      state = State.OPEN;
      opened();
    }
  }

  public boolean removeCloseCallback(CloseCallback callback) {
    return closeCallbacks.remove(callback);
  }

  public boolean removeReturnCallback(ReturnCallback callback) {
    return returnCallbacks.remove(callback);
  }

  /**
   * Limits the number of unacknowledged messages delivered to the consumers of this channel.
   */
  public void setQos(int prefetchCount) throws IOException {
    setQos(prefetchCount, 0, null);
  }

  /**
   * Limits the number and size of unacknowledged messages delivered to the consumers of this
   * channel.
   *
   * @throws IllegalArgumentException if {@code prefetchCount} or {@code prefetchSize} are negative
   * @throws ChannelClosedException if the channel is closed
   * @throws OperationTimeoutException if the {@code timeout} elapses
   */
  public void setQos(int prefetchCount, int prefetchSize, Duration timeout) throws IOException {
    Assert.isTrue(prefetchCount >= 0, "prefetchCount must be >= 0");
    Assert.isTrue(prefetchSize >= 0, "prefetchSize must be >= 0");
    invoke(qosOperation(prefetchCount, prefetchSize), timeout);
    this.prefetchCount = prefetchCount;
    this.prefetchSize = prefetchSize;
    onQos(prefetchCount, prefetchSize);
  }

  @Override
  public String toString() {
    return String.format("channel-%s on %s", id, connection);
  }

  /**
   * Attaches the channel to the {@code delegate}, listening for its shutdown, returns and confirms.
   */
  void attach(com.rabbitmq.client.Channel channel, TransportSession session) throws IOException {
    final Delegate delegate = new Delegate(channel, session);
    channel.addShutdownListener(new ShutdownListener() {
      @Override
      public void shutdownCompleted(ShutdownSignalException cause) {
        delegateShutdown(delegate, cause);
      }
    });
    channel.addReturnListener(new ReturnListener() {
      @Override
      public void handleReturn(int replyCode, String replyText, String exchange, String routingKey,
          AMQP.BasicProperties properties, byte[] body) {
        returned(delegate, new ReturnedMessage(replyCode, replyText, exchange, routingKey, properties,
            body));
      }
    });

    if (config.isPublisherConfirms()) {
      channel.addConfirmListener(new ConfirmListener() {
        @Override
        public void handleAck(long deliveryTag, boolean multiple) {
          confirmed(delegate, deliveryTag, multiple, true);
        }

        @Override
        public void handleNack(long deliveryTag, boolean multiple) {
          confirmed(delegate, deliveryTag, multiple, false);
        }
      });
      invoke(channel, new ChannelOperation<Void>() {
        @Override
        public Void call(com.rabbitmq.client.Channel channel) throws IOException {
          channel.confirmSelect();
          return null;
        }

        @Override
        public String toString() {
          return "confirm.select";
        }
      }, effectiveTimeout(null));
    }

    returnsAwaitingConfirm.clear();
    current = delegate;
  }

  /**
   * Marks the channel as closed for good, failing pending confirmations and notifying close
   * callbacks. Returns false if the channel was already closed.
   */
  boolean closed(Throwable cause) {
    synchronized (stateLock) {
      if (!closeNotified.compareAndSet(false, true))
        return false;
      if (cause instanceof ShutdownSignalException)
        closeReason = (ShutdownSignalException) cause;
      else if (cause != null)
        closeReason = Exceptions.extractCause(cause, ShutdownSignalException.class);
      state = State.CLOSED;
      afterClosed();
    }

    confirmations.failAll(cause == null ? closedException() : Exceptions.translate(cause, this));
    connection.removeChannel(this);
    for (CloseCallback callback : closeCallbacks.snapshot())
      try {
        callback.onClose(this, cause);
      } catch (Exception e) {
        log.error("Close callback {} failed for {}", callback, this, e);
      }
    return true;
  }

  ChannelClosedException closedException() {
    ShutdownSignalException reason = closeReason;
    return reason == null ? new ChannelClosedException(String.format("%s is closed", this))
        : new ChannelClosedException(String.format("%s was closed by the broker", this), reason);
  }

  /**
   * Called when a raw channel shuts down.
   */
  void delegateShutdown(Delegate delegate, ShutdownSignalException cause) {
    if (delegate != current || state == State.CLOSED)
      return;
    if (!cause.isInitiatedByApplication())
      log.error("{} was closed unexpectedly: {}", this, cause.getMessage());
    closed(cause);
  }

  Duration effectiveTimeout(Duration timeout) {
    return timeout != null ? timeout : config.getOperationTimeout();
  }

  /**
   * Performs the {@code operation} against the current raw channel.
   */
  <T> T invoke(ChannelOperation<T> operation, Duration timeout) throws IOException {
    Delegate delegate = current;
    if (state != State.OPEN || delegate == null)
      throw closedException();
    return invoke(delegate.channel, operation, effectiveTimeout(timeout));
  }

  /**
   * Performs the {@code operation} against the {@code channel}, waiting at most {@code timeout}.
   */
  <T> T invoke(final com.rabbitmq.client.Channel channel, final ChannelOperation<T> operation,
      Duration timeout) throws IOException {
    log.debug("Invoking {} on {}", operation, this);
    try {
      return Invocations.call(new Callable<T>() {
        @Override
        public T call() throws Exception {
          return operation.call(channel);
        }

        @Override
        public String toString() {
          return operation.toString();
        }
      }, timeout);
    } catch (ShutdownSignalException e) {
      throw Exceptions.translate(e, this);
    } catch (IOException e) {
      throw Exceptions.translate(e, this);
    }
  }

  Exchange newExchange(String name, String type, ExchangeOptions options) {
    return new Exchange(this, name, type, options);
  }

  Queue newQueue(String name, QueueOptions options) {
    return new Queue(this, name, options);
  }

  void notifyCreated() {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onCreate(this);
      } catch (Exception e) {
        log.error("Channel listener {} failed for {}", listener, this, e);
      }
  }

  /** Called with the state lock held once the channel closes for good. */
  void afterClosed() {
  }

  /** Called with the state lock held once the channel has been opened. */
  void opened() {
  }

  /** Called once QoS has been applied. */
  void onQos(int prefetchCount, int prefetchSize) {
  }

  /**
   * Publishes the {@code message}, waiting for its confirmation when publisher confirms are
   * enabled.
   */
  void publish(final String exchange, final String routingKey, final Message message,
      final PublishOptions options) throws IOException {
    final Duration timeout = effectiveTimeout(options.getTimeout());
    final AMQP.BasicProperties properties = message.toProperties();
    invoke(new ChannelOperation<Void>() {
      @Override
      public Void call(com.rabbitmq.client.Channel channel) throws IOException {
        long deadline = Invocations.deadline(timeout);
        long sequence = 0;
        CompletableFuture<Void> confirmation = null;
        synchronized (publishLock) {
          AMQP.BasicProperties sent = properties;
          if (config.isPublisherConfirms()) {
            sequence = channel.getNextPublishSeqNo();
            sent = withPublishSequence(properties, sequence);
            confirmation = confirmations.register(sequence);
          }

          try {
            channel.basicPublish(exchange, routingKey, options.isMandatory(), options.isImmediate(),
                sent, message.getBody());
          } catch (IOException e) {
            confirmations.cancel(sequence);
            throw e;
          } catch (RuntimeException e) {
            confirmations.cancel(sequence);
            throw e;
          }
        }

        if (confirmation != null)
          awaitConfirmation(sequence, confirmation, deadline);
        return null;
      }

      @Override
      public String toString() {
        return String.format("basic.publish of %s to '%s' with routing key '%s'", message, exchange,
            routingKey);
      }
    }, timeout);
  }

  private void awaitConfirmation(long sequence, CompletableFuture<Void> confirmation, long deadline)
      throws IOException {
    try {
      if (deadline == -1)
        confirmation.get();
      else
        confirmation.get(Math.max(0, Invocations.remaining(deadline)), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      confirmations.cancel(sequence);
      throw new OperationTimeoutException(String.format(
          "Timed out waiting for confirmation of publish %s on %s", sequence, this));
    } catch (InterruptedException e) {
      confirmations.cancel(sequence);
      Thread.currentThread().interrupt();
      throw new InterruptedIOException(String.format(
          "Interrupted while waiting for confirmation of publish %s on %s", sequence, this));
    } catch (ExecutionException e) {
      throw Exceptions.translate(e.getCause(), this);
    }
  }

  private void confirmed(Delegate delegate, long deliveryTag, boolean multiple, boolean ack) {
    if (delegate != current)
      return;
    List<Long> tags = confirmations.keys();
    Collections.sort(tags);
    for (Long tag : tags) {
      if (tag.longValue() > deliveryTag || (!multiple && tag.longValue() != deliveryTag))
        continue;
      ReturnedMessage returned = returnsAwaitingConfirm.remove(tag);
      if (!ack)
        confirmations.fail(tag, new MessageNackedException(tag.longValue()));
      else if (returned != null)
        confirmations.fail(tag, new MessageReturnedException(returned));
      else
        confirmations.complete(tag, null);
    }

    // Returns of publishes that stopped waiting, such as after a timeout
    for (Iterator<Long> it = returnsAwaitingConfirm.keySet().iterator(); it.hasNext();) {
      long tag = it.next().longValue();
      if (tag == deliveryTag || (multiple && tag < deliveryTag))
        it.remove();
    }
  }

  private void returned(Delegate delegate, ReturnedMessage message) {
    if (delegate != current)
      return;
    if (config.isPublisherConfirms()) {
      Long sequence = publishSequence(message.getProperties());
      if (sequence != null)
        returnsAwaitingConfirm.put(sequence, message);
    }
    List<ReturnCallback> callbacks = returnCallbacks.snapshot();
    if (callbacks.isEmpty())
      log.warn("{} was returned on {} with no return callback", message, this);
    for (ReturnCallback callback : callbacks)
      try {
        callback.onReturn(this, message);
      } catch (Exception e) {
        log.error("Return callback {} failed for {}", callback, this, e);
      }
  }

  /**
   * Returns the {@code properties} with the publish {@code sequence} added to their headers, so that
   * a basic.return can be matched to the publish it belongs to.
   */
  static AMQP.BasicProperties withPublishSequence(AMQP.BasicProperties properties, long sequence) {
    Map<String, Object> headers = properties.getHeaders() == null ? new HashMap<String, Object>()
        : new HashMap<String, Object>(properties.getHeaders());
    headers.put(PUBLISH_SEQUENCE_HEADER, Long.valueOf(sequence));
    return properties.builder().headers(headers).build();
  }

  static Long publishSequence(AMQP.BasicProperties properties) {
    if (properties == null || properties.getHeaders() == null)
      return null;
    Object sequence = properties.getHeaders().get(PUBLISH_SEQUENCE_HEADER);
    return sequence instanceof Number ? Long.valueOf(((Number) sequence).longValue()) : null;
  }

  static ChannelOperation<Void> qosOperation(final int prefetchCount, final int prefetchSize) {
    return new ChannelOperation<Void>() {
      @Override
      public Void call(com.rabbitmq.client.Channel channel) throws IOException {
        channel.basicQos(prefetchSize, prefetchCount, false);
        return null;
      }

      @Override
      public String toString() {
        return String.format("basic.qos of prefetch %s/%s", prefetchCount, prefetchSize);
      }
    };
  }
}
