package net.jodah.tether;

import java.io.IOException;
import java.util.Map;

import net.jodah.tether.AmqpException.QueueEmptyException;
import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.util.Duration;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.GetResponse;

/**
 * A queue declared through a {@link Channel}. Operations are performed on the channel the queue
 * was declared through. A queue declared with an empty name takes the name assigned by the broker.
 */
public class Queue {
  /** Timeout applied to {@link #get()} */
  public static final Duration DEFAULT_GET_TIMEOUT = Duration.seconds(5);

  final Channel channel;
  final QueueOptions options;
  final boolean anonymous;
  private final Object getLock = new Object();
  private volatile String name;

  Queue(Channel channel, String name, QueueOptions options) {
    this.channel = channel;
    this.name = name;
    this.options = options;
    anonymous = name.isEmpty();
  }

  /**
   * Binds the queue to the {@code exchange} using the queue's name as the routing key.
   */
  public void bind(ExchangeRef exchange) throws IOException {
    bind(exchange, null, null, null);
  }

  public void bind(ExchangeRef exchange, String routingKey) throws IOException {
    bind(exchange, routingKey, null, null);
  }

  /**
   * Binds the queue to the {@code exchange}. A null {@code routingKey} binds with the queue's name.
   *
   * @throws NullPointerException if {@code exchange} is null
   * @throws AmqpException.ChannelClosedException if the channel is closed or the broker refuses the
   *           binding
   */
  public void bind(ExchangeRef exchange, String routingKey, Map<String, Object> arguments,
      Duration timeout) throws IOException {
    Assert.notNull(exchange, "exchange");
    String key = routingKey == null ? name : routingKey;
    channel.invoke(bindOperation(exchange.getName(), key, arguments), timeout);
    onBound(exchange.getName(), key, arguments);
  }

  public void cancel(String consumerTag) throws IOException {
    cancel(consumerTag, null);
  }

  /**
   * Cancels the consumer with the {@code consumerTag}.
   *
   * @throws NullPointerException if {@code consumerTag} is null
   */
  public void cancel(final String consumerTag, Duration timeout) throws IOException {
    Assert.notNull(consumerTag, "consumerTag");
    channel.invoke(new ChannelOperation<Void>() {
      @Override
      public Void call(com.rabbitmq.client.Channel channel) throws IOException {
        channel.basicCancel(consumerTag);
        return null;
      }

      @Override
      public String toString() {
        return String.format("basic.cancel of %s", consumerTag);
      }
    }, timeout);
    onCancelled(consumerTag);
  }

  /**
   * Starts a consumer that acknowledges messages manually.
   */
  public String consume(MessageHandler handler) throws IOException {
    return consume(handler, new ConsumeOptions(), null);
  }

  public String consume(MessageHandler handler, ConsumeOptions options) throws IOException {
    return consume(handler, options, null);
  }

  /**
   * Starts a consumer that passes each delivered message to the {@code handler}, returning the
   * consumer tag, which identifies the consumer for {@link #cancel(String)}.
   *
   * @throws NullPointerException if {@code handler} or {@code options} are null
   * @throws AmqpException.ChannelClosedException if the channel is closed or the broker refuses the
   *           consumer
   */
  public String consume(MessageHandler handler, ConsumeOptions options, Duration timeout)
      throws IOException {
    Assert.notNull(handler, "handler");
    Assert.notNull(options, "options");
    String consumerTag = channel.invoke(consumeOperation(handler, options), timeout);
    onConsumed(consumerTag, handler, options);
    return consumerTag;
  }

  /**
   * Declares the queue.
   */
  public AMQP.Queue.DeclareOk declare() throws IOException {
    return declare(null);
  }

  /**
   * Declares the queue, or verifies that it exists if it is passive. Declaring a queue that already
   * exists with identical properties succeeds.
   *
   * @throws AmqpException.ChannelClosedException if the channel is closed or the broker refuses the
   *           declaration
   * @throws AmqpException.OperationTimeoutException if the {@code timeout} elapses
   */
  public AMQP.Queue.DeclareOk declare(Duration timeout) throws IOException {
    AMQP.Queue.DeclareOk result = channel.invoke(declareOperation(), timeout);
    onDeclared();
    return result;
  }

  /**
   * Deletes the queue only if it has no consumers and no messages.
   */
  public int delete() throws IOException {
    return delete(true, true, null);
  }

  /**
   * Deletes the queue, returning the number of messages deleted with it.
   */
  public int delete(final boolean ifUnused, final boolean ifEmpty, Duration timeout)
      throws IOException {
    AMQP.Queue.DeleteOk result = channel.invoke(new ChannelOperation<AMQP.Queue.DeleteOk>() {
      @Override
      public AMQP.Queue.DeleteOk call(com.rabbitmq.client.Channel channel) throws IOException {
        return channel.queueDelete(name, ifUnused, ifEmpty);
      }

      @Override
      public String toString() {
        return String.format("queue.delete of %s", name);
      }
    }, timeout);
    onDeleted();
    return result == null ? 0 : result.getMessageCount();
  }

  /**
   * Gets a single message for manual acknowledgement, waiting at most {@link #DEFAULT_GET_TIMEOUT}.
   *
   * @throws QueueEmptyException if the queue is empty
   */
  public IncomingMessage get() throws IOException {
    return get(false, true, DEFAULT_GET_TIMEOUT);
  }

  /**
   * Gets a single message from the queue. Gets on the same queue are serialized.
   *
   * @return the message, or null if the queue is empty and {@code failIfEmpty} is false
   * @throws QueueEmptyException if the queue is empty and {@code failIfEmpty} is true
   * @throws AmqpException.OperationTimeoutException if the {@code timeout} elapses
   */
  public IncomingMessage get(final boolean noAck, boolean failIfEmpty, Duration timeout)
      throws IOException {
    IncomingMessage message;
    synchronized (getLock) {
      message = channel.invoke(new ChannelOperation<IncomingMessage>() {
        @Override
        public IncomingMessage call(com.rabbitmq.client.Channel channel) throws IOException {
          GetResponse response = channel.basicGet(name, noAck);
          return response == null ? null : new IncomingMessage(channel, null, response.getEnvelope(),
              response.getProps(), response.getBody(), noAck, response.getMessageCount());
        }

        @Override
        public String toString() {
          return String.format("basic.get from %s", name);
        }
      }, timeout);
    }

    if (message == null && failIfEmpty)
      throw new QueueEmptyException(String.format("Queue %s is empty", name));
    return message;
  }

  public Channel getChannel() {
    return channel;
  }

  /**
   * Returns the queue's name, which for an anonymous queue is the name most recently assigned by
   * the broker.
   */
  public String getName() {
    return name;
  }

  public QueueOptions getOptions() {
    return options;
  }

  /**
   * Returns whether the broker assigns the queue's name.
   */
  public boolean isAnonymous() {
    return anonymous;
  }

  /**
   * Returns an iterator over the messages delivered to a consumer of this queue that acknowledges
   * messages manually.
   */
  public QueueIterator iterator() {
    return iterator(new ConsumeOptions());
  }

  public QueueIterator iterator(ConsumeOptions options) {
    return new QueueIterator(this, Assert.notNull(options, "options"));
  }

  public int purge() throws IOException {
    return purge(null);
  }

  /**
   * Removes all ready messages from the queue, returning how many were removed.
   */
  public int purge(Duration timeout) throws IOException {
    AMQP.Queue.PurgeOk result = channel.invoke(new ChannelOperation<AMQP.Queue.PurgeOk>() {
      @Override
      public AMQP.Queue.PurgeOk call(com.rabbitmq.client.Channel channel) throws IOException {
        return channel.queuePurge(name);
      }

      @Override
      public String toString() {
        return String.format("queue.purge of %s", name);
      }
    }, timeout);
    return result == null ? 0 : result.getMessageCount();
  }

  @Override
  public String toString() {
    return String.format("queue %s", name);
  }

  public void unbind(ExchangeRef exchange, String routingKey) throws IOException {
    unbind(exchange, routingKey, null, null);
  }

  /**
   * Removes the binding of the queue to the {@code exchange}. A null {@code routingKey} means the
   * queue's name.
   */
  public void unbind(ExchangeRef exchange, String routingKey, final Map<String, Object> arguments,
      Duration timeout) throws IOException {
    Assert.notNull(exchange, "exchange");
    final String exchangeName = exchange.getName();
    final String key = routingKey == null ? name : routingKey;
    channel.invoke(new ChannelOperation<Void>() {
      @Override
      public Void call(com.rabbitmq.client.Channel channel) throws IOException {
        channel.queueUnbind(name, exchangeName, key, arguments);
        return null;
      }

      @Override
      public String toString() {
        return String.format("queue.unbind of %s from %s with '%s'", name, exchangeName, key);
      }
    }, timeout);
    onUnbound(exchangeName, key, arguments);
  }

  ChannelOperation<Void> bindOperation(final String exchange, final String routingKey,
      final Map<String, Object> arguments) {
    return new ChannelOperation<Void>() {
      @Override
      public Void call(com.rabbitmq.client.Channel channel) throws IOException {
        channel.queueBind(name, exchange, routingKey, arguments);
        return null;
      }

      @Override
      public String toString() {
        return String.format("queue.bind of %s to %s with '%s'", name, exchange, routingKey);
      }
    };
  }

  ChannelOperation<String> consumeOperation(final MessageHandler handler, final ConsumeOptions options) {
    return new ChannelOperation<String>() {
      @Override
      public String call(com.rabbitmq.client.Channel channel) throws IOException {
        String tag = options.getConsumerTag() == null ? "" : options.getConsumerTag();
        ConsumerDelegate consumer = new ConsumerDelegate(Queue.this, channel, handler, options.isNoAck());
        return channel.basicConsume(name, options.isNoAck(), tag, false, options.isExclusive(),
            options.getArguments(), consumer);
      }

      @Override
      public String toString() {
        return String.format("basic.consume from %s", name);
      }
    };
  }

  ChannelOperation<AMQP.Queue.DeclareOk> declareOperation() {
    return new ChannelOperation<AMQP.Queue.DeclareOk>() {
      @Override
      public AMQP.Queue.DeclareOk call(com.rabbitmq.client.Channel channel) throws IOException {
        AMQP.Queue.DeclareOk result;
        if (options.isPassive())
          result = channel.queueDeclarePassive(name);
        else
          result = channel.queueDeclare(anonymous ? "" : name, options.isDurable(),
              options.isExclusive(), options.isAutoDelete(), options.getArguments());
        if (result != null && result.getQueue() != null)
          name = result.getQueue();
        return result;
      }

      @Override
      public String toString() {
        return String.format("queue.declare of %s", anonymous ? "anonymous queue" : name);
      }
    };
  }

  void onBound(String exchange, String routingKey, Map<String, Object> arguments) {
  }

  void onCancelled(String consumerTag) {
  }

  /** Called when the broker cancels the consumer, such as when the queue is deleted. */
  void onConsumerCancelled(String consumerTag) {
  }

  void onConsumed(String consumerTag, MessageHandler handler, ConsumeOptions options) {
  }

  void onDeclared() {
  }

  void onDeleted() {
  }

  void onUnbound(String exchange, String routingKey, Map<String, Object> arguments) {
  }
}
