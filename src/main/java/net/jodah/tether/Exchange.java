package net.jodah.tether;

import java.io.IOException;
import java.util.Map;

import net.jodah.tether.AmqpException.PolicyException;
import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.util.Duration;

import com.rabbitmq.client.AMQP;

/**
 * An exchange declared through a {@link Channel}. Operations are performed on the channel the
 * exchange was declared through.
 */
public class Exchange {
  final Channel channel;
  final String name;
  final String type;
  final ExchangeOptions options;

  Exchange(Channel channel, String name, String type, ExchangeOptions options) {
    this.channel = channel;
    this.name = name;
    this.type = type;
    this.options = options;
  }

  /**
   * Binds this exchange to the {@code source} exchange so that messages routed by the source with
   * the {@code routingKey} are forwarded to this exchange.
   */
  public void bind(ExchangeRef source, String routingKey) throws IOException {
    bind(source, routingKey, null, null);
  }

  /**
   * Binds this exchange to the {@code source} exchange. A null {@code routingKey} binds with the
   * empty routing key.
   *
   * @throws NullPointerException if {@code source} is null
   * @throws AmqpException.ChannelClosedException if the channel is closed or the broker refuses the
   *           binding
   */
  public void bind(ExchangeRef source, String routingKey, Map<String, Object> arguments,
      Duration timeout) throws IOException {
    Assert.notNull(source, "source");
    String key = routingKey == null ? "" : routingKey;
    channel.invoke(bindOperation(source.getName(), key, arguments), timeout);
    onBound(source.getName(), key, arguments);
  }

  /**
   * Declares the exchange.
   */
  public AMQP.Exchange.DeclareOk declare() throws IOException {
    return declare(null);
  }

  /**
   * Declares the exchange, or verifies that it exists if it is passive. Declaring an exchange that
   * already exists with identical properties succeeds.
   *
   * @throws AmqpException.ChannelClosedException if the channel is closed or the broker refuses the
   *           declaration
   * @throws AmqpException.OperationTimeoutException if the {@code timeout} elapses
   */
  public AMQP.Exchange.DeclareOk declare(Duration timeout) throws IOException {
    AMQP.Exchange.DeclareOk result = channel.invoke(declareOperation(), timeout);
    onDeclared();
    return result;
  }

  /**
   * Deletes the exchange whether or not it is in use.
   */
  public void delete() throws IOException {
    delete(false, null);
  }

  /**
   * Deletes the exchange, only if it has no bindings when {@code ifUnused} is true.
   */
  public void delete(final boolean ifUnused, Duration timeout) throws IOException {
    channel.invoke(new ChannelOperation<Void>() {
      @Override
      public Void call(com.rabbitmq.client.Channel channel) throws IOException {
        channel.exchangeDelete(name, ifUnused);
        return null;
      }

      @Override
      public String toString() {
        return String.format("exchange.delete of %s", name);
      }
    }, timeout);
    onDeleted();
  }

  public Channel getChannel() {
    return channel;
  }

  public String getName() {
    return name;
  }

  public ExchangeOptions getOptions() {
    return options;
  }

  public String getType() {
    return type;
  }

  public boolean isInternal() {
    return options.isInternal();
  }

  /**
   * Publishes the {@code message} with the {@code routingKey} as mandatory.
   */
  public void publish(Message message, String routingKey) throws IOException {
    publish(message, routingKey, new PublishOptions());
  }

  /**
   * Publishes the {@code message} with the {@code routingKey}. When publisher confirms are enabled
   * this waits until the broker has confirmed the message.
   *
   * @throws NullPointerException if {@code message}, {@code routingKey} or {@code options} are null
   * @throws PolicyException if the exchange is internal, without contacting the broker
   * @throws AmqpException.MessageReturnedException if a mandatory message was unroutable
   * @throws AmqpException.MessageNackedException if the broker refused the message
   * @throws AmqpException.OperationTimeoutException if the timeout elapses
   */
  public void publish(Message message, String routingKey, PublishOptions options) throws IOException {
    Assert.notNull(message, "message");
    Assert.notNull(routingKey, "routingKey");
    Assert.notNull(options, "options");
    if (isInternal())
      throw new PolicyException(String.format("Cannot publish to internal exchange %s", name));
    channel.publish(name, routingKey, message, options);
  }

  @Override
  public String toString() {
    return name.isEmpty() ? "default exchange" : String.format("exchange %s", name);
  }

  public void unbind(ExchangeRef source, String routingKey) throws IOException {
    unbind(source, routingKey, null, null);
  }

  /**
   * Removes the binding of this exchange to the {@code source} exchange.
   */
  public void unbind(ExchangeRef source, String routingKey, final Map<String, Object> arguments,
      Duration timeout) throws IOException {
    Assert.notNull(source, "source");
    final String sourceName = source.getName();
    final String key = routingKey == null ? "" : routingKey;
    channel.invoke(new ChannelOperation<Void>() {
      @Override
      public Void call(com.rabbitmq.client.Channel channel) throws IOException {
        channel.exchangeUnbind(name, sourceName, key, arguments);
        return null;
      }

      @Override
      public String toString() {
        return String.format("exchange.unbind of %s from %s with '%s'", name, sourceName, key);
      }
    }, timeout);
    onUnbound(sourceName, key, arguments);
  }

  ChannelOperation<Void> bindOperation(final String source, final String routingKey,
      final Map<String, Object> arguments) {
    return new ChannelOperation<Void>() {
      @Override
      public Void call(com.rabbitmq.client.Channel channel) throws IOException {
        channel.exchangeBind(name, source, routingKey, arguments);
        return null;
      }

      @Override
      public String toString() {
        return String.format("exchange.bind of %s to %s with '%s'", name, source, routingKey);
      }
    };
  }

  ChannelOperation<AMQP.Exchange.DeclareOk> declareOperation() {
    return new ChannelOperation<AMQP.Exchange.DeclareOk>() {
      @Override
      public AMQP.Exchange.DeclareOk call(com.rabbitmq.client.Channel channel) throws IOException {
        if (options.isPassive())
          return channel.exchangeDeclarePassive(name);
        return channel.exchangeDeclare(name, type, options.isDurable(), options.isAutoDelete(),
            options.isInternal(), options.getArguments());
      }

      @Override
      public String toString() {
        return String.format("exchange.declare of %s", name);
      }
    };
  }

  void onBound(String source, String routingKey, Map<String, Object> arguments) {
  }

  void onDeclared() {
  }

  void onDeleted() {
  }

  void onUnbound(String source, String routingKey, Map<String, Object> arguments) {
  }
}
