package net.jodah.tether;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import net.jodah.tether.AmqpException.ConnectionException;
import net.jodah.tether.TransportSession.SessionCloseListener;
import net.jodah.tether.config.Config;
import net.jodah.tether.event.ChannelListener;
import net.jodah.tether.event.ConnectionListener;
import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.internal.util.Collections;
import net.jodah.tether.internal.util.concurrent.NamedThreadFactory;
import net.jodah.tether.util.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.ShutdownSignalException;

/**
 * A logical connection to a broker through which {@link Channel}s are created. A plain connection
 * is established with a single attempt and is closed for good, along with its channels, when the
 * link to the broker is lost. See {@link RobustConnection} for a connection that reconnects.
 *
 * <p>
 * Connections are created via {@link Connections}.
 */
public class Connection {
  private static final AtomicInteger CONNECTION_COUNTER = new AtomicInteger();
  static final ExecutorService RECOVERY_EXECUTORS = Executors.newCachedThreadPool(new NamedThreadFactory(
      "tether-recovery-%s"));

  public enum State {
    CONNECTING, CONNECTED, RECONNECTING, CLOSED
  }

  final Logger log = LoggerFactory.getLogger(getClass());
  final ConnectionOptions options;
  final Config config;
  final String name;
  final ExecutorService consumerExecutor;
  final Object stateLock = new Object();
  final SessionCloseListener sessionListener = new SessionCloseListener() {
    @Override
    public void sessionClosed(TransportSession session, ShutdownSignalException cause) {
      Connection.this.sessionClosed(session, cause);
    }
  };
  private final Map<Integer, Channel> channels = Collections.synchronizedLinkedMap();
  private final AtomicInteger channelCounter = new AtomicInteger();
  volatile State state = State.CONNECTING;
  volatile TransportSession session;

  Connection(ConnectionOptions options, Config config) {
    this.options = options;
    this.config = config;
    name = options.getName() == null ? String.format("cxn-%s", CONNECTION_COUNTER.incrementAndGet())
        : options.getName();
    consumerExecutor = options.getConsumerExecutor() == null ? Executors.newCachedThreadPool(new NamedThreadFactory(
        name + "-consumer-%s")) : options.getConsumerExecutor();
  }

  /**
   * Creates and opens a channel whose configuration inherits from the connection's.
   *
   * @throws ConnectionException if the connection is closed or its link is dead
   */
  public Channel channel() throws IOException {
    return channel(new Config(config));
  }

  /**
   * Creates and opens a channel with the {@code channelConfig}.
   *
   * @throws NullPointerException if {@code channelConfig} is null
   * @throws ConnectionException if the connection is closed or its link is dead
   */
  public Channel channel(Config channelConfig) throws IOException {
    Assert.notNull(channelConfig, "channelConfig");
    if (state == State.CLOSED)
      throw closedException();

    Channel channel = newChannel(channelConfig, channelCounter.incrementAndGet());
    channels.put(Integer.valueOf(channel.id), channel);
    try {
      channel.open();
    } catch (IOException e) {
      channels.remove(Integer.valueOf(channel.id));
      log.error("Failed to create channel on {}", this, e);
      for (ChannelListener listener : channelConfig.getChannelListeners())
        try {
          listener.onCreateFailure(e);
        } catch (Exception le) {
          log.error("Channel listener {} failed for {}", listener, this, le);
        }
      throw e;
    }

    log.info("Created {}", channel);
    channel.notifyCreated();
    return channel;
  }

  /**
   * Closes the connection and its channels. Closing a closed connection has no effect.
   */
  public void close() throws IOException {
    synchronized (stateLock) {
      if (state == State.CLOSED)
        return;
      state = State.CLOSED;
      afterClosed();
    }

    log.info("Closing {}", this);
    for (Channel channel : getChannels())
      try {
        channel.close();
      } catch (IOException e) {
        log.warn("Failed to close {}", channel, e);
      }

    TransportSession current = session;
    if (current != null)
      current.close();
    shutdownConsumerExecutor();
  }

  /**
   * Returns a snapshot of the connection's open channels.
   */
  public List<Channel> getChannels() {
    return Collections.snapshot(channels);
  }

  public Config getConfig() {
    return config;
  }

  public String getName() {
    return name;
  }

  public ConnectionOptions getOptions() {
    return options;
  }

  public State getState() {
    return state;
  }

  public boolean isClosed() {
    return state == State.CLOSED;
  }

  public boolean isOpen() {
    return state == State.CONNECTED;
  }

  /**
   * Waits until the connection is connected.
   *
   * @throws ConnectionException if the connection is closed
   */
  public void ready() throws IOException {
    ready(null);
  }

  /**
   * Waits at most {@code timeout} until the connection is connected. A plain connection is either
   * connected or closed, so this never waits.
   *
   * @throws ConnectionException if the connection is closed
   */
  public void ready(Duration timeout) throws IOException {
    if (state == State.CLOSED)
      throw closedException();
  }

  @Override
  public String toString() {
    return name;
  }

  /** Called with the state lock held once the connection closes for good. */
  void afterClosed() {
  }

  ConnectionException closedException() {
    return new ConnectionException(String.format("Connection %s is closed", this));
  }

  /**
   * Establishes the initial session with a single attempt.
   */
  void connect() throws IOException {
    try {
      TransportSession newSession = TransportSession.connect(options, name, consumerExecutor);
      synchronized (stateLock) {
        session = newSession;
        state = State.CONNECTED;
      }
      newSession.addCloseListener(sessionListener);
    } catch (IOException e) {
      log.error("Failed to create connection {}", name, e);
      synchronized (stateLock) {
        state = State.CLOSED;
      }
      shutdownConsumerExecutor();
      for (ConnectionListener listener : config.getConnectionListeners())
        try {
          listener.onCreateFailure(e);
        } catch (Exception le) {
          log.error("Connection listener {} failed for {}", listener, name, le);
        }
      throw e;
    }

    log.info("Created connection {} to {}", name, options.getAddresses());
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onCreate(this);
      } catch (Exception e) {
        log.error("Connection listener {} failed for {}", listener, this, e);
      }
  }

  /**
   * Called when the link behind the {@code lostSession} is gone. A plain connection closes for good.
   */
  void connectionLost(TransportSession lostSession, Throwable cause) {
    if (lostSession != session)
      return;
    terminate(cause);
  }

  /**
   * Returns the current session.
   *
   * @throws ConnectionException if the connection is closed
   */
  TransportSession currentSession() throws ConnectionException {
    TransportSession current = session;
    if (state == State.CLOSED || current == null)
      throw closedException();
    return current;
  }

  Channel newChannel(Config channelConfig, int id) {
    return new Channel(this, channelConfig, id);
  }

  /**
   * Opens a raw channel on the {@code session}, treating a dead link as a lost connection.
   */
  com.rabbitmq.client.Channel openDelegate(TransportSession session) throws IOException {
    try {
      return session.openChannel();
    } catch (ConnectionException e) {
      connectionLost(session, e);
      throw e;
    }
  }

  void removeChannel(Channel channel) {
    channels.remove(Integer.valueOf(channel.id));
  }

  void sessionClosed(TransportSession closedSession, ShutdownSignalException cause) {
    if (closedSession != session || state == State.CLOSED || cause.isInitiatedByApplication())
      return;
    log.error("Connection {} was closed unexpectedly: {}", this, cause.getMessage());
    connectionLost(closedSession, cause);
  }

  /**
   * Closes the connection and its channels for good because of the {@code cause}.
   */
  void terminate(Throwable cause) {
    synchronized (stateLock) {
      if (state == State.CLOSED)
        return;
      state = State.CLOSED;
      afterClosed();
    }

    log.error("Connection {} was closed: {}", this, cause == null ? null : cause.getMessage());
    for (Channel channel : getChannels())
      channel.closed(cause);
    TransportSession current = session;
    if (current != null)
      current.abort();
    shutdownConsumerExecutor();
  }

  private void shutdownConsumerExecutor() {
    if (options.getConsumerExecutor() == null)
      consumerExecutor.shutdown();
  }
}
