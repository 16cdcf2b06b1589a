package net.jodah.tether;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import net.jodah.tether.AmqpException.ConnectionException;
import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.internal.util.CallbackRegistry;
import net.jodah.tether.internal.util.Exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * A single physical connection to a broker. A session is not robust: it is established with a
 * single attempt and, once closed, stays closed. {@link Connection}s replace their session when the
 * link to the broker is lost.
 */
public class TransportSession {
  private static final Logger log = LoggerFactory.getLogger(TransportSession.class);
  private final com.rabbitmq.client.Connection delegate;
  private final String name;
  private final CallbackRegistry<SessionCloseListener> closeListeners = new CallbackRegistry<SessionCloseListener>();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Notified when a session is closed, whether by the application or because the link was lost.
   */
  public interface SessionCloseListener {
    void sessionClosed(TransportSession session, ShutdownSignalException cause);
  }

  TransportSession(com.rabbitmq.client.Connection delegate, String name) {
    this.delegate = delegate;
    this.name = name;
    delegate.addShutdownListener(new ShutdownListener() {
      @Override
      public void shutdownCompleted(ShutdownSignalException cause) {
        closed.set(true);
        for (SessionCloseListener listener : closeListeners.snapshot())
          try {
            listener.sessionClosed(TransportSession.this, cause);
          } catch (Exception e) {
            log.error("Session close listener {} failed for {}", listener, TransportSession.this, e);
          }
      }
    });
  }

  /**
   * Establishes a session with a single attempt against the addresses of the {@code options},
   * dispatching consumer callbacks on the {@code consumerExecutor}.
   *
   * @throws ConnectionException if the session cannot be established
   */
  public static TransportSession connect(ConnectionOptions options, String name,
      ExecutorService consumerExecutor) throws ConnectionException {
    Assert.notNull(options, "options");
    ConnectionFactory factory = options.getConnectionFactory();
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    try {
      log.info("Creating session {} to {}", name, options.getAddresses());
      com.rabbitmq.client.Connection connection = factory.newConnection(consumerExecutor,
          options.getAddresses(), name);
      return new TransportSession(connection, name);
    } catch (IOException e) {
      throw new ConnectionException(String.format("Failed to connect %s", name), e);
    } catch (TimeoutException e) {
      throw new ConnectionException(String.format("Timed out connecting %s", name), e);
    }
  }

  /**
   * Adds a {@code listener} to be notified when the session closes. If the session is already
   * closed the listener is notified immediately.
   */
  public void addCloseListener(SessionCloseListener listener) {
    closeListeners.add(listener);
    if (closed.get() && closeListeners.remove(listener))
      listener.sessionClosed(this, delegate.getCloseReason());
  }

  /**
   * Closes the session. Closing a closed session has no effect.
   */
  public void close() {
    if (!delegate.isOpen())
      return;
    try {
      delegate.close();
    } catch (ShutdownSignalException e) {
      log.debug("Session {} was already closed", this);
    } catch (IOException e) {
      log.warn("Failed to cleanly close session {}", this, e);
    }
  }

  /**
   * Aborts the session without waiting for the broker, ignoring any failure.
   */
  public void abort() {
    delegate.abort();
  }

  public ShutdownSignalException getCloseReason() {
    return delegate.getCloseReason();
  }

  /**
   * Returns whether the session is open.
   */
  public boolean isOpen() {
    return delegate.isOpen();
  }

  /**
   * Opens a new raw channel on the session.
   *
   * @throws ConnectionException if the session is closed or its link is dead
   * @throws IOException if the broker refuses the channel
   */
  public com.rabbitmq.client.Channel openChannel() throws IOException {
    try {
      com.rabbitmq.client.Channel channel = delegate.createChannel();
      if (channel == null)
        throw new ConnectionException(String.format("No channels available on %s", this));
      return channel;
    } catch (ShutdownSignalException e) {
      throw new ConnectionException(String.format("Session %s is closed", this), e);
    } catch (IOException e) {
      if (Exceptions.isConnectionFailure(e) || !delegate.isOpen())
        throw new ConnectionException(String.format("Session %s is closed", this), e);
      throw e;
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
