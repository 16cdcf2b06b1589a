package net.jodah.tether;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.atomic.AtomicBoolean;

import net.jodah.tether.AmqpException.ConnectionException;
import net.jodah.tether.AmqpException.OperationTimeoutException;
import net.jodah.tether.config.Config;
import net.jodah.tether.config.RecoveryPolicy;
import net.jodah.tether.event.ConnectionListener;
import net.jodah.tether.internal.RecoveryStats;
import net.jodah.tether.internal.util.CallbackRegistry;
import net.jodah.tether.internal.util.Exceptions;
import net.jodah.tether.internal.util.concurrent.Invocations;
import net.jodah.tether.internal.util.concurrent.ReconnectPause;
import net.jodah.tether.internal.util.concurrent.ReentrantCircuit;
import net.jodah.tether.util.Duration;

/**
 * A connection that reconnects when the link to the broker is lost, reopening its
 * {@link RobustChannel}s and restoring what was declared through them. Reconnection follows the
 * configured {@link RecoveryPolicy} and runs on a recovery thread, one reconnection at a time.
 *
 * <p>
 * Connections are created via {@link Connections#createRobust(ConnectionOptions, Config)}.
 */
public class RobustConnection extends Connection {
  private final AtomicBoolean reconnecting = new AtomicBoolean();
  private final ReentrantCircuit circuit = new ReentrantCircuit();
  private final ReconnectPause pause = new ReconnectPause();
  private final CallbackRegistry<ReconnectCallback> reconnectCallbacks = new CallbackRegistry<ReconnectCallback>();

  RobustConnection(ConnectionOptions options, Config config) {
    super(options, config);
  }

  /**
   * Adds a strongly held {@code callback} to be called after each successful reconnect.
   */
  public void addReconnectCallback(ReconnectCallback callback) {
    reconnectCallbacks.add(callback);
  }

  /**
   * Adds a {@code callback} to be called after each successful reconnect, holding it weakly if
   * {@code weak} is true so that it does not prevent the callback from being garbage collected.
   */
  public void addReconnectCallback(ReconnectCallback callback, boolean weak) {
    reconnectCallbacks.add(callback, weak);
  }

  /**
   * Returns whether a reconnection is in progress.
   */
  public boolean isReconnecting() {
    return reconnecting.get();
  }

  /**
   * Waits at most {@code timeout} until the connection is connected. A null timeout waits
   * indefinitely.
   *
   * @throws ConnectionException if the connection is closed, or closes while waiting
   * @throws OperationTimeoutException if the {@code timeout} elapses
   */
  @Override
  public void ready(Duration timeout) throws IOException {
    awaitReady(Invocations.deadline(timeout));
  }

  public boolean removeReconnectCallback(ReconnectCallback callback) {
    return reconnectCallbacks.remove(callback);
  }

  @Override
  void afterClosed() {
    pause.cancel();
    circuit.close();
  }

  /**
   * Waits until the connection is connected or the {@code deadline} passes.
   */
  void awaitReady(long deadline) throws IOException {
    if (state == State.CLOSED)
      throw closedException();
    try {
      if (!circuit.await(Invocations.remaining(deadline)))
        throw new OperationTimeoutException(String.format("Timed out waiting for %s to reconnect", this));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException(String.format("Interrupted while waiting for %s to reconnect",
          this));
    }

    if (state == State.CLOSED)
      throw closedException();
  }

  /**
   * Starts reconnecting unless a reconnection is already in progress or the {@code lostSession} is
   * stale.
   */
  @Override
  void connectionLost(TransportSession lostSession, Throwable cause) {
    if (lostSession != session || state == State.CLOSED || !reconnecting.compareAndSet(false, true))
      return;

    final RecoveryPolicy policy = recoveryPolicy();
    if (!policy.allowsAttempts()) {
      reconnecting.set(false);
      terminate(cause);
      return;
    }

    synchronized (stateLock) {
      if (state == State.CLOSED) {
        reconnecting.set(false);
        return;
      }
      state = State.RECONNECTING;
      circuit.open();
    }

    log.info("Recovering {} using {}", this, policy);
    suspendChannels();
    lostSession.abort();
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onRecoveryStarted(this);
      } catch (Exception e) {
        log.error("Connection listener {} failed for {}", listener, this, e);
      }

    final Throwable lostCause = cause;
    RECOVERY_EXECUTORS.execute(new Runnable() {
      @Override
      public void run() {
        reconnect(policy, lostCause);
      }
    });
  }

  @Override
  Channel newChannel(Config channelConfig, int id) {
    return new RobustChannel(this, channelConfig, id);
  }

  /**
   * Returns the recovery policy, with its interval replaced by the connection's reconnect interval
   * when one was set and the policy does not back off.
   */
  RecoveryPolicy recoveryPolicy() {
    RecoveryPolicy policy = config.getRecoveryPolicy();
    if (options.getReconnectInterval() != null && !policy.isBackoff())
      policy = policy.copy().withInterval(options.getReconnectInterval());
    return policy;
  }

  /**
   * Performs reconnect attempts until one succeeds, the connection is closed or the {@code policy}
   * is exceeded.
   */
  private void reconnect(RecoveryPolicy policy, Throwable cause) {
    RecoveryStats stats = new RecoveryStats(policy);
    Throwable failure = cause;

    while (state != State.CLOSED) {
      if (stats.isPolicyExceeded()) {
        recoveryFailed(stats, failure);
        return;
      }

      try {
        if (!pause.pause(stats.getWaitTime()))
          break;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        recoveryFailed(stats, e);
        return;
      }

      if (state == State.CLOSED)
        break;
      stats.incrementAttempts();
      log.info("Reconnecting {}, attempt {}", this, stats.getAttemptCount());

      TransportSession newSession;
      try {
        newSession = TransportSession.connect(options, name, consumerExecutor);
      } catch (IOException e) {
        log.warn("Failed to reconnect {}: {}", this, e.getMessage());
        failure = e;
        continue;
      }

      synchronized (stateLock) {
        if (state == State.CLOSED) {
          newSession.close();
          break;
        }
        session = newSession;
      }

      newSession.addCloseListener(sessionListener);
      for (ConnectionListener listener : config.getConnectionListeners())
        try {
          listener.onRecovery(this);
        } catch (Exception e) {
          log.error("Connection listener {} failed for {}", listener, this, e);
        }

      try {
        reopenChannels(newSession);
      } catch (IOException e) {
        log.warn("Lost {} while restoring its channels: {}", this, e.getMessage());
        failure = e;
        suspendChannels();
        newSession.abort();
        continue;
      }

      for (ReconnectCallback callback : reconnectCallbacks.snapshot())
        try {
          callback.onReconnect(this);
        } catch (Exception e) {
          log.error("Reconnect callback {} failed for {}", callback, this, e);
        }

      synchronized (stateLock) {
        if (state == State.CLOSED)
          break;
        state = State.CONNECTED;
        reconnecting.set(false);
        circuit.close();
      }

      log.info("Recovered {} after {} attempt(s)", this, stats.getAttemptCount());
      for (ConnectionListener listener : config.getConnectionListeners())
        try {
          listener.onRecoveryCompleted(this);
        } catch (Exception e) {
          log.error("Connection listener {} failed for {}", listener, this, e);
        }

      // The link may have been lost again before reconnection was marked complete
      if (!newSession.isOpen())
        connectionLost(newSession, new ConnectionException(String.format("Lost %s during recovery", this)));
      return;
    }

    reconnecting.set(false);
    circuit.close();
    log.info("Stopped reconnecting {} since it was closed", this);
  }

  /**
   * Gives up reconnecting, closing the connection and its channels.
   */
  private void recoveryFailed(RecoveryStats stats, Throwable cause) {
    ConnectionException failure = new ConnectionException(String.format(
        "Failed to reconnect %s after %s attempt(s)", this, stats.getAttemptCount()), cause);
    log.error("Giving up reconnecting {}", this, failure);
    reconnecting.set(false);
    terminate(failure);
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onRecoveryFailure(this, failure);
      } catch (Exception e) {
        log.error("Connection listener {} failed for {}", listener, this, e);
      }
  }

  /**
   * Reopens each live channel on the {@code newSession}. A channel that cannot be restored is closed
   * without affecting the others.
   *
   * @throws IOException if the {@code newSession} is lost while reopening
   */
  private void reopenChannels(TransportSession newSession) throws IOException {
    for (Channel channel : getChannels()) {
      if (!(channel instanceof RobustChannel) || channel.isClosed())
        continue;
      try {
        ((RobustChannel) channel).reopen(newSession);
      } catch (IOException e) {
        if (Exceptions.isConnectionFailure(e) || !newSession.isOpen())
          throw e;
        log.error("Failed to restore {} during recovery of {}", channel, this);
      }
    }

    if (!newSession.isOpen())
      throw new ConnectionException(String.format("Lost %s during recovery", this));
  }

  private void suspendChannels() {
    for (Channel channel : getChannels())
      if (channel instanceof RobustChannel)
        ((RobustChannel) channel).suspend();
  }
}
