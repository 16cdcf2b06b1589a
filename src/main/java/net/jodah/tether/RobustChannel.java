package net.jodah.tether;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.atomic.AtomicBoolean;

import net.jodah.tether.AmqpException.ConnectionException;
import net.jodah.tether.AmqpException.OperationTimeoutException;
import net.jodah.tether.config.Config;
import net.jodah.tether.event.ChannelListener;
import net.jodah.tether.internal.RestorationLedger;
import net.jodah.tether.internal.RestorationLedger.Entry;
import net.jodah.tether.internal.util.Exceptions;
import net.jodah.tether.internal.util.concurrent.Invocations;
import net.jodah.tether.internal.util.concurrent.ReentrantCircuit;
import net.jodah.tether.util.Duration;

import com.rabbitmq.client.ShutdownSignalException;

/**
 * A channel that survives the loss of its raw channel or of its connection's link. Declarations,
 * bindings, QoS and consumers made through the channel are recorded when they succeed and are
 * restored, in order, on a fresh raw channel whenever the channel is reopened.
 *
 * <p>
 * Operations attempted while the channel is being restored wait until it is open again, bounded by
 * their timeout, and operations that fail because the channel or its connection went away are
 * issued again once the channel is restored. Failures caused by the request itself, such as a
 * declaration that conflicts with an existing queue, are never retried.
 */
public class RobustChannel extends Channel {
  final RestorationLedger<com.rabbitmq.client.Channel> ledger = new RestorationLedger<com.rabbitmq.client.Channel>();
  private final RobustConnection robustConnection;
  private final ReentrantCircuit circuit = new ReentrantCircuit();
  private final AtomicBoolean reopenScheduled = new AtomicBoolean();
  private volatile boolean restoring;

  RobustChannel(RobustConnection connection, Config config, int id) {
    super(connection, config, id);
    robustConnection = connection;
    circuit.open();
  }

  /**
   * Returns the number of declarations, bindings, QoS settings and consumers that will be restored
   * when the channel is reopened.
   */
  public int getRestorableCount() {
    return ledger.size();
  }

  /**
   * Opens the channel, waiting for the connection to reconnect if its link is currently down.
   */
  @Override
  public void open() throws IOException {
    long deadline = Invocations.deadline(config.getOperationTimeout());
    while (true) {
      try {
        super.open();
        return;
      } catch (IOException e) {
        if (state == State.CLOSED || !Exceptions.isConnectionFailure(e))
          throw e;
        robustConnection.awaitReady(deadline);
      }
    }
  }

  /**
   * Reopens the channel on the connection's current session, restoring everything that was
   * recorded. A failure to restore that is not caused by the connection closes the channel for
   * good.
   *
   * @throws AmqpException.ChannelClosedException if the channel is closed or cannot be restored
   * @throws AmqpException.ConnectionException if the connection is closed or its link is dead
   */
  public void reopen() throws IOException {
    reopen(robustConnection.currentSession());
  }

  @Override
  public String toString() {
    return String.format("robust channel-%s on %s", id, connection);
  }

  @Override
  void afterClosed() {
    circuit.close();
  }

  /**
   * Waits for the channel to be open, returning its current delegate.
   */
  Delegate awaitOpen(long deadline) throws IOException {
    while (true) {
      if (state == State.CLOSED)
        throw closedException();
      Delegate delegate = current;
      if (state == State.OPEN && delegate != null)
        return delegate;
      try {
        if (!circuit.await(Invocations.remaining(deadline)))
          throw new OperationTimeoutException(String.format("Timed out waiting for %s to recover", this));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException(String.format("Interrupted while waiting for %s to recover",
            this));
      }
    }
  }

  /**
   * Ignores closures of stale delegates and closures that happen while restoring, which the restore
   * itself reports. A closure caused by the connection is left to the connection to recover, while
   * a closure of just this channel reopens it.
   */
  @Override
  void delegateShutdown(Delegate delegate, ShutdownSignalException cause) {
    if (delegate != current || state == State.CLOSED || restoring || cause.isInitiatedByApplication())
      return;
    if (Exceptions.isConnectionClosure(cause)) {
      suspend(delegate, cause);
      robustConnection.connectionLost(delegate.session, cause);
    } else {
      log.error("{} was closed unexpectedly: {}", this, cause.getMessage());
      if (suspend(delegate, cause))
        scheduleReopen();
    }
  }

  /**
   * Performs the {@code operation} once the channel is open, issuing it again after recovery when it
   * fails because the channel or its connection went away.
   */
  @Override
  <T> T invoke(ChannelOperation<T> operation, Duration timeout) throws IOException {
    long deadline = Invocations.deadline(effectiveTimeout(timeout));
    while (true) {
      Delegate delegate = awaitOpen(deadline);
      try {
        return invoke(delegate.channel, operation, Invocations.remainingTimeout(deadline));
      } catch (IOException e) {
        if (state == State.CLOSED || !Exceptions.isRetryable(e))
          throw e;
        log.debug("Retrying {} on {} after failure: {}", operation, this, e.getMessage());
        delegateFailed(delegate, e);
      }
    }
  }

  @Override
  Exchange newExchange(String name, String type, ExchangeOptions options) {
    return new RobustExchange(this, name, type, options);
  }

  @Override
  Queue newQueue(String name, QueueOptions options) {
    return new RobustQueue(this, name, options);
  }

  @Override
  void onQos(int prefetchCount, int prefetchSize) {
    ledger.record(QosDeclaration.KEY, new QosDeclaration(prefetchCount, prefetchSize));
  }

  @Override
  void opened() {
    circuit.close();
  }

  /**
   * Reopens the channel on the {@code session}, replaying the ledger.
   */
  synchronized void reopen(TransportSession session) throws IOException {
    if (state == State.CLOSED)
      throw closedException();

    Delegate previous = current;
    suspend(previous, null);
    restoring = true;
    log.info("Recovering {}", this);
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryStarted(this);
      } catch (Exception e) {
        log.error("Channel listener {} failed for {}", listener, this, e);
      }

    try {
      if (previous != null && previous.channel.isOpen())
        previous.channel.abort();
      com.rabbitmq.client.Channel channel = robustConnection.openDelegate(session);
      attach(channel, session);
      for (Entry<com.rabbitmq.client.Channel> entry : ledger.entries()) {
        log.debug("Restoring {} on {}", entry, this);
        entry.restore(channel);
      }
    } catch (Exception e) {
      restoring = false;
      IOException failure = Exceptions.translate(e, this);
      if (Exceptions.isConnectionFailure(e) || !session.isOpen()) {
        log.warn("Failed to recover {} since its connection was lost", this);
        robustConnection.connectionLost(session, failure);
        throw failure;
      }

      log.error("Failed to recover {}", this, e);
      Delegate failed = current;
      closed(failure);
      if (failed != null && failed.channel.isOpen())
        failed.channel.abort();
      for (ChannelListener listener : config.getChannelListeners())
        try {
          listener.onRecoveryFailure(this, failure);
        } catch (Exception le) {
          log.error("Channel listener {} failed for {}", listener, this, le);
        }
      throw failure;
    }

    synchronized (stateLock) {
      restoring = false;
      if (state == State.CLOSED)
        return;
      state = State.OPEN;
      circuit.close();
    }

    log.info("Recovered {}", this);
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryCompleted(this);
      } catch (Exception e) {
        log.error("Channel listener {} failed for {}", listener, this, e);
      }
  }

  /**
   * Suspends the channel because its connection's link is gone.
   */
  void suspend() {
    Delegate delegate = current;
    if (delegate != null)
      suspend(delegate, null);
  }

  /**
   * Handles a retryable failure of an operation performed against the {@code delegate}.
   */
  private void delegateFailed(Delegate delegate, IOException failure) {
    if (delegate != current || state != State.OPEN)
      return;
    if (Exceptions.isConnectionFailure(failure) || !delegate.session.isOpen()) {
      suspend(delegate, failure);
      robustConnection.connectionLost(delegate.session, failure);
    } else if (suspend(delegate, failure))
      scheduleReopen();
  }

  /**
   * Reopens the channel on a recovery thread, unless a reopen is already scheduled.
   */
  private void scheduleReopen() {
    if (!reopenScheduled.compareAndSet(false, true))
      return;
    Connection.RECOVERY_EXECUTORS.execute(new Runnable() {
      @Override
      public void run() {
        reopenScheduled.set(false);
        try {
          if (state != State.CLOSED)
            reopen();
        } catch (IOException e) {
          log.debug("Scheduled reopen of {} did not complete: {}", RobustChannel.this, e.getMessage());
        }
      }
    });
  }

  /**
   * Marks the channel as awaiting recovery if the {@code delegate} is still current, failing pending
   * confirmations. Returns whether the channel was suspended.
   */
  private boolean suspend(Delegate delegate, Throwable cause) {
    synchronized (stateLock) {
      if (delegate != current || state == State.CLOSED)
        return false;
      state = State.OPENING;
      circuit.open();
    }

    confirmations.failAll(cause == null ? new ConnectionException(String.format(
        "%s was interrupted by recovery", this)) : Exceptions.translate(cause, this));
    return true;
  }
}
