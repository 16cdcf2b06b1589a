package net.jodah.tether.internal.util;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import net.jodah.tether.AmqpException;
import net.jodah.tether.AmqpException.ChannelClosedException;
import net.jodah.tether.AmqpException.ConnectionException;
import net.jodah.tether.AmqpException.OperationTimeoutException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;

public final class Exceptions {
  private Exceptions() {
  }

  @SuppressWarnings("unchecked")
  public static <T extends Throwable> T extractCause(Throwable t, Class<T> type) {
    Throwable cause = t;
    while (cause != null) {
      if (type.isAssignableFrom(cause.getClass()))
        return (T) cause;
      cause = cause.getCause();
    }

    return null;
  }

  public static boolean isCausedByConnectionClosure(Throwable t) {
    ShutdownSignalException sse = extractCause(t, ShutdownSignalException.class);
    return sse != null && isConnectionClosure(sse);
  }

  /**
   * Reliably returns whether the shutdown signal represents a connection closure.
   */
  public static boolean isConnectionClosure(ShutdownSignalException e) {
    return e instanceof AlreadyClosedException ? e.getReference() instanceof Connection : e
        .isHardError();
  }

  /**
   * Returns whether {@code t} indicates that the link to the broker is gone, as opposed to a
   * failure of an individual channel or operation.
   */
  public static boolean isConnectionFailure(Throwable t) {
    if (t instanceof ConnectionException || isCausedByConnectionClosure(t))
      return true;
    return extractCause(t, ShutdownSignalException.class) == null
        && (extractCause(t, SocketException.class) != null || extractCause(t, EOFException.class) != null);
  }

  /**
   * Returns whether the failure was one where the request never reached the broker or was lost
   * along with the connection, such that it's safe to issue again once the link is restored.
   * Failures caused by the caller, such as access refused, not found, resource locked or
   * precondition failed, are never retryable.
   */
  public static boolean isRetryable(Throwable t) {
    if (t instanceof SocketTimeoutException || t instanceof ConnectException
        || extractCause(t, EOFException.class) != null)
      return true;
    ShutdownSignalException sse = extractCause(t, ShutdownSignalException.class);
    if (sse == null)
      return isConnectionFailure(t);
    if (sse.isInitiatedByApplication())
      return false;
    if (sse instanceof AlreadyClosedException)
      return true;
    Method method = sse.getReason();
    if (method instanceof AMQP.Connection.Close)
      return isRetryable(((AMQP.Connection.Close) method).getReplyCode());
    if (method instanceof AMQP.Channel.Close)
      return isRetryable(((AMQP.Channel.Close) method).getReplyCode());
    return sse.isHardError();
  }

  /**
   * Translates failures raised by the protocol engine into the tether exception types, naming the
   * {@code resource} the operation was performed against.
   */
  public static IOException translate(Throwable t, Object resource) {
    if (t instanceof AmqpException)
      return (AmqpException) t;
    if (t instanceof TimeoutException)
      return new OperationTimeoutException(String.format("Operation on %s timed out", resource));
    ShutdownSignalException sse = extractCause(t, ShutdownSignalException.class);
    if (sse != null) {
      if (isConnectionClosure(sse))
        return new ChannelClosedException(String.format("Connection for %s was closed", resource), sse);
      return new ChannelClosedException(String.format("%s was closed", resource), sse);
    }
    if (isConnectionFailure(t))
      return new ConnectionException(String.format("Connection for %s failed", resource), t);
    if (t instanceof IOException)
      return (IOException) t;
    return new AmqpException(String.format("Operation on %s failed", resource), t);
  }

  private static boolean isRetryable(int failureCode) {
    switch (failureCode) {
    /** Channel failures */
      case 311: // Content too large
        return true;
      case 313: // No consumers
        return false;
      case 403: // Access refused
        return false;
      case 404: // Not found
        return false;
      case 405: // Resource locked
        return false;
      case 406: // Precondition failed
        return false;

        /** Connection failures */
      case 320: // Connection forced
        return true;
      case 402: // Invalid path
        return false;
      case 501: // Frame error
        return false;
      case 502: // Syntax error
        return false;
      case 503: // Invalid Command
        return false;
      case 504: // Channel error
        return false;
      case 505: // Unexpected frame
        return false;
      case 506: // Resource error
        return false;
      case 530: // Not allowed
        return false;
      case 540: // Not implemented
        return false;
      case 541: // Internal error
        return true;

      default:
        return false;
    }
  }
}
