package net.jodah.tether;

import java.io.IOException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Base class for the failures raised by tether. Specific failures are exposed as nested
 * subclasses so that callers can catch exactly what they can handle.
 */
public class AmqpException extends IOException {
  private static final long serialVersionUID = 1L;

  public AmqpException(String message) {
    super(message);
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Thrown when a connection cannot be established, or is lost and cannot be re-established.
   */
  public static class ConnectionException extends AmqpException {
    private static final long serialVersionUID = 1L;

    public ConnectionException(String message) {
      super(message);
    }

    public ConnectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Thrown when an operation is attempted on, or interrupted by, a closed channel. Carries the
   * broker's reply code and text when the broker closed the channel.
   */
  public static class ChannelClosedException extends AmqpException {
    private static final long serialVersionUID = 1L;
    private final int replyCode;
    private final String replyText;
    private final transient ShutdownSignalException shutdownSignal;

    public ChannelClosedException(String message) {
      super(message);
      replyCode = 0;
      replyText = null;
      shutdownSignal = null;
    }

    public ChannelClosedException(String message, ShutdownSignalException cause) {
      super(message, cause);
      shutdownSignal = cause;
      Method reason = cause == null ? null : cause.getReason();
      if (reason instanceof AMQP.Channel.Close) {
        replyCode = ((AMQP.Channel.Close) reason).getReplyCode();
        replyText = ((AMQP.Channel.Close) reason).getReplyText();
      } else if (reason instanceof AMQP.Connection.Close) {
        replyCode = ((AMQP.Connection.Close) reason).getReplyCode();
        replyText = ((AMQP.Connection.Close) reason).getReplyText();
      } else {
        replyCode = 0;
        replyText = null;
      }
    }

    /** Returns the broker's reply code, else 0 if the closure did not come from the broker. */
    public int getReplyCode() {
      return replyCode;
    }

    public String getReplyText() {
      return replyText;
    }

    /** Returns the underlying shutdown signal, if any. */
    public ShutdownSignalException getShutdownSignal() {
      return shutdownSignal;
    }
  }

  /**
   * Thrown when an operation is refused locally, before anything is sent to the broker, such as a
   * publish to an internal exchange.
   */
  public static class PolicyException extends AmqpException {
    private static final long serialVersionUID = 1L;

    public PolicyException(String message) {
      super(message);
    }
  }

  /**
   * Thrown by a single-message get when the queue has no messages.
   */
  public static class QueueEmptyException extends AmqpException {
    private static final long serialVersionUID = 1L;

    public QueueEmptyException(String message) {
      super(message);
    }
  }

  /**
   * Thrown when an operation does not complete within its timeout. The request may or may not
   * have reached the broker.
   */
  public static class OperationTimeoutException extends AmqpException {
    private static final long serialVersionUID = 1L;

    public OperationTimeoutException(String message) {
      super(message);
    }
  }

  /**
   * Thrown from a confirmed publish when the broker returned the mandatory message as unroutable.
   */
  public static class MessageReturnedException extends AmqpException {
    private static final long serialVersionUID = 1L;
    private final transient ReturnedMessage returnedMessage;

    public MessageReturnedException(ReturnedMessage returnedMessage) {
      super(String.format("Message was returned by the broker: %s %s",
          returnedMessage.getReplyCode(), returnedMessage.getReplyText()));
      this.returnedMessage = returnedMessage;
    }

    public ReturnedMessage getReturnedMessage() {
      return returnedMessage;
    }
  }

  /**
   * Thrown from a confirmed publish when the broker negatively acknowledged the message.
   */
  public static class MessageNackedException extends AmqpException {
    private static final long serialVersionUID = 1L;
    private final long deliveryTag;

    public MessageNackedException(long deliveryTag) {
      super("Message was not acknowledged by the broker: " + deliveryTag);
      this.deliveryTag = deliveryTag;
    }

    public long getDeliveryTag() {
      return deliveryTag;
    }
  }

  /**
   * Thrown when a message body cannot be decoded.
   */
  public static class DeserializationException extends AmqpException {
    private static final long serialVersionUID = 1L;

    public DeserializationException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
