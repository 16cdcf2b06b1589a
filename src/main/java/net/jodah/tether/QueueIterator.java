package net.jodah.tether;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.jodah.tether.AmqpException.ChannelClosedException;
import net.jodah.tether.AmqpException.OperationTimeoutException;
import net.jodah.tether.internal.util.concurrent.Invocations;
import net.jodah.tether.util.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Envelope;

/**
 * Iterates over the messages delivered to a consumer of a queue. The consumer is started by
 * {@link #open()} or by the first pull, and deliveries are buffered until they are pulled. When the
 * queue's channel is robust, the consumer is restored along with the channel and the iterator keeps
 * receiving messages after a reconnect.
 *
 * <p>
 * Buffered messages that await acknowledgement on a raw channel that has since been replaced are
 * discarded when pulled, since the broker delivers them again to the restored consumer. Closing the
 * iterator cancels the consumer and returns any buffered messages to the broker.
 */
public class QueueIterator implements Iterator<IncomingMessage>, Closeable {
  private static final Logger log = LoggerFactory.getLogger(QueueIterator.class);
  private static final IncomingMessage CLOSED = new IncomingMessage(null, null, new Envelope(0, false,
      "", ""), null, null, true, -1);

  private final Queue queue;
  private final ConsumeOptions options;
  private final BlockingDeque<IncomingMessage> buffer = new LinkedBlockingDeque<IncomingMessage>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final CloseCallback closeCallback = new CloseCallback() {
    @Override
    public void onClose(Channel channel, Throwable cause) {
      buffer.offer(CLOSED);
    }
  };
  private volatile String consumerTag;

  QueueIterator(Queue queue, ConsumeOptions options) {
    this.queue = queue;
    this.options = options;
  }

  /**
   * Cancels the consumer and rejects buffered messages with requeue so that the broker can deliver
   * them elsewhere. Closing a closed iterator has no effect.
   */
  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true))
      return;

    Channel channel = queue.getChannel();
    channel.removeCloseCallback(closeCallback);
    try {
      String tag = consumerTag;
      if (tag != null && !channel.isClosed())
        queue.cancel(tag);
    } catch (ChannelClosedException e) {
      log.debug("Could not cancel consumer {} of {} since its channel is closed", consumerTag, queue);
    } finally {
      List<IncomingMessage> pending = new ArrayList<IncomingMessage>();
      buffer.drainTo(pending);
      for (IncomingMessage message : pending)
        requeue(message);
      buffer.offer(CLOSED);
    }
  }

  /**
   * Returns the tag of the iterator's consumer, or null if it has not been started.
   */
  public String getConsumerTag() {
    return consumerTag;
  }

  public Queue getQueue() {
    return queue;
  }

  /**
   * Blocks until a message is available, returning false if the iterator or its channel was closed.
   */
  @Override
  public boolean hasNext() {
    if (closed.get())
      return false;
    try {
      open();
      IncomingMessage message = take(-1);
      buffer.offerFirst(message);
      return message != CLOSED;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (IOException e) {
      log.error("Failed to start consumer for {}", queue, e);
      return false;
    }
  }

  /**
   * Returns whether the iterator has been closed.
   */
  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Blocks until a message is available and returns it.
   *
   * @throws NoSuchElementException if the iterator or its channel was closed
   */
  @Override
  public IncomingMessage next() {
    try {
      return poll(null);
    } catch (ChannelClosedException e) {
      throw new NoSuchElementException(e.getMessage());
    } catch (IOException e) {
      NoSuchElementException nse = new NoSuchElementException(e.getMessage());
      nse.initCause(e);
      throw nse;
    }
  }

  /**
   * Starts the iterator's consumer. Starting a started iterator has no effect.
   *
   * @throws ChannelClosedException if the iterator or its channel is closed
   */
  public synchronized void open() throws IOException {
    if (closed.get())
      throw new ChannelClosedException(String.format("Iterator over %s is closed", queue));
    if (consumerTag != null)
      return;
    queue.getChannel().addCloseCallback(closeCallback);
    consumerTag = queue.consume(new MessageHandler() {
      @Override
      public void handle(IncomingMessage message) {
        if (closed.get())
          requeue(message);
        else
          buffer.offer(message);
      }

      @Override
      public String toString() {
        return String.format("iterator over %s", queue);
      }
    }, options);
  }

  /**
   * Returns the next message, waiting at most {@code timeout}. A null timeout waits indefinitely.
   *
   * @throws OperationTimeoutException if no message arrives within the {@code timeout}
   * @throws ChannelClosedException if the iterator or its channel is closed while waiting
   */
  public IncomingMessage poll(Duration timeout) throws IOException {
    open();
    IncomingMessage message;
    try {
      message = take(Invocations.deadline(timeout));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException(String.format("Interrupted while polling %s", queue));
    }

    if (message == null)
      throw new OperationTimeoutException(String.format("No message from %s within %s", queue, timeout));
    if (message == CLOSED) {
      buffer.offerFirst(CLOSED);
      if (closed.get())
        throw new ChannelClosedException(String.format("Iterator over %s is closed", queue));
      throw queue.getChannel().closedException();
    }
    return message;
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

  @Override
  public String toString() {
    return String.format("iterator over %s", queue);
  }

  /**
   * Takes the next live message from the buffer, waiting until the {@code deadline}. Returns null if
   * the deadline passes.
   */
  private IncomingMessage take(long deadline) throws InterruptedException {
    while (true) {
      IncomingMessage message = deadline == -1 ? buffer.takeFirst() : buffer.pollFirst(
          Math.max(0, Invocations.remaining(deadline)), TimeUnit.NANOSECONDS);
      if (message == null || message == CLOSED || message.isNoAck() || message.isChannelOpen())
        return message;
      log.debug("Discarding {} from {} since the broker will redeliver it", message, queue);
    }
  }

  private void requeue(IncomingMessage message) {
    if (message == CLOSED || message.isNoAck() || message.isProcessed() || !message.isChannelOpen())
      return;
    try {
      message.reject(true);
    } catch (IOException e) {
      log.warn("Failed to requeue {} from {}", message, queue, e);
    } catch (IllegalStateException e) {
      log.debug("{} was settled before it could be requeued", message);
    }
  }
}
