package net.jodah.tether.internal.util;

import static org.mockito.Mockito.mock;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.util.concurrent.TimeoutException;

import net.jodah.tether.AmqpException.ChannelClosedException;
import net.jodah.tether.AmqpException.ConnectionException;
import net.jodah.tether.AmqpException.OperationTimeoutException;

import org.testng.annotations.Test;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

@Test
public class ExceptionsTest {
  static ShutdownSignalException channelClosure(int code) {
    return new ShutdownSignalException(false, false, new AMQP.Channel.Close.Builder().replyCode(code)
        .replyText("text-" + code)
        .build(), mock(Channel.class));
  }

  static ShutdownSignalException connectionClosure(int code) {
    return new ShutdownSignalException(true, false, new AMQP.Connection.Close.Builder().replyCode(
        code).replyText("text-" + code).build(), mock(Connection.class));
  }

  public void shouldNotRetryCallerErrors() {
    for (int code : new int[] { 403, 404, 405, 406 })
      assertFalse(Exceptions.isRetryable(new IOException(channelClosure(code))), "code " + code);
  }

  public void shouldRetryConnectionLoss() {
    assertTrue(Exceptions.isRetryable(new IOException(connectionClosure(320))));
    assertTrue(Exceptions.isRetryable(new ConnectException()));
    assertTrue(Exceptions.isRetryable(new ConnectionException("lost")));
    assertTrue(Exceptions.isRetryable(new AlreadyClosedException(connectionClosure(320))));
  }

  public void shouldNotRetryApplicationClosures() {
    ShutdownSignalException sse = new ShutdownSignalException(false, true, null, mock(Channel.class));
    assertFalse(Exceptions.isRetryable(new AlreadyClosedException(sse)));
  }

  public void shouldDistinguishConnectionClosures() {
    assertTrue(Exceptions.isConnectionClosure(connectionClosure(320)));
    assertFalse(Exceptions.isConnectionClosure(channelClosure(404)));
    assertTrue(Exceptions.isConnectionFailure(new SocketException()));
    assertFalse(Exceptions.isConnectionFailure(new IOException(channelClosure(404))));
  }

  public void shouldTranslateChannelClosures() {
    IOException e = Exceptions.translate(new IOException(channelClosure(404)), "channel-1");
    assertTrue(e instanceof ChannelClosedException);
    assertEquals(((ChannelClosedException) e).getReplyCode(), 404);
    assertEquals(((ChannelClosedException) e).getReplyText(), "text-404");
  }

  public void shouldTranslateTimeouts() {
    assertTrue(Exceptions.translate(new TimeoutException(), "channel-1") instanceof OperationTimeoutException);
  }

  public void shouldTranslateSocketFailures() {
    assertTrue(Exceptions.translate(new SocketException(), "channel-1") instanceof ConnectionException);
  }
}
