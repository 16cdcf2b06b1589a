package net.jodah.tether;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.nio.charset.StandardCharsets;

import net.jodah.tether.AmqpException.ChannelClosedException;
import net.jodah.tether.AmqpException.DeserializationException;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

@Test
public class IncomingMessageTest {
  com.rabbitmq.client.Channel channel;

  @BeforeMethod
  protected void beforeMethod() {
    channel = mock(com.rabbitmq.client.Channel.class);
  }

  IncomingMessage message(byte[] body, boolean noAck) {
    AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder().messageId("m-1")
        .contentType("text/plain").build();
    return new IncomingMessage(channel, "ctag", new Envelope(7, true, "orders", "new"), properties,
        body, noAck, -1);
  }

  public void shouldExposeEnvelopeAndProperties() throws Throwable {
    IncomingMessage message = message("hello".getBytes(StandardCharsets.UTF_8), false);

    assertEquals(message.getBodyAsString(), "hello");
    assertEquals(message.getDeliveryTag(), 7);
    assertEquals(message.getExchange(), "orders");
    assertEquals(message.getRoutingKey(), "new");
    assertEquals(message.getMessageId(), "m-1");
    assertEquals(message.getContentType(), "text/plain");
    assertEquals(message.getConsumerTag(), "ctag");
    assertTrue(message.isRedelivered());
    assertNull(message.getCorrelationId());
    assertFalse(message.isProcessed());
  }

  public void shouldSettleOnce() throws Throwable {
    IncomingMessage message = message(new byte[0], false);
    message.ack();

    verify(channel).basicAck(7, false);
    assertTrue(message.isProcessed());

    try {
      message.ack();
      fail();
    } catch (IllegalStateException expected) {
    }

    try {
      message.nack(true);
      fail();
    } catch (IllegalStateException expected) {
    }

    try {
      message.reject(false);
      fail();
    } catch (IllegalStateException expected) {
    }
  }

  public void shouldRejectWithRequeue() throws Throwable {
    message(new byte[0], false).reject(true);
    verify(channel).basicReject(7, true);
  }

  public void shouldNackWithoutRequeue() throws Throwable {
    message(new byte[0], false).nack(false);
    verify(channel).basicNack(7, false, false);
  }

  public void shouldNotSettleNoAckMessages() throws Throwable {
    IncomingMessage message = message(new byte[0], true);

    try {
      message.ack();
      fail();
    } catch (IllegalStateException expected) {
    }

    verifyNoInteractions(channel);
    assertFalse(message.isProcessed());
  }

  public void shouldFailToDecodeInvalidUtf8() throws Throwable {
    IncomingMessage message = message(new byte[] { (byte) 0xc3, (byte) 0x28 }, false);

    try {
      message.getBodyAsString();
      fail();
    } catch (DeserializationException expected) {
    }

    assertEquals(message.getBody().length, 2);
  }

  public void shouldTranslateClosedChannelFailures() throws Throwable {
    ShutdownSignalException cause = new ShutdownSignalException(false, false,
        new AMQP.Channel.Close.Builder().replyCode(406).replyText("PRECONDITION_FAILED").build(),
        channel);
    doThrow(new AlreadyClosedException(cause)).when(channel).basicAck(7, false);
    IncomingMessage message = message(new byte[0], false);

    try {
      message.ack();
      fail();
    } catch (ChannelClosedException expected) {
    }

    assertTrue(message.isProcessed());
  }

  public void shouldReportWhetherChannelIsOpen() {
    IncomingMessage message = message(new byte[0], false);
    when(channel.isOpen()).thenReturn(true);
    assertTrue(message.isChannelOpen());
    when(channel.isOpen()).thenReturn(false);
    assertFalse(message.isChannelOpen());
  }
}
