package net.jodah.tether;

import java.io.IOException;

/**
 * An operation performed against a raw channel. Operations are reusable so that robust channels
 * can issue them again after recovery and replay them against a fresh raw channel.
 */
interface ChannelOperation<T> {
  T call(com.rabbitmq.client.Channel channel) throws IOException;
}
