package net.jodah.tether;

/**
 * Handles messages delivered to a consumer. Exceptions thrown by the handler are logged and do not
 * stop the consumer; the message is left unsettled.
 */
public interface MessageHandler {
  void handle(IncomingMessage message) throws Exception;
}
