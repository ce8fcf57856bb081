package com.acme.retry.spi;

/** Consumer handle for one destination. */
public interface MessageReceiver extends AutoCloseable {

  String entityPath();

  /** Start push-based delivery of messages to {@code handlers}. */
  void subscribe(MessageHandlers handlers, SubscribeOptions options);

  /** Settle {@code message} as processed, removing it from the queue. */
  void completeMessage(ReceivedMessage message);

  /** Settle {@code message} onto the destination's dead-letter queue. */
  void deadLetterMessage(ReceivedMessage message, DeadLetterOptions options);

  boolean isClosed();

  /** Stop delivery. Messages already scheduled for later delivery are not affected. */
  @Override
  void close();
}
