package com.acme.retry.spi;

import java.time.Instant;

/** Outbound channel to one destination. */
public interface MessageSender extends AutoCloseable {

  String entityPath();

  /**
   * Enqueue {@code message} now, visible to consumers from {@code scheduledEnqueueTime} on. Returns
   * once the broker accepted the message.
   */
  void scheduleMessage(OutboundMessage message, Instant scheduledEnqueueTime);

  @Override
  void close();
}
