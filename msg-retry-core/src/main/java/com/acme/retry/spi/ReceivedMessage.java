package com.acme.retry.spi;

import java.util.Map;

/** A message delivered by a {@link MessageReceiver}. */
public interface ReceivedMessage {

  /** Logical message id, or {@code null} when the producer did not set one. */
  String messageId();

  String contentType();

  String body();

  /** Application properties; never {@code null}. */
  Map<String, Object> applicationProperties();
}
