package com.acme.retry.spi;

/** User code processing one delivered message. Throwing marks the attempt as failed. */
@FunctionalInterface
public interface MessageHandler {
  void handle(ReceivedMessage message) throws Exception;
}
