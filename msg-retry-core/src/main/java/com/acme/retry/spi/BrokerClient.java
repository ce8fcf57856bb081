package com.acme.retry.spi;

/** Entry point to the message broker. */
public interface BrokerClient extends AutoCloseable {

  MessageSender createSender(String destination);

  MessageReceiver createReceiver(String destination);

  @Override
  void close();
}
