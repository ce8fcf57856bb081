package com.acme.retry.sender;

import com.acme.retry.spi.BrokerClient;
import com.acme.retry.spi.MessageSender;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One outbound sender per destination, opened on first registration and kept until {@link #close}.
 * Registration and lookup are safe to call from concurrent consumer threads; a destination's sender
 * is created at most once.
 */
public class SenderRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SenderRegistry.class);

  private final BrokerClient brokerClient;
  private final Map<String, MessageSender> senders = new ConcurrentHashMap<>();

  public SenderRegistry(BrokerClient brokerClient) {
    this.brokerClient = brokerClient;
  }

  /** Open a sender for {@code destination} unless one is already registered. */
  public void register(String destination) {
    senders.computeIfAbsent(
        destination,
        name -> {
          log.info("Registering sender for destination: {}", name);
          return brokerClient.createSender(name);
        });
  }

  public Optional<MessageSender> get(String destination) {
    return Optional.ofNullable(senders.get(destination));
  }

  @Override
  public void close() {
    for (Map.Entry<String, MessageSender> entry : senders.entrySet()) {
      try {
        entry.getValue().close();
      } catch (RuntimeException e) {
        log.warn("Failed to close sender for destination: {}", entry.getKey(), e);
      }
    }
    senders.clear();
  }
}
