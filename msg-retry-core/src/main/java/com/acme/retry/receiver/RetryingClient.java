package com.acme.retry.receiver;

import com.acme.retry.config.RetryConfig;
import com.acme.retry.core.RetryConfigurationException;
import com.acme.retry.core.RetryPolicy;
import com.acme.retry.orchestrator.RetryOrchestrator;
import com.acme.retry.sender.SenderRegistry;
import com.acme.retry.spi.BrokerClient;
import com.acme.retry.spi.MessageSender;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer-side service owning the {@link SenderRegistry}. Hands out receivers that retry failed
 * messages onto their own destination, and the senders registered for configured destinations.
 */
public class RetryingClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RetryingClient.class);

  private final BrokerClient brokerClient;
  private final SenderRegistry senders;
  private final RetryOrchestrator orchestrator;
  private final RetryConfig config;
  private final List<RetryingReceiver> receivers = new CopyOnWriteArrayList<>();

  public RetryingClient(
      BrokerClient brokerClient,
      SenderRegistry senders,
      RetryOrchestrator orchestrator,
      RetryConfig config) {
    this.brokerClient = brokerClient;
    this.senders = senders;
    this.orchestrator = orchestrator;
    this.config = config;
    config.getSenders().forEach(senders::register);
  }

  /** Receiver for {@code destination} using the configured policy for it. */
  public RetryingReceiver createReceiver(String destination) {
    return createReceiver(destination, config.policyFor(destination));
  }

  /**
   * Receiver for {@code destination} retrying under {@code policy}. Retries are scheduled back onto
   * {@code destination}, so its sender is registered here.
   */
  public RetryingReceiver createReceiver(String destination, RetryPolicy policy) {
    senders.register(destination);
    RetryingReceiver receiver =
        new RetryingReceiver(
            brokerClient.createReceiver(destination), orchestrator, destination, policy);
    receivers.add(receiver);
    log.info("Created retrying receiver for {}", destination);
    return receiver;
  }

  /**
   * @throws RetryConfigurationException if no sender was registered for {@code destination}
   */
  public MessageSender sender(String destination) {
    return senders
        .get(destination)
        .orElseThrow(
            () ->
                new RetryConfigurationException(
                    "No sender registered for destination: " + destination));
  }

  public RetryConfig config() {
    return config;
  }

  @Override
  public void close() {
    for (RetryingReceiver receiver : receivers) {
      try {
        if (!receiver.isClosed()) {
          receiver.close();
        }
      } catch (RuntimeException e) {
        log.warn("Failed to close receiver for {}", receiver.entityPath(), e);
      }
    }
    receivers.clear();
    senders.close();
  }
}
