package com.acme.retry.worker;

import com.acme.retry.config.RetryConfig;
import com.acme.retry.core.RetryConfigurationException;
import com.acme.retry.receiver.RetryingClient;
import com.acme.retry.receiver.RetryingReceiver;
import com.acme.retry.spi.MessageHandlers;
import com.acme.retry.spi.ProcessErrorContext;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Subscribes a retrying receiver for every configured queue that has a handler. */
@Singleton
@Requires(beans = RetryingClient.class)
public class ReceiverBootstrap implements ApplicationEventListener<StartupEvent> {
  private static final Logger log = LoggerFactory.getLogger(ReceiverBootstrap.class);

  private final RetryingClient client;
  private final Map<String, DestinationHandler> handlers = new HashMap<>();
  private final List<RetryingReceiver> receivers = new ArrayList<>();

  public ReceiverBootstrap(RetryingClient client, List<DestinationHandler> handlers) {
    this.client = client;
    for (DestinationHandler handler : handlers) {
      DestinationHandler previous = this.handlers.put(handler.destination(), handler);
      if (previous != null) {
        throw new RetryConfigurationException(
            "More than one handler for destination: " + handler.destination());
      }
    }
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    start();
  }

  synchronized void start() {
    RetryConfig config = client.config();
    for (String destination : config.getReceivers()) {
      DestinationHandler handler = handlers.get(destination);
      if (handler == null) {
        log.warn("No handler for configured receiver {}, not subscribing", destination);
        continue;
      }
      RetryingReceiver receiver = client.createReceiver(destination);
      receiver.subscribe(
          MessageHandlers.of(handler, this::onError), config.toSubscribeOptions());
      receivers.add(receiver);
    }
    for (String destination : handlers.keySet()) {
      if (!config.getReceivers().contains(destination)) {
        log.warn("Handler for {} is not listed under retry.receivers, not subscribing", destination);
      }
    }
    log.info("Started {} retrying receiver(s)", receivers.size());
  }

  private void onError(ProcessErrorContext context) {
    log.error(
        "Receiver error on {} ({})", context.entityPath(), context.errorSource(), context.error());
  }

  List<RetryingReceiver> receivers() {
    return receivers;
  }

  @PreDestroy
  synchronized void shutdown() {
    log.info("Closing {} receiver(s)", receivers.size());
    for (RetryingReceiver receiver : receivers) {
      try {
        receiver.close();
      } catch (RuntimeException e) {
        log.warn("Failed to close receiver for {}", receiver.entityPath(), e);
      }
    }
    receivers.clear();
  }
}
