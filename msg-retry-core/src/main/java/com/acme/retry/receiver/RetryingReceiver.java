package com.acme.retry.receiver;

import com.acme.retry.core.RetryConfigurationException;
import com.acme.retry.core.RetryPolicy;
import com.acme.retry.orchestrator.RetryOrchestrator;
import com.acme.retry.spi.DeadLetterOptions;
import com.acme.retry.spi.ErrorHandler;
import com.acme.retry.spi.MessageHandler;
import com.acme.retry.spi.MessageHandlers;
import com.acme.retry.spi.MessageReceiver;
import com.acme.retry.spi.ProcessErrorContext;
import com.acme.retry.spi.ReceivedMessage;
import com.acme.retry.spi.SubscribeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drop-in {@link MessageReceiver} that routes every message of a subscription through the {@link
 * RetryOrchestrator}. All other operations go straight to the wrapped receiver.
 */
public class RetryingReceiver implements MessageReceiver {
  private static final Logger log = LoggerFactory.getLogger(RetryingReceiver.class);

  static final String ERROR_PROCESS_MESSAGE =
      "A processMessage handler is required to subscribe with retry";

  private final MessageReceiver delegate;
  private final RetryOrchestrator orchestrator;
  private final String destination;
  private final RetryPolicy policy;

  public RetryingReceiver(
      MessageReceiver delegate,
      RetryOrchestrator orchestrator,
      String destination,
      RetryPolicy policy) {
    this.delegate = delegate;
    this.orchestrator = orchestrator;
    this.destination = destination;
    this.policy = policy;
  }

  /**
   * Subscribe with retry applied to {@code handlers.processMessage()}. Transport errors go to
   * {@code handlers.processError()} unchanged.
   *
   * @throws RetryConfigurationException if no message handler is given, or no sender is
   *     registered for the destination retries go to
   */
  @Override
  public void subscribe(MessageHandlers handlers, SubscribeOptions options) {
    if (handlers == null || handlers.processMessage() == null) {
      throw new RetryConfigurationException(ERROR_PROCESS_MESSAGE);
    }
    orchestrator.senderFor(destination);
    MessageHandler retrying =
        orchestrator.wrap(handlers.processMessage(), destination, policy, delegate);
    ErrorHandler userErrorHandler = handlers.processError();

    log.info(
        "Subscribing to {} with retry (maxAttempts={}, delays={})",
        destination,
        policy.maxAttempts(),
        policy.delaySchedule());
    delegate.subscribe(
        MessageHandlers.of(retrying, context -> forwardError(context, userErrorHandler)), options);
  }

  private void forwardError(ProcessErrorContext context, ErrorHandler userErrorHandler)
      throws Exception {
    if (userErrorHandler != null) {
      userErrorHandler.handle(context);
    } else {
      log.warn(
          "Unhandled {} error on {}", context.errorSource(), context.entityPath(), context.error());
    }
  }

  @Override
  public void close() {
    log.info("Closing receiver for {}", destination);
    delegate.close();
  }

  @Override
  public String entityPath() {
    return delegate.entityPath();
  }

  @Override
  public void completeMessage(ReceivedMessage message) {
    delegate.completeMessage(message);
  }

  @Override
  public void deadLetterMessage(ReceivedMessage message, DeadLetterOptions options) {
    delegate.deadLetterMessage(message, options);
  }

  @Override
  public boolean isClosed() {
    return delegate.isClosed();
  }

  public RetryPolicy policy() {
    return policy;
  }
}
