package com.acme.retry.orchestrator;

import com.acme.retry.codec.RetryMetadataCodec;
import com.acme.retry.core.DeadLetterException;
import com.acme.retry.core.RetryConfigurationException;
import com.acme.retry.core.RetryHeaders;
import com.acme.retry.core.RetryMetadata;
import com.acme.retry.core.RetryPolicy;
import com.acme.retry.sender.SenderRegistry;
import com.acme.retry.spi.DeadLetterOptions;
import com.acme.retry.spi.MessageHandler;
import com.acme.retry.spi.MessageReceiver;
import com.acme.retry.spi.MessageSender;
import com.acme.retry.spi.OutboundMessage;
import com.acme.retry.spi.ReceivedMessage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the fate of a message whose handler failed: schedule a delayed clone back onto the same
 * destination, or move it to the dead-letter queue once its attempts are used up.
 *
 * <p>Per message the transitions are {@code Delivered -> Done}, {@code Delivered ->
 * Scheduled(delay) -> Delivered(clone)} and {@code Delivered -> DeadLettered}. The delay itself is
 * left to the broker's scheduled delivery; nothing here waits or spawns threads.
 */
public class RetryOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(RetryOrchestrator.class);

  private final SenderRegistry senders;
  private final RetryMetadataCodec codec;
  private final Clock clock;

  public RetryOrchestrator(SenderRegistry senders, RetryMetadataCodec codec) {
    this(senders, codec, Clock.systemUTC());
  }

  public RetryOrchestrator(SenderRegistry senders, RetryMetadataCodec codec, Clock clock) {
    this.senders = senders;
    this.codec = codec;
    this.clock = clock;
  }

  /**
   * Wrap {@code handler} so that its failures go through the retry cycle instead of reaching the
   * caller. Only a failure to dead-letter, or a retry for a destination without a sender, escapes
   * the returned handler.
   */
  public MessageHandler wrap(
      MessageHandler handler, String destination, RetryPolicy policy, MessageReceiver receiver) {
    return message -> {
      try {
        handler.handle(message);
      } catch (Exception e) {
        handleFailure(message, destination, policy, e, receiver);
      }
    };
  }

  void handleFailure(
      ReceivedMessage message,
      String destination,
      RetryPolicy policy,
      Exception error,
      MessageReceiver receiver) {
    RetryMetadata metadata = codec.extract(message, policy);
    RetryPolicy effective = metadata.policy();
    int currentAttempt = nextAttempt(metadata.attemptCount());

    log.warn(
        "Message {} failed on attempt {}/{}: {}",
        message.messageId(),
        currentAttempt,
        effective.maxAttempts(),
        describe(error));

    if (effective.isExhaustedBy(currentAttempt)) {
      log.error(
          "Message {} exhausted all retry attempts. Will be moved to DLQ.", message.messageId());
      deadLetter(message, receiver, error);
      return;
    }

    Duration delay = effective.delayAfter(currentAttempt);
    OutboundMessage retryMessage = codec.embed(metadata, currentAttempt, message);

    // the original leaves the queue before its clone can become visible
    receiver.completeMessage(message);
    scheduleRetry(retryMessage, senderFor(destination), metadata, currentAttempt, delay);
  }

  /**
   * The sender retries for {@code destination} are scheduled on.
   *
   * @throws RetryConfigurationException if no sender is registered for {@code destination}
   */
  public MessageSender senderFor(String destination) {
    return senders
        .get(destination)
        .orElseThrow(
            () ->
                new RetryConfigurationException(
                    "No sender registered for destination: " + destination));
  }

  private static int nextAttempt(int attemptCount) {
    return attemptCount == Integer.MAX_VALUE ? Integer.MAX_VALUE : attemptCount + 1;
  }

  private void scheduleRetry(
      OutboundMessage retryMessage,
      MessageSender sender,
      RetryMetadata metadata,
      int attemptCount,
      Duration delay) {
    Instant scheduledEnqueueTime = clock.instant().plus(delay);

    sender.scheduleMessage(retryMessage, scheduledEnqueueTime);
    log.info(
        "Scheduled retry {} of message {} on {} at {} (delay {}ms)",
        attemptCount,
        metadata.originalMessageId(),
        sender.entityPath(),
        scheduledEnqueueTime,
        delay.toMillis());
  }

  private void deadLetter(ReceivedMessage message, MessageReceiver receiver, Exception error) {
    String originalError = describe(error);
    try {
      receiver.deadLetterMessage(
          message,
          new DeadLetterOptions(
              RetryHeaders.DEAD_LETTER_REASON,
              "Custom retry exhausted. Original error: " + originalError));
    } catch (RuntimeException dlqError) {
      log.error("Failed to dead-letter message {}", message.messageId(), dlqError);
      DeadLetterException failure = new DeadLetterException(originalError, dlqError);
      failure.addSuppressed(error);
      throw failure;
    }
  }

  private static String describe(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.toString();
  }
}
