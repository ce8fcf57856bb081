package com.acme.retry.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Retry bookkeeping carried inside a message's application properties.
 *
 * <p>{@code attemptCount} is the number of attempts that already failed, not counting the one being
 * handled. {@code maxRetries} and {@code delayIntervals} are the policy frozen when the message
 * first failed, so later configuration changes do not alter the budget of a message in flight.
 */
public record RetryMetadata(
    String originalMessageId,
    int attemptCount,
    Instant firstAttemptTime,
    Instant lastAttemptTime,
    int maxRetries,
    List<Duration> delayIntervals) {

  public RetryMetadata {
    delayIntervals = List.copyOf(delayIntervals);
  }

  /** The frozen policy this message is retried under. */
  public RetryPolicy policy() {
    return new RetryPolicy(maxRetries, delayIntervals);
  }
}
