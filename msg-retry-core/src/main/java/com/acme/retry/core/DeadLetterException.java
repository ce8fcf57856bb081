package com.acme.retry.core;

/**
 * Raised when a message that exhausted its attempts could not be moved to the dead-letter queue.
 * The message text names both the settlement failure and the handler error that started it; the
 * settlement failure is the cause.
 */
public class DeadLetterException extends TransientException {

  public DeadLetterException(String originalError, Throwable deadLetterFailure) {
    super(
        "Failed to dead-letter message: "
            + describe(deadLetterFailure)
            + ". Original error: "
            + originalError,
        deadLetterFailure);
  }

  private static String describe(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.toString();
  }
}
