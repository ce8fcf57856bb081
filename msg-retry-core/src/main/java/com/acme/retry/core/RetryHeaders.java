package com.acme.retry.core;

import java.util.List;

/**
 * Application property keys that carry retry bookkeeping on the message itself. These names are a
 * wire contract shared with every other consumer of the format and must not change.
 */
public final class RetryHeaders {
  public static final String RETRY_ORIGINAL_ID = "x-retry-original-id";
  public static final String RETRY_ATTEMPT = "x-retry-attempt";
  public static final String RETRY_FIRST_ATTEMPT = "x-retry-first-attempt";
  public static final String RETRY_LAST_ATTEMPT = "x-retry-last-attempt";
  public static final String RETRY_MAX_ATTEMPTS = "x-retry-max-attempts";
  public static final String RETRY_DELAY_INTERVALS = "x-retry-delay-intervals";

  public static final List<String> ALL =
      List.of(
          RETRY_ORIGINAL_ID,
          RETRY_ATTEMPT,
          RETRY_FIRST_ATTEMPT,
          RETRY_LAST_ATTEMPT,
          RETRY_MAX_ATTEMPTS,
          RETRY_DELAY_INTERVALS);

  /** Reason code recorded on messages moved to the dead-letter queue. */
  public static final String DEAD_LETTER_REASON = "MaxCustomRetryAttemptsExceeded";

  private RetryHeaders() {}
}
