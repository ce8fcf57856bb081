package com.acme.retry.spi;

/**
 * Subscription settings.
 *
 * @param autoCompleteMessages complete a message once its handler returned without settling it
 * @param maxConcurrentCalls number of messages handled at the same time
 */
public record SubscribeOptions(boolean autoCompleteMessages, int maxConcurrentCalls) {

  public static final SubscribeOptions DEFAULT = new SubscribeOptions(true, 1);

  public SubscribeOptions {
    if (maxConcurrentCalls < 1) {
      throw new IllegalArgumentException("maxConcurrentCalls must be >= 1");
    }
  }
}
