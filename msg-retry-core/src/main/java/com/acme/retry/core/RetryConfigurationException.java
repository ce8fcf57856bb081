package com.acme.retry.core;

/**
 * Wiring mistake detected while subscribing or scheduling a retry, e.g. a subscription without a
 * message handler or a retry for a destination that has no registered sender.
 */
public class RetryConfigurationException extends PermanentException {
  public RetryConfigurationException(String message) {
    super(message);
  }
}
