package com.acme.retry.spi;

/**
 * An error raised while a subscription was receiving or settling messages, or one that escaped the
 * message handler.
 */
public record ProcessErrorContext(Throwable error, String entityPath, ErrorSource errorSource) {

  public enum ErrorSource {
    RECEIVE,
    PROCESS_MESSAGE,
    COMPLETE,
    DEAD_LETTER
  }
}
