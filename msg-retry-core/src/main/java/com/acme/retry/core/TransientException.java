package com.acme.retry.core;

/** Broker or infrastructure failure that may succeed when repeated later. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
