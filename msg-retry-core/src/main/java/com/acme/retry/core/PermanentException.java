package com.acme.retry.core;

/** Failure that will not go away when the same operation is repeated. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
