package com.acme.retry.spi;

/** Receives transport-level errors reported by a subscription. */
@FunctionalInterface
public interface ErrorHandler {
  void handle(ProcessErrorContext context) throws Exception;
}
