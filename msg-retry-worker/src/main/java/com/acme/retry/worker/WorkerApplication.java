package com.acme.retry.worker;

import io.micronaut.runtime.Micronaut;

/**
 * Worker Application - consumes the configured queues through the retry orchestrator. Failed
 * messages are rescheduled onto their own queue and dead-lettered once their attempts are used up.
 * Can run multiple instances for horizontal scaling.
 */
public class WorkerApplication {
  public static void main(String[] args) {
    Micronaut.run(WorkerApplication.class, args);
  }
}
