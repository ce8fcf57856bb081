package com.acme.retry.worker.config;

import com.acme.retry.config.RetryConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final RetryConfig retryConfig;
  private final String deadLetterSuffix;

  public ConfigurationLogger(
      RetryConfig retryConfig, @Value("${jms.dead-letter-suffix:.DLQ}") String deadLetterSuffix) {
    this.retryConfig = retryConfig;
    this.deadLetterSuffix = deadLetterSuffix;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    LOG.info("━━━ Retry Configuration ━━━");
    LOG.info("  Max Attempts:       {} (including the first delivery)", retryConfig.getMaxAttempts());
    LOG.info("  Delays:             {} (delay before attempt 2, 3, ...)", retryConfig.getDelays());
    LOG.info("  Receivers:          {}", retryConfig.getReceivers());
    LOG.info("  Senders:            {}", retryConfig.getSenders());
    LOG.info("  Auto Complete:      {}", retryConfig.isAutoComplete());
    LOG.info("  Concurrent Calls:   {} (per receiver)", retryConfig.getMaxConcurrentCalls());
    LOG.info("━━━ Messaging Configuration ━━━");
    LOG.info("  MQ Host:            {}", System.getenv().getOrDefault("MQ_HOST", "localhost"));
    LOG.info("  Queue Manager:      {}", System.getenv().getOrDefault("MQ_QMGR", "QM1"));
    LOG.info("  DLQ Suffix:         {}", deadLetterSuffix);
  }
}
