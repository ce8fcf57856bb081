package com.acme.retry.worker.config;

import com.acme.retry.codec.RetryMetadataCodec;
import com.acme.retry.config.RetryConfig;
import com.acme.retry.orchestrator.RetryOrchestrator;
import com.acme.retry.receiver.RetryingClient;
import com.acme.retry.sender.SenderRegistry;
import com.acme.retry.spi.BrokerClient;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Factory for the retry beans. The core module stays free of framework dependencies; the wiring to
 * Micronaut lives here.
 */
@Factory
public class RetryBeansFactory {

  /** Creates RetryConfig bean populated from application.yml retry.* properties */
  @Singleton
  @ConfigurationProperties("retry")
  public RetryConfig retryConfig() {
    return new RetryConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public RetryMetadataCodec retryMetadataCodec(Clock clock) {
    return new RetryMetadataCodec(clock);
  }

  @Singleton
  @Requires(beans = BrokerClient.class)
  public SenderRegistry senderRegistry(BrokerClient brokerClient) {
    return new SenderRegistry(brokerClient);
  }

  @Singleton
  @Requires(beans = SenderRegistry.class)
  public RetryOrchestrator retryOrchestrator(
      SenderRegistry senderRegistry, RetryMetadataCodec codec, Clock clock) {
    return new RetryOrchestrator(senderRegistry, codec, clock);
  }

  /** Creates RetryingClient; closing it closes its receivers and every registered sender */
  @Bean(preDestroy = "close")
  @Singleton
  @Requires(beans = RetryOrchestrator.class)
  public RetryingClient retryingClient(
      BrokerClient brokerClient,
      SenderRegistry senderRegistry,
      RetryOrchestrator orchestrator,
      RetryConfig config) {
    return new RetryingClient(brokerClient, senderRegistry, orchestrator, config);
  }
}
