package com.acme.retry.config;

import com.acme.retry.core.RetryPolicy;
import com.acme.retry.spi.SubscribeOptions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Retry settings for the consumer side. Pure POJO - no framework dependencies.
 *
 * <p>{@code maxAttempts} and {@code delays} form the default policy; individual destinations may
 * override it with {@link #putPolicy}.
 */
public class RetryConfig {

  private int maxAttempts = 3;
  private List<Duration> delays =
      new ArrayList<>(List.of(Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(30)));
  private List<String> senders = new ArrayList<>();
  private List<String> receivers = new ArrayList<>();
  private boolean autoComplete = true;
  private int maxConcurrentCalls = 1;
  private final Map<String, RetryPolicy> policies = new HashMap<>();

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public List<Duration> getDelays() {
    return delays;
  }

  public void setDelays(List<Duration> delays) {
    this.delays = delays;
  }

  /** Destinations whose senders are opened at startup. */
  public List<String> getSenders() {
    return senders;
  }

  public void setSenders(List<String> senders) {
    this.senders = senders;
  }

  /** Destinations consumed through the retry orchestrator. */
  public List<String> getReceivers() {
    return receivers;
  }

  public void setReceivers(List<String> receivers) {
    this.receivers = receivers;
  }

  public boolean isAutoComplete() {
    return autoComplete;
  }

  public void setAutoComplete(boolean autoComplete) {
    this.autoComplete = autoComplete;
  }

  public int getMaxConcurrentCalls() {
    return maxConcurrentCalls;
  }

  public void setMaxConcurrentCalls(int maxConcurrentCalls) {
    this.maxConcurrentCalls = maxConcurrentCalls;
  }

  /**
   * The default policy.
   *
   * @throws IllegalArgumentException if {@code maxAttempts} or {@code delays} are invalid
   */
  public RetryPolicy toPolicy() {
    return new RetryPolicy(maxAttempts, delays);
  }

  public void putPolicy(String destination, RetryPolicy policy) {
    policies.put(destination, policy);
  }

  public RetryPolicy policyFor(String destination) {
    RetryPolicy override = policies.get(destination);
    return override != null ? override : toPolicy();
  }

  public SubscribeOptions toSubscribeOptions() {
    return new SubscribeOptions(autoComplete, maxConcurrentCalls);
  }
}
