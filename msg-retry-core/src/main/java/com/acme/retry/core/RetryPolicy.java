package com.acme.retry.core;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Attempt budget and delay schedule for one destination.
 *
 * <p>{@code maxAttempts} counts every delivery including the first one. {@code delaySchedule.get(i)}
 * is the wait before attempt {@code i + 2}; attempts beyond the end of the schedule reuse its last
 * entry.
 */
public record RetryPolicy(int maxAttempts, List<Duration> delaySchedule) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
    }
    Objects.requireNonNull(delaySchedule, "delaySchedule");
    if (delaySchedule.isEmpty()) {
      throw new IllegalArgumentException("delaySchedule must not be empty");
    }
    for (Duration delay : delaySchedule) {
      if (delay == null || delay.isNegative()) {
        throw new IllegalArgumentException("delaySchedule entries must be >= 0, was " + delay);
      }
    }
    delaySchedule = List.copyOf(delaySchedule);
  }

  public static RetryPolicy ofMillis(int maxAttempts, long... delaysMillis) {
    return new RetryPolicy(
        maxAttempts, Arrays.stream(delaysMillis).mapToObj(Duration::ofMillis).toList());
  }

  /**
   * Delay applied before re-delivering a message whose {@code currentAttempt}-th attempt just
   * failed. Clamped to the last schedule entry.
   */
  public Duration delayAfter(int currentAttempt) {
    int index = Math.min(Math.max(currentAttempt - 1, 0), delaySchedule.size() - 1);
    return delaySchedule.get(index);
  }

  /** True when the failed {@code currentAttempt} used up the attempt budget. */
  public boolean isExhaustedBy(int currentAttempt) {
    return currentAttempt >= maxAttempts;
  }

  public List<Long> delayScheduleMillis() {
    return delaySchedule.stream().map(Duration::toMillis).toList();
  }
}
