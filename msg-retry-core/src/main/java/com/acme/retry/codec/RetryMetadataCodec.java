package com.acme.retry.codec;

import static com.acme.retry.core.RetryHeaders.RETRY_ATTEMPT;
import static com.acme.retry.core.RetryHeaders.RETRY_DELAY_INTERVALS;
import static com.acme.retry.core.RetryHeaders.RETRY_FIRST_ATTEMPT;
import static com.acme.retry.core.RetryHeaders.RETRY_LAST_ATTEMPT;
import static com.acme.retry.core.RetryHeaders.RETRY_MAX_ATTEMPTS;
import static com.acme.retry.core.RetryHeaders.RETRY_ORIGINAL_ID;

import com.acme.retry.core.Jsons;
import com.acme.retry.core.RetryMetadata;
import com.acme.retry.core.RetryPolicy;
import com.acme.retry.spi.OutboundMessage;
import com.acme.retry.spi.ReceivedMessage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@link RetryMetadata} from and to a message's application properties. All
 * coercions between the untyped property bag and typed metadata happen here.
 *
 * <p>Malformed properties never fail a message: each field that cannot be read falls back to the
 * value of the policy passed to {@link #extract}.
 */
public class RetryMetadataCodec {
  private static final Logger log = LoggerFactory.getLogger(RetryMetadataCodec.class);

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private final Clock clock;

  public RetryMetadataCodec() {
    this(Clock.systemUTC());
  }

  public RetryMetadataCodec(Clock clock) {
    this.clock = clock;
  }

  /**
   * Metadata of {@code message}, or fresh metadata for a message that has never been retried.
   */
  public RetryMetadata extract(ReceivedMessage message, RetryPolicy policy) {
    Map<String, Object> props = message.applicationProperties();
    Object originalId = props == null ? null : props.get(RETRY_ORIGINAL_ID);
    Instant now = clock.instant();

    if (originalId == null || originalId.toString().isBlank()) {
      return new RetryMetadata(
          fallbackId(message),
          0,
          now,
          now,
          policy.maxAttempts(),
          policy.delaySchedule());
    }

    String messageId = message.messageId();
    return new RetryMetadata(
        originalId.toString(),
        readInt(props, RETRY_ATTEMPT, 0, 0, messageId),
        readInstant(props, RETRY_FIRST_ATTEMPT, now, messageId),
        readInstant(props, RETRY_LAST_ATTEMPT, now, messageId),
        readInt(props, RETRY_MAX_ATTEMPTS, 1, policy.maxAttempts(), messageId),
        readDelays(props, policy.delaySchedule(), messageId));
  }

  /**
   * Clone of {@code original} carrying {@code metadata} with {@code attemptCount} failed attempts.
   * Other application properties of the original are kept.
   */
  public OutboundMessage embed(
      RetryMetadata metadata, int attemptCount, ReceivedMessage original) {
    Map<String, Object> props = new HashMap<>();
    if (original.applicationProperties() != null) {
      for (Map.Entry<String, Object> e : original.applicationProperties().entrySet()) {
        if (e.getValue() != null) {
          props.put(e.getKey(), e.getValue());
        }
      }
    }
    props.put(RETRY_ORIGINAL_ID, metadata.originalMessageId());
    props.put(RETRY_ATTEMPT, attemptCount);
    props.put(RETRY_FIRST_ATTEMPT, formatTimestamp(metadata.firstAttemptTime()));
    props.put(RETRY_LAST_ATTEMPT, formatTimestamp(clock.instant()));
    props.put(RETRY_MAX_ATTEMPTS, metadata.maxRetries());
    props.put(RETRY_DELAY_INTERVALS, Jsons.toJson(metadata.policy().delayScheduleMillis()));

    return new OutboundMessage(
        metadata.originalMessageId() + "-retry-" + attemptCount,
        original.contentType(),
        original.body(),
        props);
  }

  public static String formatTimestamp(Instant instant) {
    return TIMESTAMP.format(instant);
  }

  private String fallbackId(ReceivedMessage message) {
    String id = message.messageId();
    return id == null || id.isEmpty() ? "msg-" + clock.millis() : id;
  }

  private static int readInt(
      Map<String, Object> props, String key, int min, int fallback, String messageId) {
    Object raw = props.get(key);
    if (raw == null) {
      return fallback;
    }
    try {
      long value =
          raw instanceof Number
              ? ((Number) raw).longValue()
              : (long) Double.parseDouble(raw.toString().trim());
      if (value < min) {
        log.debug("Ignoring {}={} on message {}", key, raw, messageId);
        return fallback;
      }
      // saturate so that an oversized count still reads as exhausted
      return (int) Math.min(value, Integer.MAX_VALUE);
    } catch (NumberFormatException e) {
      log.warn("Unparseable {}={} on message {}, using {}", key, raw, messageId, fallback);
      return fallback;
    }
  }

  private static Instant readInstant(
      Map<String, Object> props, String key, Instant fallback, String messageId) {
    Object raw = props.get(key);
    if (raw == null) {
      return fallback;
    }
    String text = raw.toString().trim();
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(text).toInstant();
      } catch (DateTimeParseException again) {
        log.warn("Unparseable {}={} on message {}", key, raw, messageId);
        return fallback;
      }
    }
  }

  private static List<Duration> readDelays(
      Map<String, Object> props, List<Duration> fallback, String messageId) {
    Object raw = props.get(RETRY_DELAY_INTERVALS);
    if (raw == null) {
      return fallback;
    }
    try {
      List<Long> millis = Jsons.longList(raw.toString());
      if (millis == null || millis.isEmpty() || millis.stream().anyMatch(m -> m == null || m < 0)) {
        log.warn("Invalid {}={} on message {}", RETRY_DELAY_INTERVALS, raw, messageId);
        return fallback;
      }
      return millis.stream().map(Duration::ofMillis).toList();
    } catch (IllegalArgumentException e) {
      log.warn("Unparseable {}={} on message {}", RETRY_DELAY_INTERVALS, raw, messageId);
      return fallback;
    }
  }
}
