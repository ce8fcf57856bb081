package com.acme.retry.spi;

import java.util.HashMap;
import java.util.Map;

/** A message handed to a {@link MessageSender}. Properties with a {@code null} value are dropped. */
public record OutboundMessage(
    String messageId, String contentType, String body, Map<String, Object> applicationProperties) {

  public OutboundMessage {
    Map<String, Object> props = new HashMap<>();
    if (applicationProperties != null) {
      applicationProperties.forEach(
          (key, value) -> {
            if (key != null && value != null) {
              props.put(key, value);
            }
          });
    }
    applicationProperties = Map.copyOf(props);
  }
}
