package com.acme.retry.mq;

import com.acme.retry.core.RetryHeaders;
import com.acme.retry.spi.OutboundMessage;
import jakarta.jms.BytesMessage;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps between JMS messages and the broker SPI messages.
 *
 * <p>JMS property names must be Java identifiers, so the hyphenated retry keys ({@code
 * x-retry-attempt}, ...) travel as {@code x_retry_attempt} on JMS and are mapped back to their
 * canonical names on receipt. Other property names that are not valid identifiers are dropped.
 */
public final class Mappers {
  private static final Logger log = LoggerFactory.getLogger(Mappers.class);

  static final String PROP_MESSAGE_ID = "messageId";
  static final String PROP_CONTENT_TYPE = "contentType";
  static final String PROP_DEAD_LETTER_REASON = "DeadLetterReason";
  static final String PROP_DEAD_LETTER_DESCRIPTION = "DeadLetterErrorDescription";

  private static final Map<String, String> TO_JMS = new HashMap<>();
  private static final Map<String, String> FROM_JMS = new HashMap<>();

  static {
    for (String key : RetryHeaders.ALL) {
      String jmsName = key.replace('-', '_');
      TO_JMS.put(key, jmsName);
      FROM_JMS.put(jmsName, key);
    }
  }

  private Mappers() {}

  public static JmsReceivedMessage toReceivedMessage(Message m, Session session)
      throws JMSException {
    Map<String, Object> props = new HashMap<>();
    Enumeration<?> names = m.getPropertyNames();
    while (names.hasMoreElements()) {
      String name = (String) names.nextElement();
      if (isReserved(name) || PROP_MESSAGE_ID.equals(name) || PROP_CONTENT_TYPE.equals(name)) {
        continue;
      }
      props.put(fromJmsPropertyName(name), m.getObjectProperty(name));
    }

    String messageId = m.getStringProperty(PROP_MESSAGE_ID);
    if (messageId == null || messageId.isBlank()) {
      messageId = m.getJMSMessageID();
    }
    return new JmsReceivedMessage(
        messageId, m.getStringProperty(PROP_CONTENT_TYPE), readBody(m), props, m, session);
  }

  public static TextMessage toJmsMessage(Session session, OutboundMessage message)
      throws JMSException {
    TextMessage msg = session.createTextMessage(message.body());
    if (message.messageId() != null) {
      msg.setStringProperty(PROP_MESSAGE_ID, message.messageId());
    }
    if (message.contentType() != null) {
      msg.setStringProperty(PROP_CONTENT_TYPE, message.contentType());
    }
    copyProperties(message.applicationProperties(), msg);
    return msg;
  }

  static void copyProperties(Map<String, Object> properties, Message target)
      throws JMSException {
    for (Map.Entry<String, Object> e : properties.entrySet()) {
      String name = toJmsPropertyName(e.getKey());
      if (!isValidPropertyName(name) || isReserved(name)) {
        log.warn("Dropping property {}: not a valid JMS property name", e.getKey());
        continue;
      }
      Object value = e.getValue();
      if (value == null) {
        continue;
      }
      if (isJmsPropertyType(value)) {
        target.setObjectProperty(name, value);
      } else {
        target.setStringProperty(name, value.toString());
      }
    }
  }

  private static boolean isJmsPropertyType(Object value) {
    return value instanceof String
        || value instanceof Boolean
        || value instanceof Integer
        || value instanceof Long
        || value instanceof Double
        || value instanceof Float
        || value instanceof Short
        || value instanceof Byte;
  }

  static String toJmsPropertyName(String key) {
    return TO_JMS.getOrDefault(key, key);
  }

  static String fromJmsPropertyName(String name) {
    return FROM_JMS.getOrDefault(name, name);
  }

  static boolean isValidPropertyName(String name) {
    if (name == null || name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0))) {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      if (!Character.isJavaIdentifierPart(name.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isReserved(String name) {
    return name.startsWith("JMSX") || name.startsWith("JMS_");
  }

  private static String readBody(Message m) throws JMSException {
    if (m instanceof TextMessage) {
      return ((TextMessage) m).getText();
    }
    if (m instanceof BytesMessage) {
      BytesMessage bytes = (BytesMessage) m;
      byte[] data = new byte[(int) bytes.getBodyLength()];
      bytes.readBytes(data);
      return new String(data, StandardCharsets.UTF_8);
    }
    log.warn("Unsupported JMS message type {}, body ignored", m.getClass().getSimpleName());
    return null;
  }
}
