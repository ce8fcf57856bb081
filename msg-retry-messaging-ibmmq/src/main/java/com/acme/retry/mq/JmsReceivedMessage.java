package com.acme.retry.mq;

import com.acme.retry.spi.ReceivedMessage;
import jakarta.jms.Message;
import jakarta.jms.Session;
import java.util.Collections;
import java.util.Map;

/** A {@link ReceivedMessage} bound to the JMS message and session it arrived on. */
public final class JmsReceivedMessage implements ReceivedMessage {

  private final String messageId;
  private final String contentType;
  private final String body;
  private final Map<String, Object> applicationProperties;
  private final Message jmsMessage;
  private final Session session;
  private volatile boolean settled;

  JmsReceivedMessage(
      String messageId,
      String contentType,
      String body,
      Map<String, Object> applicationProperties,
      Message jmsMessage,
      Session session) {
    this.messageId = messageId;
    this.contentType = contentType;
    this.body = body;
    this.applicationProperties = Collections.unmodifiableMap(applicationProperties);
    this.jmsMessage = jmsMessage;
    this.session = session;
  }

  @Override
  public String messageId() {
    return messageId;
  }

  @Override
  public String contentType() {
    return contentType;
  }

  @Override
  public String body() {
    return body;
  }

  @Override
  public Map<String, Object> applicationProperties() {
    return applicationProperties;
  }

  Message jmsMessage() {
    return jmsMessage;
  }

  Session session() {
    return session;
  }

  boolean isSettled() {
    return settled;
  }

  void markSettled() {
    settled = true;
  }
}
