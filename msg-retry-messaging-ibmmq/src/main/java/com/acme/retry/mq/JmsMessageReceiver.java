package com.acme.retry.mq;

import com.acme.retry.core.TransientException;
import com.acme.retry.spi.DeadLetterOptions;
import com.acme.retry.spi.MessageHandlers;
import com.acme.retry.spi.MessageReceiver;
import com.acme.retry.spi.OutboundMessage;
import com.acme.retry.spi.ProcessErrorContext;
import com.acme.retry.spi.ProcessErrorContext.ErrorSource;
import com.acme.retry.spi.ReceivedMessage;
import com.acme.retry.spi.SubscribeOptions;
import jakarta.jms.Connection;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.MessageConsumer;
import jakarta.jms.MessageListener;
import jakarta.jms.MessageProducer;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receiver for one queue. Each concurrent call gets its own {@code CLIENT_ACKNOWLEDGE} session, so
 * settling a message acknowledges it on the session it was delivered on. A message that is neither
 * completed nor dead-lettered is redelivered after the session is recovered.
 *
 * <p>Dead-lettering copies the message to {@code <queue><suffix>} with {@code DeadLetterReason} and
 * {@code DeadLetterErrorDescription} properties before acknowledging the original.
 */
public class JmsMessageReceiver implements MessageReceiver {
  private static final Logger log = LoggerFactory.getLogger(JmsMessageReceiver.class);

  private final Connection connection;
  private final String queueName;
  private final String deadLetterQueueName;
  private final List<Session> sessions = new ArrayList<>();
  private final List<MessageConsumer> consumers = new ArrayList<>();
  private volatile MessageHandlers handlers;
  private volatile boolean closed;

  JmsMessageReceiver(Connection connection, String queueName, String deadLetterSuffix) {
    this.connection = connection;
    this.queueName = queueName;
    this.deadLetterQueueName = queueName + deadLetterSuffix;
  }

  @Override
  public String entityPath() {
    return queueName;
  }

  @Override
  public synchronized void subscribe(MessageHandlers handlers, SubscribeOptions options) {
    if (closed) {
      throw new IllegalStateException("Receiver for " + queueName + " is closed");
    }
    if (this.handlers != null) {
      throw new IllegalStateException("Receiver for " + queueName + " is already subscribed");
    }
    if (handlers == null || handlers.processMessage() == null) {
      throw new IllegalArgumentException("A processMessage handler is required");
    }
    this.handlers = handlers;
    try {
      for (int i = 0; i < options.maxConcurrentCalls(); i++) {
        Session session = connection.createSession(false, Session.CLIENT_ACKNOWLEDGE);
        sessions.add(session);
        MessageConsumer consumer = session.createConsumer(session.createQueue(queueName));
        consumers.add(consumer);
        consumer.setMessageListener(listener(session, options));
      }
    } catch (JMSException e) {
      close();
      throw new TransientException("Failed to subscribe to queue: " + queueName, e);
    }
    log.info(
        "Subscribed to {} (autoComplete={}, maxConcurrentCalls={})",
        queueName,
        options.autoCompleteMessages(),
        options.maxConcurrentCalls());
  }

  private MessageListener listener(Session session, SubscribeOptions options) {
    return message -> {
      JmsReceivedMessage received;
      try {
        received = Mappers.toReceivedMessage(message, session);
      } catch (JMSException e) {
        log.error("Failed to read message from {}", queueName, e);
        reportError(e, ErrorSource.RECEIVE);
        recover(session);
        return;
      }

      try {
        handlers.processMessage().handle(received);
      } catch (Exception e) {
        log.error("Handler failed for message {} on {}", received.messageId(), queueName, e);
        reportError(e, ErrorSource.PROCESS_MESSAGE);
        if (!received.isSettled()) {
          recover(session);
        }
        return;
      }

      if (options.autoCompleteMessages() && !received.isSettled()) {
        try {
          completeMessage(received);
        } catch (RuntimeException e) {
          log.error("Failed to complete message {} on {}", received.messageId(), queueName, e);
          reportError(e, ErrorSource.COMPLETE);
        }
      }
    };
  }

  /**
   * @throws IllegalArgumentException if {@code message} was not received by a JMS receiver
   * @throws TransientException if the acknowledgement fails
   */
  @Override
  public void completeMessage(ReceivedMessage message) {
    JmsReceivedMessage received = jms(message);
    try {
      received.jmsMessage().acknowledge();
      received.markSettled();
      log.debug("Completed message {} on {}", received.messageId(), queueName);
    } catch (JMSException e) {
      throw new TransientException("Failed to complete message " + received.messageId(), e);
    }
  }

  /**
   * @throws IllegalArgumentException if {@code message} was not received by a JMS receiver
   * @throws TransientException if the copy cannot be sent or the original acknowledged
   */
  @Override
  public void deadLetterMessage(ReceivedMessage message, DeadLetterOptions options) {
    JmsReceivedMessage received = jms(message);
    Session session = received.session();
    try {
      TextMessage copy =
          Mappers.toJmsMessage(
              session,
              new OutboundMessage(
                  received.messageId(),
                  received.contentType(),
                  received.body(),
                  received.applicationProperties()));
      if (options.deadLetterReason() != null) {
        copy.setStringProperty(Mappers.PROP_DEAD_LETTER_REASON, options.deadLetterReason());
      }
      if (options.deadLetterErrorDescription() != null) {
        copy.setStringProperty(
            Mappers.PROP_DEAD_LETTER_DESCRIPTION, options.deadLetterErrorDescription());
      }
      MessageProducer producer = session.createProducer(session.createQueue(deadLetterQueueName));
      try {
        producer.send(copy);
      } finally {
        producer.close();
      }
      received.jmsMessage().acknowledge();
      received.markSettled();
      log.info(
          "Dead-lettered message {} to {} ({})",
          received.messageId(),
          deadLetterQueueName,
          options.deadLetterReason());
    } catch (JMSException e) {
      throw new TransientException(
          "Failed to dead-letter message " + received.messageId() + " to " + deadLetterQueueName,
          e);
    }
  }

  /** Report a connection-level failure to the subscription's error handler. */
  void onConnectionError(JMSException e) {
    if (handlers != null && !closed) {
      reportError(e, ErrorSource.RECEIVE);
    }
  }

  private void reportError(Throwable error, ErrorSource source) {
    MessageHandlers current = handlers;
    if (current == null || current.processError() == null) {
      return;
    }
    try {
      current.processError().handle(new ProcessErrorContext(error, queueName, source));
    } catch (Exception e) {
      log.warn("Error handler failed for {} error on {}", source, queueName, e);
    }
  }

  private void recover(Session session) {
    try {
      session.recover();
    } catch (JMSException e) {
      log.warn("Failed to recover session on {}", queueName, e);
    }
  }

  private static JmsReceivedMessage jms(ReceivedMessage message) {
    if (!(message instanceof JmsReceivedMessage)) {
      throw new IllegalArgumentException(
          "Message was not received from JMS: " + message.getClass().getName());
    }
    return (JmsReceivedMessage) message;
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (MessageConsumer consumer : consumers) {
      try {
        consumer.close();
      } catch (JMSException e) {
        log.debug("Error closing consumer", e);
      }
    }
    for (Session session : sessions) {
      try {
        session.close();
      } catch (JMSException e) {
        log.debug("Error closing session", e);
      }
    }
    consumers.clear();
    sessions.clear();
    log.info("Receiver for {} closed", queueName);
  }
}
