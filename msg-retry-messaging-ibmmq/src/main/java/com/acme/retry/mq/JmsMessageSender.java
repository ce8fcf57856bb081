package com.acme.retry.mq;

import com.acme.retry.core.TransientException;
import com.acme.retry.spi.MessageSender;
import com.acme.retry.spi.OutboundMessage;
import jakarta.jms.Connection;
import jakarta.jms.JMSException;
import jakarta.jms.MessageProducer;
import jakarta.jms.Queue;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sender for one queue. Scheduled delivery uses the JMS 2.0 delivery delay, so the broker holds the
 * message until its enqueue time. The session is shared by all callers and guarded by this object's
 * monitor.
 */
public class JmsMessageSender implements MessageSender {
  private static final Logger log = LoggerFactory.getLogger(JmsMessageSender.class);

  private final String queueName;
  private final Clock clock;
  private final Session session;
  private final MessageProducer producer;
  private final Queue queue;
  private boolean closed;

  JmsMessageSender(Connection connection, String queueName, Clock clock) {
    this.queueName = queueName;
    this.clock = clock;
    try {
      this.session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
      this.queue = session.createQueue(queueName);
      this.producer = session.createProducer(null);
    } catch (JMSException e) {
      throw new TransientException("Failed to create JMS sender for queue: " + queueName, e);
    }
    log.info("JMS sender created for queue {}", queueName);
  }

  @Override
  public String entityPath() {
    return queueName;
  }

  @Override
  public synchronized void scheduleMessage(
      OutboundMessage message, Instant scheduledEnqueueTime) {
    if (closed) {
      throw new IllegalStateException("Sender for " + queueName + " is closed");
    }
    long delayMillis =
        Math.max(0, Duration.between(clock.instant(), scheduledEnqueueTime).toMillis());
    try {
      TextMessage msg = Mappers.toJmsMessage(session, message);
      producer.setDeliveryDelay(delayMillis);
      producer.send(queue, msg);
      log.debug(
          "Scheduled message {} on {} with delivery delay {}ms",
          message.messageId(),
          queueName,
          delayMillis);
    } catch (JMSException e) {
      log.error("Error details for queue {}: {}", queueName, e.getMessage(), e);
      throw new TransientException("Failed to schedule message to queue: " + queueName, e);
    }
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      producer.close();
    } catch (JMSException e) {
      log.debug("Error closing producer", e);
    }
    try {
      session.close();
    } catch (JMSException e) {
      log.debug("Error closing session", e);
    }
  }
}
