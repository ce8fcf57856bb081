package com.acme.retry.mq;

import com.acme.retry.spi.BrokerClient;
import com.acme.retry.spi.MessageReceiver;
import com.acme.retry.spi.MessageSender;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import jakarta.jms.Connection;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link BrokerClient} over a single started JMS connection. */
@Singleton
@Requires(beans = IbmMqFactoryProvider.class)
public class JmsBrokerClient implements BrokerClient {
  private static final Logger log = LoggerFactory.getLogger(JmsBrokerClient.class);

  public static final String DEFAULT_DEAD_LETTER_SUFFIX = ".DLQ";

  private final Connection connection;
  private final String deadLetterSuffix;
  private final Clock clock;
  private final List<JmsMessageReceiver> receivers = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  @Inject
  public JmsBrokerClient(
      @Named("mqConnectionFactory") ConnectionFactory cf,
      @Value("${jms.dead-letter-suffix:.DLQ}") String deadLetterSuffix) {
    this(cf, deadLetterSuffix, Clock.systemUTC());
  }

  public JmsBrokerClient(ConnectionFactory cf, String deadLetterSuffix, Clock clock) {
    this.deadLetterSuffix = deadLetterSuffix;
    this.clock = clock;
    try {
      this.connection = cf.createConnection();
      this.connection.setExceptionListener(this::onConnectionError);
      this.connection.start();
      log.info("JMS connection initialized and started");
    } catch (JMSException e) {
      throw new IllegalStateException("Failed to initialize JMS connection", e);
    }
  }

  @Override
  public MessageSender createSender(String destination) {
    return new JmsMessageSender(connection, destination, clock);
  }

  @Override
  public MessageReceiver createReceiver(String destination) {
    JmsMessageReceiver receiver = new JmsMessageReceiver(connection, destination, deadLetterSuffix);
    receivers.add(receiver);
    return receiver;
  }

  void onConnectionError(JMSException e) {
    log.error("JMS connection error: {}", e.getMessage(), e);
    for (JmsMessageReceiver receiver : receivers) {
      receiver.onConnectionError(e);
    }
  }

  @PreDestroy
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    log.info("Shutting down JMS connection");
    for (JmsMessageReceiver receiver : receivers) {
      receiver.close();
    }
    receivers.clear();
    try {
      connection.close();
    } catch (JMSException e) {
      log.warn("Error during JMS shutdown", e);
    }
  }
}
