package com.acme.retry.worker.sample;

import com.acme.retry.core.Jsons;
import com.acme.retry.core.PermanentException;
import com.acme.retry.core.TransientException;
import com.acme.retry.spi.ReceivedMessage;
import com.acme.retry.worker.DestinationHandler;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sample handler for order events. A {@code mode} of {@code failTransient} or {@code failPermanent}
 * makes every attempt fail, so the event ends up on the dead-letter queue.
 */
@Singleton
public class OrderEventHandler implements DestinationHandler {
  private static final Logger log = LoggerFactory.getLogger(OrderEventHandler.class);

  private final String destination;

  public OrderEventHandler(@Value("${sample.orders.queue:APP.ORDERS.Q}") String destination) {
    this.destination = destination;
  }

  @Override
  public String destination() {
    return destination;
  }

  @Override
  public void handle(ReceivedMessage message) {
    OrderEvent event = Jsons.fromJson(message.body(), OrderEvent.class);
    if (event.orderId() == null || event.amount() == null) {
      throw new PermanentException("Order event without orderId or amount");
    }
    if ("failPermanent".equals(event.mode()) || event.amount().compareTo(BigDecimal.ZERO) <= 0) {
      throw new PermanentException("Invalid amount for order " + event.orderId());
    }
    if ("failTransient".equals(event.mode())) {
      throw new TransientException("Downstream timeout");
    }
    log.info(
        "Processed order {} for customer {} amount {}",
        event.orderId(),
        event.customerId(),
        event.amount());
  }
}
