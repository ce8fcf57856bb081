package com.acme.retry.worker;

import com.acme.retry.spi.MessageHandler;

/**
 * Business handler for one queue. Beans of this type are subscribed with retry at startup when their
 * destination is listed under {@code retry.receivers}.
 */
public interface DestinationHandler extends MessageHandler {

  String destination();
}
