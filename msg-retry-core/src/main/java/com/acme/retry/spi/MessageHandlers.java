package com.acme.retry.spi;

/** Callbacks passed to {@link MessageReceiver#subscribe}. Either may be {@code null}. */
public record MessageHandlers(MessageHandler processMessage, ErrorHandler processError) {

  public static MessageHandlers of(MessageHandler processMessage, ErrorHandler processError) {
    return new MessageHandlers(processMessage, processError);
  }

  public static MessageHandlers of(MessageHandler processMessage) {
    return new MessageHandlers(processMessage, null);
  }
}
