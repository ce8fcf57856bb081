package com.acme.retry.core;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DeadLetterException - combined diagnostics")
class DeadLetterExceptionTest {

  @Test
  @DisplayName("should name both the settlement failure and the original error")
  void testMessageCombinesBothErrors() {
    IllegalStateException dlqFailure = new IllegalStateException("link detached");

    DeadLetterException e = new DeadLetterException("payment declined", dlqFailure);

    assertThat(e)
        .hasMessage("Failed to dead-letter message: link detached. Original error: payment declined")
        .hasCause(dlqFailure)
        .isInstanceOf(TransientException.class);
  }

  @Test
  @DisplayName("should describe a settlement failure without a message by its type")
  void testSettlementFailureWithoutMessage() {
    DeadLetterException e = new DeadLetterException("payment declined", new IllegalStateException());

    assertThat(e)
        .hasMessage(
            "Failed to dead-letter message: java.lang.IllegalStateException."
                + " Original error: payment declined");
  }
}
