package com.acme.retry.orchestrator;

import static com.acme.retry.core.RetryHeaders.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.retry.codec.RetryMetadataCodec;
import com.acme.retry.core.DeadLetterException;
import com.acme.retry.core.RetryConfigurationException;
import com.acme.retry.core.RetryPolicy;
import com.acme.retry.sender.SenderRegistry;
import com.acme.retry.spi.BrokerClient;
import com.acme.retry.spi.DeadLetterOptions;
import com.acme.retry.spi.MessageHandler;
import com.acme.retry.spi.MessageReceiver;
import com.acme.retry.spi.MessageSender;
import com.acme.retry.spi.OutboundMessage;
import com.acme.retry.spi.TestMessage;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

@DisplayName("RetryOrchestrator - retry and dead-letter decisions")
class RetryOrchestratorTest {

  private static final String QUEUE = "orders";
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final RetryPolicy POLICY = RetryPolicy.ofMillis(3, 100, 200, 300);

  private BrokerClient brokerClient;
  private MessageSender sender;
  private MessageReceiver receiver;
  private SenderRegistry registry;
  private RetryOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    brokerClient = mock(BrokerClient.class);
    sender = mock(MessageSender.class);
    receiver = mock(MessageReceiver.class);
    when(brokerClient.createSender(QUEUE)).thenReturn(sender);
    when(sender.entityPath()).thenReturn(QUEUE);

    registry = new SenderRegistry(brokerClient);
    registry.register(QUEUE);
    orchestrator = new RetryOrchestrator(registry, new RetryMetadataCodec(clock), clock);
  }

  private static MessageHandler failing(String error) {
    return message -> {
      throw new IllegalStateException(error);
    };
  }

  private static Map<String, Object> retried(int attempt) {
    Map<String, Object> props = new HashMap<>();
    props.put(RETRY_ORIGINAL_ID, "orig-id");
    props.put(RETRY_ATTEMPT, attempt);
    props.put(RETRY_FIRST_ATTEMPT, "2024-05-01T09:00:00.000Z");
    props.put(RETRY_LAST_ATTEMPT, "2024-05-01T09:59:00.000Z");
    props.put(RETRY_MAX_ATTEMPTS, 3);
    props.put(RETRY_DELAY_INTERVALS, "[100,200,300]");
    return props;
  }

  @Test
  @DisplayName("wrap - should do nothing else when the handler succeeds")
  void testSuccess() throws Exception {
    // Given
    MessageHandler handler = mock(MessageHandler.class);
    TestMessage message = TestMessage.of("m-1", "{}");

    // When
    orchestrator.wrap(handler, QUEUE, POLICY, receiver).handle(message);

    // Then
    verify(handler).handle(message);
    verifyNoInteractions(receiver);
    verify(sender, never()).scheduleMessage(any(), any());
  }

  @Test
  @DisplayName("first failure - should complete the original and schedule a clone after the first delay")
  void testFirstFailureSchedulesRetry() throws Exception {
    // Given
    TestMessage message = TestMessage.of("m-1", "{\"orderId\":42}");

    // When
    orchestrator.wrap(failing("boom"), QUEUE, POLICY, receiver).handle(message);

    // Then
    InOrder order = inOrder(receiver, sender);
    order.verify(receiver).completeMessage(message);
    ArgumentCaptor<OutboundMessage> clone = ArgumentCaptor.forClass(OutboundMessage.class);
    order.verify(sender).scheduleMessage(clone.capture(), eq(NOW.plusMillis(100)));

    assertThat(clone.getValue().messageId()).isEqualTo("m-1-retry-1");
    assertThat(clone.getValue().body()).isEqualTo("{\"orderId\":42}");
    assertThat(clone.getValue().applicationProperties())
        .containsEntry(RETRY_ATTEMPT, 1)
        .containsEntry(RETRY_ORIGINAL_ID, "m-1");
    verify(receiver, never()).deadLetterMessage(any(), any());
  }

  @Test
  @DisplayName("later failure - should use the delay for the failed attempt")
  void testSecondFailureUsesSecondDelay() throws Exception {
    TestMessage message = TestMessage.of("orig-id-retry-1", "{}", retried(1));

    orchestrator.wrap(failing("boom"), QUEUE, POLICY, receiver).handle(message);

    ArgumentCaptor<OutboundMessage> clone = ArgumentCaptor.forClass(OutboundMessage.class);
    verify(sender).scheduleMessage(clone.capture(), eq(NOW.plusMillis(200)));
    assertThat(clone.getValue().messageId()).isEqualTo("orig-id-retry-2");
    assertThat(clone.getValue().applicationProperties())
        .containsEntry(RETRY_ORIGINAL_ID, "orig-id")
        .containsEntry(RETRY_ATTEMPT, 2)
        .containsEntry(RETRY_FIRST_ATTEMPT, "2024-05-01T09:00:00.000Z");
  }

  @Test
  @DisplayName("past the schedule - should reuse the last delay")
  void testDelayClampsToLastEntry() throws Exception {
    RetryPolicy shortSchedule = RetryPolicy.ofMillis(10, 100, 200);
    Map<String, Object> props = retried(4);
    props.put(RETRY_MAX_ATTEMPTS, 10);
    props.put(RETRY_DELAY_INTERVALS, "[100,200]");

    orchestrator
        .wrap(failing("boom"), QUEUE, shortSchedule, receiver)
        .handle(TestMessage.of("x", "{}", props));

    verify(sender).scheduleMessage(any(), eq(NOW.plusMillis(200)));
  }

  @Test
  @DisplayName("exhausted - should dead-letter without scheduling")
  void testExhaustedDeadLetters() throws Exception {
    // Given
    TestMessage message = TestMessage.of("orig-id-retry-3", "{}", retried(3));

    // When
    orchestrator.wrap(failing("payment declined"), QUEUE, POLICY, receiver).handle(message);

    // Then
    ArgumentCaptor<DeadLetterOptions> options = ArgumentCaptor.forClass(DeadLetterOptions.class);
    verify(receiver).deadLetterMessage(eq(message), options.capture());
    assertThat(options.getValue().deadLetterReason()).isEqualTo("MaxCustomRetryAttemptsExceeded");
    assertThat(options.getValue().deadLetterErrorDescription())
        .isEqualTo("Custom retry exhausted. Original error: payment declined");
    verify(receiver, never()).completeMessage(any());
    verify(sender, never()).scheduleMessage(any(), any());
  }

  @Test
  @DisplayName("last allowed attempt - should dead-letter on the failure that used up the budget")
  void testLastAllowedAttemptDeadLetters() throws Exception {
    TestMessage message = TestMessage.of("orig-id-retry-2", "{}", retried(2));

    orchestrator.wrap(failing("boom"), QUEUE, POLICY, receiver).handle(message);

    verify(receiver).deadLetterMessage(eq(message), any());
    verify(sender, never()).scheduleMessage(any(), any());
  }

  @Test
  @DisplayName("single attempt policy - should dead-letter on the first failure")
  void testSingleAttemptPolicy() throws Exception {
    TestMessage message = TestMessage.of("m-1", "{}");

    orchestrator
        .wrap(failing("boom"), QUEUE, RetryPolicy.ofMillis(1, 100), receiver)
        .handle(message);

    verify(receiver).deadLetterMessage(eq(message), any());
    verifyNoInteractions(sender);
  }

  @Test
  @DisplayName("dead-letter failure - should surface both errors to the caller")
  void testDeadLetterFailure() {
    // Given
    TestMessage message = TestMessage.of("orig-id-retry-3", "{}", retried(3));
    doThrow(new IllegalStateException("dlq fail"))
        .when(receiver)
        .deadLetterMessage(eq(message), any());
    MessageHandler wrapped = orchestrator.wrap(failing("original boom"), QUEUE, POLICY, receiver);

    // When / Then
    assertThatThrownBy(() -> wrapped.handle(message))
        .isInstanceOf(DeadLetterException.class)
        .hasMessageContaining("Failed to dead-letter message: dlq fail")
        .hasMessageContaining("original boom")
        .hasCauseInstanceOf(IllegalStateException.class)
        .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
  }

  @Test
  @DisplayName("missing sender - should settle the message and fail with a configuration error")
  void testMissingSender() {
    TestMessage message = TestMessage.of("m-1", "{}");
    MessageHandler wrapped = orchestrator.wrap(failing("boom"), "missing", POLICY, receiver);

    assertThatThrownBy(() -> wrapped.handle(message))
        .isInstanceOf(RetryConfigurationException.class)
        .hasMessage("No sender registered for destination: missing");
    verify(receiver).completeMessage(message);
    verify(sender, never()).scheduleMessage(any(), any());
  }

  @Test
  @DisplayName("senderFor - should fail with a configuration error for an unknown destination")
  void testSenderFor() {
    assertThat(orchestrator.senderFor(QUEUE)).isSameAs(sender);
    assertThatThrownBy(() -> orchestrator.senderFor("missing"))
        .isInstanceOf(RetryConfigurationException.class)
        .hasMessage("No sender registered for destination: missing");
  }

  @Test
  @DisplayName("null property value - should still schedule the clone without that property")
  void testNullPropertyValue() throws Exception {
    // Given
    Map<String, Object> props = new HashMap<>();
    props.put("note", null);
    props.put("tenant", "acme");
    TestMessage message = TestMessage.of("m-1", "{}", props);

    // When
    orchestrator.wrap(failing("boom"), QUEUE, POLICY, receiver).handle(message);

    // Then
    verify(receiver).completeMessage(message);
    ArgumentCaptor<OutboundMessage> clone = ArgumentCaptor.forClass(OutboundMessage.class);
    verify(sender).scheduleMessage(clone.capture(), eq(NOW.plusMillis(100)));
    assertThat(clone.getValue().applicationProperties())
        .containsEntry("tenant", "acme")
        .doesNotContainKey("note");
  }

  @Test
  @DisplayName("clone failure - should leave the original unsettled")
  void testCloneFailureLeavesOriginal() {
    // Given
    RetryMetadataCodec brokenCodec = mock(RetryMetadataCodec.class);
    when(brokenCodec.extract(any(), any()))
        .thenAnswer(
            inv -> new RetryMetadataCodec().extract(inv.getArgument(0), inv.getArgument(1)));
    when(brokenCodec.embed(any(), anyInt(), any())).thenThrow(new IllegalStateException("bad"));
    RetryOrchestrator broken = new RetryOrchestrator(registry, brokenCodec);
    MessageHandler wrapped = broken.wrap(failing("boom"), QUEUE, POLICY, receiver);

    // When / Then
    assertThatThrownBy(() -> wrapped.handle(TestMessage.of("m-1", "{}")))
        .isInstanceOf(IllegalStateException.class);
    verify(receiver, never()).completeMessage(any());
  }

  @Test
  @DisplayName("attempt count at Integer.MAX_VALUE - should dead-letter instead of overflowing")
  void testMaxIntAttemptDeadLetters() throws Exception {
    Map<String, Object> props = retried(3);
    props.put(RETRY_ATTEMPT, Integer.MAX_VALUE);
    TestMessage message = TestMessage.of("orig-id-retry-x", "{}", props);

    orchestrator.wrap(failing("boom"), QUEUE, POLICY, receiver).handle(message);

    verify(receiver).deadLetterMessage(eq(message), any());
    verify(receiver, never()).completeMessage(any());
    verify(sender, never()).scheduleMessage(any(), any());
  }

  @Test
  @DisplayName("attempt count beyond int range - should dead-letter instead of truncating")
  void testLongAttemptDeadLetters() throws Exception {
    Map<String, Object> props = retried(3);
    props.put(RETRY_ATTEMPT, 4294967296L);
    TestMessage message = TestMessage.of("orig-id-retry-x", "{}", props);

    orchestrator.wrap(failing("boom"), QUEUE, POLICY, receiver).handle(message);

    verify(receiver).deadLetterMessage(eq(message), any());
    verify(sender, never()).scheduleMessage(any(), any());
  }

  @Test
  @DisplayName("frozen policy - should keep the budget the message started with")
  void testFrozenBudget() throws Exception {
    // message started under maxAttempts=3 and already failed twice
    TestMessage message = TestMessage.of("orig-id-retry-2", "{}", retried(2));

    orchestrator
        .wrap(failing("boom"), QUEUE, RetryPolicy.ofMillis(10, 5), receiver)
        .handle(message);

    verify(receiver).deadLetterMessage(eq(message), any());
  }

  @Test
  @DisplayName("error without message - should describe the error by its type")
  void testErrorWithoutMessage() throws Exception {
    TestMessage message = TestMessage.of("orig-id-retry-3", "{}", retried(3));
    MessageHandler npe =
        m -> {
          throw new NullPointerException();
        };

    orchestrator.wrap(npe, QUEUE, POLICY, receiver).handle(message);

    ArgumentCaptor<DeadLetterOptions> options = ArgumentCaptor.forClass(DeadLetterOptions.class);
    verify(receiver).deadLetterMessage(eq(message), options.capture());
    assertThat(options.getValue().deadLetterErrorDescription())
        .contains("java.lang.NullPointerException");
  }
}
