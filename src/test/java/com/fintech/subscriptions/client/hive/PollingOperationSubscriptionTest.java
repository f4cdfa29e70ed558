package com.fintech.subscriptions.client.hive;

import com.fintech.subscriptions.client.LedgerClient;
import com.fintech.subscriptions.client.LedgerOperation;
import com.fintech.subscriptions.client.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PollingOperationSubscriptionTest {

    private PollingOperationSubscription subscription;

    @BeforeEach
    void setUp() {
        subscription = new PollingOperationSubscription("subscriptions.pay");
    }

    private static LedgerOperation op(long sequence) {
        return LedgerOperation.builder().sequence(sequence).type("transfer").build();
    }

    @Test
    @DisplayName("Should only position the cursor on the first batch")
    void shouldPrimeCursorOnFirstBatch() {
        int emitted = subscription.offerBatch(List.of(op(8), op(10), op(9)));

        assertThat(emitted).isZero();
        assertThat(subscription.getCursor()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should emit everything past the resume sequence starting with the first batch")
    void shouldEmitGapOnFirstBatchWhenResumed() throws InterruptedException {
        // Given
        PollingOperationSubscription resumed = new PollingOperationSubscription("subscriptions.pay", 1);

        // When
        int emitted = resumed.offerBatch(List.of(op(1), op(2)));

        // Then
        assertThat(emitted).isEqualTo(1);
        assertThat(resumed.getStartSequence()).isEqualTo(1);
        assertThat(resumed.take().getOperation().getSequence()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report the primed cursor as the start sequence")
    void shouldExposeStartSequenceOncePrimed() {
        assertThat(subscription.getStartSequence()).isEqualTo(LedgerClient.FROM_HEAD);

        subscription.offerBatch(List.of(op(4), op(6)));
        subscription.offerBatch(List.of(op(7)));

        assertThat(subscription.getStartSequence()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should emit only operations past the cursor, in sequence order")
    void shouldEmitNewOperationsInOrder() throws InterruptedException {
        // Given
        subscription.offerBatch(List.of(op(9), op(10)));

        // When
        int emitted = subscription.offerBatch(List.of(op(12), op(10), op(11)));

        // Then
        assertThat(emitted).isEqualTo(2);
        assertThat(subscription.getCursor()).isEqualTo(12);
        assertThat(subscription.take().getOperation().getSequence()).isEqualTo(11);
        assertThat(subscription.take().getOperation().getSequence()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should not emit the same operation twice across overlapping batches")
    void shouldNotReemitOverlappingOperations() {
        subscription.offerBatch(List.of(op(1)));
        assertThat(subscription.offerBatch(List.of(op(1), op(2)))).isEqualTo(1);
        assertThat(subscription.offerBatch(List.of(op(1), op(2)))).isZero();
    }

    @Test
    @DisplayName("Should end with a completion event and drop further operations once cancelled")
    void shouldCompleteOnCancel() throws InterruptedException {
        // Given
        subscription.offerBatch(List.of());

        // When
        subscription.cancel();
        int emitted = subscription.offerBatch(List.of(op(1)));

        // Then
        assertThat(subscription.isCancelled()).isTrue();
        assertThat(emitted).isZero();
        assertThat(subscription.take().getKind()).isEqualTo(StreamEvent.Kind.COMPLETED);
    }

    @Test
    @DisplayName("Should deliver a single error event when failed")
    void shouldDeliverErrorOnce() throws InterruptedException {
        IllegalStateException error = new IllegalStateException("poll failed");

        subscription.fail(error);
        subscription.fail(new IllegalStateException("second"));
        subscription.cancel();

        StreamEvent event = subscription.take();
        assertThat(event.getKind()).isEqualTo(StreamEvent.Kind.ERROR);
        assertThat(event.getError()).isSameAs(error);
        assertThat(subscription.isTerminated()).isTrue();
    }
}
