package com.fintech.subscriptions.service;

import com.fintech.subscriptions.client.LedgerClient;
import com.fintech.subscriptions.client.LedgerClientFactory;
import com.fintech.subscriptions.client.LedgerOperation;
import com.fintech.subscriptions.client.QueueBackedSubscription;
import com.fintech.subscriptions.exception.LedgerApiException;
import com.fintech.subscriptions.exception.ReconnectionExhaustedException;
import com.fintech.subscriptions.exception.RetryExhaustedException;
import com.fintech.subscriptions.resilience.GuardedCircuitBreaker;
import com.fintech.subscriptions.resilience.RetryExecutor;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectionSupervisorTest {

    private static final String ACCOUNT = "subscriptions.pay";
    private static final String OTHER_ACCOUNT = "premium.pay";

    @Mock
    private LedgerClientFactory clientFactory;

    @Mock
    private TransferProcessor transferProcessor;

    @Mock
    private FatalConditionHandler fatalConditionHandler;

    @Mock
    private LedgerClient client;

    private GuardedCircuitBreaker circuitBreaker;
    private RetryExecutor retryExecutor;
    private List<Long> reconnectWaits;
    private ConnectionSupervisor supervisor;

    @BeforeEach
    void setUp() {
        circuitBreaker = GuardedCircuitBreaker.of(CircuitBreakerRegistry.ofDefaults(), "ledger-network",
                3, Duration.ofSeconds(60), Clock.systemUTC());
        retryExecutor = new RetryExecutor("Ledger network", 2, Duration.ofMillis(5000), 1.5, millis -> { });
        reconnectWaits = new ArrayList<>();
        supervisor = supervisor(Runnable::run, List.of(ACCOUNT));
    }

    @AfterEach
    void tearDown() {
        supervisor.stop();
    }

    private ConnectionSupervisor supervisor(Executor reconnectExecutor, List<String> accounts) {
        return new ConnectionSupervisor(clientFactory, circuitBreaker, retryExecutor, transferProcessor,
                fatalConditionHandler, accounts, 5, Duration.ofSeconds(5), reconnectWaits::add, reconnectExecutor);
    }

    private static LedgerOperation op(long sequence) {
        return LedgerOperation.builder().sequence(sequence).type("transfer").build();
    }

    @Nested
    @DisplayName("Connecting")
    class ConnectTests {

        @Test
        @DisplayName("Should connect a fresh client and register for its notifications")
        void shouldConnect() {
            // Given
            when(clientFactory.create()).thenReturn(client);

            // When
            supervisor.connect();

            // Then
            assertThat(supervisor.isConnected()).isTrue();
            assertThat(supervisor.getStatus()).isEqualTo(ConnectionSupervisor.ConnectionStatus.CONNECTED);
            verify(client).setListener(any());
            verify(client).connect();
        }

        @Test
        @DisplayName("Should be a no-op when already connected")
        void shouldNotReconnectWhenConnected() {
            when(clientFactory.create()).thenReturn(client);

            supervisor.connect();
            supervisor.connect();

            verify(clientFactory, times(1)).create();
        }

        @Test
        @DisplayName("Should retry with a new client and close the failed one")
        void shouldRetryWithNewClient() {
            // Given
            LedgerClient failing = mock(LedgerClient.class);
            doThrow(new LedgerApiException("refused", "http://node", "connect")).when(failing).connect();
            when(clientFactory.create()).thenReturn(failing, client);

            // When
            supervisor.connect();

            // Then
            assertThat(supervisor.isConnected()).isTrue();
            verify(failing).close();
            verify(client, never()).close();
        }

        @Test
        @DisplayName("Should stay disconnected and propagate when every attempt fails")
        void shouldPropagateExhaustedConnect() {
            // Given
            when(clientFactory.create()).thenThrow(new LedgerApiException("unreachable", "http://node", "connect"));

            // When / Then
            assertThatThrownBy(() -> supervisor.connect()).isInstanceOf(RetryExhaustedException.class);
            assertThat(supervisor.isConnected()).isFalse();
            assertThat(supervisor.getCircuitBreakerState().getFailureCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Monitoring")
    class MonitoringTests {

        @Test
        @DisplayName("Should process operations of an account in arrival order")
        void shouldProcessInOrder() {
            // Given
            QueueBackedSubscription subscription = new QueueBackedSubscription(ACCOUNT);
            when(clientFactory.create()).thenReturn(client);
            when(client.observe(eq(ACCOUNT), anyLong())).thenReturn(subscription);
            LedgerOperation first = op(1);
            LedgerOperation second = op(2);
            LedgerOperation third = op(3);

            // When
            supervisor.startMonitoring();
            subscription.emit(first);
            subscription.emit(second);
            subscription.emit(third);

            // Then
            verify(transferProcessor, timeout(2000)).process(third);
            InOrder inOrder = inOrder(transferProcessor);
            inOrder.verify(transferProcessor).process(first);
            inOrder.verify(transferProcessor).process(second);
            inOrder.verify(transferProcessor).process(third);
        }

        @Test
        @DisplayName("Should open one stream per account")
        void shouldObserveEveryAccount() {
            // Given
            supervisor.stop();
            supervisor = supervisor(Runnable::run, List.of(ACCOUNT, OTHER_ACCOUNT));
            when(clientFactory.create()).thenReturn(client);
            when(client.observe(eq(ACCOUNT), anyLong())).thenReturn(new QueueBackedSubscription(ACCOUNT));
            when(client.observe(eq(OTHER_ACCOUNT), anyLong())).thenReturn(new QueueBackedSubscription(OTHER_ACCOUNT));

            // When
            supervisor.startMonitoring();

            // Then
            verify(client).observe(eq(ACCOUNT), anyLong());
            verify(client).observe(eq(OTHER_ACCOUNT), anyLong());
            assertThat(supervisor.isMonitoring()).isTrue();
        }

        @Test
        @DisplayName("Should continue with the next operation when one fails to process")
        void shouldIsolateProcessingFailures() {
            // Given
            QueueBackedSubscription subscription = new QueueBackedSubscription(ACCOUNT);
            when(clientFactory.create()).thenReturn(client);
            when(client.observe(eq(ACCOUNT), anyLong())).thenReturn(subscription);
            LedgerOperation broken = op(1);
            LedgerOperation healthy = op(2);
            when(transferProcessor.process(broken)).thenThrow(new IllegalStateException("database down"));

            // When
            supervisor.startMonitoring();
            subscription.emit(broken);
            subscription.emit(healthy);

            // Then
            verify(transferProcessor, timeout(2000)).process(healthy);
            assertThat(supervisor.isConnected()).isTrue();
        }
    }

    @Nested
    @DisplayName("Reconnecting")
    class ReconnectTests {

        @Test
        @DisplayName("Should replace the client and reopen streams after a disconnect")
        void shouldReconnectAndResubscribe() {
            // Given
            LedgerClient replacement = mock(LedgerClient.class);
            QueueBackedSubscription original = new QueueBackedSubscription(ACCOUNT);
            QueueBackedSubscription reopened = new QueueBackedSubscription(ACCOUNT);
            when(clientFactory.create()).thenReturn(client, replacement);
            when(client.observe(eq(ACCOUNT), anyLong())).thenReturn(original);
            when(replacement.observe(eq(ACCOUNT), anyLong())).thenReturn(reopened);
            supervisor.startMonitoring();

            // When
            supervisor.handleDisconnect(new IllegalStateException("socket closed"));

            // Then
            assertThat(original.isCancelled()).isTrue();
            verify(client).close();
            verify(replacement).observe(eq(ACCOUNT), anyLong());
            assertThat(reconnectWaits).containsExactly(5000L);
            assertThat(supervisor.isConnected()).isTrue();
            assertThat(supervisor.getReconnectAttempts()).isZero();

            LedgerOperation operation = op(7);
            reopened.emit(operation);
            verify(transferProcessor, timeout(2000)).process(operation);
        }

        @Test
        @DisplayName("Should open the first streams from the account head")
        void shouldStartFromHead() {
            when(clientFactory.create()).thenReturn(client);
            when(client.observe(eq(ACCOUNT), anyLong())).thenReturn(new QueueBackedSubscription(ACCOUNT));

            supervisor.startMonitoring();

            verify(client).observe(ACCOUNT, LedgerClient.FROM_HEAD);
        }

        @Test
        @DisplayName("Should resume after the stream start when nothing arrived before the outage")
        void shouldResumeAfterStreamStart() {
            // Given
            LedgerClient replacement = mock(LedgerClient.class);
            QueueBackedSubscription original = new QueueBackedSubscription(ACCOUNT, 1);
            QueueBackedSubscription reopened = new QueueBackedSubscription(ACCOUNT, 1);
            when(clientFactory.create()).thenReturn(client, replacement);
            when(client.observe(eq(ACCOUNT), anyLong())).thenReturn(original);
            when(replacement.observe(eq(ACCOUNT), anyLong())).thenReturn(reopened);
            supervisor.startMonitoring();

            // When
            original.fail(new LedgerApiException("node down", "http://node", "history"));

            // Then
            verify(replacement, timeout(2000)).observe(ACCOUNT, 1L);
            LedgerOperation paidDuringOutage = op(2);
            reopened.emit(paidDuringOutage);
            verify(transferProcessor, timeout(2000)).process(paidDuringOutage);
        }

        @Test
        @DisplayName("Should resume after the last dispatched operation")
        void shouldResumeAfterLastDispatchedOperation() {
            // Given
            LedgerClient replacement = mock(LedgerClient.class);
            QueueBackedSubscription original = new QueueBackedSubscription(ACCOUNT, 3);
            when(clientFactory.create()).thenReturn(client, replacement);
            when(client.observe(eq(ACCOUNT), anyLong())).thenReturn(original);
            when(replacement.observe(eq(ACCOUNT), anyLong())).thenReturn(new QueueBackedSubscription(ACCOUNT, 5));
            supervisor.startMonitoring();
            LedgerOperation last = op(5);
            original.emit(op(4));
            original.emit(last);
            verify(transferProcessor, timeout(2000)).process(last);

            // When
            original.fail(new LedgerApiException("node down", "http://node", "history"));

            // Then
            verify(replacement, timeout(2000)).observe(ACCOUNT, 5L);
            assertThat(supervisor.getResumePoint(ACCOUNT)).isEqualTo(5);
        }

        @Test
        @DisplayName("Should reconnect when a stream ends with an error")
        void shouldReconnectOnStreamError() {
            // Given
            LedgerClient replacement = mock(LedgerClient.class);
            QueueBackedSubscription original = new QueueBackedSubscription(ACCOUNT);
            when(clientFactory.create()).thenReturn(client, replacement);
            when(client.observe(eq(ACCOUNT), anyLong())).thenReturn(original);
            when(replacement.observe(eq(ACCOUNT), anyLong())).thenReturn(new QueueBackedSubscription(ACCOUNT));
            supervisor.startMonitoring();

            // When
            original.fail(new LedgerApiException("poll failed", "http://node", "history"));

            // Then
            verify(replacement, timeout(2000)).observe(eq(ACCOUNT), anyLong());
        }

        @Test
        @DisplayName("Should schedule a single reconnect for duplicate notifications")
        void shouldCollapseDuplicateNotifications() {
            // Given
            List<Runnable> scheduled = new ArrayList<>();
            supervisor.stop();
            supervisor = supervisor(scheduled::add, List.of(ACCOUNT));
            when(clientFactory.create()).thenReturn(client);
            supervisor.connect();

            // When
            supervisor.handleDisconnect(new IllegalStateException("error"));
            supervisor.handleDisconnect(null);
            supervisor.handleDisconnect(new IllegalStateException("error again"));

            // Then
            assertThat(scheduled).hasSize(1);
            assertThat(supervisor.isConnected()).isFalse();
        }

        @Test
        @DisplayName("Should ignore notifications from a replaced client")
        void shouldIgnoreStaleClientNotifications() {
            // Given
            LedgerClient replacement = mock(LedgerClient.class);
            when(clientFactory.create()).thenReturn(client, replacement);
            supervisor.connect();
            ArgumentCaptor<LedgerClient.ConnectionListener> listener =
                    ArgumentCaptor.forClass(LedgerClient.ConnectionListener.class);
            verify(client).setListener(listener.capture());
            supervisor.handleDisconnect(null);

            // When
            listener.getValue().onError(new IllegalStateException("late error from old client"));
            listener.getValue().onDisconnect();

            // Then
            verify(clientFactory, times(2)).create();
            assertThat(supervisor.isConnected()).isTrue();
        }

        @Test
        @DisplayName("Should escalate as fatal once the reconnect budget is exhausted")
        void shouldEscalateWhenReconnectsExhausted() {
            // Given
            when(clientFactory.create())
                    .thenReturn(client)
                    .thenThrow(new LedgerApiException("unreachable", "http://node", "connect"));
            supervisor.connect();

            // When
            supervisor.handleDisconnect(new IllegalStateException("node gone"));

            // Then
            ArgumentCaptor<Throwable> fatal = ArgumentCaptor.forClass(Throwable.class);
            verify(fatalConditionHandler).onFatal(fatal.capture());
            assertThat(fatal.getValue()).isInstanceOf(ReconnectionExhaustedException.class);
            assertThat(((ReconnectionExhaustedException) fatal.getValue()).getAttempts()).isEqualTo(5);
            assertThat(supervisor.getReconnectAttempts()).isEqualTo(5);
            assertThat(reconnectWaits).hasSize(5).containsOnly(5000L);
            assertThat(supervisor.isConnected()).isFalse();
            // Three exhausted connects open the breaker; the last two attempts are rejected without a call
            assertThat(supervisor.getCircuitBreakerState().isOpen()).isTrue();
            verify(clientFactory, times(1 + 3 * 2)).create();
        }
    }

    @Test
    @DisplayName("Should cancel streams, close the client and ignore later notifications once stopped")
    void shouldStop() {
        // Given
        QueueBackedSubscription subscription = new QueueBackedSubscription(ACCOUNT);
        when(clientFactory.create()).thenReturn(client);
        when(client.observe(eq(ACCOUNT), anyLong())).thenReturn(subscription);
        supervisor.startMonitoring();

        // When
        supervisor.stop();
        supervisor.handleDisconnect(new IllegalStateException("late"));

        // Then
        assertThat(subscription.isCancelled()).isTrue();
        verify(client).close();
        verify(clientFactory, times(1)).create();
        assertThat(supervisor.isConnected()).isFalse();
        assertThatThrownBy(() -> supervisor.connect()).isInstanceOf(IllegalStateException.class);
    }
}
