package com.fintech.subscriptions.service;

import com.fintech.subscriptions.client.LedgerClient;
import com.fintech.subscriptions.client.LedgerClientFactory;
import com.fintech.subscriptions.client.LedgerOperation;
import com.fintech.subscriptions.client.OperationSubscription;
import com.fintech.subscriptions.client.StreamEvent;
import com.fintech.subscriptions.exception.ReconnectionExhaustedException;
import com.fintech.subscriptions.resilience.CircuitBreakerSnapshot;
import com.fintech.subscriptions.resilience.GuardedCircuitBreaker;
import com.fintech.subscriptions.resilience.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the upstream connection and the per-account operation streams.
 * <p>
 * Connection status moves DISCONNECTED -> CONNECTING -> CONNECTED and back to DISCONNECTED
 * on any error or disconnect notification. Only the notification that performs the
 * CONNECTED -> DISCONNECTED transition schedules a reconnect, so duplicate notifications
 * for the same outage produce a single reconnect sequence.
 * <p>
 * Reconnects run on one dedicated thread: wait {@code reconnectDelay}, connect through the
 * network breaker and retry executor, reopen every stream. After {@code maxReconnectAttempts}
 * consecutive failed reconnects the {@link FatalConditionHandler} is invoked.
 * <p>
 * Each stream has its own consumer task. Operations of one account are processed one at a
 * time in arrival order; a failure while processing one operation is logged and the stream
 * continues with the next.
 * <p>
 * The supervisor remembers, per account, the highest sequence a stream started after or an
 * operation was dispatched at. Streams reopened after a reconnect resume after that sequence,
 * so operations that reached the account during the outage are replayed; grants are
 * idempotent, so replaying an operation that was already processed is harmless.
 */
@Slf4j
public class ConnectionSupervisor {

    public enum ConnectionStatus {
        DISCONNECTED,
        CONNECTING,
        CONNECTED
    }

    private final LedgerClientFactory clientFactory;
    private final GuardedCircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final TransferProcessor transferProcessor;
    private final FatalConditionHandler fatalConditionHandler;
    private final List<String> accounts;
    private final int maxReconnectAttempts;
    private final Duration reconnectDelay;
    private final Sleeper sleeper;
    private final Executor reconnectExecutor;
    private final ExecutorService consumerExecutor;

    private final AtomicReference<ConnectionStatus> status = new AtomicReference<>(ConnectionStatus.DISCONNECTED);
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final List<OperationSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Map<String, Long> resumePoints = new ConcurrentHashMap<>();

    private volatile LedgerClient client;
    private volatile boolean monitoring;
    private volatile boolean stopped;

    public ConnectionSupervisor(LedgerClientFactory clientFactory,
                                GuardedCircuitBreaker circuitBreaker,
                                RetryExecutor retryExecutor,
                                TransferProcessor transferProcessor,
                                FatalConditionHandler fatalConditionHandler,
                                List<String> accounts,
                                int maxReconnectAttempts,
                                Duration reconnectDelay) {
        this(clientFactory, circuitBreaker, retryExecutor, transferProcessor, fatalConditionHandler,
                accounts, maxReconnectAttempts, reconnectDelay, new ThreadWaitSleeper(),
                Executors.newSingleThreadExecutor(daemonThreads("ledger-reconnect-")));
    }

    ConnectionSupervisor(LedgerClientFactory clientFactory,
                         GuardedCircuitBreaker circuitBreaker,
                         RetryExecutor retryExecutor,
                         TransferProcessor transferProcessor,
                         FatalConditionHandler fatalConditionHandler,
                         List<String> accounts,
                         int maxReconnectAttempts,
                         Duration reconnectDelay,
                         Sleeper sleeper,
                         Executor reconnectExecutor) {
        this.clientFactory = clientFactory;
        this.circuitBreaker = circuitBreaker;
        this.retryExecutor = retryExecutor;
        this.transferProcessor = transferProcessor;
        this.fatalConditionHandler = fatalConditionHandler;
        this.accounts = List.copyOf(accounts);
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.reconnectDelay = reconnectDelay;
        this.sleeper = sleeper;
        this.reconnectExecutor = reconnectExecutor;
        this.consumerExecutor = Executors.newCachedThreadPool(daemonThreads("ledger-stream-"));
    }

    /**
     * Connects to the ledger network. A no-op when already connected.
     *
     * @throws com.fintech.subscriptions.exception.CircuitOpenException if the network breaker is open
     * @throws com.fintech.subscriptions.exception.RetryExhaustedException if every connect attempt failed
     */
    public synchronized void connect() {
        if (stopped) {
            throw new IllegalStateException("Connection supervisor has been stopped");
        }
        if (status.get() == ConnectionStatus.CONNECTED) {
            return;
        }

        status.set(ConnectionStatus.CONNECTING);
        AtomicReference<LedgerClient> attempt = new AtomicReference<>();
        try {
            LedgerClient connected = circuitBreaker.execute(() -> retryExecutor.execute(() -> {
                closeQuietly(attempt.getAndSet(null));
                LedgerClient candidate = clientFactory.create();
                attempt.set(candidate);
                candidate.setListener(new ClientListener(candidate));
                candidate.connect();
                return candidate;
            }));
            client = connected;
            reconnectAttempts.set(0);
            status.set(ConnectionStatus.CONNECTED);
            log.info("Successfully connected to ledger network");
        } catch (RuntimeException e) {
            closeQuietly(attempt.getAndSet(null));
            status.set(ConnectionStatus.DISCONNECTED);
            log.error("Failed to connect to ledger network: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Connects if needed and opens one operation stream per monitored account.
     */
    public void startMonitoring() {
        connect();
        monitoring = true;
        openSubscriptions();
        log.info("Real-time monitoring started for accounts {}", accounts);
    }

    /**
     * Reacts to an upstream error or disconnect. Ignored unless currently connected.
     */
    public void handleDisconnect(Throwable cause) {
        if (stopped) {
            return;
        }
        if (!status.compareAndSet(ConnectionStatus.CONNECTED, ConnectionStatus.DISCONNECTED)) {
            log.debug("Disconnect already being handled, ignoring notification");
            return;
        }

        log.warn("Ledger connection lost: {}", cause == null ? "disconnected" : cause.getMessage());
        try {
            reconnectExecutor.execute(() -> {
                teardown();
                reconnect();
            });
        } catch (RejectedExecutionException e) {
            log.warn("Reconnect not scheduled, supervisor is shutting down");
        }
    }

    /**
     * Cancels every stream, closes the client and stops all background work. Further
     * notifications are ignored.
     */
    public void stop() {
        stopped = true;
        monitoring = false;
        teardown();
        status.set(ConnectionStatus.DISCONNECTED);
        consumerExecutor.shutdownNow();
        if (reconnectExecutor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
        log.info("Ledger monitor stopped");
    }

    public boolean isConnected() {
        return status.get() == ConnectionStatus.CONNECTED;
    }

    public ConnectionStatus getStatus() {
        return status.get();
    }

    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    public boolean isMonitoring() {
        return monitoring;
    }

    public List<String> getAccounts() {
        return accounts;
    }

    public CircuitBreakerSnapshot getCircuitBreakerState() {
        return circuitBreaker.getState();
    }

    private void reconnect() {
        Throwable lastError = null;
        while (!stopped) {
            if (reconnectAttempts.get() >= maxReconnectAttempts) {
                log.error("Max reconnection attempts ({}) reached", maxReconnectAttempts);
                fatalConditionHandler.onFatal(new ReconnectionExhaustedException(maxReconnectAttempts, lastError));
                return;
            }

            int attempt = reconnectAttempts.incrementAndGet();
            log.info("Attempting to reconnect ({}/{})...", attempt, maxReconnectAttempts);
            try {
                sleeper.sleep(reconnectDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Reconnect interrupted");
                return;
            }
            if (stopped) {
                return;
            }

            try {
                connect();
                if (monitoring) {
                    openSubscriptions();
                }
                log.info("Reconnected to ledger network");
                return;
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Reconnection attempt {}/{} failed: {}", attempt, maxReconnectAttempts, e.getMessage());
                teardown();
                status.set(ConnectionStatus.DISCONNECTED);
            }
        }
    }

    private synchronized void openSubscriptions() {
        LedgerClient current = client;
        if (current == null) {
            throw new IllegalStateException("Not connected to ledger network");
        }
        for (String account : accounts) {
            long resumeAfter = resumePoints.getOrDefault(account, LedgerClient.FROM_HEAD);
            OperationSubscription subscription = current.observe(account, resumeAfter);
            subscriptions.add(subscription);
            consumerExecutor.execute(() -> consume(subscription));
            if (resumeAfter == LedgerClient.FROM_HEAD) {
                log.info("Monitoring operations for {}", account);
            } else {
                log.info("Monitoring operations for {} resuming after sequence {}", account, resumeAfter);
            }
        }
    }

    private synchronized void teardown() {
        for (OperationSubscription subscription : subscriptions) {
            recordPosition(subscription.getAccount(), subscription.getStartSequence());
            try {
                subscription.cancel();
            } catch (RuntimeException e) {
                log.warn("Error cancelling subscription for {}: {}", subscription.getAccount(), e.getMessage());
            }
        }
        subscriptions.clear();

        LedgerClient current = client;
        client = null;
        closeQuietly(current);
    }

    void consume(OperationSubscription subscription) {
        try {
            while (!subscription.isCancelled()) {
                StreamEvent event = subscription.take();
                if (subscription.isCancelled()) {
                    return;
                }
                switch (event.getKind()) {
                    case OPERATION -> dispatch(subscription, event.getOperation());
                    case ERROR -> {
                        log.error("Operation stream for {} failed: {}",
                                subscription.getAccount(), event.getError().getMessage());
                        if (subscriptions.contains(subscription)) {
                            handleDisconnect(event.getError());
                        }
                        return;
                    }
                    case COMPLETED -> {
                        log.warn("Operation stream for {} ended", subscription.getAccount());
                        if (subscriptions.contains(subscription)) {
                            handleDisconnect(null);
                        }
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Consumer for {} interrupted", subscription.getAccount());
        }
    }

    private void dispatch(OperationSubscription subscription, LedgerOperation operation) {
        try {
            transferProcessor.process(operation);
        } catch (Exception e) {
            log.error("Error processing operation {} on {}: {}",
                    operation.getSequence(), subscription.getAccount(), e.getMessage(), e);
        }
        recordPosition(subscription.getAccount(), operation.getSequence());
    }

    private void recordPosition(String account, long sequence) {
        if (sequence != LedgerClient.FROM_HEAD) {
            resumePoints.merge(account, sequence, Math::max);
        }
    }

    long getResumePoint(String account) {
        return resumePoints.getOrDefault(account, LedgerClient.FROM_HEAD);
    }

    private void closeQuietly(LedgerClient ledgerClient) {
        if (ledgerClient == null) {
            return;
        }
        try {
            ledgerClient.close();
        } catch (RuntimeException e) {
            log.warn("Error closing ledger client: {}", e.getMessage());
        }
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(prefix);
        threadFactory.setDaemon(true);
        return threadFactory;
    }

    private class ClientListener implements LedgerClient.ConnectionListener {

        private final LedgerClient source;

        ClientListener(LedgerClient source) {
            this.source = source;
        }

        @Override
        public void onError(Throwable error) {
            if (source != client) {
                log.debug("Ignoring error from a replaced ledger client: {}", error.getMessage());
                return;
            }
            log.error("Ledger client error: {}", error.getMessage());
            handleDisconnect(error);
        }

        @Override
        public void onDisconnect() {
            if (source != client) {
                log.debug("Ignoring disconnect from a replaced ledger client");
                return;
            }
            log.warn("Ledger client disconnected");
            handleDisconnect(null);
        }
    }
}
