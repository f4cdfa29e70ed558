package com.fintech.subscriptions.client.hive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.subscriptions.client.LedgerClient;
import com.fintech.subscriptions.client.LedgerOperation;
import com.fintech.subscriptions.client.OperationSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Ledger client for a Hive API node.
 * <p>
 * Streams are emulated by polling {@code condenser_api.get_account_history}. A failed poll
 * terminates its subscription with an error and is reported to the connection listener.
 */
@Slf4j
public class HiveLedgerClient implements LedgerClient {

    private static final ConnectionListener NO_LISTENER = new ConnectionListener() {
        @Override
        public void onError(Throwable error) {
        }

        @Override
        public void onDisconnect() {
        }
    };

    private final HiveRpcClient rpcClient;
    private final Duration pollInterval;
    private final int batchSize;
    private final ScheduledExecutorService poller;
    private final List<PollingOperationSubscription> subscriptions = new CopyOnWriteArrayList<>();

    private volatile ConnectionListener listener = NO_LISTENER;
    private volatile boolean connected;
    private volatile boolean closed;

    public HiveLedgerClient(HiveRpcClient rpcClient, Duration pollInterval, int batchSize) {
        this.rpcClient = rpcClient;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("ledger-poll-");
        threadFactory.setDaemon(true);
        this.poller = Executors.newSingleThreadScheduledExecutor(threadFactory);
    }

    @Override
    public void connect() {
        if (closed) {
            throw new IllegalStateException("Ledger client has been closed");
        }
        JsonNode properties = rpcClient.getDynamicGlobalProperties();
        connected = true;
        log.info("Connected to ledger node {} at head block {}",
                rpcClient.getNodeUrl(), properties.path("head_block_number").asLong());
    }

    @Override
    public OperationSubscription observe(String account, long afterSequence) {
        if (!connected || closed) {
            throw new IllegalStateException("Ledger client is not connected");
        }
        PollingOperationSubscription subscription = new PollingOperationSubscription(account, afterSequence);
        subscriptions.add(subscription);
        ScheduledFuture<?> task = poller.scheduleWithFixedDelay(() -> poll(subscription),
                0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        subscription.setPollTask(task);
        if (afterSequence == FROM_HEAD) {
            log.info("Observing operations of account {} every {}ms", account, pollInterval.toMillis());
        } else {
            log.info("Observing operations of account {} after sequence {} every {}ms",
                    account, afterSequence, pollInterval.toMillis());
        }
        return subscription;
    }

    private void poll(PollingOperationSubscription subscription) {
        if (subscription.isTerminated()) {
            subscription.stopPolling();
            return;
        }
        try {
            int emitted = subscription.offerBatch(accountHistory(subscription.getAccount(), batchSize));
            if (emitted > 0) {
                log.debug("Received {} new operations for {}", emitted, subscription.getAccount());
            }
        } catch (RuntimeException e) {
            log.warn("Polling account {} failed: {}", subscription.getAccount(), e.getMessage());
            subscription.stopPolling();
            subscription.fail(e);
            if (!closed) {
                connected = false;
                listener.onError(e);
            }
        }
    }

    @Override
    public List<LedgerOperation> accountHistory(String account, int limit) {
        return rpcClient.getAccountHistory(account, limit);
    }

    @Override
    public void setListener(ConnectionListener listener) {
        this.listener = listener == null ? NO_LISTENER : listener;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        connected = false;
        subscriptions.forEach(PollingOperationSubscription::cancel);
        subscriptions.clear();
        poller.shutdownNow();
        log.debug("Ledger client for {} closed", rpcClient.getNodeUrl());
    }
}
