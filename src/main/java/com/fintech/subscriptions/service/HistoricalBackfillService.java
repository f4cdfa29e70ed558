package com.fintech.subscriptions.service;

import com.fintech.subscriptions.client.LedgerClient;
import com.fintech.subscriptions.client.LedgerClientFactory;
import com.fintech.subscriptions.client.LedgerOperation;
import com.fintech.subscriptions.config.SubscriptionTrackerProperties;
import com.fintech.subscriptions.dto.BackfillResult;
import com.fintech.subscriptions.dto.SubscriptionMatch;
import com.fintech.subscriptions.resilience.GuardedCircuitBreaker;
import com.fintech.subscriptions.resilience.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Replays recent account history through the transfer processor on startup, so payments
 * made while the service was down are not lost. Replays are safe because grants are
 * idempotent.
 * <p>
 * A payment whose paid period ({@code timestamp + product days}) already ended is skipped;
 * replaying it would open a new full window for a subscription that has run out.
 */
@Service
@Slf4j
public class HistoricalBackfillService {

    private final LedgerClientFactory clientFactory;
    private final GuardedCircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final TransferProcessor transferProcessor;
    private final TransferClassifier classifier;
    private final ProductCatalog catalog;
    private final Duration window;
    private final int historyLimit;
    private final Clock clock;

    public HistoricalBackfillService(LedgerClientFactory clientFactory,
                                     @Qualifier("networkCircuitBreaker") GuardedCircuitBreaker circuitBreaker,
                                     @Qualifier("networkRetryExecutor") RetryExecutor retryExecutor,
                                     TransferProcessor transferProcessor,
                                     TransferClassifier classifier,
                                     ProductCatalog catalog,
                                     SubscriptionTrackerProperties properties,
                                     Clock clock) {
        this.clientFactory = clientFactory;
        this.circuitBreaker = circuitBreaker;
        this.retryExecutor = retryExecutor;
        this.transferProcessor = transferProcessor;
        this.classifier = classifier;
        this.catalog = catalog;
        this.window = properties.getBackfill().getWindow();
        this.historyLimit = properties.getBackfill().getHistoryLimit();
        this.clock = clock;
    }

    public BackfillResult backfill() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minus(window);
        BackfillResult result = BackfillResult.builder().startedAt(now).build();

        log.info("Searching for subscription payments to {} since {}", catalog.getPaymentAccounts(), cutoff);

        try (LedgerClient client = clientFactory.create()) {
            for (String account : catalog.getPaymentAccounts()) {
                scanAccount(client, account, now, cutoff, result);
            }
        }

        result.setCompletedAt(LocalDateTime.now(clock));
        log.info("Backfill completed: scanned={}, granted={}, alreadyActive={}, ignored={}, outOfWindow={}, lapsed={}, errors={}",
                result.getScanned(), result.getGranted(), result.getAlreadyActive(),
                result.getIgnored(), result.getOutOfWindow(), result.getLapsed(), result.getErrors());
        return result;
    }

    private void scanAccount(LedgerClient client, String account, LocalDateTime now, LocalDateTime cutoff,
                             BackfillResult result) {
        List<LedgerOperation> history;
        try {
            history = circuitBreaker.execute(() -> retryExecutor.execute(
                    () -> client.accountHistory(account, historyLimit)));
        } catch (RuntimeException e) {
            log.error("Error fetching history for {}: {}", account, e.getMessage());
            result.addError(account, null, e.getMessage());
            return;
        }

        log.info("Fetched {} historical operations for {}", history.size(), account);

        for (LedgerOperation operation : history) {
            result.incrementScanned();
            if (operation.getTimestamp() == null || operation.getTimestamp().isBefore(cutoff)) {
                result.incrementOutOfWindow();
                continue;
            }
            if (hasLapsed(operation, now)) {
                result.incrementLapsed();
                continue;
            }
            try {
                result.record(transferProcessor.process(operation));
            } catch (Exception e) {
                log.error("Error processing historical operation {} on {}: {}",
                        operation.getSequence(), account, e.getMessage());
                result.addError(account, operation.getSequence(), e.getMessage());
            }
        }
    }

    private boolean hasLapsed(LedgerOperation operation, LocalDateTime now) {
        Optional<SubscriptionMatch> match = classifier.classify(operation);
        if (match.isEmpty()) {
            return false;
        }
        LocalDateTime paidUntil = operation.getTimestamp().plusDays(match.get().getDays());
        if (paidUntil.isBefore(now)) {
            log.debug("Skipping payment {} from {}: its {} day period ended at {}",
                    operation.getSequence(), match.get().getUsername(), match.get().getDays(), paidUntil);
            return true;
        }
        return false;
    }
}
