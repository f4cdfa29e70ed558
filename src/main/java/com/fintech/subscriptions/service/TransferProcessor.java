package com.fintech.subscriptions.service;

import com.fintech.subscriptions.client.LedgerOperation;
import com.fintech.subscriptions.dto.GrantOutcome;
import com.fintech.subscriptions.dto.ProcessingOutcome;
import com.fintech.subscriptions.dto.SubscriptionMatch;
import com.fintech.subscriptions.resilience.RetryExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns qualifying transfers into subscription grants.
 * <p>
 * Classification runs once; only the grant is retried. Retrying a grant is always safe
 * because the ledger never extends a running window.
 */
@Service
@Slf4j
public class TransferProcessor {

    private final TransferClassifier classifier;
    private final SubscriptionLedger ledger;
    private final RetryExecutor retryExecutor;
    private final MeterRegistry meterRegistry;

    private Counter matchedCounter;
    private Counter grantedCounter;
    private Counter alreadyActiveCounter;
    private Counter ignoredCounter;

    public TransferProcessor(TransferClassifier classifier,
                             SubscriptionLedger ledger,
                             @Qualifier("processingRetryExecutor") RetryExecutor retryExecutor,
                             MeterRegistry meterRegistry) {
        this.classifier = classifier;
        this.ledger = ledger;
        this.retryExecutor = retryExecutor;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        matchedCounter = Counter.builder("subscriptions.transfers.matched")
                .description("Transfers that matched a subscription product")
                .register(meterRegistry);

        grantedCounter = Counter.builder("subscriptions.grants.granted")
                .description("Subscription windows opened by a payment")
                .register(meterRegistry);

        alreadyActiveCounter = Counter.builder("subscriptions.grants.already_active")
                .description("Payments received while the payer's window was still running")
                .register(meterRegistry);

        ignoredCounter = Counter.builder("subscriptions.operations.ignored")
                .description("Operations that are not qualifying subscription payments")
                .register(meterRegistry);
    }

    public ProcessingOutcome process(LedgerOperation operation) {
        Optional<SubscriptionMatch> classified = classifier.classify(operation);
        if (classified.isEmpty()) {
            ignoredCounter.increment();
            return ProcessingOutcome.IGNORED;
        }

        SubscriptionMatch match = classified.get();
        matchedCounter.increment();
        log.info("Subscription transfer detected: from {}, amount {}, product {}, memo '{}'",
                match.getUsername(), match.getTransfer().getAmount(),
                match.getProduct().getName(), match.getTransfer().getMemo());

        GrantOutcome outcome = retryExecutor.execute(
                () -> ledger.grantSubscription(match.getUsername(), match.getDays()));

        if (outcome == GrantOutcome.GRANTED) {
            grantedCounter.increment();
            log.info("Subscription processed successfully for {} at {}",
                    match.getUsername(), match.getTransfer().getTimestamp());
            return ProcessingOutcome.GRANTED;
        }
        alreadyActiveCounter.increment();
        return ProcessingOutcome.ALREADY_ACTIVE;
    }
}
