package com.fintech.subscriptions.service;

import com.fintech.subscriptions.dto.GrantOutcome;
import com.fintech.subscriptions.dto.SubscriptionCounts;
import com.fintech.subscriptions.entity.Subscription;
import com.fintech.subscriptions.repository.SubscriptionRepository;
import com.fintech.subscriptions.resilience.CircuitBreakerSnapshot;
import com.fintech.subscriptions.resilience.GuardedCircuitBreaker;
import com.fintech.subscriptions.resilience.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Persistence of subscription windows.
 * <p>
 * Every database call goes through the database circuit breaker and retry executor.
 * Grants are idempotent: a payer with a running window is left untouched, so duplicate or
 * replayed deliveries of a payment cannot stack extra days.
 */
@Service
@Slf4j
public class SubscriptionLedger {

    static final int MAX_USERNAME_LENGTH = 16;

    private final SubscriptionRepository subscriptionRepository;
    private final TransactionTemplate transactionTemplate;
    private final GuardedCircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    public SubscriptionLedger(SubscriptionRepository subscriptionRepository,
                              TransactionTemplate transactionTemplate,
                              @Qualifier("databaseCircuitBreaker") GuardedCircuitBreaker circuitBreaker,
                              @Qualifier("databaseRetryExecutor") RetryExecutor retryExecutor,
                              Clock clock) {
        this.subscriptionRepository = subscriptionRepository;
        this.transactionTemplate = transactionTemplate;
        this.circuitBreaker = circuitBreaker;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    /**
     * Grants {@code days} of subscription starting now, unless the user's current window is
     * still running.
     *
     * @return GRANTED if a window was opened, ALREADY_ACTIVE if the running window was kept
     */
    public GrantOutcome grantSubscription(String username, int days) {
        validateUsername(username);
        if (days <= 0) {
            throw new IllegalArgumentException("Subscription days must be positive, got " + days);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiration = now.plusDays(days);

        int updated = guarded(() -> {
            try {
                return subscriptionRepository.grantIfLapsed(username, now, expiration);
            } catch (DataIntegrityViolationException e) {
                // A concurrent grant inserted the row first, so the user now has a running window
                log.info("Concurrent grant for {} already created a subscription", username);
                return 0;
            }
        });

        if (updated > 0) {
            log.info("Subscription processed for {}: {} to {}", username, now, expiration);
            return GrantOutcome.GRANTED;
        }
        log.info("No update needed for {}, current subscription is still active", username);
        return GrantOutcome.ALREADY_ACTIVE;
    }

    /**
     * Manual grant. A positive {@code days} sets the window to end {@code days} from now
     * unless it already ends later; zero revokes the subscription immediately.
     */
    public GrantOutcome grantTrial(String username, int days) {
        validateUsername(username);
        if (days < 0) {
            throw new IllegalArgumentException("Trial days must not be negative, got " + days);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (days == 0) {
            int revoked = guarded(() -> subscriptionRepository.revoke(username, now));
            if (revoked > 0) {
                log.info("Revoked subscription for {}", username);
                return GrantOutcome.REVOKED;
            }
            log.warn("No subscription to revoke for {}", username);
            return GrantOutcome.UNCHANGED;
        }

        LocalDateTime expiration = now.plusDays(days);
        int updated = guarded(() -> {
            try {
                return subscriptionRepository.extendUntil(username, now, expiration);
            } catch (DataIntegrityViolationException e) {
                log.info("Concurrent grant for {} already created a subscription", username);
                return 0;
            }
        });

        if (updated > 0) {
            log.info("Added {}-day trial for {}, expires {}", days, username, expiration);
            return GrantOutcome.GRANTED;
        }
        log.info("Trial for {} not applied, existing subscription ends later", username);
        return GrantOutcome.UNCHANGED;
    }

    /**
     * Clears the active flag of every lapsed subscription.
     *
     * @return the usernames that were deactivated
     */
    public List<String> deactivateExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<String> deactivated = guarded(() -> transactionTemplate.execute(status -> {
            List<String> lapsed = subscriptionRepository.findLapsedActiveUsernames(now);
            if (lapsed.isEmpty()) {
                return Collections.<String>emptyList();
            }
            subscriptionRepository.deactivate(lapsed, now);
            return lapsed;
        }));
        return deactivated == null ? List.of() : deactivated;
    }

    public Optional<Subscription> findSubscription(String username) {
        return guarded(() -> subscriptionRepository.findById(username));
    }

    public SubscriptionCounts countSubscriptions() {
        return guarded(() -> new SubscriptionCounts(
                subscriptionRepository.count(),
                subscriptionRepository.countByActiveTrue()));
    }

    public CircuitBreakerSnapshot getCircuitBreakerState() {
        return circuitBreaker.getState();
    }

    private <T> T guarded(Callable<T> operation) {
        return circuitBreaker.execute(() -> retryExecutor.execute(operation));
    }

    private static void validateUsername(String username) {
        if (username == null || username.isEmpty() || username.length() > MAX_USERNAME_LENGTH) {
            throw new IllegalArgumentException("Invalid username '" + username
                    + "'. Must be between 1 and " + MAX_USERNAME_LENGTH + " characters.");
        }
    }
}
