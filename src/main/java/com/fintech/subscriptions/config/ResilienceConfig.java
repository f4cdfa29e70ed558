package com.fintech.subscriptions.config;

import com.fintech.subscriptions.config.SubscriptionTrackerProperties.Breaker;
import com.fintech.subscriptions.config.SubscriptionTrackerProperties.Resilience;
import com.fintech.subscriptions.config.SubscriptionTrackerProperties.Retry;
import com.fintech.subscriptions.resilience.GuardedCircuitBreaker;
import com.fintech.subscriptions.resilience.RetryExecutor;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Circuit breakers and retry executors guarding the two external dependencies.
 * <p>
 * Calls are wrapped as breaker(retry(operation)): a whole retry sequence counts as one
 * call against the breaker, and an open breaker rejects without retrying.
 * <p>
 * Breaker states:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Dependency is failing, requests fail fast
 * - HALF_OPEN: Reset timeout elapsed, the next request is a trial
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    public GuardedCircuitBreaker networkCircuitBreaker(CircuitBreakerRegistry registry,
                                                       SubscriptionTrackerProperties properties,
                                                       Clock clock) {
        return breaker(registry, "ledger-network", properties.getResilience().getNetwork(), clock);
    }

    @Bean
    public GuardedCircuitBreaker databaseCircuitBreaker(CircuitBreakerRegistry registry,
                                                        SubscriptionTrackerProperties properties,
                                                        Clock clock) {
        return breaker(registry, "database", properties.getResilience().getDatabase(), clock);
    }

    @Bean
    public RetryExecutor networkRetryExecutor(SubscriptionTrackerProperties properties) {
        return retry("Ledger network", properties.getResilience().getNetworkRetry());
    }

    @Bean
    public RetryExecutor databaseRetryExecutor(SubscriptionTrackerProperties properties) {
        return retry("Database", properties.getResilience().getDatabaseRetry());
    }

    /**
     * Retries a qualifying payment's grant as a whole, on top of the database-level retry.
     */
    @Bean
    public RetryExecutor processingRetryExecutor(SubscriptionTrackerProperties properties) {
        Resilience resilience = properties.getResilience();
        return retry("Transfer processing", resilience.getProcessingRetry());
    }

    private static GuardedCircuitBreaker breaker(CircuitBreakerRegistry registry, String name,
                                                 Breaker settings, Clock clock) {
        return GuardedCircuitBreaker.of(registry, name,
                settings.getFailureThreshold(), settings.getResetTimeout(), clock);
    }

    private static RetryExecutor retry(String name, Retry settings) {
        return new RetryExecutor(name,
                settings.getMaxAttempts(), settings.getInitialDelay(), settings.getBackoffFactor());
    }
}
