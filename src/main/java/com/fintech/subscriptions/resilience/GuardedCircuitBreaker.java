package com.fintech.subscriptions.resilience;

import com.fintech.subscriptions.exception.CircuitOpenException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Circuit breaker around one external dependency (the ledger node or the database).
 * <p>
 * States:
 * - CLOSED: calls pass through; {@code failureThreshold} consecutive failures open the circuit
 * - OPEN: calls fail fast with {@link CircuitOpenException} until {@code resetTimeout} has
 * elapsed since the last failure
 * - After the timeout the next call is let through with counters reset. Its failure reopens
 * the circuit immediately, its success closes it.
 * <p>
 * Backed by a Resilience4j breaker configured with a count-based window of
 * {@code failureThreshold} calls and a 100% failure rate threshold.
 */
@Slf4j
public class GuardedCircuitBreaker {

    private final CircuitBreaker circuitBreaker;
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicReference<Instant> lastFailureTime = new AtomicReference<>();

    public GuardedCircuitBreaker(CircuitBreaker circuitBreaker, Clock clock) {
        this.circuitBreaker = circuitBreaker;

        circuitBreaker.getEventPublisher()
                .onError(event -> {
                    failureCount.incrementAndGet();
                    lastFailureTime.set(clock.instant());
                })
                .onSuccess(event -> failureCount.set(0))
                .onStateTransition(event -> onTransition(event.getStateTransition().getToState()));
    }

    /**
     * Creates a breaker in the given registry that opens after {@code failureThreshold}
     * consecutive failures and lets one call through after {@code resetTimeout}.
     */
    public static GuardedCircuitBreaker of(CircuitBreakerRegistry registry, String name,
                                           int failureThreshold, Duration resetTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1, got " + failureThreshold);
        }
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                // Slow calls are not failures here
                .slowCallRateThreshold(100)
                .slowCallDurationThreshold(Duration.ofDays(1))
                .waitDurationInOpenState(resetTimeout)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        return new GuardedCircuitBreaker(registry.circuitBreaker(name, config), clock);
    }

    /**
     * Runs the operation through the breaker.
     *
     * @throws CircuitOpenException if the circuit is open; the operation is not invoked
     */
    public <T> T execute(Supplier<T> operation) {
        try {
            return circuitBreaker.executeSupplier(operation);
        } catch (CallNotPermittedException e) {
            log.debug("Rejecting call, circuit breaker {} is open", getName());
            throw new CircuitOpenException(getName(), e);
        }
    }

    public CircuitBreakerSnapshot getState() {
        return CircuitBreakerSnapshot.builder()
                .name(getName())
                .open(circuitBreaker.getState() == CircuitBreaker.State.OPEN)
                .failureCount(failureCount.get())
                .lastFailureTime(lastFailureTime.get())
                .build();
    }

    public String getName() {
        return circuitBreaker.getName();
    }

    private void onTransition(CircuitBreaker.State toState) {
        switch (toState) {
            case OPEN -> log.warn("Circuit breaker {} opened after {} consecutive failures",
                    getName(), failureCount.get());
            case HALF_OPEN -> {
                failureCount.set(0);
                lastFailureTime.set(null);
                log.info("Circuit breaker {} reset timeout elapsed, allowing a trial call", getName());
            }
            case CLOSED -> log.info("Circuit breaker {} closed", getName());
            default -> log.debug("Circuit breaker {} moved to {}", getName(), toState);
        }
    }
}
