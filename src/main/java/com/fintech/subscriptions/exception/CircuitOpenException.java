package com.fintech.subscriptions.exception;

/**
 * Thrown instead of invoking a guarded operation while its circuit breaker is open.
 */
public class CircuitOpenException extends SubscriptionTrackerException {

    private final String circuitName;

    public CircuitOpenException(String circuitName, Throwable cause) {
        super("Circuit breaker is open for " + circuitName, cause);
        this.circuitName = circuitName;
    }

    public String getCircuitName() {
        return circuitName;
    }
}
