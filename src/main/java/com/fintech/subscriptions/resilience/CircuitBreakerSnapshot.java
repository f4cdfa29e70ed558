package com.fintech.subscriptions.resilience;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of a circuit breaker, exposed for status reporting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerSnapshot {

    private String name;

    private boolean open;

    /**
     * Consecutive failures since the last success or reset.
     */
    private int failureCount;

    /**
     * Null when no failure was recorded since the last reset.
     */
    private Instant lastFailureTime;
}
