package com.fintech.subscriptions.exception;

/**
 * Raised when the upstream connection could not be re-established within the reconnect budget.
 * The process cannot recover from this on its own and has to be restarted.
 */
public class ReconnectionExhaustedException extends SubscriptionTrackerException {

    private final int attempts;

    public ReconnectionExhaustedException(int attempts, Throwable lastError) {
        super("Failed to maintain ledger connection after " + attempts + " reconnection attempts", lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
