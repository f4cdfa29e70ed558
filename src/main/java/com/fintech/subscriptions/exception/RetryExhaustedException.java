package com.fintech.subscriptions.exception;

/**
 * Thrown when every attempt of a retried operation failed.
 * The cause is the error raised by the last attempt.
 */
public class RetryExhaustedException extends SubscriptionTrackerException {

    private final String operationName;
    private final int attempts;

    public RetryExhaustedException(String operationName, int attempts, Throwable lastError) {
        super(String.format("%s operation failed after %d attempts: %s",
                operationName, attempts, lastError == null ? "unknown error" : lastError.getMessage()), lastError);
        this.operationName = operationName;
        this.attempts = attempts;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getAttempts() {
        return attempts;
    }
}
