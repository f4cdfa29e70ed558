package com.fintech.subscriptions.exception;

/**
 * Base exception for subscription tracking errors.
 */
public class SubscriptionTrackerException extends RuntimeException {

    public SubscriptionTrackerException(String message) {
        super(message);
    }

    public SubscriptionTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
