package com.fintech.subscriptions.client;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Signal read by a subscription consumer: an operation, or the terminal error/completion
 * of the subscription.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StreamEvent {

    public enum Kind {
        OPERATION,
        ERROR,
        COMPLETED
    }

    Kind kind;

    LedgerOperation operation;

    Throwable error;

    public static StreamEvent operation(LedgerOperation operation) {
        return new StreamEvent(Kind.OPERATION, operation, null);
    }

    public static StreamEvent error(Throwable error) {
        return new StreamEvent(Kind.ERROR, null, error);
    }

    public static StreamEvent completed() {
        return new StreamEvent(Kind.COMPLETED, null, null);
    }
}
