package com.fintech.subscriptions.client;

/**
 * Unbounded stream of operations for one account.
 * <p>
 * A subscription ends with exactly one ERROR or COMPLETED event and cannot be restarted;
 * a new one has to be opened through {@link LedgerClient#observe(String, long)}.
 */
public interface OperationSubscription {

    String getAccount();

    /**
     * Sequence the stream emits after, or {@link LedgerClient#FROM_HEAD} while it has not been
     * positioned yet.
     */
    long getStartSequence();

    /**
     * Blocks until the next event is available.
     */
    StreamEvent take() throws InterruptedException;

    /**
     * Stops delivery. A consumer blocked in {@link #take()} is woken up and must then
     * check {@link #isCancelled()}.
     */
    void cancel();

    boolean isCancelled();
}
