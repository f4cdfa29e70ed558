package com.fintech.subscriptions.client;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Subscription whose producer pushes events into an in-memory queue.
 * Once terminated (error, completion or cancel) further events are dropped.
 */
public class QueueBackedSubscription implements OperationSubscription {

    private final String account;
    private final BlockingQueue<StreamEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile boolean cancelled;
    private volatile long startSequence;

    public QueueBackedSubscription(String account) {
        this(account, LedgerClient.FROM_HEAD);
    }

    public QueueBackedSubscription(String account, long startSequence) {
        this.account = account;
        this.startSequence = startSequence;
    }

    @Override
    public String getAccount() {
        return account;
    }

    @Override
    public long getStartSequence() {
        return startSequence;
    }

    protected void setStartSequence(long startSequence) {
        this.startSequence = startSequence;
    }

    public boolean emit(LedgerOperation operation) {
        if (terminated.get()) {
            return false;
        }
        events.add(StreamEvent.operation(operation));
        return true;
    }

    public void fail(Throwable error) {
        if (terminated.compareAndSet(false, true)) {
            events.add(StreamEvent.error(error));
        }
    }

    public void complete() {
        if (terminated.compareAndSet(false, true)) {
            events.add(StreamEvent.completed());
        }
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    @Override
    public StreamEvent take() throws InterruptedException {
        return events.take();
    }

    @Override
    public void cancel() {
        cancelled = true;
        if (terminated.compareAndSet(false, true)) {
            events.add(StreamEvent.completed());
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }
}
