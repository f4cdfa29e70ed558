package com.fintech.subscriptions.client.hive;

import com.fintech.subscriptions.client.LedgerClient;
import com.fintech.subscriptions.client.LedgerOperation;
import com.fintech.subscriptions.client.QueueBackedSubscription;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Subscription fed by periodic account-history polls.
 * <p>
 * A subscription opened {@link LedgerClient#FROM_HEAD} uses its first batch only to position
 * the cursor at the newest sequence; history before that is the backfill's job. A subscription
 * resumed after a known sequence emits everything past it, starting with the first batch.
 * Every batch emits the operations past the cursor in sequence order.
 */
public class PollingOperationSubscription extends QueueBackedSubscription {

    private long cursor = -1;
    private boolean primed;
    private volatile ScheduledFuture<?> pollTask;

    public PollingOperationSubscription(String account) {
        this(account, LedgerClient.FROM_HEAD);
    }

    public PollingOperationSubscription(String account, long afterSequence) {
        super(account, afterSequence);
        if (afterSequence != LedgerClient.FROM_HEAD) {
            cursor = afterSequence;
            primed = true;
        }
    }

    /**
     * @return the number of operations emitted
     */
    public synchronized int offerBatch(List<LedgerOperation> batch) {
        if (!primed) {
            cursor = batch.stream().mapToLong(LedgerOperation::getSequence).max().orElse(-1);
            primed = true;
            setStartSequence(cursor);
            return 0;
        }

        int emitted = 0;
        List<LedgerOperation> ordered = batch.stream()
                .sorted(Comparator.comparingLong(LedgerOperation::getSequence))
                .toList();
        for (LedgerOperation operation : ordered) {
            if (operation.getSequence() > cursor) {
                if (emit(operation)) {
                    emitted++;
                }
                cursor = operation.getSequence();
            }
        }
        return emitted;
    }

    public synchronized long getCursor() {
        return cursor;
    }

    void setPollTask(ScheduledFuture<?> pollTask) {
        this.pollTask = pollTask;
    }

    void stopPolling() {
        ScheduledFuture<?> task = pollTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    @Override
    public void cancel() {
        super.cancel();
        stopPolling();
    }
}
