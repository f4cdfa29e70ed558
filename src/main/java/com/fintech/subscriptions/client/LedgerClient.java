package com.fintech.subscriptions.client;

import java.util.List;

/**
 * Connection to the upstream ledger network.
 * <p>
 * A client is single-use: after an error or disconnect it is closed and replaced by a new
 * instance from {@link LedgerClientFactory}, never reconnected.
 */
public interface LedgerClient extends AutoCloseable {

    /**
     * Start position for a stream that begins at the account's newest operation.
     */
    long FROM_HEAD = Long.MIN_VALUE;

    /**
     * Establishes the connection.
     *
     * @throws com.fintech.subscriptions.exception.LedgerApiException if the node cannot be reached
     */
    void connect();

    /**
     * Opens a stream of operations on the given account.
     *
     * @param afterSequence the stream emits every operation with a higher sequence, or only
     *                      operations arriving from now on when {@link #FROM_HEAD}
     */
    OperationSubscription observe(String account, long afterSequence);

    /**
     * Fetches the most recent operations of an account, oldest first.
     *
     * @param limit maximum number of operations
     */
    List<LedgerOperation> accountHistory(String account, int limit);

    void setListener(ConnectionListener listener);

    @Override
    void close();

    /**
     * Asynchronous notifications raised by the client.
     */
    interface ConnectionListener {

        void onError(Throwable error);

        void onDisconnect();
    }
}
