package com.fintech.subscriptions.client;

@FunctionalInterface
public interface LedgerClientFactory {

    /**
     * Creates a new, not yet connected client.
     */
    LedgerClient create();
}
