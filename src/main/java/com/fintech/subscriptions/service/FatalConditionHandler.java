package com.fintech.subscriptions.service;

/**
 * Receives conditions the service cannot recover from, such as an exhausted reconnect budget.
 */
@FunctionalInterface
public interface FatalConditionHandler {

    void onFatal(Throwable error);
}
