package com.fintech.subscriptions.dto;

/**
 * What the transfer processor did with one ledger operation.
 */
public enum ProcessingOutcome {
    IGNORED,
    GRANTED,
    ALREADY_ACTIVE
}
