package com.fintech.subscriptions.dto;

/**
 * Result of a write to the subscription ledger.
 */
public enum GrantOutcome {
    /**
     * A new window was opened or an existing one extended.
     */
    GRANTED,

    /**
     * The payer still has a running window; nothing was written.
     * Duplicate deliveries of the same payment end here.
     */
    ALREADY_ACTIVE,

    /**
     * A manual grant did not change the existing window because it already ends later,
     * or a revocation found no record.
     */
    UNCHANGED,

    /**
     * The window was ended by a manual revocation.
     */
    REVOKED
}
