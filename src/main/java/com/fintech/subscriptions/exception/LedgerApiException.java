package com.fintech.subscriptions.exception;

/**
 * Thrown when a call to the ledger API node fails.
 * This covers transport errors, timeouts, malformed responses and JSON-RPC error objects.
 */
public class LedgerApiException extends SubscriptionTrackerException {

    private final String nodeUrl;
    private final String method;

    public LedgerApiException(String message, String nodeUrl, String method) {
        super(message);
        this.nodeUrl = nodeUrl;
        this.method = method;
    }

    public LedgerApiException(String message, String nodeUrl, String method, Throwable cause) {
        super(message, cause);
        this.nodeUrl = nodeUrl;
        this.method = method;
    }

    public String getNodeUrl() {
        return nodeUrl;
    }

    /**
     * The JSON-RPC method that failed, e.g. {@code condenser_api.get_account_history}.
     */
    public String getMethod() {
        return method;
    }
}
