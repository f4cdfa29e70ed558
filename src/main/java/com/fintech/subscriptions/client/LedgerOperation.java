package com.fintech.subscriptions.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One operation from a monitored account's history, as delivered by the ledger node.
 */
@Value
@Builder
@AllArgsConstructor
public class LedgerOperation {

    /**
     * Position of the operation in the account history. Increases monotonically per account.
     */
    long sequence;

    String transactionId;

    long blockNumber;

    /**
     * Block time, UTC.
     */
    LocalDateTime timestamp;

    /**
     * Operation name without the {@code _operation} suffix, e.g. {@code transfer}.
     */
    String type;

    JsonNode body;

    public String text(String field) {
        JsonNode value = body == null ? null : body.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
