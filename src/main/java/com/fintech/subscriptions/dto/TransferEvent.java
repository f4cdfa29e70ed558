package com.fintech.subscriptions.dto;

import com.fintech.subscriptions.client.AssetAmount;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A transfer normalized from a raw ledger operation. Only lives for one classification pass.
 */
@Value
@Builder
public class TransferEvent {

    String sender;

    String recipient;

    AssetAmount amount;

    String memo;

    LocalDateTime timestamp;

    public String getCurrencyCode() {
        return amount.getCurrencyCode();
    }
}
