package com.fintech.subscriptions.dto;

import com.fintech.subscriptions.config.SubscriptionTrackerProperties.Product;
import lombok.Value;

/**
 * A transfer that qualifies for a product.
 */
@Value
public class SubscriptionMatch {

    TransferEvent transfer;

    Product product;

    public String getUsername() {
        return transfer.getSender();
    }

    public int getDays() {
        return product.getDays();
    }
}
