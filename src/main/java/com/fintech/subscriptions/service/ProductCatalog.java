package com.fintech.subscriptions.service;

import com.fintech.subscriptions.config.SubscriptionTrackerProperties;
import com.fintech.subscriptions.config.SubscriptionTrackerProperties.Product;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * The configured subscription products and the payment accounts they are paid to.
 */
@Component
@Slf4j
public class ProductCatalog {

    private final String settlementCurrency;
    private final List<Product> products;
    private final List<String> paymentAccounts;

    public ProductCatalog(SubscriptionTrackerProperties properties) {
        this.settlementCurrency = properties.getSettlementCurrency();
        this.products = List.copyOf(properties.getProducts());

        if (products.isEmpty()) {
            throw new IllegalStateException("No subscription products configured");
        }
        for (Product product : products) {
            validate(product);
        }

        this.paymentAccounts = products.stream()
                .map(Product::getAccount)
                .distinct()
                .toList();

        log.info("Loaded {} subscription products paid in {} to accounts {}",
                products.size(), settlementCurrency, paymentAccounts);
    }

    private static void validate(Product product) {
        if (product.getAccount() == null || product.getAccount().isBlank()) {
            throw new IllegalStateException("Product " + product.getName() + " has no payment account");
        }
        if (product.getAmount() == null || product.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalStateException("Product " + product.getName() + " needs a positive amount");
        }
        if (product.getDays() <= 0) {
            throw new IllegalStateException("Product " + product.getName() + " needs a positive number of days");
        }
    }

    public List<Product> getProducts() {
        return products;
    }

    /**
     * Distinct payment-receiving accounts, in configuration order. One stream is opened per account.
     */
    public List<String> getPaymentAccounts() {
        return paymentAccounts;
    }

    public boolean isPaymentAccount(String account) {
        return paymentAccounts.contains(account);
    }

    public String getSettlementCurrency() {
        return settlementCurrency;
    }
}
