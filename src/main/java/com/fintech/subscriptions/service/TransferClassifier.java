package com.fintech.subscriptions.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.subscriptions.client.AssetAmount;
import com.fintech.subscriptions.client.LedgerOperation;
import com.fintech.subscriptions.config.SubscriptionTrackerProperties.Product;
import com.fintech.subscriptions.dto.SubscriptionMatch;
import com.fintech.subscriptions.dto.TransferEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a ledger operation is a qualifying subscription payment.
 * <p>
 * Filters, in order: transfer-shaped operation, configured payment account, settlement
 * currency, then the first product whose amount matches exactly and whose memo, if it
 * requires one, equals {@code subscribe:<account>} ignoring case. Anything else is not a
 * match; most operations on an account are unrelated to subscriptions.
 */
@Component
@Slf4j
public class TransferClassifier {

    static final Set<String> TRANSFER_TYPES = Set.of("transfer", "fill_recurrent_transfer");

    static final String MEMO_PREFIX = "subscribe:";

    private final ProductCatalog catalog;

    public TransferClassifier(ProductCatalog catalog) {
        this.catalog = catalog;
    }

    public Optional<SubscriptionMatch> classify(LedgerOperation operation) {
        if (!TRANSFER_TYPES.contains(operation.getType())) {
            return Optional.empty();
        }

        TransferEvent transfer;
        try {
            transfer = normalize(operation);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed {} operation {}: {}",
                    operation.getType(), operation.getSequence(), e.getMessage());
            return Optional.empty();
        }

        if (!catalog.isPaymentAccount(transfer.getRecipient())) {
            log.debug("Ignoring transfer {} to non-payment account {}", operation.getSequence(), transfer.getRecipient());
            return Optional.empty();
        }
        if (!catalog.getSettlementCurrency().equals(transfer.getCurrencyCode())) {
            log.debug("Ignoring transfer {} in {}", operation.getSequence(), transfer.getCurrencyCode());
            return Optional.empty();
        }

        Optional<SubscriptionMatch> match = catalog.getProducts().stream()
                .filter(product -> matches(product, transfer))
                .findFirst()
                .map(product -> new SubscriptionMatch(transfer, product));

        if (match.isEmpty()) {
            log.debug("Transfer {} from {} of {} with memo '{}' matches no product",
                    operation.getSequence(), transfer.getSender(), transfer.getAmount(), transfer.getMemo());
        }
        return match;
    }

    /**
     * @throws IllegalArgumentException if the operation lacks a sender, recipient or valid amount
     */
    public TransferEvent normalize(LedgerOperation operation) {
        String sender = operation.text("from");
        String recipient = operation.text("to");
        if (sender == null || recipient == null) {
            throw new IllegalArgumentException("Transfer without sender or recipient");
        }
        JsonNode body = operation.getBody();
        AssetAmount amount = AssetAmount.parse(body == null ? null : body.get("amount"));
        String memo = operation.text("memo");

        return TransferEvent.builder()
                .sender(sender)
                .recipient(recipient)
                .amount(amount)
                .memo(memo == null ? "" : memo)
                .timestamp(operation.getTimestamp())
                .build();
    }

    boolean matches(Product product, TransferEvent transfer) {
        if (!product.getAccount().equals(transfer.getRecipient())) {
            return false;
        }
        if (!transfer.getAmount().hasValue(product.getAmount())) {
            return false;
        }
        String expectedMemo = expectedMemo(product);
        return expectedMemo == null || expectedMemo.equalsIgnoreCase(transfer.getMemo());
    }

    static String expectedMemo(Product product) {
        String memoAccount = product.getMemoAccount();
        return memoAccount == null || memoAccount.isBlank() ? null : MEMO_PREFIX + memoAccount;
    }
}
