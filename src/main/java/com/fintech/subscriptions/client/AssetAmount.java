package com.fintech.subscriptions.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * An amount of a ledger asset.
 * <p>
 * Nodes return amounts either as a legacy string ({@code "5.000 HBD"}) or as an asset object
 * ({@code {"amount": "5000", "precision": 3, "nai": "@@000000013"}}); both parse to the same value.
 */
@Value
public class AssetAmount {

    private static final Map<String, String> NAI_SYMBOLS = Map.of(
            "@@000000013", "HBD",
            "@@000000021", "HIVE",
            "@@000000037", "VESTS"
    );

    BigDecimal value;

    String currencyCode;

    /**
     * @throws IllegalArgumentException if the node is neither format
     */
    public static AssetAmount parse(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing amount");
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        if (node.isObject() && node.hasNonNull("amount") && node.hasNonNull("nai")) {
            BigInteger units = new BigInteger(node.get("amount").asText());
            int precision = node.path("precision").asInt(0);
            String nai = node.get("nai").asText();
            return new AssetAmount(new BigDecimal(units, precision), NAI_SYMBOLS.getOrDefault(nai, nai));
        }
        throw new IllegalArgumentException("Unsupported amount format: " + node);
    }

    public static AssetAmount parse(String text) {
        String[] parts = text.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Unsupported amount format: " + text);
        }
        return new AssetAmount(new BigDecimal(parts[0]), parts[1]);
    }

    /**
     * Numeric equality regardless of scale, so 5 equals 5.000.
     */
    public boolean hasValue(BigDecimal expected) {
        return expected != null && value.compareTo(expected) == 0;
    }

    @Override
    public String toString() {
        return value.toPlainString() + " " + currencyCode;
    }
}
