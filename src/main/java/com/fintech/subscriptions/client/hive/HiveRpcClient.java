package com.fintech.subscriptions.client.hive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.subscriptions.client.LedgerOperation;
import com.fintech.subscriptions.exception.LedgerApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 client for a Hive API node.
 */
@Slf4j
public class HiveRpcClient {

    static final String GET_DYNAMIC_GLOBAL_PROPERTIES = "condenser_api.get_dynamic_global_properties";
    static final String GET_ACCOUNT_HISTORY = "condenser_api.get_account_history";

    private static final String OPERATION_SUFFIX = "_operation";

    private final RestClient restClient;
    private final String nodeUrl;
    private final AtomicLong requestIds = new AtomicLong();

    public HiveRpcClient(RestClient restClient, String nodeUrl) {
        this.restClient = restClient;
        this.nodeUrl = nodeUrl;
    }

    /**
     * Sends one JSON-RPC request and returns its {@code result}.
     *
     * @throws LedgerApiException on transport failure, an empty response or a JSON-RPC error object
     */
    public JsonNode call(String method, List<?> params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("method", method);
        request.put("params", params);
        request.put("id", requestIds.incrementAndGet());

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(nodeUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new LedgerApiException("Request to ledger node failed: " + e.getMessage(), nodeUrl, method, e);
        }

        if (response == null) {
            throw new LedgerApiException("Empty response from ledger node", nodeUrl, method);
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new LedgerApiException("Ledger node returned error: " + error.path("message").asText(error.toString()),
                    nodeUrl, method);
        }
        JsonNode result = response.get("result");
        if (result == null || result.isNull()) {
            throw new LedgerApiException("Ledger node response has no result", nodeUrl, method);
        }
        return result;
    }

    public JsonNode getDynamicGlobalProperties() {
        return call(GET_DYNAMIC_GLOBAL_PROPERTIES, List.of());
    }

    /**
     * Returns up to {@code limit} of the latest operations of an account, ordered by sequence.
     */
    public List<LedgerOperation> getAccountHistory(String account, int limit) {
        JsonNode result = call(GET_ACCOUNT_HISTORY, List.of(account, -1, limit));
        if (!result.isArray()) {
            throw new LedgerApiException("Unexpected account history format", nodeUrl, GET_ACCOUNT_HISTORY);
        }

        List<LedgerOperation> operations = new ArrayList<>(result.size());
        for (JsonNode entry : result) {
            LedgerOperation operation = parseHistoryEntry(entry);
            if (operation != null) {
                operations.add(operation);
            }
        }
        operations.sort(Comparator.comparingLong(LedgerOperation::getSequence));
        return operations;
    }

    /**
     * Parses {@code [index, {trx_id, block, timestamp, op}]}. The op is either
     * {@code [type, body]} or {@code {"type": "..._operation", "value": body}}.
     * Returns null for entries that do not have this shape.
     */
    LedgerOperation parseHistoryEntry(JsonNode entry) {
        if (!entry.isArray() || entry.size() < 2) {
            log.debug("Skipping malformed history entry: {}", entry);
            return null;
        }
        JsonNode details = entry.get(1);
        JsonNode op = details.path("op");

        String type;
        JsonNode body;
        if (op.isArray() && op.size() == 2) {
            type = op.get(0).asText();
            body = op.get(1);
        } else if (op.isObject() && op.has("type")) {
            type = op.get("type").asText();
            body = op.path("value");
        } else {
            log.debug("Skipping history entry without operation: {}", entry);
            return null;
        }
        if (type.endsWith(OPERATION_SUFFIX)) {
            type = type.substring(0, type.length() - OPERATION_SUFFIX.length());
        }

        return LedgerOperation.builder()
                .sequence(entry.get(0).asLong())
                .transactionId(details.path("trx_id").asText(null))
                .blockNumber(details.path("block").asLong())
                .timestamp(parseTimestamp(details.path("timestamp").asText(null)))
                .type(type)
                .body(body)
                .build();
    }

    private LocalDateTime parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.endsWith("Z") ? value.substring(0, value.length() - 1) : value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable operation timestamp {}", value);
            return null;
        }
    }

    public String getNodeUrl() {
        return nodeUrl;
    }
}
