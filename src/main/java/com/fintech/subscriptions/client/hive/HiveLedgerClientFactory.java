package com.fintech.subscriptions.client.hive;

import com.fintech.subscriptions.client.LedgerClient;
import com.fintech.subscriptions.client.LedgerClientFactory;
import com.fintech.subscriptions.config.SubscriptionTrackerProperties;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Builds a fresh {@link HiveLedgerClient}, with its own HTTP client, on every call.
 */
@Component
public class HiveLedgerClientFactory implements LedgerClientFactory {

    private final RestClient.Builder restClientBuilder;
    private final SubscriptionTrackerProperties properties;

    public HiveLedgerClientFactory(RestClient.Builder restClientBuilder, SubscriptionTrackerProperties properties) {
        this.restClientBuilder = restClientBuilder;
        this.properties = properties;
    }

    @Override
    public LedgerClient create() {
        SubscriptionTrackerProperties.Node node = properties.getNode();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) node.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) node.getReadTimeout().toMillis());

        RestClient restClient = restClientBuilder.clone()
                .requestFactory(requestFactory)
                .build();

        return new HiveLedgerClient(new HiveRpcClient(restClient, node.getUrl()),
                node.getPollInterval(), node.getHistoryBatchSize());
    }
}
