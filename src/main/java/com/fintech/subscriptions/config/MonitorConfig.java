package com.fintech.subscriptions.config;

import com.fintech.subscriptions.client.LedgerClientFactory;
import com.fintech.subscriptions.resilience.GuardedCircuitBreaker;
import com.fintech.subscriptions.resilience.RetryExecutor;
import com.fintech.subscriptions.service.ConnectionSupervisor;
import com.fintech.subscriptions.service.FatalConditionHandler;
import com.fintech.subscriptions.service.ProductCatalog;
import com.fintech.subscriptions.service.TransferProcessor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MonitorConfig {

    @Bean
    public ConnectionSupervisor connectionSupervisor(LedgerClientFactory clientFactory,
                                                     @Qualifier("networkCircuitBreaker") GuardedCircuitBreaker circuitBreaker,
                                                     @Qualifier("networkRetryExecutor") RetryExecutor retryExecutor,
                                                     TransferProcessor transferProcessor,
                                                     FatalConditionHandler fatalConditionHandler,
                                                     ProductCatalog catalog,
                                                     SubscriptionTrackerProperties properties) {
        SubscriptionTrackerProperties.Monitor monitor = properties.getMonitor();
        return new ConnectionSupervisor(clientFactory, circuitBreaker, retryExecutor, transferProcessor,
                fatalConditionHandler, catalog.getPaymentAccounts(),
                monitor.getMaxReconnectAttempts(), monitor.getReconnectDelay());
    }
}
