package com.fintech.subscriptions.scheduler;

import com.fintech.subscriptions.resilience.CircuitBreakerSnapshot;
import com.fintech.subscriptions.service.ConnectionSupervisor;
import com.fintech.subscriptions.service.ConnectionSupervisor.ConnectionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Logs the upstream connection state whenever it differs from the previous check.
 */
@Component
@ConditionalOnProperty(prefix = "subscriptions.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ConnectionStateReporter {

    private final ConnectionSupervisor supervisor;

    private ConnectionStatus lastStatus;
    private boolean lastBreakerOpen;

    public ConnectionStateReporter(ConnectionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Scheduled(fixedDelayString = "${subscriptions.monitor.state-report-interval-ms:60000}")
    public void reportState() {
        ConnectionStatus status = supervisor.getStatus();
        CircuitBreakerSnapshot breaker = supervisor.getCircuitBreakerState();

        if (status != lastStatus || breaker.isOpen() != lastBreakerOpen) {
            log.info("Ledger connection state: {}, circuit breaker {}, reconnect attempts {}",
                    status, breaker.isOpen() ? "OPEN" : "CLOSED", supervisor.getReconnectAttempts());
            lastStatus = status;
            lastBreakerOpen = breaker.isOpen();
        }
    }
}
