package com.fintech.subscriptions.lifecycle;

import com.fintech.subscriptions.config.SubscriptionTrackerProperties;
import com.fintech.subscriptions.dto.BackfillResult;
import com.fintech.subscriptions.scheduler.ExpirationSweeper;
import com.fintech.subscriptions.service.ConnectionSupervisor;
import com.fintech.subscriptions.service.HistoricalBackfillService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts and stops the monitoring pipeline with the application context.
 * <p>
 * Startup: historical backfill, expiration sweeper, then live monitoring. A failure to
 * start monitoring aborts startup.
 * <p>
 * Shutdown runs before the web server stops and before the connection pool is closed by
 * the context: supervisor first, then the sweeper. Each step is attempted even if an
 * earlier one failed.
 */
@Component
@ConditionalOnProperty(prefix = "subscriptions.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SubscriptionTrackerLifecycle implements SmartLifecycle {

    private final ConnectionSupervisor supervisor;
    private final HistoricalBackfillService backfillService;
    private final ExpirationSweeper sweeper;
    private final boolean backfillEnabled;

    private volatile boolean running;

    public SubscriptionTrackerLifecycle(ConnectionSupervisor supervisor,
                                        HistoricalBackfillService backfillService,
                                        ExpirationSweeper sweeper,
                                        SubscriptionTrackerProperties properties) {
        this.supervisor = supervisor;
        this.backfillService = backfillService;
        this.sweeper = sweeper;
        this.backfillEnabled = properties.getBackfill().isEnabled();
    }

    @Override
    public void start() {
        log.info("Starting subscription monitor for accounts {}", supervisor.getAccounts());

        if (backfillEnabled) {
            try {
                BackfillResult result = backfillService.backfill();
                log.info("Historical backfill finished in {}ms with {} grants",
                        result.getDurationMs(), result.getGranted());
            } catch (RuntimeException e) {
                log.error("Historical backfill failed, continuing with live monitoring: {}", e.getMessage(), e);
            }
        }

        sweeper.start();
        supervisor.startMonitoring();
        running = true;
        log.info("Subscription monitor started");
    }

    @Override
    public void stop() {
        log.info("Shutting down subscription monitor...");
        try {
            supervisor.stop();
        } catch (RuntimeException e) {
            log.error("Error stopping ledger monitor: {}", e.getMessage(), e);
        }
        try {
            sweeper.cancel();
        } catch (RuntimeException e) {
            log.error("Error cancelling expiration sweep: {}", e.getMessage(), e);
        }
        running = false;
        log.info("Subscription monitor shutdown complete");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
