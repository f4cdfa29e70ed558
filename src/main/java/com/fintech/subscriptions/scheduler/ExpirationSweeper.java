package com.fintech.subscriptions.scheduler;

import com.fintech.subscriptions.config.SubscriptionTrackerProperties;
import com.fintech.subscriptions.service.HeartbeatMonitor;
import com.fintech.subscriptions.service.SubscriptionLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically deactivates lapsed subscriptions and bumps the liveness heartbeat.
 * <p>
 * The first sweep runs as soon as the sweeper is started, then every {@code interval}.
 * A failed sweep is logged and leaves the heartbeat untouched, so repeated failures
 * eventually turn the health check unhealthy.
 */
@Component
@Slf4j
public class ExpirationSweeper {

    private final SubscriptionLedger ledger;
    private final HeartbeatMonitor heartbeatMonitor;
    private final TaskScheduler taskScheduler;
    private final Duration interval;
    private final MeterRegistry meterRegistry;

    private Counter deactivatedCounter;
    private Counter failedSweepCounter;

    private ScheduledFuture<?> scheduledSweep;

    public ExpirationSweeper(SubscriptionLedger ledger,
                             HeartbeatMonitor heartbeatMonitor,
                             TaskScheduler taskScheduler,
                             SubscriptionTrackerProperties properties,
                             MeterRegistry meterRegistry) {
        this.ledger = ledger;
        this.heartbeatMonitor = heartbeatMonitor;
        this.taskScheduler = taskScheduler;
        this.interval = properties.getSweep().getInterval();
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        deactivatedCounter = Counter.builder("subscriptions.sweep.deactivated")
                .description("Subscriptions deactivated after their window lapsed")
                .register(meterRegistry);

        failedSweepCounter = Counter.builder("subscriptions.sweep.failures")
                .description("Expiration sweeps that failed")
                .register(meterRegistry);
    }

    public synchronized void start() {
        if (scheduledSweep != null) {
            return;
        }
        scheduledSweep = taskScheduler.scheduleAtFixedRate(this::runSweep, interval);
        log.info("Expiration sweep scheduled every {}", interval);
    }

    public void runSweep() {
        try {
            List<String> deactivated = ledger.deactivateExpired();
            if (!deactivated.isEmpty()) {
                deactivatedCounter.increment(deactivated.size());
                log.info("Deactivated {} expired subscriptions: {}", deactivated.size(), deactivated);
            } else {
                log.debug("No expired subscriptions");
            }
            heartbeatMonitor.notifyHeartbeat();
        } catch (Exception e) {
            failedSweepCounter.increment();
            log.error("Error checking expired subscriptions: {}", e.getMessage(), e);
        }
    }

    public synchronized void cancel() {
        if (scheduledSweep != null) {
            scheduledSweep.cancel(false);
            scheduledSweep = null;
            log.info("Expiration sweep cancelled");
        }
    }

    public synchronized boolean isScheduled() {
        return scheduledSweep != null;
    }
}
