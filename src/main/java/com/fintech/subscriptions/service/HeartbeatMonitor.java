package com.fintech.subscriptions.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Liveness heartbeat, bumped after every successful expiration sweep.
 */
@Component
@Slf4j
public class HeartbeatMonitor {

    private final Clock clock;
    private final AtomicReference<Instant> lastHeartbeat;

    public HeartbeatMonitor(Clock clock) {
        this.clock = clock;
        this.lastHeartbeat = new AtomicReference<>(clock.instant());
    }

    public void notifyHeartbeat() {
        lastHeartbeat.set(clock.instant());
        log.debug("Heartbeat timestamp updated");
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat.get();
    }

    public boolean isStale(Duration maxAge) {
        return Duration.between(lastHeartbeat.get(), clock.instant()).compareTo(maxAge) > 0;
    }
}
