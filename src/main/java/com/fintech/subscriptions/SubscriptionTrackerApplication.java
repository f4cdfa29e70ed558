package com.fintech.subscriptions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Subscription Tracker
 * <p>
 * Watches payment-receiving accounts on the Hive ledger and turns qualifying transfers
 * into time-limited subscriptions.
 * <p>
 * Key Features:
 * - Real-time operation streams with automatic reconnect
 * - Circuit breakers and retry with exponential backoff around the ledger node and database
 * - Idempotent subscription grants
 * - Hourly expiration sweep with liveness heartbeat
 * - Startup backfill of recent account history
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class SubscriptionTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubscriptionTrackerApplication.class, args);
    }
}
