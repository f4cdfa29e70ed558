package com.fintech.subscriptions.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the subscription tracker, bound from the {@code subscriptions} prefix
 * in application.yml.
 */
@ConfigurationProperties(prefix = "subscriptions")
@NoArgsConstructor
@Getter
@Setter
public class SubscriptionTrackerProperties {

    /** Currency code every qualifying payment must settle in. */
    private String settlementCurrency = "HBD";

    private List<Product> products = new ArrayList<>();

    private final Node node = new Node();

    private final Monitor monitor = new Monitor();

    private final Sweep sweep = new Sweep();

    private final Backfill backfill = new Backfill();

    private final Resilience resilience = new Resilience();

    /**
     * A purchasable subscription. A transfer qualifies when it reaches {@code account} with
     * exactly {@code amount} and, if {@code memoAccount} is set, the memo
     * {@code subscribe:<memoAccount>}.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Product {

        private String name;

        /** Payment-receiving account. */
        private String account;

        private BigDecimal amount;

        private String memoAccount;

        private int days = 31;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Node {

        /** Base URL of the JSON-RPC API node. */
        private String url = "https://api.hive.blog";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(30);

        private Duration pollInterval = Duration.ofSeconds(3);

        /** Operations requested per stream poll. */
        private int historyBatchSize = 100;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Monitor {

        private boolean enabled = true;

        private int maxReconnectAttempts = 5;

        private Duration reconnectDelay = Duration.ofSeconds(5);

        private long stateReportIntervalMs = 60_000L;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Sweep {

        private Duration interval = Duration.ofHours(1);

        /** The service reports unhealthy when no sweep succeeded for this long. */
        private Duration heartbeatMaxAge = Duration.ofHours(2);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Backfill {

        private boolean enabled = true;

        private Duration window = Duration.ofDays(31);

        private int historyLimit = 1000;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Resilience {

        private final Breaker network = new Breaker(3, Duration.ofSeconds(60));

        private final Breaker database = new Breaker(5, Duration.ofSeconds(30));

        private final Retry networkRetry = new Retry(5, Duration.ofSeconds(5), 1.5);

        private final Retry databaseRetry = new Retry(3, Duration.ofSeconds(1), 2.0);

        private final Retry processingRetry = new Retry(3, Duration.ofSeconds(1), 2.0);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Breaker {

        private int failureThreshold;

        private Duration resetTimeout;

        Breaker(int failureThreshold, Duration resetTimeout) {
            this.failureThreshold = failureThreshold;
            this.resetTimeout = resetTimeout;
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        private int maxAttempts;

        private Duration initialDelay;

        private double backoffFactor;

        Retry(int maxAttempts, Duration initialDelay, double backoffFactor) {
            this.maxAttempts = maxAttempts;
            this.initialDelay = initialDelay;
            this.backoffFactor = backoffFactor;
        }
    }
}
