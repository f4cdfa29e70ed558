package com.fintech.subscriptions.controller;

import com.fintech.subscriptions.config.SubscriptionTrackerProperties;
import com.fintech.subscriptions.dto.SubscriptionCounts;
import com.fintech.subscriptions.entity.Subscription;
import com.fintech.subscriptions.service.ConnectionSupervisor;
import com.fintech.subscriptions.service.HeartbeatMonitor;
import com.fintech.subscriptions.service.SubscriptionLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health and status endpoints.
 * <p>
 * The health check reports healthy only when the database answers, an expiration sweep
 * succeeded recently and the ledger connection is up.
 */
@RestController
@RequestMapping("/api/v1/subscriptions")
@Slf4j
@Tag(name = "Subscriptions", description = "Subscription tracker health and status API")
public class SubscriptionStatusController {

    private final SubscriptionLedger ledger;
    private final ConnectionSupervisor supervisor;
    private final HeartbeatMonitor heartbeatMonitor;
    private final Duration heartbeatMaxAge;

    public SubscriptionStatusController(SubscriptionLedger ledger,
                                        ConnectionSupervisor supervisor,
                                        HeartbeatMonitor heartbeatMonitor,
                                        SubscriptionTrackerProperties properties) {
        this.ledger = ledger;
        this.supervisor = supervisor;
        this.heartbeatMonitor = heartbeatMonitor;
        this.heartbeatMaxAge = properties.getSweep().getHeartbeatMaxAge();
    }

    @Operation(
            summary = "Health check",
            description = "Returns 200 when the database is reachable, the last expiration sweep is recent and the ledger connection is up, 503 otherwise."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Service is healthy"),
            @ApiResponse(responseCode = "503", description = "Service is unhealthy")
    })
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        boolean databaseUp = isDatabaseUp();
        boolean sweepRecent = !heartbeatMonitor.isStale(heartbeatMaxAge);
        boolean ledgerConnected = supervisor.isConnected();
        boolean healthy = databaseUp && sweepRecent && ledgerConnected;

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", healthy ? "healthy" : "unhealthy");
        health.put("database", databaseUp ? "connected" : "disconnected");
        health.put("lastCheck", heartbeatMonitor.getLastHeartbeat().toString());
        health.put("ledger", ledgerConnected ? "connected" : "disconnected");

        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }

    @Operation(
            summary = "Service status",
            description = "Returns subscription counts, connection state and circuit breaker states."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status retrieved successfully"),
            @ApiResponse(responseCode = "500", description = "Status could not be retrieved")
    })
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        try {
            SubscriptionCounts counts = ledger.countSubscriptions();

            Map<String, Object> connection = new LinkedHashMap<>();
            connection.put("status", supervisor.getStatus().name());
            connection.put("reconnectAttempts", supervisor.getReconnectAttempts());
            connection.put("accounts", supervisor.getAccounts());

            Map<String, Object> status = new LinkedHashMap<>();
            status.put("subscriptions", Map.of(
                    "total", counts.getTotal(),
                    "active", counts.getActive()));
            status.put("ledger", connection);
            status.put("circuitBreakers", Map.of(
                    "network", supervisor.getCircuitBreakerState(),
                    "database", ledger.getCircuitBreakerState()));
            status.put("lastCheck", heartbeatMonitor.getLastHeartbeat().toString());
            return ResponseEntity.ok(status);
        } catch (RuntimeException e) {
            log.error("Status check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to get status", "message", String.valueOf(e.getMessage())));
        }
    }

    @Operation(
            summary = "Get subscription by username",
            description = "Returns the subscription record of a single user."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Subscription found",
                    content = @Content(schema = @Schema(implementation = Subscription.class))),
            @ApiResponse(responseCode = "404", description = "Subscription not found")
    })
    @GetMapping("/{username}")
    public ResponseEntity<Subscription> getSubscription(
            @Parameter(description = "Ledger account name") @PathVariable String username) {
        return ledger.findSubscription(username)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private boolean isDatabaseUp() {
        try {
            ledger.countSubscriptions();
            return true;
        } catch (RuntimeException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
