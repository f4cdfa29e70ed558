package com.fintech.subscriptions.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the results of a historical backfill scan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillResult {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int scanned = 0;

    @Builder.Default
    private int granted = 0;

    @Builder.Default
    private int alreadyActive = 0;

    @Builder.Default
    private int ignored = 0;

    /**
     * Operations older than the backfill window.
     */
    @Builder.Default
    private int outOfWindow = 0;

    /**
     * Qualifying payments whose paid period had already ended.
     */
    @Builder.Default
    private int lapsed = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<BackfillError> errorDetails = new ArrayList<>();

    /**
     * A failed account fetch ({@code sequence} is null) or a failed operation.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BackfillError {
        private String account;
        private Long sequence;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void record(ProcessingOutcome outcome) {
        switch (outcome) {
            case GRANTED -> granted++;
            case ALREADY_ACTIVE -> alreadyActive++;
            case IGNORED -> ignored++;
        }
    }

    public void incrementScanned() {
        this.scanned++;
    }

    public void incrementOutOfWindow() {
        this.outOfWindow++;
    }

    public void incrementLapsed() {
        this.lapsed++;
    }

    public void addError(String account, Long sequence, String errorMessage) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(BackfillError.builder()
                .account(account)
                .sequence(sequence)
                .errorMessage(errorMessage)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
