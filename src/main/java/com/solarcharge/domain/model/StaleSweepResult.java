package com.solarcharge.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Summary of one stale-session sweep. Per-session failures are collected here
 * instead of aborting the sweep.
 */
@Data
@Builder
public class StaleSweepResult {

    private String trigger;
    private LocalDateTime timestamp;
    private LocalDateTime cutoff;

    private int staleFound;
    private int completed;

    /** Sessions already completed by another path between the scan and the update. */
    private int alreadyClosed;

    @Builder.Default
    private List<SweepFailure> failures = new ArrayList<>();

    private long durationMs;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Data
    @Builder
    public static class SweepFailure {
        private String sessionId;
        private String reason;
    }
}
