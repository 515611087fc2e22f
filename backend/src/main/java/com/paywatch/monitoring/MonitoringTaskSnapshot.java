package com.paywatch.monitoring;

import java.time.Instant;

/**
 * Read-only view of an active monitoring task, for diagnostics.
 */
public record MonitoringTaskSnapshot(
        String requestId,
        Instant startedAt,
        Instant lastPollAt,
        long pollCount,
        long errorCount,
        int consecutiveErrors,
        boolean awaitingSettlement
) {
}
