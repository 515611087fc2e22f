package com.paywatch.monitoring;

import com.paywatch.oracle.VerificationResult;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polling loop state for one payment request. Iterations of one task never overlap (fixed delay), so the
 * counters only need visibility across pool threads, not mutual exclusion.
 */
class MonitoringTask {

    @Getter
    private final String requestId;
    @Getter
    private final Instant startedAt;
    private final AtomicLong pollCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicInteger consecutiveErrors = new AtomicInteger();
    private volatile Instant lastPollAt;
    private volatile boolean cancelled;
    private volatile ScheduledFuture<?> future;
    /** Match whose status transition or transaction record has not been persisted yet. */
    private volatile VerificationResult pendingSettlement;

    MonitoringTask(String requestId, Instant startedAt) {
        this.requestId = requestId;
        this.startedAt = startedAt;
    }

    void attach(ScheduledFuture<?> scheduled) {
        this.future = scheduled;
        if (cancelled) {
            scheduled.cancel(false);
        }
    }

    /** No further iterations start; one already running completes. */
    void cancel() {
        cancelled = true;
        ScheduledFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
    }

    boolean isCancelled() {
        return cancelled;
    }

    void recordPoll(Instant at) {
        lastPollAt = at;
        pollCount.incrementAndGet();
    }

    /** @return consecutive failures including this one */
    int recordError() {
        errorCount.incrementAndGet();
        return consecutiveErrors.incrementAndGet();
    }

    void recordSuccess() {
        consecutiveErrors.set(0);
    }

    VerificationResult getPendingSettlement() {
        return pendingSettlement;
    }

    void setPendingSettlement(VerificationResult result) {
        this.pendingSettlement = result;
    }

    boolean hasPendingSettlement() {
        return pendingSettlement != null;
    }

    MonitoringTaskSnapshot snapshot() {
        return new MonitoringTaskSnapshot(requestId, startedAt, lastPollAt, pollCount.get(), errorCount.get(),
                consecutiveErrors.get(), pendingSettlement != null);
    }
}
