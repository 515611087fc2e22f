package com.paywatch.monitoring;

import com.paywatch.common.RetryPolicy;
import com.paywatch.domain.PaymentRequest;
import com.paywatch.domain.PaymentRequestCreatedEvent;
import com.paywatch.domain.PaymentRequestStatus;
import com.paywatch.domain.PaymentRequestStatusChangedEvent;
import com.paywatch.domain.PaymentTransaction;
import com.paywatch.domain.PaymentTransactionStatus;
import com.paywatch.ledger.TransactionLedger;
import com.paywatch.lifecycle.PaymentRequestLifecycleService;
import com.paywatch.monitoring.config.MonitoringConfig;
import com.paywatch.monitoring.config.MonitoringProperties;
import com.paywatch.oracle.VerificationOracle;
import com.paywatch.oracle.VerificationResult;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One fixed-delay polling task per PENDING payment request. Each iteration checks expiry first, then asks the
 * {@link VerificationOracle}; a match completes the request and records its transaction (the settlement).
 * <p>
 * At most one task exists per request: {@link #start} replaces an existing task atomically. Oracle failures only
 * bump counters; the next iteration is the retry. Settlement writes are retried through {@link RetryPolicy} and,
 * when still failing, redone by the next iteration before the oracle is asked again. This class never sets FAILED.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentMonitorScheduler {

    static final String UNKNOWN_SENDER = "Unknown";

    private final ConcurrentHashMap<String, MonitoringTask> tasks = new ConcurrentHashMap<>();

    private final PaymentRequestLifecycleService lifecycle;
    private final VerificationOracle oracle;
    private final TransactionLedger ledger;
    private final MonitoringProperties properties;
    private final Clock clock;
    @Qualifier(MonitoringConfig.MONITORING_SCHEDULER)
    private final TaskScheduler taskScheduler;
    @Qualifier(MonitoringConfig.CRITICAL_WRITE_RETRY)
    private final RetryPolicy criticalWrites;

    @EventListener
    public void onRequestCreated(PaymentRequestCreatedEvent event) {
        start(event.requestId());
    }

    @EventListener
    public void onStatusChanged(PaymentRequestStatusChangedEvent event) {
        if (event.current() == null || !event.current().isTerminal()) {
            return;
        }
        MonitoringTask task = tasks.get(event.requestId());
        if (task != null && task.hasPendingSettlement()) {
            // the task records the transaction and removes itself
            return;
        }
        stop(event.requestId());
    }

    /**
     * Starts monitoring a PENDING, unexpired request, replacing any task it already has. Never throws.
     */
    public void start(String requestId) {
        try {
            Optional<PaymentRequest> request = lifecycle.getRequest(requestId);
            if (request.isEmpty()) {
                log.warn("Not monitoring {}: request not found", requestId);
                return;
            }
            if (!request.get().isActiveAt(clock.instant())) {
                log.debug("Not monitoring {}: status {} expiresAt {}", requestId,
                        request.get().getStatus(), request.get().getExpiresAt());
                return;
            }
            schedule(requestId);
        } catch (RuntimeException e) {
            log.error("Failed to start monitoring for {}", requestId, e);
        }
    }

    /** Idempotent. */
    public void stop(String requestId) {
        MonitoringTask task = tasks.remove(requestId);
        if (task != null) {
            task.cancel();
            log.debug("Stopped monitoring {} after {} poll(s)", requestId, task.snapshot().pollCount());
        }
    }

    @PreDestroy
    public void stopAll() {
        int count = tasks.size();
        tasks.values().forEach(MonitoringTask::cancel);
        tasks.clear();
        if (count > 0) {
            log.info("Stopped {} monitoring task(s)", count);
        }
    }

    /**
     * Restart recovery: monitors every PENDING request still inside its window and expires the ones past it.
     * An overdue request whose EXPIRED write fails gets a task anyway; its first iteration retries the expiry.
     * Requests already monitored keep their task, so calling this twice changes nothing.
     *
     * @return number of tasks started
     */
    public int restoreActive(Collection<PaymentRequest> requests) {
        Instant now = clock.instant();
        int started = 0;
        int expired = 0;
        for (PaymentRequest request : requests) {
            if (request == null || !request.isPending()) {
                continue;
            }
            if (request.isExpiredAt(now) && expire(request.getId())) {
                expired++;
                continue;
            }
            if (tasks.containsKey(request.getId())) {
                continue;
            }
            try {
                schedule(request.getId());
                started++;
            } catch (RuntimeException e) {
                log.error("Failed to restore monitoring for {}", request.getId(), e);
            }
        }
        if (started > 0 || expired > 0) {
            log.info("Monitoring restored: {} task(s) started, {} overdue request(s) expired", started, expired);
        }
        return started;
    }

    public boolean isMonitoring(String requestId) {
        return tasks.containsKey(requestId);
    }

    /** Snapshots of the active tasks, oldest first. */
    public List<MonitoringTaskSnapshot> activeTasks() {
        return tasks.values().stream()
                .map(MonitoringTask::snapshot)
                .sorted(Comparator.comparing(MonitoringTaskSnapshot::startedAt))
                .toList();
    }

    private void schedule(String requestId) {
        Duration interval = properties.getPollInterval();
        tasks.compute(requestId, (id, existing) -> {
            if (existing != null) {
                existing.cancel();
                log.debug("Replacing monitoring task for {}", id);
            }
            MonitoringTask task = new MonitoringTask(id, clock.instant());
            Instant firstPoll = taskScheduler.getClock().instant().plus(interval);
            task.attach(taskScheduler.scheduleWithFixedDelay(() -> runIteration(task), firstPoll, interval));
            log.info("Monitoring payment request {} every {}s", id, interval.toSeconds());
            return task;
        });
    }

    private void runIteration(MonitoringTask task) {
        try {
            poll(task);
        } catch (RuntimeException e) {
            task.recordError();
            log.error("Unexpected failure polling {}", task.getRequestId(), e);
        }
    }

    /**
     * One iteration. Order matters: an unpersisted settlement of a completed request goes first, then the expiry
     * check, then a retried settlement, and only then the oracle.
     */
    void poll(MonitoringTask task) {
        if (task.isCancelled()) {
            return;
        }
        String requestId = task.getRequestId();
        task.recordPoll(clock.instant());

        Optional<PaymentRequest> current = lifecycle.getRequest(requestId);
        if (current.isEmpty()) {
            log.info("Payment request {} no longer exists, stopping monitoring", requestId);
            finish(task);
            return;
        }
        PaymentRequest request = current.get();
        if (request.getStatus() == PaymentRequestStatus.COMPLETED && task.hasPendingSettlement()) {
            if (settle(task, request, task.getPendingSettlement())) {
                finish(task);
            }
            return;
        }
        if (!request.isPending()) {
            log.debug("Payment request {} is {}, stopping monitoring", requestId, request.getStatus());
            finish(task);
            return;
        }
        if (request.isExpiredAt(clock.instant())) {
            log.info("Payment request {} expired at {}", requestId, request.getExpiresAt());
            if (expire(requestId)) {
                finish(task);
            }
            return;
        }
        if (task.hasPendingSettlement()) {
            if (settle(task, request, task.getPendingSettlement())) {
                finish(task);
            }
            return;
        }
        if (task.isCancelled()) {
            return;
        }

        Optional<VerificationResult> result;
        try {
            String asset = oracle.resolveAsset(request.getChain(), request.getCurrency());
            result = oracle.verify(request.getChain(), request.getRecipient(), request.getAmount(), asset,
                    request.getCreatedAt());
        } catch (RuntimeException e) {
            int consecutive = task.recordError();
            if (consecutive > properties.getErrorWarnThreshold()) {
                log.warn("Verification for {} still failing after {} consecutive attempts: {}",
                        requestId, consecutive, e.getMessage());
            } else {
                log.warn("Verification for {} failed (attempt {}): {}", requestId, consecutive, e.getMessage());
            }
            return;
        }
        task.recordSuccess();

        if (result.isEmpty() || !result.get().isMatch()) {
            lifecycle.recordLastChecked(requestId, clock.instant());
            return;
        }
        VerificationResult match = result.get();
        log.info("Payment detected for {}: txHash={} amount={}", requestId, match.txHash(), match.amount());
        task.setPendingSettlement(match);
        if (settle(task, request, match)) {
            finish(task);
        }
    }

    /**
     * Completes the request (conditional) and records its transaction (idempotent).
     *
     * @return true when the task is done with this request
     */
    private boolean settle(MonitoringTask task, PaymentRequest request, VerificationResult match) {
        String requestId = request.getId();
        try {
            if (request.isPending()) {
                boolean completed = criticalWrites.execute(
                        () -> lifecycle.transitionStatus(requestId, PaymentRequestStatus.COMPLETED));
                if (!completed) {
                    PaymentRequestStatus status = lifecycle.getRequest(requestId)
                            .map(PaymentRequest::getStatus)
                            .orElse(null);
                    if (status != PaymentRequestStatus.COMPLETED) {
                        log.info("Not settling {}: request is {}", requestId, status);
                        task.setPendingSettlement(null);
                        return true;
                    }
                }
            }
            PaymentTransaction recorded = criticalWrites.execute(() -> ledger.record(toTransaction(request, match)));
            task.setPendingSettlement(null);
            log.info("Payment request {} settled by transaction {}", requestId, recorded.getId());
            return true;
        } catch (RuntimeException e) {
            log.warn("Settlement of {} (txHash={}) failed, retrying next poll: {}",
                    requestId, match.txHash(), e.getMessage());
            return false;
        }
    }

    /**
     * @return true once the request has left PENDING, whoever moved it; false when the EXPIRED write failed and
     *         the request must stay monitored so the next iteration retries
     */
    private boolean expire(String requestId) {
        try {
            if (criticalWrites.execute(() -> lifecycle.transitionStatus(requestId, PaymentRequestStatus.EXPIRED))) {
                return true;
            }
            return lifecycle.getRequest(requestId).map(r -> !r.isPending()).orElse(true);
        } catch (RuntimeException e) {
            log.warn("Could not expire {}, retrying next poll: {}", requestId, e.getMessage());
            return false;
        }
    }

    private void finish(MonitoringTask task) {
        task.cancel();
        tasks.remove(task.getRequestId(), task);
    }

    private PaymentTransaction toTransaction(PaymentRequest request, VerificationResult match) {
        PaymentTransaction tx = new PaymentTransaction();
        tx.setRequestId(request.getId());
        tx.setTxHash(match.txHash());
        tx.setAmount(match.amount() != null ? match.amount() : request.getAmount());
        tx.setCurrency(request.getCurrency());
        tx.setChain(request.getChain());
        tx.setFrom(match.from() != null ? match.from() : UNKNOWN_SENDER);
        tx.setTo(match.to() != null ? match.to() : request.getRecipient());
        tx.setStatus(PaymentTransactionStatus.COMPLETED);
        tx.setDescription(request.getDescription());
        tx.setTimestamp(match.timestamp() != null ? match.timestamp() : clock.instant());
        return tx;
    }
}
