package com.paywatch.lifecycle;

import com.paywatch.config.CaffeineConfig;
import com.paywatch.domain.PaymentRequest;
import com.paywatch.domain.PaymentRequestCreatedEvent;
import com.paywatch.domain.PaymentRequestStatus;
import com.paywatch.domain.PaymentRequestStatusChangedEvent;
import com.paywatch.store.PaymentStore;
import com.paywatch.store.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the payment request state machine: PENDING → COMPLETED | EXPIRED | FAILED, each request leaving PENDING
 * exactly once. The store is authoritative; {@link CaffeineConfig#PAYMENT_REQUEST_CACHE} keeps a local copy
 * used when the store is unavailable and re-persisted once it is back.
 * <p>
 * Monitoring is driven by the events published here ({@link PaymentRequestCreatedEvent},
 * {@link PaymentRequestStatusChangedEvent}); this service never calls the scheduler directly.
 */
@Service
@Slf4j
public class PaymentRequestLifecycleService {

    static final String ID_PREFIX = "req_";
    static final String DEFAULT_DESCRIPTION = "Payment request";

    private final PaymentStore store;
    private final Cache requestCache;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PaymentRequestLifecycleService(PaymentStore store,
                                          CacheManager cacheManager,
                                          ApplicationEventPublisher eventPublisher,
                                          Clock clock) {
        this.store = store;
        this.requestCache = Objects.requireNonNull(cacheManager.getCache(CaffeineConfig.PAYMENT_REQUEST_CACHE),
                "cache " + CaffeineConfig.PAYMENT_REQUEST_CACHE + " not configured");
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Creates a PENDING request valid for one hour and starts monitoring it. A store failure does not fail the call:
     * the request is kept locally and persisted on a later read.
     *
     * @throws PaymentRequestException INVALID_REQUEST when a required field is missing or the amount is not positive
     */
    public PaymentRequest createRequest(CreatePaymentRequestCommand command) {
        validate(command);
        String description = command.description() == null || command.description().isBlank()
                ? DEFAULT_DESCRIPTION : command.description().trim();
        PaymentRequest request = PaymentRequest.newPending(
                ID_PREFIX + UUID.randomUUID(),
                new BigDecimal(command.amount().trim()).toPlainString(),
                command.currency().trim(),
                command.chain().trim().toLowerCase(Locale.ROOT),
                command.recipient().trim(),
                description,
                clock.instant());
        PaymentRequest result = request;
        try {
            result = store.createRequest(request);
        } catch (StoreException e) {
            log.warn("Could not persist payment request {}, keeping local copy: {}", request.getId(), e.getMessage());
        }
        remember(result);
        log.info("Created payment request {}: {} {} on {} to {}, expires {}",
                result.getId(), result.getAmount(), result.getCurrency(), result.getChain(),
                result.getRecipient(), result.getExpiresAt());
        eventPublisher.publishEvent(new PaymentRequestCreatedEvent(result.getId()));
        return result;
    }

    /**
     * Moves a PENDING request to {@code target} with a conditional write, so concurrent callers cannot both win.
     *
     * @return false when the request is missing, already terminal, or the transition is not allowed
     * @throws StoreException when the store is unavailable; the caller decides whether to retry
     */
    public boolean transitionStatus(String id, PaymentRequestStatus target) {
        Optional<PaymentRequest> current = store.findRequest(id);
        if (current.isEmpty()) {
            current = reconcile(id);
        }
        if (current.isEmpty()) {
            log.debug("Refusing transition of {} to {}: request not found", id, target);
            return false;
        }
        PaymentRequestStatus previous = current.get().getStatus();
        if (previous == null || !previous.canTransitionTo(target)) {
            log.debug("Refusing transition of {} from {} to {}", id, previous, target);
            return false;
        }
        Optional<PaymentRequest> updated = store.updateStatusIfPending(id, target, clock.instant());
        if (updated.isEmpty()) {
            log.debug("Transition of {} to {} lost to a concurrent update", id, target);
            return false;
        }
        remember(updated.get());
        log.info("Payment request {} moved {} -> {}", id, previous, target);
        eventPublisher.publishEvent(new PaymentRequestStatusChangedEvent(id, previous, target));
        return true;
    }

    /**
     * Store first, local copy when the store is unavailable. A request only known locally is re-persisted.
     */
    public Optional<PaymentRequest> getRequest(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        Optional<PaymentRequest> stored;
        try {
            stored = store.findRequest(id);
        } catch (StoreException e) {
            log.warn("Store unavailable reading request {}, using local copy: {}", id, e.getMessage());
            return cached(id);
        }
        if (stored.isPresent()) {
            remember(stored.get());
            return stored;
        }
        return reconcile(id);
    }

    /**
     * @throws PaymentRequestException REQUEST_NOT_FOUND
     */
    public PaymentRequest requireRequest(String id) {
        return getRequest(id).orElseThrow(() -> new PaymentRequestException(
                PaymentRequestException.REQUEST_NOT_FOUND, "Payment request not found: " + id));
    }

    /** All requests, newest first. */
    public List<PaymentRequest> listRequests() {
        return store.listRequests();
    }

    /** Best-effort; failures are logged and dropped. */
    public void recordLastChecked(String id, Instant checkedAt) {
        cached(id).ifPresent(r -> {
            r.setLastChecked(checkedAt);
            remember(r);
        });
        try {
            if (!store.updateLastChecked(id, checkedAt)) {
                log.debug("lastChecked not updated for {}: no stored request", id);
            }
        } catch (StoreException e) {
            log.debug("lastChecked update failed for {}: {}", id, e.getMessage());
        }
    }

    /**
     * Transitions every PENDING request whose window has closed to EXPIRED.
     *
     * @return number of requests expired by this call
     */
    public int expireOverdueRequests() {
        List<PaymentRequest> overdue;
        try {
            overdue = store.listOverduePending(clock.instant());
        } catch (StoreException e) {
            log.warn("Expired request sweep skipped, store unavailable: {}", e.getMessage());
            return 0;
        }
        int expired = 0;
        for (PaymentRequest request : overdue) {
            try {
                if (transitionStatus(request.getId(), PaymentRequestStatus.EXPIRED)) {
                    expired++;
                }
            } catch (StoreException e) {
                log.warn("Could not expire request {}: {}", request.getId(), e.getMessage());
            }
        }
        return expired;
    }

    private Optional<PaymentRequest> reconcile(String id) {
        Optional<PaymentRequest> local = cached(id);
        if (local.isEmpty()) {
            return Optional.empty();
        }
        try {
            PaymentRequest persisted = store.createRequest(local.get().copy());
            log.info("Persisted locally kept payment request {}", id);
            remember(persisted);
            return Optional.of(persisted);
        } catch (DuplicateKeyException e) {
            log.debug("Request {} was persisted concurrently", id);
            Optional<PaymentRequest> stored = store.findRequest(id);
            stored.ifPresent(this::remember);
            return stored.isPresent() ? stored : local;
        } catch (StoreException e) {
            log.warn("Could not persist locally kept request {}: {}", id, e.getMessage());
            return local;
        }
    }

    private Optional<PaymentRequest> cached(String id) {
        PaymentRequest r = requestCache.get(id, PaymentRequest.class);
        return Optional.ofNullable(r).map(PaymentRequest::copy);
    }

    private void remember(PaymentRequest request) {
        requestCache.put(request.getId(), request.copy());
    }

    private static void validate(CreatePaymentRequestCommand command) {
        if (command == null) {
            throw invalid("Request body is required");
        }
        requireText(command.currency(), "currency");
        requireText(command.chain(), "chain");
        requireText(command.recipient(), "recipient");
        requireText(command.amount(), "amount");
        BigDecimal amount;
        try {
            amount = new BigDecimal(command.amount().trim());
        } catch (NumberFormatException e) {
            throw invalid("amount must be a decimal number");
        }
        if (amount.signum() <= 0) {
            throw invalid("amount must be positive");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw invalid(field + " is required");
        }
    }

    private static PaymentRequestException invalid(String message) {
        return new PaymentRequestException(PaymentRequestException.INVALID_REQUEST, message);
    }
}
