package com.paywatch.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Atomic updates for payment_requests that plain derived queries cannot express.
 */
public interface PaymentRequestRepositoryCustom {

    /**
     * Sets status and updatedAt only if the stored status is still PENDING.
     *
     * @return the updated request, or empty when the request is missing or already terminal
     */
    Optional<PaymentRequest> updateStatusIfPending(String id, PaymentRequestStatus status, Instant updatedAt);

    /**
     * Sets lastChecked without touching status or updatedAt.
     *
     * @return true if a document matched
     */
    boolean updateLastChecked(String id, Instant lastChecked);
}
