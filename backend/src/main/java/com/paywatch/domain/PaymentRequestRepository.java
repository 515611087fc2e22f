package com.paywatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for payment_requests. Conditional status updates live in {@link PaymentRequestRepositoryCustom}.
 */
public interface PaymentRequestRepository extends MongoRepository<PaymentRequest, String>, PaymentRequestRepositoryCustom {

    List<PaymentRequest> findAllByOrderByCreatedAtDesc();

    /** Pending requests whose expiry has passed (sweep). */
    List<PaymentRequest> findByStatusAndExpiresAtLessThanEqual(PaymentRequestStatus status, Instant cutoff);
}
