package com.paywatch.domain;

/**
 * Application event: a request left PENDING. Published only after the transition was persisted.
 */
public record PaymentRequestStatusChangedEvent(String requestId,
                                               PaymentRequestStatus previous,
                                               PaymentRequestStatus current) {
}
