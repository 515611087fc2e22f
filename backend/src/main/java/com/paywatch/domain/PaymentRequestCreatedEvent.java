package com.paywatch.domain;

/**
 * Application event: a payment request was created (persisted or held as a local fallback copy).
 * Consumed by {@link com.paywatch.monitoring.PaymentMonitorScheduler} to start monitoring.
 */
public record PaymentRequestCreatedEvent(String requestId) {
}
