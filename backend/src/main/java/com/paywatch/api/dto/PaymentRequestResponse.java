package com.paywatch.api.dto;

import com.paywatch.domain.PaymentRequest;
import com.paywatch.domain.PaymentRequestStatus;

import java.time.Instant;

/**
 * Payment request as returned by the API. {@code status} is the effective status: a PENDING request past
 * {@code expiresAt} is reported EXPIRED before the monitor or the sweep has persisted it.
 */
public record PaymentRequestResponse(
        String id,
        String amount,
        String currency,
        String chain,
        String recipient,
        String description,
        String status,
        boolean expired,
        Instant createdAt,
        Instant expiresAt,
        Instant lastChecked,
        Instant updatedAt
) {

    public static PaymentRequestResponse from(PaymentRequest r, Instant now) {
        boolean expired = r.isExpiredAt(now);
        PaymentRequestStatus effective = r.isPending() && expired ? PaymentRequestStatus.EXPIRED : r.getStatus();
        return new PaymentRequestResponse(
                r.getId(),
                r.getAmount(),
                r.getCurrency(),
                r.getChain(),
                r.getRecipient(),
                r.getDescription(),
                effective != null ? effective.name() : null,
                expired,
                r.getCreatedAt(),
                r.getExpiresAt(),
                r.getLastChecked(),
                r.getUpdatedAt());
    }
}
