package com.paywatch.api.dto;

import com.paywatch.domain.PaymentRequestStatus;
import jakarta.validation.constraints.NotNull;

/**
 * PUT /api/v1/requests/{id}/status body.
 */
public record StatusUpdateBody(
        @NotNull(message = "INVALID_STATUS")
        PaymentRequestStatus status
) {
}
