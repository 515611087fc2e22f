package com.paywatch.lifecycle;

/**
 * Input of {@link PaymentRequestLifecycleService#createRequest}. {@code description} is optional.
 */
public record CreatePaymentRequestCommand(
        String amount,
        String currency,
        String chain,
        String recipient,
        String description
) {
}
