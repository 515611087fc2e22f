package com.paywatch.domain;

/**
 * Status of a recorded transfer. Verified request payments are always COMPLETED.
 */
public enum PaymentTransactionStatus {
    PENDING,
    COMPLETED,
    FAILED
}
