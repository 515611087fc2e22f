package com.paywatch.domain;

/**
 * Payment request state. PENDING is the only non-terminal state; a request leaves it exactly once.
 */
public enum PaymentRequestStatus {
    PENDING,
    COMPLETED,
    EXPIRED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Allowed transitions: PENDING → COMPLETED | EXPIRED | FAILED. Nothing leaves a terminal state.
     */
    public boolean canTransitionTo(PaymentRequestStatus target) {
        return this == PENDING && target != null && target != PENDING;
    }
}
