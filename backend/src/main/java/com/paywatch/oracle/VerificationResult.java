package com.paywatch.oracle;

import java.time.Instant;

/**
 * One matching incoming transfer. Any field except {@code verified} may be null when the chain did not report it.
 */
public record VerificationResult(
        boolean verified,
        String txHash,
        String from,
        String to,
        String amount,
        Instant timestamp
) {

    /** Positive result that can be settled: verified with a transaction hash. */
    public boolean isMatch() {
        return verified && txHash != null && !txHash.isBlank();
    }
}
