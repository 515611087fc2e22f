package com.paywatch.oracle;

import java.time.Instant;
import java.util.Optional;

/**
 * Answers "has {@code recipient} received {@code amount} of {@code asset} on {@code chain} since {@code since}".
 * Safe to call repeatedly; a single call never retries internally beyond its short per-call timeout.
 */
public interface VerificationOracle {

    /** Asset marker for the chain's native coin. */
    String NATIVE = "native";

    /**
     * @param asset token symbol, or {@link #NATIVE}
     * @return the first matching incoming transfer, or empty when none is visible yet
     * @throws OracleException on transport, timeout or decode failure
     */
    Optional<VerificationResult> verify(String chain, String recipient, String amount, String asset, Instant since);

    /**
     * Maps a request currency to the asset argument of {@link #verify}: {@link #NATIVE} for the chain's
     * native symbol, the symbol itself otherwise.
     */
    String resolveAsset(String chain, String currency);
}
