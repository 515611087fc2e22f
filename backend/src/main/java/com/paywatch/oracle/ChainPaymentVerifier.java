package com.paywatch.oracle;

import com.paywatch.oracle.config.OracleProperties;

import java.time.Instant;
import java.util.Optional;

/**
 * Chain-family specific verification. Selected by {@link ChainRoutingVerificationOracle} from the chain's {@link ChainType}.
 */
public interface ChainPaymentVerifier {

    boolean supports(ChainType type);

    Optional<VerificationResult> verify(String chain, OracleProperties.ChainEntry config,
                                        String recipient, String amount, String asset, Instant since);
}
