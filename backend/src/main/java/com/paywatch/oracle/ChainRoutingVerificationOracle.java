package com.paywatch.oracle;

import com.paywatch.oracle.config.OracleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Oracle entry point: resolves the chain's configuration and dispatches to the verifier for its {@link ChainType}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChainRoutingVerificationOracle implements VerificationOracle {

    private final OracleProperties properties;
    private final List<ChainPaymentVerifier> verifiers;

    @Override
    public Optional<VerificationResult> verify(String chain, String recipient, String amount, String asset, Instant since) {
        OracleProperties.ChainEntry config = chainConfig(chain);
        ChainPaymentVerifier verifier = verifiers.stream()
                .filter(v -> v.supports(config.getType()))
                .findFirst()
                .orElseThrow(() -> new OracleException("No verifier for chain type " + config.getType()));
        log.debug("Verifying {} {} to {} on {} since {}", amount, asset, recipient, chain, since);
        return verifier.verify(normalize(chain), config, recipient, amount, asset, since);
    }

    @Override
    public String resolveAsset(String chain, String currency) {
        if (currency == null || currency.isBlank() || NATIVE.equalsIgnoreCase(currency)) {
            return NATIVE;
        }
        OracleProperties.ChainEntry config = properties.getChains().get(normalize(chain));
        if (config != null && currency.equalsIgnoreCase(config.getNativeCurrency())) {
            return NATIVE;
        }
        return currency;
    }

    private OracleProperties.ChainEntry chainConfig(String chain) {
        OracleProperties.ChainEntry config = chain != null ? properties.getChains().get(normalize(chain)) : null;
        if (config == null) {
            throw new OracleException("Unsupported chain: " + chain);
        }
        return config;
    }

    private static String normalize(String chain) {
        return chain == null ? null : chain.trim().toLowerCase(Locale.ROOT);
    }
}
