package com.paywatch.oracle.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.paywatch.oracle.AmountMatcher;
import com.paywatch.oracle.ChainPaymentVerifier;
import com.paywatch.oracle.ChainType;
import com.paywatch.oracle.OracleException;
import com.paywatch.oracle.VerificationOracle;
import com.paywatch.oracle.VerificationResult;
import com.paywatch.oracle.config.OracleProperties;
import com.paywatch.oracle.rpc.JsonRpcGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Solana native transfer verification: recent signatures of the recipient newer than {@code since}, then the
 * recipient's lamport balance delta in each successful transaction. SPL tokens are not supported.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SolanaPaymentVerifier implements ChainPaymentVerifier {

    private static final int SCALE = 9;
    private static final String UNKNOWN_SENDER = "Unknown";

    private final JsonRpcGateway rpc;

    @Override
    public boolean supports(ChainType type) {
        return type == ChainType.SOLANA;
    }

    @Override
    public Optional<VerificationResult> verify(String chain, OracleProperties.ChainEntry config,
                                               String recipient, String amount, String asset, Instant since) {
        if (!VerificationOracle.NATIVE.equals(asset)) {
            throw new OracleException("SPL token " + asset + " verification is not supported on " + chain);
        }
        AmountMatcher matcher = new AmountMatcher(amount, config);
        long deadline = rpc.deadline();
        JsonNode signatures = rpc.call(chain, "getSignaturesForAddress",
                List.of(recipient, Map.of("limit", config.getSignatureLimit())), deadline);
        for (JsonNode sig : signatures) {
            Instant blockTime = sig.hasNonNull("blockTime") ? Instant.ofEpochSecond(sig.get("blockTime").asLong()) : null;
            if (since != null && blockTime != null && blockTime.isBefore(since)) {
                break;
            }
            if (sig.hasNonNull("err")) {
                continue;
            }
            String signature = sig.path("signature").asText();
            JsonNode tx = rpc.call(chain, "getTransaction", List.of(signature,
                    Map.of("commitment", "confirmed", "encoding", "json", "maxSupportedTransactionVersion", 0)), deadline);
            Optional<VerificationResult> match = matchTransaction(tx, signature, recipient, matcher, config.getDecimals(), blockTime);
            if (match.isPresent()) {
                return match;
            }
        }
        log.debug("No matching transfer to {} among {} signature(s) on {}", recipient, signatures.size(), chain);
        return Optional.empty();
    }

    private static Optional<VerificationResult> matchTransaction(JsonNode tx, String signature, String recipient,
                                                                AmountMatcher matcher, int decimals, Instant blockTime) {
        if (tx.isNull() || tx.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode meta = tx.path("meta");
        if (meta.isMissingNode() || meta.hasNonNull("err")) {
            return Optional.empty();
        }
        JsonNode accountKeys = tx.path("transaction").path("message").path("accountKeys");
        int index = -1;
        String sender = null;
        for (int i = 0; i < accountKeys.size(); i++) {
            String key = accountKeyAt(accountKeys, i);
            if (recipient.equals(key)) {
                index = i;
            } else if (sender == null) {
                sender = key;
            }
        }
        if (index < 0) {
            return Optional.empty();
        }
        long pre = meta.path("preBalances").path(index).asLong(0L);
        long post = meta.path("postBalances").path(index).asLong(0L);
        BigDecimal delta = BigDecimal.valueOf(post - pre).divide(BigDecimal.TEN.pow(decimals), SCALE, RoundingMode.HALF_UP);
        if (!matcher.matches(delta)) {
            return Optional.empty();
        }
        Instant timestamp = blockTime;
        if (timestamp == null && tx.hasNonNull("blockTime")) {
            timestamp = Instant.ofEpochSecond(tx.get("blockTime").asLong());
        }
        return Optional.of(new VerificationResult(true, signature,
                sender != null ? sender : UNKNOWN_SENDER, recipient,
                delta.stripTrailingZeros().toPlainString(), timestamp));
    }

    /** accountKeys are plain strings in json encoding and {pubkey: ...} objects in jsonParsed. */
    private static String accountKeyAt(JsonNode accountKeys, int i) {
        JsonNode key = accountKeys.get(i);
        return key.isObject() ? key.path("pubkey").asText(null) : key.asText(null);
    }
}
