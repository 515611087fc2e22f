package com.paywatch.oracle.evm;

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
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * EVM verification over JSON-RPC. Native coin: walks back from head over {@code scanBlocks}, inspecting every
 * {@code blockStep}-th block with full transactions, stopping at blocks older than {@code since}. Tokens: ERC-20
 * Transfer logs to the recipient over the same window. A match needs a successful receipt (status 0x1).
 * Any failed call fails the whole verification; a partial scan is never reported as "no payment".
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvmPaymentVerifier implements ChainPaymentVerifier {

    static final String TRANSFER_TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";
    private static final int SCALE = 18;

    private final JsonRpcGateway rpc;

    @Override
    public boolean supports(ChainType type) {
        return type == ChainType.EVM;
    }

    @Override
    public Optional<VerificationResult> verify(String chain, OracleProperties.ChainEntry config,
                                               String recipient, String amount, String asset, Instant since) {
        AmountMatcher matcher = new AmountMatcher(amount, config);
        long deadline = rpc.deadline();
        long head = hexToLong(rpc.call(chain, "eth_blockNumber", List.of(), deadline).asText());
        long startBlock = Math.max(0L, head - config.getScanBlocks());
        if (VerificationOracle.NATIVE.equals(asset)) {
            return verifyNative(chain, config, recipient, matcher, since, head, startBlock, deadline);
        }
        OracleProperties.TokenEntry token = findToken(config, asset);
        if (token == null || token.getAddress() == null) {
            throw new OracleException("Token " + asset + " not supported on " + chain);
        }
        return verifyToken(chain, token, recipient, matcher, since, startBlock, deadline);
    }

    private Optional<VerificationResult> verifyNative(String chain, OracleProperties.ChainEntry config, String recipient,
                                                      AmountMatcher matcher, Instant since, long head, long startBlock,
                                                      long deadline) {
        int step = Math.max(1, config.getBlockStep());
        for (long blockNum = head; blockNum >= startBlock && blockNum > 0; blockNum -= step) {
            JsonNode block = rpc.call(chain, "eth_getBlockByNumber", List.of(toHex(blockNum), true), deadline);
            if (block.isNull() || block.isMissingNode()) {
                continue;
            }
            Instant blockTime = Instant.ofEpochSecond(hexToLong(block.path("timestamp").asText()));
            if (since != null && blockTime.isBefore(since)) {
                break;
            }
            for (JsonNode tx : block.path("transactions")) {
                if (!tx.isObject() || !recipient.equalsIgnoreCase(tx.path("to").asText(""))) {
                    continue;
                }
                BigDecimal value = hexToDecimal(tx.path("value").asText(), config.getDecimals());
                if (!matcher.matches(value)) {
                    continue;
                }
                String txHash = tx.path("hash").asText();
                if (isSuccessful(chain, txHash, deadline)) {
                    return Optional.of(new VerificationResult(true, txHash, tx.path("from").asText(null),
                            tx.path("to").asText(null), value.stripTrailingZeros().toPlainString(), blockTime));
                }
            }
        }
        log.debug("No native transfer to {} in blocks {}..{} on {}", recipient, startBlock, head, chain);
        return Optional.empty();
    }

    private Optional<VerificationResult> verifyToken(String chain, OracleProperties.TokenEntry token, String recipient,
                                                     AmountMatcher matcher, Instant since, long startBlock,
                                                     long deadline) {
        Map<String, Object> filter = new HashMap<>();
        filter.put("fromBlock", toHex(startBlock));
        filter.put("toBlock", "latest");
        filter.put("address", token.getAddress());
        filter.put("topics", Arrays.asList(TRANSFER_TOPIC, null, padAddressForTopic(recipient)));
        JsonNode logs = rpc.call(chain, "eth_getLogs", List.of(filter), deadline);
        Map<Long, Instant> blockTimes = new HashMap<>();
        for (JsonNode entry : logs) {
            long blockNumber = hexToLong(entry.path("blockNumber").asText());
            Instant blockTime = blockTimes.computeIfAbsent(blockNumber, n -> blockTimestamp(chain, n, deadline));
            if (since != null && blockTime != null && blockTime.isBefore(since)) {
                continue;
            }
            BigDecimal value = hexToDecimal(entry.path("data").asText(), token.getDecimals());
            if (!matcher.matches(value)) {
                continue;
            }
            String txHash = entry.path("transactionHash").asText();
            if (isSuccessful(chain, txHash, deadline)) {
                JsonNode topics = entry.path("topics");
                return Optional.of(new VerificationResult(true, txHash,
                        topicToAddress(topics.path(1).asText(null)),
                        topicToAddress(topics.path(2).asText(null)),
                        value.stripTrailingZeros().toPlainString(),
                        blockTime));
            }
        }
        return Optional.empty();
    }

    private Instant blockTimestamp(String chain, long blockNumber, long deadline) {
        JsonNode block = rpc.call(chain, "eth_getBlockByNumber", List.of(toHex(blockNumber), false), deadline);
        if (block.isNull() || block.isMissingNode()) {
            return null;
        }
        return Instant.ofEpochSecond(hexToLong(block.path("timestamp").asText()));
    }

    private boolean isSuccessful(String chain, String txHash, long deadline) {
        JsonNode receipt = rpc.call(chain, "eth_getTransactionReceipt", List.of(txHash), deadline);
        return "0x1".equalsIgnoreCase(receipt.path("status").asText(""));
    }

    private static OracleProperties.TokenEntry findToken(OracleProperties.ChainEntry config, String symbol) {
        OracleProperties.TokenEntry token = config.getTokens().get(symbol);
        if (token != null) {
            return token;
        }
        return config.getTokens().entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(symbol))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    static String padAddressForTopic(String address) {
        String hex = address.startsWith("0x") || address.startsWith("0X") ? address.substring(2) : address;
        return "0x" + "0".repeat(Math.max(0, 64 - hex.length())) + hex.toLowerCase(Locale.ROOT);
    }

    static String topicToAddress(String topic) {
        if (topic == null || topic.length() < 40) {
            return null;
        }
        return "0x" + topic.substring(topic.length() - 40);
    }

    static String toHex(long value) {
        return "0x" + Long.toHexString(value);
    }

    static long hexToLong(String hex) {
        try {
            return new BigInteger(strip(hex), 16).longValueExact();
        } catch (RuntimeException e) {
            throw new OracleException("Invalid hex quantity: " + hex, e);
        }
    }

    static BigDecimal hexToDecimal(String hex, int decimals) {
        String normalized = strip(hex);
        if (normalized.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigInteger raw;
        try {
            raw = new BigInteger(normalized, 16);
        } catch (NumberFormatException e) {
            throw new OracleException("Invalid hex value: " + hex, e);
        }
        return new BigDecimal(raw).divide(BigDecimal.TEN.pow(Math.max(0, decimals)), SCALE, RoundingMode.HALF_UP);
    }

    private static String strip(String hex) {
        if (hex == null) {
            return "";
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
