package com.paywatch.oracle.config;

import com.paywatch.oracle.ChainType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Verification oracle config. Per-chain entries keyed by lower-case chain id (ethereum, bnb, polygon, solana).
 * Documented defaults in application.yml.
 */
@ConfigurationProperties(prefix = "paywatch.oracle")
@NoArgsConstructor
@Getter
@Setter
public class OracleProperties {

    /** Upper bound for a single JSON-RPC call. Keeps one verification well inside the poll interval. */
    private Duration callTimeout = Duration.ofSeconds(5);

    /** Upper bound for all calls of one verification together. Must stay below the poll interval. */
    private Duration verificationTimeout = Duration.ofSeconds(15);

    /** RPC budget across all chains for this instance. */
    private int maxRequestsPerSecond = 25;

    /** How long a call may wait for a rate-limiter permit before failing. */
    private long limiterTimeoutMs = 2_000;

    /** Endpoint skipped for this long after a transport failure. */
    private long endpointCooldownMs = 30_000;

    private Map<String, ChainEntry> chains = new HashMap<>();

    public void setChains(Map<String, ChainEntry> chains) {
        this.chains = chains != null ? chains : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainEntry {

        private ChainType type = ChainType.EVM;
        private List<String> urls = new ArrayList<>();
        /** Native coin symbol; a request in this currency is verified as a native transfer. */
        private String nativeCurrency;
        private int decimals = 18;
        /** EVM: how many blocks back from head to search. */
        private long scanBlocks = 1_000;
        /** EVM native scan: inspect every n-th block. */
        private int blockStep = 10;
        /** Solana: max signatures fetched per verification. */
        private int signatureLimit = 1_000;
        /** Fraction of the requested amount a transfer may fall short by. */
        private double tolerancePercent = 0.01;
        private BigDecimal minTolerance = new BigDecimal("0.0001");
        /** Token symbol → contract. */
        private Map<String, TokenEntry> tokens = new HashMap<>();

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }

        public void setTokens(Map<String, TokenEntry> tokens) {
            this.tokens = tokens != null ? tokens : new HashMap<>();
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class TokenEntry {
        private String address;
        private int decimals = 18;
    }
}
