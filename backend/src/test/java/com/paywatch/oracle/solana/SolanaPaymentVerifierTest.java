package com.paywatch.oracle.solana;

import com.paywatch.oracle.ChainType;
import com.paywatch.oracle.OracleException;
import com.paywatch.oracle.VerificationOracle;
import com.paywatch.oracle.VerificationResult;
import com.paywatch.oracle.config.OracleProperties;
import com.paywatch.oracle.rpc.MockJsonRpcClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolanaPaymentVerifierTest {

    private static final Instant SINCE = Instant.parse("2025-01-01T00:00:00Z");
    private static final String RECIPIENT = "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM";
    private static final String PAYER = "7xKXtg2CW87d97TXJSDpbD5jBkheTqA83TZRuJosgAsU";

    private OracleProperties properties;
    private OracleProperties.ChainEntry config;

    @BeforeEach
    void setUp() {
        config = new OracleProperties.ChainEntry();
        config.setType(ChainType.SOLANA);
        config.setUrls(List.of("https://solana.test"));
        config.setNativeCurrency("SOL");
        config.setDecimals(9);
        config.setTolerancePercent(0);
        properties = new OracleProperties();
        properties.getChains().put("solana", config);
    }

    @Test
    void supports_solanaOnly() {
        SolanaPaymentVerifier verifier = new SolanaPaymentVerifier(new MockJsonRpcClient().gateway(properties));
        assertThat(verifier.supports(ChainType.SOLANA)).isTrue();
        assertThat(verifier.supports(ChainType.EVM)).isFalse();
    }

    @Test
    void balanceDelta_matched() {
        MockJsonRpcClient rpc = new MockJsonRpcClient()
                .on("getSignaturesForAddress", """
                        [{"signature":"sigFailed","err":{"InstructionError":[0,"Custom"]},"blockTime":%d},
                         {"signature":"sigPaid","err":null,"blockTime":%d}]
                        """.formatted(SINCE.getEpochSecond() + 120, SINCE.getEpochSecond() + 60))
                .on("getTransaction", params -> "sigPaid".equals(params.get(0))
                        ? transaction(2_000_000_000L, 4_500_000_000L)
                        : "null");
        SolanaPaymentVerifier verifier = new SolanaPaymentVerifier(rpc.gateway(properties));

        Optional<VerificationResult> result = verifier.verify("solana", config, RECIPIENT, "2.5", VerificationOracle.NATIVE, SINCE);

        assertThat(result).isPresent();
        assertThat(result.get().txHash()).isEqualTo("sigPaid");
        assertThat(result.get().from()).isEqualTo(PAYER);
        assertThat(result.get().amount()).isEqualTo("2.5");
        assertThat(result.get().timestamp()).isEqualTo(SINCE.plusSeconds(60));
        assertThat(rpc.callCount("getTransaction")).as("errored signatures are skipped").isEqualTo(1);
    }

    @Test
    void deltaBelowAmount_noMatch() {
        MockJsonRpcClient rpc = new MockJsonRpcClient()
                .on("getSignaturesForAddress", "[{\"signature\":\"sig1\",\"err\":null,\"blockTime\":%d}]"
                        .formatted(SINCE.getEpochSecond() + 60))
                .on("getTransaction", transaction(2_000_000_000L, 4_400_000_000L));
        SolanaPaymentVerifier verifier = new SolanaPaymentVerifier(rpc.gateway(properties));

        assertThat(verifier.verify("solana", config, RECIPIENT, "2.5", VerificationOracle.NATIVE, SINCE)).isEmpty();
    }

    @Test
    void signaturesOlderThanSince_ignored() {
        MockJsonRpcClient rpc = new MockJsonRpcClient()
                .on("getSignaturesForAddress", "[{\"signature\":\"old\",\"err\":null,\"blockTime\":%d}]"
                        .formatted(SINCE.getEpochSecond() - 60))
                .on("getTransaction", transaction(0L, 2_500_000_000L));
        SolanaPaymentVerifier verifier = new SolanaPaymentVerifier(rpc.gateway(properties));

        assertThat(verifier.verify("solana", config, RECIPIENT, "2.5", VerificationOracle.NATIVE, SINCE)).isEmpty();
        assertThat(rpc.callCount("getTransaction")).isZero();
    }

    @Test
    void failedTransactionRead_throws() {
        MockJsonRpcClient rpc = new MockJsonRpcClient()
                .on("getSignaturesForAddress", "[{\"signature\":\"sig1\",\"err\":null,\"blockTime\":%d}]"
                        .formatted(SINCE.getEpochSecond() + 60));
        SolanaPaymentVerifier verifier = new SolanaPaymentVerifier(rpc.gateway(properties));

        assertThatThrownBy(() -> verifier.verify("solana", config, RECIPIENT, "2.5", VerificationOracle.NATIVE, SINCE))
                .isInstanceOf(OracleException.class)
                .hasMessageContaining("RPC error");
    }

    @Test
    void splToken_unsupported() {
        SolanaPaymentVerifier verifier = new SolanaPaymentVerifier(new MockJsonRpcClient().gateway(properties));

        assertThatThrownBy(() -> verifier.verify("solana", config, RECIPIENT, "10", "USDC", SINCE))
                .isInstanceOf(OracleException.class)
                .hasMessageContaining("not supported");
    }

    private static String transaction(long preLamports, long postLamports) {
        return """
                {"blockTime":%d,
                 "meta":{"err":null,"fee":5000,"preBalances":[10000000000,%d],"postBalances":[7499995000,%d]},
                 "transaction":{"message":{"accountKeys":["%s","%s"]}}}
                """.formatted(SINCE.getEpochSecond() + 60, preLamports, postLamports, PAYER, RECIPIENT);
    }
}
