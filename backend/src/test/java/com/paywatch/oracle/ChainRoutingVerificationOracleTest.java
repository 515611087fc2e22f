package com.paywatch.oracle;

import com.paywatch.oracle.config.OracleProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChainRoutingVerificationOracleTest {

    private static final Instant SINCE = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private ChainPaymentVerifier evmVerifier;
    @Mock
    private ChainPaymentVerifier solanaVerifier;

    private OracleProperties properties;
    private ChainRoutingVerificationOracle oracle;

    @BeforeEach
    void setUp() {
        properties = new OracleProperties();
        OracleProperties.ChainEntry bnb = new OracleProperties.ChainEntry();
        bnb.setType(ChainType.EVM);
        bnb.setNativeCurrency("BNB");
        properties.getChains().put("bnb", bnb);
        OracleProperties.ChainEntry solana = new OracleProperties.ChainEntry();
        solana.setType(ChainType.SOLANA);
        solana.setNativeCurrency("SOL");
        properties.getChains().put("solana", solana);

        lenient().when(evmVerifier.supports(ChainType.EVM)).thenReturn(true);
        lenient().when(solanaVerifier.supports(ChainType.SOLANA)).thenReturn(true);
        oracle = new ChainRoutingVerificationOracle(properties, List.of(evmVerifier, solanaVerifier));
    }

    @Test
    void dispatchesByChainType() {
        VerificationResult match = new VerificationResult(true, "sig", "payer", "recipient", "1", SINCE);
        when(solanaVerifier.verify(eq("solana"), any(), eq("recipient"), eq("1"), eq(VerificationOracle.NATIVE), eq(SINCE)))
                .thenReturn(Optional.of(match));

        assertThat(oracle.verify("Solana", "recipient", "1", VerificationOracle.NATIVE, SINCE)).contains(match);
        verify(evmVerifier, never()).verify(anyString(), any(), anyString(), anyString(), anyString(), any());
    }

    @Test
    void unknownChain_throws() {
        assertThatThrownBy(() -> oracle.verify("tron", "recipient", "1", VerificationOracle.NATIVE, SINCE))
                .isInstanceOf(OracleException.class)
                .hasMessageContaining("Unsupported chain");
    }

    @Test
    void resolveAsset_nativeSymbolBecomesNative() {
        assertThat(oracle.resolveAsset("bnb", "bnb")).isEqualTo(VerificationOracle.NATIVE);
        assertThat(oracle.resolveAsset("bnb", null)).isEqualTo(VerificationOracle.NATIVE);
        assertThat(oracle.resolveAsset("bnb", "USDT")).isEqualTo("USDT");
        assertThat(oracle.resolveAsset("solana", "SOL")).isEqualTo(VerificationOracle.NATIVE);
    }
}
