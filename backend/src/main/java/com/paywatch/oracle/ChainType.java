package com.paywatch.oracle;

/**
 * Verification strategy family for a configured chain.
 */
public enum ChainType {
    EVM,
    SOLANA
}
