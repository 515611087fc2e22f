package com.paywatch.oracle;

import com.paywatch.oracle.config.OracleProperties;

import java.math.BigDecimal;

/**
 * Decides whether an observed transfer value pays a requested amount, allowing the chain's tolerance:
 * {@code max(minTolerance, required * tolerancePercent)}.
 */
public final class AmountMatcher {

    private final BigDecimal required;
    private final BigDecimal threshold;

    public AmountMatcher(String amount, OracleProperties.ChainEntry config) {
        try {
            this.required = new BigDecimal(amount.trim());
        } catch (RuntimeException e) {
            throw new OracleException("Requested amount is not a decimal: " + amount, e);
        }
        BigDecimal percent = required.multiply(BigDecimal.valueOf(config.getTolerancePercent()));
        BigDecimal tolerance = percent.max(config.getMinTolerance());
        this.threshold = required.subtract(tolerance);
    }

    public boolean matches(BigDecimal observed) {
        return observed != null && observed.signum() > 0 && observed.compareTo(threshold) >= 0;
    }

    public BigDecimal required() {
        return required;
    }
}
