package com.paywatch.api.dto;

import com.paywatch.domain.PaymentTransaction;
import com.paywatch.domain.PaymentTransactionStatus;
import jakarta.validation.constraints.NotBlank;

import java.util.Locale;

/**
 * POST /api/v1/transactions body: a manually reported transfer. Recording is idempotent on
 * (chain, txHash) and, for COMPLETED rows, on requestId.
 */
public record RecordTransactionBody(
        String requestId,
        String txHash,
        @NotBlank(message = "INVALID_AMOUNT")
        String amount,
        @NotBlank(message = "INVALID_CURRENCY")
        String currency,
        @NotBlank(message = "INVALID_CHAIN")
        String chain,
        String from,
        String to,
        PaymentTransactionStatus status,
        String description
) {

    public PaymentTransaction toTransaction() {
        PaymentTransaction tx = new PaymentTransaction();
        tx.setRequestId(blankToNull(requestId));
        tx.setTxHash(blankToNull(txHash));
        tx.setAmount(amount.trim());
        tx.setCurrency(currency.trim());
        tx.setChain(chain.trim().toLowerCase(Locale.ROOT));
        tx.setFrom(from);
        tx.setTo(to);
        tx.setStatus(status);
        tx.setDescription(description);
        return tx;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
