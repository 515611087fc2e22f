package com.paywatch.api.dto;

import com.paywatch.domain.PaymentTransaction;

import java.time.Instant;

public record TransactionResponse(
        String id,
        String requestId,
        String txHash,
        String amount,
        String currency,
        String chain,
        String from,
        String to,
        String status,
        String description,
        Instant timestamp
) {

    public static TransactionResponse from(PaymentTransaction t) {
        return new TransactionResponse(
                t.getId(),
                t.getRequestId(),
                t.getTxHash(),
                t.getAmount(),
                t.getCurrency(),
                t.getChain(),
                t.getFrom(),
                t.getTo(),
                t.getStatus() != null ? t.getStatus().name() : null,
                t.getDescription(),
                t.getTimestamp());
    }
}
