package com.paywatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Materialized on-chain transfer. At most one per (chain, txHash); at most one COMPLETED per requestId.
 * Unique partial indexes backing both keys are created by {@code MongoPaymentStore}.
 */
@Document(collection = "transactions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PaymentTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    /** Originating payment request, or null for transfers recorded outside a request. */
    @Indexed
    private String requestId;
    private String txHash;
    private String amount;
    private String currency;
    private String chain;
    private String from;
    private String to;
    private PaymentTransactionStatus status;
    private String description;
    private Instant timestamp;

    public boolean hasTxHash() {
        return txHash != null && !txHash.isBlank();
    }
}
