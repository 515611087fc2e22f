package com.paywatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for transactions. Dedup keys: (chain, txHash) and (requestId, COMPLETED).
 */
public interface PaymentTransactionRepository extends MongoRepository<PaymentTransaction, String> {

    Optional<PaymentTransaction> findFirstByChainAndTxHash(String chain, String txHash);

    Optional<PaymentTransaction> findFirstByRequestIdAndStatus(String requestId, PaymentTransactionStatus status);

    List<PaymentTransaction> findByRequestIdOrderByTimestampDesc(String requestId);

    List<PaymentTransaction> findAllByOrderByTimestampDesc();
}
