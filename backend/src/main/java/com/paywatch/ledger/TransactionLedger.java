package com.paywatch.ledger;

import com.paywatch.domain.PaymentTransaction;
import com.paywatch.domain.PaymentTransactionStatus;
import com.paywatch.store.PaymentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotent transaction recording keyed by (chain, txHash) and, for COMPLETED rows, by requestId.
 * Recording the same transfer twice returns the first stored row unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionLedger {

    static final String ID_PREFIX = "tx_";

    private final PaymentStore store;
    private final Clock clock;

    /**
     * Returns the existing row when one matches either dedup key; otherwise assigns defaults and inserts.
     */
    public PaymentTransaction record(PaymentTransaction transaction) {
        if (transaction == null) {
            throw new IllegalArgumentException("transaction is required");
        }
        if (transaction.getStatus() == null) {
            transaction.setStatus(PaymentTransactionStatus.COMPLETED);
        }
        Optional<PaymentTransaction> existing = findDuplicate(transaction);
        if (existing.isPresent()) {
            log.debug("Transaction already recorded as {} (txHash={}, requestId={})",
                    existing.get().getId(), transaction.getTxHash(), transaction.getRequestId());
            return existing.get();
        }
        if (transaction.getId() == null || transaction.getId().isBlank()) {
            transaction.setId(ID_PREFIX + UUID.randomUUID());
        }
        if (transaction.getTimestamp() == null) {
            transaction.setTimestamp(clock.instant());
        }
        PaymentTransaction stored = store.createTransactionIfAbsent(transaction);
        if (stored.getId().equals(transaction.getId())) {
            log.info("Recorded transaction {} for request {} (txHash={}, {} {} on {})",
                    stored.getId(), stored.getRequestId(), stored.getTxHash(),
                    stored.getAmount(), stored.getCurrency(), stored.getChain());
        }
        return stored;
    }

    public List<PaymentTransaction> listTransactions() {
        return store.listTransactions();
    }

    public List<PaymentTransaction> findByRequestId(String requestId) {
        return store.findTransactionsByRequestId(requestId);
    }

    private Optional<PaymentTransaction> findDuplicate(PaymentTransaction transaction) {
        if (transaction.hasTxHash()) {
            Optional<PaymentTransaction> byHash = store.findTransactionByChainAndTxHash(
                    transaction.getChain(), transaction.getTxHash());
            if (byHash.isPresent()) {
                return byHash;
            }
        }
        if (transaction.getRequestId() != null && transaction.getStatus() == PaymentTransactionStatus.COMPLETED) {
            return store.findCompletedTransactionForRequest(transaction.getRequestId());
        }
        return Optional.empty();
    }
}
