package com.paywatch.store;

import com.paywatch.domain.PaymentRequest;
import com.paywatch.domain.PaymentRequestStatus;
import com.paywatch.domain.PaymentTransaction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable request/transaction store. Implementations must be safe for concurrent use by monitoring tasks:
 * {@link #updateStatusIfPending} is a conditional write and {@link #createTransactionIfAbsent} is an
 * atomic insert-if-absent on both dedup keys.
 */
public interface PaymentStore {

    Optional<PaymentRequest> findRequest(String id);

    /** All requests, newest first. */
    List<PaymentRequest> listRequests();

    /** Pending requests with {@code expiresAt <= cutoff}. */
    List<PaymentRequest> listOverduePending(Instant cutoff);

    PaymentRequest createRequest(PaymentRequest request);

    /**
     * Moves a PENDING request to {@code status}. Empty when the request is missing or no longer PENDING.
     */
    Optional<PaymentRequest> updateStatusIfPending(String id, PaymentRequestStatus status, Instant updatedAt);

    /** @return false when no request matched */
    boolean updateLastChecked(String id, Instant lastChecked);

    Optional<PaymentTransaction> findTransactionByChainAndTxHash(String chain, String txHash);

    Optional<PaymentTransaction> findCompletedTransactionForRequest(String requestId);

    /**
     * Inserts the transaction unless one already exists for its (chain, txHash) or, when COMPLETED, its requestId.
     * Returns the stored row: the new one or the pre-existing winner.
     */
    PaymentTransaction createTransactionIfAbsent(PaymentTransaction transaction);

    /** All transactions, newest first. */
    List<PaymentTransaction> listTransactions();

    List<PaymentTransaction> findTransactionsByRequestId(String requestId);
}
