package com.paywatch.store;

import com.paywatch.domain.PaymentRequest;
import com.paywatch.domain.PaymentRequestRepository;
import com.paywatch.domain.PaymentRequestStatus;
import com.paywatch.domain.PaymentTransaction;
import com.paywatch.domain.PaymentTransactionRepository;
import com.paywatch.domain.PaymentTransactionStatus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoDB store. Dedup on transactions is enforced by unique partial indexes; a losing concurrent insert
 * surfaces as {@link DuplicateKeyException} and resolves to the row that won.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoPaymentStore implements PaymentStore {

    static final String TX_HASH_INDEX = "chain_txhash_uniq";
    static final String COMPLETED_REQUEST_INDEX = "request_completed_uniq";

    private final PaymentRequestRepository requestRepository;
    private final PaymentTransactionRepository transactionRepository;
    private final MongoTemplate mongoTemplate;

    @PostConstruct
    void ensureTransactionIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(PaymentTransaction.class);
        ops.ensureIndex(new Index()
                .on("chain", Sort.Direction.ASC)
                .on("txHash", Sort.Direction.ASC)
                .unique()
                .named(TX_HASH_INDEX)
                .partial(PartialIndexFilter.of(where("txHash").exists(true))));
        ops.ensureIndex(new Index()
                .on("requestId", Sort.Direction.ASC)
                .unique()
                .named(COMPLETED_REQUEST_INDEX)
                .partial(PartialIndexFilter.of(where("requestId").exists(true)
                        .and("status").is(PaymentTransactionStatus.COMPLETED.name()))));
    }

    @Override
    public Optional<PaymentRequest> findRequest(String id) {
        return call("findRequest", () -> requestRepository.findById(id));
    }

    @Override
    public List<PaymentRequest> listRequests() {
        return call("listRequests", requestRepository::findAllByOrderByCreatedAtDesc);
    }

    @Override
    public List<PaymentRequest> listOverduePending(Instant cutoff) {
        return call("listOverduePending",
                () -> requestRepository.findByStatusAndExpiresAtLessThanEqual(PaymentRequestStatus.PENDING, cutoff));
    }

    @Override
    public PaymentRequest createRequest(PaymentRequest request) {
        return call("createRequest", () -> requestRepository.insert(request));
    }

    @Override
    public Optional<PaymentRequest> updateStatusIfPending(String id, PaymentRequestStatus status, Instant updatedAt) {
        return call("updateStatusIfPending", () -> requestRepository.updateStatusIfPending(id, status, updatedAt));
    }

    @Override
    public boolean updateLastChecked(String id, Instant lastChecked) {
        return call("updateLastChecked", () -> requestRepository.updateLastChecked(id, lastChecked));
    }

    @Override
    public Optional<PaymentTransaction> findTransactionByChainAndTxHash(String chain, String txHash) {
        return call("findTransactionByChainAndTxHash", () -> transactionRepository.findFirstByChainAndTxHash(chain, txHash));
    }

    @Override
    public Optional<PaymentTransaction> findCompletedTransactionForRequest(String requestId) {
        return call("findCompletedTransactionForRequest",
                () -> transactionRepository.findFirstByRequestIdAndStatus(requestId, PaymentTransactionStatus.COMPLETED));
    }

    @Override
    public PaymentTransaction createTransactionIfAbsent(PaymentTransaction transaction) {
        Optional<PaymentTransaction> existing = findExisting(transaction);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return transactionRepository.insert(transaction);
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent insert for tx {} / request {} lost the race; returning winner",
                    transaction.getTxHash(), transaction.getRequestId());
            return findExisting(transaction)
                    .orElseThrow(() -> new StoreException("Duplicate key but no existing transaction for "
                            + transaction.getTxHash(), e));
        } catch (DataAccessException e) {
            throw new StoreException("createTransactionIfAbsent failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<PaymentTransaction> listTransactions() {
        return call("listTransactions", transactionRepository::findAllByOrderByTimestampDesc);
    }

    @Override
    public List<PaymentTransaction> findTransactionsByRequestId(String requestId) {
        return call("findTransactionsByRequestId", () -> transactionRepository.findByRequestIdOrderByTimestampDesc(requestId));
    }

    private Optional<PaymentTransaction> findExisting(PaymentTransaction transaction) {
        if (transaction.hasTxHash()) {
            Optional<PaymentTransaction> byHash = findTransactionByChainAndTxHash(transaction.getChain(), transaction.getTxHash());
            if (byHash.isPresent()) {
                return byHash;
            }
        }
        if (transaction.getRequestId() != null && transaction.getStatus() == PaymentTransactionStatus.COMPLETED) {
            return findCompletedTransactionForRequest(transaction.getRequestId());
        }
        return Optional.empty();
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DuplicateKeyException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new StoreException(operation + " failed: " + e.getMessage(), e);
        }
    }
}
