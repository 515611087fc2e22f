package com.paywatch.store;

import com.paywatch.domain.PaymentRequest;
import com.paywatch.domain.PaymentRequestRepository;
import com.paywatch.domain.PaymentRequestStatus;
import com.paywatch.domain.PaymentTransaction;
import com.paywatch.domain.PaymentTransactionRepository;
import com.paywatch.domain.PaymentTransactionStatus;
import com.paywatch.oracle.VerificationOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "paywatch.monitoring.poll-interval=1h")
@Testcontainers
class MongoPaymentStoreIntegrationTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoPaymentStore store;
    @Autowired
    PaymentRequestRepository requestRepository;
    @Autowired
    PaymentTransactionRepository transactionRepository;

    @MockBean
    VerificationOracle verificationOracle;

    @BeforeEach
    void clean() {
        requestRepository.deleteAll();
        transactionRepository.deleteAll();
    }

    @Test
    @DisplayName("status moves from PENDING once; the second conditional update matches nothing")
    void updateStatusIfPending_isConditional() {
        store.createRequest(request("req_1", NOW));

        assertThat(store.updateStatusIfPending("req_1", PaymentRequestStatus.COMPLETED, NOW.plusSeconds(5)))
                .get().extracting(PaymentRequest::getStatus).isEqualTo(PaymentRequestStatus.COMPLETED);
        assertThat(store.updateStatusIfPending("req_1", PaymentRequestStatus.EXPIRED, NOW.plusSeconds(10))).isEmpty();
        assertThat(store.updateStatusIfPending("req_missing", PaymentRequestStatus.EXPIRED, NOW)).isEmpty();

        PaymentRequest stored = store.findRequest("req_1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PaymentRequestStatus.COMPLETED);
        assertThat(stored.getUpdatedAt()).isEqualTo(NOW.plusSeconds(5));
    }

    @Test
    void createRequest_duplicateId_throwsDuplicateKey() {
        store.createRequest(request("req_1", NOW));

        assertThatThrownBy(() -> store.createRequest(request("req_1", NOW))).isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void updateLastChecked_reportsWhetherMatched() {
        store.createRequest(request("req_1", NOW));

        assertThat(store.updateLastChecked("req_1", NOW.plusSeconds(20))).isTrue();
        assertThat(store.updateLastChecked("req_missing", NOW)).isFalse();
        assertThat(store.findRequest("req_1").orElseThrow().getLastChecked()).isEqualTo(NOW.plusSeconds(20));
    }

    @Test
    void listOverduePending_onlyPendingPastExpiry() {
        store.createRequest(request("req_old", NOW.minus(Duration.ofHours(2))));
        store.createRequest(request("req_new", NOW));
        PaymentRequest oldDone = request("req_old_done", NOW.minus(Duration.ofHours(2)));
        oldDone.setStatus(PaymentRequestStatus.COMPLETED);
        store.createRequest(oldDone);

        assertThat(store.listOverduePending(NOW)).extracting(PaymentRequest::getId).containsExactly("req_old");
        assertThat(store.listRequests()).extracting(PaymentRequest::getId).first().isEqualTo("req_new");
    }

    @Test
    @DisplayName("unique index: a second row for the same chain and txHash resolves to the first")
    void createTransactionIfAbsent_sameHash() {
        PaymentTransaction first = store.createTransactionIfAbsent(tx("tx_1", "req_1", "0xabc"));
        PaymentTransaction second = store.createTransactionIfAbsent(tx("tx_2", "req_2", "0xabc"));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(transactionRepository.count()).isEqualTo(1);
        assertThatThrownBy(() -> transactionRepository.insert(tx("tx_3", null, "0xabc")))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void transactionsWithoutHash_notConstrainedByHashIndex() {
        PaymentTransaction a = tx("tx_1", null, null);
        PaymentTransaction b = tx("tx_2", null, null);

        store.createTransactionIfAbsent(a);
        store.createTransactionIfAbsent(b);

        assertThat(transactionRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("concurrent inserts for one request end with a single completed transaction")
    void createTransactionIfAbsent_concurrent() throws Exception {
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<PaymentTransaction>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                PaymentTransaction candidate = tx("tx_" + i, "req_1", "0xhash" + i);
                Callable<PaymentTransaction> call = () -> {
                    go.await();
                    return store.createTransactionIfAbsent(candidate);
                };
                futures.add(pool.submit(call));
            }
            go.countDown();
            for (Future<PaymentTransaction> f : futures) {
                assertThat(f.get().getRequestId()).isEqualTo("req_1");
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(store.findTransactionsByRequestId("req_1")).hasSize(1);
    }

    private static PaymentRequest request(String id, Instant createdAt) {
        return PaymentRequest.newPending(id, "1.5", "ETH", "ethereum", "0xrecipient", "Payment request", createdAt);
    }

    private static PaymentTransaction tx(String id, String requestId, String txHash) {
        PaymentTransaction t = new PaymentTransaction();
        t.setId(id);
        t.setRequestId(requestId);
        t.setTxHash(txHash);
        t.setAmount("1.5");
        t.setCurrency("ETH");
        t.setChain("ethereum");
        t.setFrom("0xpayer");
        t.setTo("0xrecipient");
        t.setStatus(PaymentTransactionStatus.COMPLETED);
        t.setTimestamp(NOW);
        return t;
    }
}
