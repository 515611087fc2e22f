package com.paywatch.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed conditional updates for payment_requests.
 */
@Repository
@RequiredArgsConstructor
public class PaymentRequestRepositoryImpl implements PaymentRequestRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<PaymentRequest> updateStatusIfPending(String id, PaymentRequestStatus status, Instant updatedAt) {
        Query query = new Query(where("_id").is(id).and("status").is(PaymentRequestStatus.PENDING));
        Update update = new Update().set("status", status).set("updatedAt", updatedAt);
        PaymentRequest updated = mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), PaymentRequest.class);
        return Optional.ofNullable(updated);
    }

    @Override
    public boolean updateLastChecked(String id, Instant lastChecked) {
        Query query = new Query(where("_id").is(id));
        return mongoTemplate.updateFirst(query, new Update().set("lastChecked", lastChecked), PaymentRequest.class)
                .getMatchedCount() > 0;
    }
}
