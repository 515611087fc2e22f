package com.paywatch.api.controller;

import com.paywatch.api.dto.CreatePaymentRequestBody;
import com.paywatch.api.dto.PaymentRequestResponse;
import com.paywatch.api.dto.StatusUpdateBody;
import com.paywatch.api.dto.TransactionResponse;
import com.paywatch.domain.PaymentRequest;
import com.paywatch.ledger.TransactionLedger;
import com.paywatch.lifecycle.PaymentRequestException;
import com.paywatch.lifecycle.PaymentRequestLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * POST/GET /api/v1/requests, GET /api/v1/requests/{id}, PUT /api/v1/requests/{id}/status,
 * GET /api/v1/requests/{id}/transactions.
 */
@RestController
@RequestMapping("/api/v1/requests")
@RequiredArgsConstructor
public class PaymentRequestController {

    private final PaymentRequestLifecycleService lifecycleService;
    private final TransactionLedger transactionLedger;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<PaymentRequestResponse> create(@Valid @RequestBody CreatePaymentRequestBody body) {
        PaymentRequest created = lifecycleService.createRequest(body.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentRequestResponse.from(created, clock.instant()));
    }

    @GetMapping
    public ResponseEntity<List<PaymentRequestResponse>> list() {
        Instant now = clock.instant();
        return ResponseEntity.ok(lifecycleService.listRequests().stream()
                .map(r -> PaymentRequestResponse.from(r, now))
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentRequestResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(PaymentRequestResponse.from(lifecycleService.requireRequest(id), clock.instant()));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<PaymentRequestResponse> updateStatus(@PathVariable String id,
                                                               @Valid @RequestBody StatusUpdateBody body) {
        PaymentRequest current = lifecycleService.requireRequest(id);
        if (!lifecycleService.transitionStatus(id, body.status())) {
            throw new PaymentRequestException(PaymentRequestException.INVALID_TRANSITION,
                    "Cannot move request " + id + " from " + current.getStatus() + " to " + body.status());
        }
        return ResponseEntity.ok(PaymentRequestResponse.from(lifecycleService.requireRequest(id), clock.instant()));
    }

    @GetMapping("/{id}/transactions")
    public ResponseEntity<List<TransactionResponse>> transactions(@PathVariable String id) {
        lifecycleService.requireRequest(id);
        return ResponseEntity.ok(transactionLedger.findByRequestId(id).stream()
                .map(TransactionResponse::from)
                .toList());
    }
}
