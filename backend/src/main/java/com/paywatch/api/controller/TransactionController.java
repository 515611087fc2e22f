package com.paywatch.api.controller;

import com.paywatch.api.dto.RecordTransactionBody;
import com.paywatch.api.dto.TransactionResponse;
import com.paywatch.ledger.TransactionLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Transaction ledger API. POST is idempotent: a duplicate returns the stored row.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionLedger transactionLedger;

    @GetMapping
    public ResponseEntity<List<TransactionResponse>> list() {
        return ResponseEntity.ok(transactionLedger.listTransactions().stream()
                .map(TransactionResponse::from)
                .toList());
    }

    @PostMapping
    public ResponseEntity<TransactionResponse> record(@Valid @RequestBody RecordTransactionBody body) {
        return ResponseEntity.ok(TransactionResponse.from(transactionLedger.record(body.toTransaction())));
    }
}
