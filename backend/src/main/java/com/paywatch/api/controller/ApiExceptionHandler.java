package com.paywatch.api.controller;

import com.paywatch.api.dto.ErrorBody;
import com.paywatch.lifecycle.PaymentRequestException;
import com.paywatch.store.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

/**
 * Maps lifecycle and store failures to ErrorBody: REQUEST_NOT_FOUND 404, INVALID_TRANSITION 409,
 * INVALID_REQUEST 400, STORE_UNAVAILABLE 503.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class ApiExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(PaymentRequestException.class)
    public ResponseEntity<ErrorBody> handlePaymentRequest(PaymentRequestException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case PaymentRequestException.REQUEST_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PaymentRequestException.INVALID_TRANSITION -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage(), clock));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(PaymentRequestException.INVALID_REQUEST, ex.getMessage(), clock));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorBody> handleStore(StoreException ex) {
        log.warn("Store unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("STORE_UNAVAILABLE", "Storage is temporarily unavailable", clock));
    }
}
