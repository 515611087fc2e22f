package com.paywatch.api.controller;

import com.paywatch.api.dto.ErrorBody;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;
import java.util.Map;

/**
 * Request body problems → 400 ErrorBody. Bean Validation messages on the DTOs are the error codes
 * (INVALID_AMOUNT, INVALID_CHAIN, ...); a body that cannot be decoded at all is INVALID_REQUEST.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class ValidationExceptionHandler {

    private static final Map<String, String> MESSAGES = Map.of(
            "INVALID_AMOUNT", "Amount must be a positive decimal number",
            "INVALID_CURRENCY", "Currency is required",
            "INVALID_CHAIN", "Chain is missing or not supported",
            "INVALID_RECIPIENT", "Recipient address is required",
            "INVALID_DESCRIPTION", "Description is too long",
            "INVALID_STATUS", "Status is required");

    private final Clock clock;

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleBindFailure(WebExchangeBindException ex) {
        FieldError first = ex.getFieldError();
        String code = first != null && first.getDefaultMessage() != null && MESSAGES.containsKey(first.getDefaultMessage())
                ? first.getDefaultMessage()
                : "VALIDATION_ERROR";
        String message = MESSAGES.getOrDefault(code,
                first != null ? first.getField() + ": " + first.getDefaultMessage() : "Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(code, message, clock));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadableBody(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "Request body could not be read", clock));
    }
}
