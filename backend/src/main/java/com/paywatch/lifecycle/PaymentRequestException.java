package com.paywatch.lifecycle;

import lombok.Getter;

/**
 * Thrown by the lifecycle service when a request is missing, invalid, or a status change is refused.
 * The API maps the codes to 404 REQUEST_NOT_FOUND, 409 INVALID_TRANSITION and 400 INVALID_REQUEST.
 */
@Getter
public class PaymentRequestException extends RuntimeException {

    public static final String REQUEST_NOT_FOUND = "REQUEST_NOT_FOUND";
    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    private final String errorCode;

    public PaymentRequestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
