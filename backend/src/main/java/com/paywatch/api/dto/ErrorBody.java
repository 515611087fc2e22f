package com.paywatch.api.dto;

import java.time.Clock;
import java.time.Instant;

/**
 * Error response body: error code, human-readable message, timestamp (ISO 8601).
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message, Clock clock) {
        return new ErrorBody(error, message, clock.instant());
    }
}
