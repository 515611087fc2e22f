package com.paywatch.oracle;

/**
 * Thrown when a verification call fails (HTTP, JSON-RPC error, timeout, malformed response, unsupported asset).
 * Always transient from the caller's perspective: the next poll retries.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
