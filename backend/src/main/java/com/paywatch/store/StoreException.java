package com.paywatch.store;

/**
 * Thrown when the store cannot complete a read or write (connectivity, timeout, unexpected driver error).
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
