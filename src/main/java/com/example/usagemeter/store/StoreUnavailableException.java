package com.example.usagemeter.store;

/**
 * A backing store (counter store, usage ledger or subscription source) could not be reached,
 * timed out, or answered with something unusable.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
