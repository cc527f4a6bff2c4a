package com.example.usagemeter.ledger;

/**
 * The ledger already holds an event with this idempotency key.
 */
public class DuplicateEventException extends Exception {

    private final String idempotencyKey;

    public DuplicateEventException(String idempotencyKey, Throwable cause) {
        super("Usage event already recorded: " + idempotencyKey, cause);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
