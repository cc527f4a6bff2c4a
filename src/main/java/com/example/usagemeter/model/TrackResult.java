package com.example.usagemeter.model;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of recording a usage event.
 * <p>
 * A duplicate idempotency key is reported as success with {@link #isDuplicate()} set.
 */
public class TrackResult {

    private final boolean success;
    private final boolean duplicate;
    private final ErrorKind error;
    private final List<String> errors;
    private final String idempotencyKey;

    private TrackResult(boolean success, boolean duplicate, ErrorKind error, List<String> errors,
                        String idempotencyKey) {
        this.success = success;
        this.duplicate = duplicate;
        this.error = error;
        this.errors = errors == null ? Collections.emptyList() : List.copyOf(errors);
        this.idempotencyKey = idempotencyKey;
    }

    public static TrackResult recorded(String idempotencyKey) {
        return new TrackResult(true, false, null, null, idempotencyKey);
    }

    public static TrackResult alreadyRecorded(String idempotencyKey) {
        return new TrackResult(true, true, null, null, idempotencyKey);
    }

    public static TrackResult invalid(List<String> errors) {
        return new TrackResult(false, false, ErrorKind.VALIDATION_ERROR, errors, null);
    }

    public static TrackResult storeUnavailable(String idempotencyKey, String message) {
        return new TrackResult(false, false, ErrorKind.STORE_UNAVAILABLE, List.of(message), idempotencyKey);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    public ErrorKind getError() {
        return error;
    }

    public List<String> getErrors() {
        return errors;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
