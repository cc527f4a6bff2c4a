package com.example.usagemeter.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of metered actions. Codes are the stable identifiers stored in the ledger
 * and used in counter keys.
 */
public enum UsageAction {
    MESSAGE("message"),
    UPLOAD("upload"),
    DOWNLOAD("download"),
    API_CALL("api_call"),
    SEARCH("search"),
    EMBEDDING("embedding"),
    STORAGE_DELTA("storage_delta"),
    CONNECTION("connection"),
    EXPORT("export");

    private final String code;

    UsageAction(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Storage is a level, not a rate: its quota is evaluated over all recorded deltas
     * instead of the current billing cycle.
     */
    public boolean isCumulative() {
        return this == STORAGE_DELTA;
    }

    /**
     * Resolves a code such as {@code api_call} or its configuration spelling {@code api-call}.
     */
    public static Optional<UsageAction> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (UsageAction action : values()) {
            if (action.code.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
