package com.example.usagemeter.model;

/**
 * Machine-readable reason attached to every denial or rejected usage event.
 */
public enum ErrorKind {
    VALIDATION_ERROR("validation_error"),
    DUPLICATE_EVENT("duplicate_event"),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),
    USAGE_LIMIT_EXCEEDED("usage_limit_exceeded"),
    FEATURE_NOT_AVAILABLE("feature_not_available"),
    SUBSCRIPTION_INACTIVE("subscription_inactive"),
    STORE_UNAVAILABLE("store_unavailable");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
