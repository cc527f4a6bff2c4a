package com.example.usagemeter.model;

import java.util.Locale;
import java.util.Optional;

public enum SubscriptionStatus {
    ACTIVE,
    TRIALING,
    PAST_DUE,
    CANCELLED,
    EXPIRED;

    /**
     * Only active and trialing subscriptions may consume metered resources.
     */
    public boolean isEntitled() {
        return this == ACTIVE || this == TRIALING;
    }

    public static Optional<SubscriptionStatus> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(code.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
