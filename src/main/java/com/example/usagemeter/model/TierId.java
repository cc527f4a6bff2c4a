package com.example.usagemeter.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Subscription tiers, declared from lowest to highest. Declaration order is the upgrade path
 * and is what decides whether a tier change was a downgrade.
 */
public enum TierId {
    FREE("free"),
    PRO("pro"),
    PRO_BYOK("pro_byok");

    private final String code;

    TierId(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isHigherThan(TierId other) {
        return other != null && ordinal() > other.ordinal();
    }

    public static Optional<TierId> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (TierId tier : values()) {
            if (tier.code.equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
