package com.example.usagemeter.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A per-resource quota: either a non-negative ceiling or unlimited.
 */
public final class UsageLimit {

    public static final String UNLIMITED_TOKEN = "unlimited";

    private static final UsageLimit UNLIMITED = new UsageLimit(-1L);

    private final long value;

    private UsageLimit(long value) {
        this.value = value;
    }

    public static UsageLimit unlimited() {
        return UNLIMITED;
    }

    public static UsageLimit of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("limit must be >= 0 or unlimited, got " + value);
        }
        return new UsageLimit(value);
    }

    /**
     * Parses the configuration spelling: a non-negative integer or {@code unlimited}.
     */
    public static UsageLimit parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("limit value is empty");
        }
        String trimmed = raw.trim();
        if (UNLIMITED_TOKEN.equals(trimmed.toLowerCase(Locale.ROOT))) {
            return UNLIMITED;
        }
        try {
            return of(Long.parseLong(trimmed));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("limit must be an integer or 'unlimited', got '" + raw + "'", ex);
        }
    }

    public boolean isUnlimited() {
        return value < 0;
    }

    /**
     * @return the ceiling; callers must check {@link #isUnlimited()} first
     */
    public long getValue() {
        if (isUnlimited()) {
            throw new IllegalStateException("unlimited has no numeric value");
        }
        return value;
    }

    public boolean permits(long total) {
        return isUnlimited() || total <= value;
    }

    public boolean isGreaterThan(UsageLimit other) {
        if (isUnlimited()) {
            return !other.isUnlimited();
        }
        return !other.isUnlimited() && value > other.value;
    }

    /**
     * Unlimited always reports 0%. A zero ceiling reports 100%.
     */
    public double percentUsed(long current) {
        if (isUnlimited()) {
            return 0.0;
        }
        if (value == 0) {
            return 100.0;
        }
        return Math.min(100.0, (current * 100.0) / value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UsageLimit)) {
            return false;
        }
        return value == ((UsageLimit) o).value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return isUnlimited() ? UNLIMITED_TOKEN : Long.toString(value);
    }
}
