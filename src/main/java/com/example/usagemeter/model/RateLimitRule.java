package com.example.usagemeter.model;

import java.time.Duration;

/**
 * Requests allowed per window for one action on one tier.
 */
public class RateLimitRule {

    private final long limit;
    private final Duration window;
    private final RateLimitAlgorithm algorithm;

    public RateLimitRule(long limit, Duration window, RateLimitAlgorithm algorithm) {
        this.limit = limit;
        this.window = window;
        this.algorithm = algorithm;
    }

    public long getLimit() {
        return limit;
    }

    public Duration getWindow() {
        return window;
    }

    public long getWindowSeconds() {
        return window.getSeconds();
    }

    public RateLimitAlgorithm getAlgorithm() {
        return algorithm;
    }
}
