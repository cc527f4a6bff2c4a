package com.example.usagemeter.model;

public enum RateLimitAlgorithm {
    /**
     * Counter per window; the window starts on the first request and ends when the key's TTL expires.
     */
    FIXED_WINDOW,

    /**
     * Ordered log of request timestamps, pruned to the trailing window on every check.
     */
    SLIDING_WINDOW
}
