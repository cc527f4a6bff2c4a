package com.example.usagemeter.model;

import java.time.Instant;

/**
 * Read-only view of a counter, produced without consuming capacity.
 */
public class RateLimitStatus {

    private final UsageAction action;
    private final long windowSeconds;
    private final long current;
    private final long limit;
    private final Instant resetTime;

    public RateLimitStatus(UsageAction action, long windowSeconds, long current, long limit, Instant resetTime) {
        this.action = action;
        this.windowSeconds = windowSeconds;
        this.current = current;
        this.limit = limit;
        this.resetTime = resetTime;
    }

    public UsageAction getAction() {
        return action;
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }

    public long getCurrent() {
        return current;
    }

    public long getLimit() {
        return limit;
    }

    public long getRemaining() {
        return Math.max(0L, limit - current);
    }

    public Instant getResetTime() {
        return resetTime;
    }
}
