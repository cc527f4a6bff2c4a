package com.example.usagemeter.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Result returned by the rate limiter for a single check.
 */
public class RateLimitResult {

    private final RateLimitDecision decision;
    private final long limit;
    private final long remaining;
    private final Instant resetTime;
    private final Duration retryAfter;
    private final boolean degraded;

    public RateLimitResult(RateLimitDecision decision, long limit, long remaining, Instant resetTime,
                           Duration retryAfter, boolean degraded) {
        this.decision = decision;
        this.limit = limit;
        this.remaining = remaining;
        this.resetTime = resetTime;
        this.retryAfter = retryAfter;
        this.degraded = degraded;
    }

    public static RateLimitResult allow(long limit, long remaining, Instant resetTime) {
        return new RateLimitResult(RateLimitDecision.ALLOW, limit, Math.max(0L, remaining), resetTime, null, false);
    }

    /**
     * Admission granted without consulting the store (fail-open on a store outage).
     */
    public static RateLimitResult allowDegraded(long limit, Instant resetTime) {
        return new RateLimitResult(RateLimitDecision.ALLOW, limit, limit, resetTime, null, true);
    }

    public static RateLimitResult rejectRateLimited(long limit, Instant resetTime, Duration retryAfter) {
        return new RateLimitResult(RateLimitDecision.REJECT_RATE_LIMITED, limit, 0L, resetTime, retryAfter, false);
    }

    public static RateLimitResult rejectStoreFailure(long limit, Instant resetTime, Duration retryAfter) {
        return new RateLimitResult(RateLimitDecision.REJECT_STORE_FAILURE, limit, 0L, resetTime, retryAfter, true);
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    public boolean isAllowed() {
        return decision == RateLimitDecision.ALLOW;
    }

    public long getLimit() {
        return limit;
    }

    public long getRemaining() {
        return remaining;
    }

    public Instant getResetTime() {
        return resetTime;
    }

    /**
     * @return time until the caller may retry, or null when the request was admitted
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * @return true if the result was produced while the counter store was unavailable
     */
    public boolean isDegraded() {
        return degraded;
    }

    /**
     * @return the denial reason, or null when the request was admitted
     */
    public ErrorKind getError() {
        switch (decision) {
            case REJECT_RATE_LIMITED:
                return ErrorKind.RATE_LIMIT_EXCEEDED;
            case REJECT_STORE_FAILURE:
                return ErrorKind.STORE_UNAVAILABLE;
            default:
                return null;
        }
    }
}
