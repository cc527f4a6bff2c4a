package com.example.usagemeter.middleware;

import com.example.usagemeter.model.ErrorKind;
import com.example.usagemeter.model.RateLimitResult;
import com.example.usagemeter.model.TierCheckResult;
import com.example.usagemeter.model.TierId;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of {@link UsageMiddleware#enforceAndRun}. Either the operation ran and {@link #getValue()}
 * holds its result, or it was denied and {@link #getError()} says why.
 * <p>
 * Quota fields ({@code current}, {@code limit}, {@code remaining}, {@code percentUsed}) come from the
 * tier check; {@code retryAfter} and {@code resetTime} from the rate limiter. Fields that do not
 * apply are -1 or null.
 */
public class EnforcementResult<T> {

    private final boolean allowed;
    private final T value;
    private final ErrorKind error;
    private final String message;
    private final TierId tier;
    private final long current;
    private final long limit;
    private final long remaining;
    private final double percentUsed;
    private final Duration retryAfter;
    private final Instant resetTime;
    private final boolean overLimit;
    private final Instant graceDeadline;
    private final boolean degraded;

    private EnforcementResult(boolean allowed, T value, ErrorKind error, String message, TierId tier,
                              long current, long limit, long remaining, double percentUsed,
                              Duration retryAfter, Instant resetTime, boolean overLimit,
                              Instant graceDeadline, boolean degraded) {
        this.allowed = allowed;
        this.value = value;
        this.error = error;
        this.message = message;
        this.tier = tier;
        this.current = current;
        this.limit = limit;
        this.remaining = remaining;
        this.percentUsed = percentUsed;
        this.retryAfter = retryAfter;
        this.resetTime = resetTime;
        this.overLimit = overLimit;
        this.graceDeadline = graceDeadline;
        this.degraded = degraded;
    }

    /**
     * @param quota null when the tier check was skipped because its store was down and the action fails open
     * @param rate  null when the action has no rate-limit rule on the tenant's tier
     */
    static <T> EnforcementResult<T> completed(T value, TierId tier, TierCheckResult quota, RateLimitResult rate) {
        boolean degraded = quota == null || (rate != null && rate.isDegraded());
        return new EnforcementResult<>(true, value, null, null, tier,
                quota == null ? -1L : quota.getCurrent(),
                quota == null ? -1L : quota.getLimit(),
                quota == null ? -1L : quota.getRemaining(),
                quota == null ? 0.0 : quota.getPercentUsed(),
                null,
                rate == null ? null : rate.getResetTime(),
                quota != null && quota.isOverLimit(),
                quota == null ? null : quota.getGraceDeadline(),
                degraded);
    }

    static <T> EnforcementResult<T> featureNotAvailable(TierId tier, String feature) {
        return denied(ErrorKind.FEATURE_NOT_AVAILABLE,
                "Feature '" + feature + "' is not available on the " + tier.getCode() + " tier", tier, false);
    }

    static <T> EnforcementResult<T> quotaDenied(TierCheckResult quota, String message) {
        return new EnforcementResult<>(false, null, quota.getError(), message, quota.getTier(),
                quota.getCurrent(), quota.getLimit(), quota.getRemaining(), quota.getPercentUsed(),
                null, null, quota.isOverLimit(), null, quota.getError() == ErrorKind.STORE_UNAVAILABLE);
    }

    static <T> EnforcementResult<T> rateLimited(TierId tier, TierCheckResult quota, RateLimitResult rate,
                                                String message) {
        return new EnforcementResult<>(false, null, rate.getError(), message, tier,
                quota == null ? -1L : quota.getCurrent(),
                rate.getLimit(),
                rate.getRemaining(),
                quota == null ? 0.0 : quota.getPercentUsed(),
                rate.getRetryAfter(),
                rate.getResetTime(),
                false, null, rate.isDegraded());
    }

    static <T> EnforcementResult<T> invalidRequest(String message) {
        return denied(ErrorKind.VALIDATION_ERROR, message, null, false);
    }

    static <T> EnforcementResult<T> storeUnavailable(TierId tier, String message) {
        return denied(ErrorKind.STORE_UNAVAILABLE, message, tier, true);
    }

    private static <T> EnforcementResult<T> denied(ErrorKind error, String message, TierId tier, boolean degraded) {
        return new EnforcementResult<>(false, null, error, message, tier, -1L, -1L, -1L, 0.0,
                null, null, false, null, degraded);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public T getValue() {
        return value;
    }

    public ErrorKind getError() {
        return error;
    }

    /**
     * @return machine-readable denial code, or null when allowed
     */
    public String getCode() {
        return error == null ? null : error.getCode();
    }

    public String getMessage() {
        return message;
    }

    public TierId getTier() {
        return tier;
    }

    public long getCurrent() {
        return current;
    }

    public long getLimit() {
        return limit;
    }

    public long getRemaining() {
        return remaining;
    }

    public double getPercentUsed() {
        return percentUsed;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public Instant getResetTime() {
        return resetTime;
    }

    public boolean isOverLimit() {
        return overLimit;
    }

    public Instant getGraceDeadline() {
        return graceDeadline;
    }

    /**
     * @return true if a store outage was absorbed by a fail-open policy or caused the denial
     */
    public boolean isDegraded() {
        return degraded;
    }

    @Override
    public String toString() {
        return allowed
                ? "EnforcementResult{allowed, tier=" + tier + ", remaining=" + remaining + "}"
                : "EnforcementResult{denied, code=" + getCode() + ", message=" + message + "}";
    }
}
