package com.example.usagemeter.model;

import java.time.Instant;

/**
 * Outcome of a quota check. Denials are values, never exceptions.
 * <p>
 * For unlimited quotas {@code limit} and {@code remaining} are reported as -1 and
 * {@code percentUsed} as 0.
 */
public class TierCheckResult {

    private final boolean allowed;
    private final ErrorKind error;
    private final UsageAction action;
    private final TierId tier;
    private final long current;
    private final long limit;
    private final long remaining;
    private final double percentUsed;
    private final boolean unlimited;
    private final boolean overLimit;
    private final Instant graceDeadline;

    private TierCheckResult(boolean allowed, ErrorKind error, UsageAction action, TierId tier, long current,
                            long limit, long remaining, double percentUsed, boolean unlimited,
                            boolean overLimit, Instant graceDeadline) {
        this.allowed = allowed;
        this.error = error;
        this.action = action;
        this.tier = tier;
        this.current = current;
        this.limit = limit;
        this.remaining = remaining;
        this.percentUsed = percentUsed;
        this.unlimited = unlimited;
        this.overLimit = overLimit;
        this.graceDeadline = graceDeadline;
    }

    public static TierCheckResult unlimited(UsageAction action, TierId tier, long current) {
        return new TierCheckResult(true, null, action, tier, current, -1L, -1L, 0.0, true, false, null);
    }

    public static TierCheckResult withinLimit(UsageAction action, TierId tier, long current, UsageLimit limit) {
        long ceiling = limit.getValue();
        return new TierCheckResult(true, null, action, tier, current, ceiling, Math.max(0L, ceiling - current),
                limit.percentUsed(current), false, false, null);
    }

    /**
     * Allowed while a downgrade grace period is running even though the new tier's limit is exceeded.
     */
    public static TierCheckResult inGracePeriod(UsageAction action, TierId tier, long current, UsageLimit limit,
                                                Instant graceDeadline) {
        long ceiling = limit.getValue();
        return new TierCheckResult(true, null, action, tier, current, ceiling, Math.max(0L, ceiling - current),
                limit.percentUsed(current), false, true, graceDeadline);
    }

    public static TierCheckResult exceeded(UsageAction action, TierId tier, long current, UsageLimit limit) {
        long ceiling = limit.getValue();
        return new TierCheckResult(false, ErrorKind.USAGE_LIMIT_EXCEEDED, action, tier, current, ceiling,
                Math.max(0L, ceiling - current), limit.percentUsed(current), false, current >= ceiling, null);
    }

    public static TierCheckResult inactive(UsageAction action, TierId tier) {
        return new TierCheckResult(false, ErrorKind.SUBSCRIPTION_INACTIVE, action, tier, 0L, 0L, 0L, 0.0,
                false, false, null);
    }

    public static TierCheckResult storeUnavailable(UsageAction action, TierId tier) {
        return new TierCheckResult(false, ErrorKind.STORE_UNAVAILABLE, action, tier, 0L, 0L, 0L, 0.0,
                false, false, null);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public ErrorKind getError() {
        return error;
    }

    public UsageAction getAction() {
        return action;
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

    public boolean isUnlimited() {
        return unlimited;
    }

    public boolean isOverLimit() {
        return overLimit;
    }

    public Instant getGraceDeadline() {
        return graceDeadline;
    }
}
