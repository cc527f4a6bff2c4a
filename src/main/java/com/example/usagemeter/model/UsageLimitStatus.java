package com.example.usagemeter.model;

import java.time.Instant;

public class UsageLimitStatus {

    private final UsageAction action;
    private final long current;
    private final UsageLimit limit;
    private final Instant resetDate;

    public UsageLimitStatus(UsageAction action, long current, UsageLimit limit, Instant resetDate) {
        this.action = action;
        this.current = current;
        this.limit = limit;
        this.resetDate = resetDate;
    }

    public UsageAction getAction() {
        return action;
    }

    public long getCurrent() {
        return current;
    }

    public UsageLimit getLimit() {
        return limit;
    }

    public long getRemaining() {
        return limit.isUnlimited() ? -1L : Math.max(0L, limit.getValue() - current);
    }

    public double getPercentUsed() {
        return limit.percentUsed(current);
    }

    /**
     * @return when the quota window resets, or null for cumulative quotas that never reset
     */
    public Instant getResetDate() {
        return resetDate;
    }
}
