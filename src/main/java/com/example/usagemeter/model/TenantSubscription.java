package com.example.usagemeter.model;

import java.time.Instant;

/**
 * Subscription facts for a tenant as reported by the subscription source. Read-only here.
 */
public class TenantSubscription {

    private final String tenantId;
    private final TierId tier;
    private final TierId previousTier;
    private final SubscriptionStatus status;
    private final Instant cycleStart;
    private final Instant cycleEnd;
    private final Instant tierChangedAt;

    public TenantSubscription(String tenantId, TierId tier, TierId previousTier, SubscriptionStatus status,
                              Instant cycleStart, Instant cycleEnd, Instant tierChangedAt) {
        this.tenantId = tenantId;
        this.tier = tier;
        this.previousTier = previousTier;
        this.status = status;
        this.cycleStart = cycleStart;
        this.cycleEnd = cycleEnd;
        this.tierChangedAt = tierChangedAt;
    }

    /**
     * Tenants unknown to the subscription source run on the free plan.
     */
    public static TenantSubscription defaultFree(String tenantId) {
        return new TenantSubscription(tenantId, TierId.FREE, null, SubscriptionStatus.ACTIVE, null, null, null);
    }

    public String getTenantId() {
        return tenantId;
    }

    public TierId getTier() {
        return tier;
    }

    /**
     * @return the tier held before {@link #getTierChangedAt()}, or null if the tier never changed
     */
    public TierId getPreviousTier() {
        return previousTier;
    }

    public SubscriptionStatus getStatus() {
        return status;
    }

    public Instant getCycleStart() {
        return cycleStart;
    }

    public Instant getCycleEnd() {
        return cycleEnd;
    }

    public Instant getTierChangedAt() {
        return tierChangedAt;
    }

    public boolean isDowngrade() {
        return previousTier != null && tierChangedAt != null && previousTier.isHigherThan(tier);
    }
}
