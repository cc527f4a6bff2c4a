package com.example.usagemeter.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of a tenant's plan: tier, status, per-action quota usage and effective features.
 */
public class TierStatus {

    private final TenantSubscription subscription;
    private final Map<UsageAction, UsageLimitStatus> limits;
    private final Set<String> features;

    public TierStatus(TenantSubscription subscription, Map<UsageAction, UsageLimitStatus> limits,
                      Set<String> features) {
        this.subscription = subscription;
        EnumMap<UsageAction, UsageLimitStatus> copy = new EnumMap<>(UsageAction.class);
        copy.putAll(limits);
        this.limits = Collections.unmodifiableMap(copy);
        this.features = Collections.unmodifiableSet(new LinkedHashSet<>(features));
    }

    public TenantSubscription getSubscription() {
        return subscription;
    }

    public TierId getTier() {
        return subscription.getTier();
    }

    public SubscriptionStatus getStatus() {
        return subscription.getStatus();
    }

    public Map<UsageAction, UsageLimitStatus> getLimits() {
        return limits;
    }

    public Set<String> getFeatures() {
        return features;
    }
}
