package com.example.usagemeter.model;

import java.util.Collections;
import java.util.List;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Validated, immutable description of one subscription tier.
 * <p>
 * An action without an entry in {@link #getLimits()} carries no quota on this tier.
 */
public class TierDefinition {

    private final TierId id;
    private final Map<UsageAction, UsageLimit> limits;
    private final Set<String> features;
    private final Map<UsageAction, List<RateLimitRule>> rateLimits;

    public TierDefinition(TierId id,
                          Map<UsageAction, UsageLimit> limits,
                          Set<String> features,
                          Map<UsageAction, List<RateLimitRule>> rateLimits) {
        this.id = id;
        this.limits = Collections.unmodifiableMap(limits.isEmpty()
                ? new EnumMap<>(UsageAction.class) : new EnumMap<>(limits));
        this.features = Collections.unmodifiableSet(new LinkedHashSet<>(features));
        Map<UsageAction, List<RateLimitRule>> rules = new EnumMap<>(UsageAction.class);
        rateLimits.forEach((action, list) -> rules.put(action, List.copyOf(list)));
        this.rateLimits = Collections.unmodifiableMap(rules);
    }

    public TierId getId() {
        return id;
    }

    public Map<UsageAction, UsageLimit> getLimits() {
        return limits;
    }

    public UsageLimit getLimit(UsageAction action) {
        return limits.getOrDefault(action, UsageLimit.unlimited());
    }

    public Set<String> getFeatures() {
        return features;
    }

    /**
     * Rules for {@code action}, shortest window first. Empty when the action is not rate limited.
     */
    public List<RateLimitRule> getRateLimits(UsageAction action) {
        return rateLimits.getOrDefault(action, List.of());
    }

    public Map<UsageAction, List<RateLimitRule>> getRateLimits() {
        return rateLimits;
    }
}
