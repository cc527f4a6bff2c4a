package com.example.usagemeter.config;

import com.example.usagemeter.model.RateLimitRule;
import com.example.usagemeter.model.TierDefinition;
import com.example.usagemeter.model.TierId;
import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.model.UsageLimit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable tier table built once from {@link UsageMeterProperties}.
 * <p>
 * All validation happens in the constructor: an unknown tier or action code, a negative limit,
 * a non-positive rate-limit rule or a missing grace period aborts startup with
 * {@link TierConfigurationException}. Lookups afterwards never re-check the data.
 */
@Component
public class TierCatalog {

    private static final Logger log = LoggerFactory.getLogger(TierCatalog.class);

    private final Map<TierId, TierDefinition> tiers;
    private final Map<String, Map<UsageAction, UsageLimit>> limitOverrides;
    private final Map<String, Set<String>> featureOverrides;
    private final Map<UsageAction, String> requiredFeatures;
    private final Duration downgradeGracePeriod;
    private final double upgradeThresholdPercent;

    @Autowired
    public TierCatalog(UsageMeterProperties properties) {
        this.tiers = Collections.unmodifiableMap(buildTiers(properties.getTiers()));
        this.limitOverrides = Collections.unmodifiableMap(buildLimitOverrides(properties.getLimitOverrides()));
        this.featureOverrides = Collections.unmodifiableMap(buildFeatureOverrides(properties.getFeatureOverrides()));
        this.requiredFeatures = Collections.unmodifiableMap(buildRequiredFeatures(properties.getRequiredFeatures()));

        Duration grace = properties.getDowngradeGracePeriod();
        if (grace == null) {
            throw new TierConfigurationException("usage-meter.downgrade-grace-period must be configured");
        }
        if (grace.isNegative()) {
            throw new TierConfigurationException("usage-meter.downgrade-grace-period must not be negative: " + grace);
        }
        this.downgradeGracePeriod = grace;

        double threshold = properties.getUpgradeThresholdPercent();
        // percent used is capped at 100, so a threshold of 100 could never be exceeded
        if (threshold <= 0.0 || threshold >= 100.0) {
            throw new TierConfigurationException("usage-meter.upgrade-threshold-percent must be in (0, 100): " + threshold);
        }
        this.upgradeThresholdPercent = threshold;

        log.info("Loaded tier catalog: tiers={} limitOverrides={} featureOverrides={} gracePeriod={}",
                tiers.keySet(), limitOverrides.size(), featureOverrides.size(), downgradeGracePeriod);
    }

    public TierDefinition getDefinition(TierId tier) {
        return tiers.get(tier);
    }

    /**
     * Tenant override first, then the tier's own limit. Actions without either carry no quota.
     */
    public UsageLimit getEffectiveLimit(String tenantId, TierId tier, UsageAction action) {
        Map<UsageAction, UsageLimit> overrides = limitOverrides.get(tenantId);
        if (overrides != null && overrides.containsKey(action)) {
            return overrides.get(action);
        }
        return tiers.get(tier).getLimit(action);
    }

    /**
     * Actions with a quota for this tenant, in declaration order.
     */
    public Set<UsageAction> getMeteredActions(String tenantId, TierId tier) {
        Set<UsageAction> actions = new LinkedHashSet<>(tiers.get(tier).getLimits().keySet());
        Map<UsageAction, UsageLimit> overrides = limitOverrides.get(tenantId);
        if (overrides != null) {
            actions.addAll(overrides.keySet());
        }
        return actions;
    }

    public boolean isFeatureEnabled(String tenantId, TierId tier, String feature) {
        if (tiers.get(tier).getFeatures().contains(feature)) {
            return true;
        }
        Set<String> extra = featureOverrides.get(tenantId);
        return extra != null && extra.contains(feature);
    }

    public Set<String> getEffectiveFeatures(String tenantId, TierId tier) {
        Set<String> features = new LinkedHashSet<>(tiers.get(tier).getFeatures());
        features.addAll(featureOverrides.getOrDefault(tenantId, Collections.emptySet()));
        return features;
    }

    /**
     * Every window {@code action} is limited by on {@code tier}, shortest first.
     */
    public List<RateLimitRule> getRateLimitRules(TierId tier, UsageAction action) {
        return tiers.get(tier).getRateLimits(action);
    }

    public Optional<String> getRequiredFeature(UsageAction action) {
        return Optional.ofNullable(requiredFeatures.get(action));
    }

    /**
     * @return the tier directly above, or empty for the highest tier
     */
    public Optional<TierId> getNextTier(TierId tier) {
        TierId[] all = TierId.values();
        int next = tier.ordinal() + 1;
        return next < all.length ? Optional.of(all[next]) : Optional.empty();
    }

    public Duration getDowngradeGracePeriod() {
        return downgradeGracePeriod;
    }

    public double getUpgradeThresholdPercent() {
        return upgradeThresholdPercent;
    }

    private static Map<TierId, TierDefinition> buildTiers(Map<String, UsageMeterProperties.Tier> raw) {
        Map<TierId, TierDefinition> result = new EnumMap<>(TierId.class);
        for (Map.Entry<String, UsageMeterProperties.Tier> entry : raw.entrySet()) {
            TierId id = TierId.fromCode(entry.getKey())
                    .orElseThrow(() -> new TierConfigurationException("Unknown tier id: " + entry.getKey()));
            UsageMeterProperties.Tier tier = entry.getValue();
            Map<UsageAction, UsageLimit> limits = parseLimits("tier " + id.getCode(), tier.getLimits());
            Map<UsageAction, List<RateLimitRule>> rules = new EnumMap<>(UsageAction.class);
            for (Map.Entry<String, List<UsageMeterProperties.RateLimitRule>> ruleEntry
                    : tier.getRateLimits().entrySet()) {
                UsageAction action = parseAction("tier " + id.getCode() + " rate-limits", ruleEntry.getKey());
                rules.put(action, toRules(id, action, ruleEntry.getValue()));
            }
            Set<String> features = new LinkedHashSet<>(tier.getFeatures());
            result.put(id, new TierDefinition(id, limits, features, rules));
        }
        for (TierId id : TierId.values()) {
            if (!result.containsKey(id)) {
                throw new TierConfigurationException("Tier '" + id.getCode() + "' is not configured");
            }
        }
        return result;
    }

    private static List<RateLimitRule> toRules(TierId tier, UsageAction action,
                                               List<UsageMeterProperties.RateLimitRule> raw) {
        List<RateLimitRule> rules = new ArrayList<>();
        Set<String> windows = new HashSet<>();
        for (UsageMeterProperties.RateLimitRule rule : raw) {
            RateLimitRule parsed = toRule(tier, action, rule);
            // window and algorithm together name the counter key
            if (!windows.add(parsed.getWindowSeconds() + ":" + parsed.getAlgorithm())) {
                throw new TierConfigurationException("Rate limit for " + tier.getCode() + "/" + action.getCode()
                        + " declares the " + parsed.getWindow() + " " + parsed.getAlgorithm() + " window twice");
            }
            rules.add(parsed);
        }
        rules.sort(Comparator.comparing(RateLimitRule::getWindow));
        return rules;
    }

    private static RateLimitRule toRule(TierId tier, UsageAction action, UsageMeterProperties.RateLimitRule raw) {
        if (raw == null) {
            throw new TierConfigurationException("Empty rate limit rule for " + tier.getCode() + "/" + action.getCode());
        }
        if (raw.getLimit() <= 0) {
            throw new TierConfigurationException("Rate limit for " + tier.getCode() + "/" + action.getCode()
                    + " must be positive, got " + raw.getLimit());
        }
        if (raw.getWindow() == null || raw.getWindow().getSeconds() < 1) {
            throw new TierConfigurationException("Rate limit window for " + tier.getCode() + "/" + action.getCode()
                    + " must be at least one second, got " + raw.getWindow());
        }
        if (raw.getAlgorithm() == null) {
            throw new TierConfigurationException("Rate limit algorithm for " + tier.getCode() + "/"
                    + action.getCode() + " is missing");
        }
        return new RateLimitRule(raw.getLimit(), raw.getWindow(), raw.getAlgorithm());
    }

    private static Map<String, Map<UsageAction, UsageLimit>> buildLimitOverrides(Map<String, Map<String, String>> raw) {
        Map<String, Map<UsageAction, UsageLimit>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, String>> entry : raw.entrySet()) {
            result.put(entry.getKey(), Collections.unmodifiableMap(
                    parseLimits("limit override for tenant " + entry.getKey(), entry.getValue())));
        }
        return result;
    }

    private static Map<String, Set<String>> buildFeatureOverrides(Map<String, Set<String>> raw) {
        Map<String, Set<String>> result = new HashMap<>();
        raw.forEach((tenant, features) ->
                result.put(tenant, Collections.unmodifiableSet(new LinkedHashSet<>(features))));
        return result;
    }

    private static Map<UsageAction, String> buildRequiredFeatures(Map<String, String> raw) {
        Map<UsageAction, String> result = new EnumMap<>(UsageAction.class);
        raw.forEach((code, feature) -> result.put(parseAction("required-features", code), feature));
        return result;
    }

    private static Map<UsageAction, UsageLimit> parseLimits(String context, Map<String, String> raw) {
        Map<UsageAction, UsageLimit> limits = new EnumMap<>(UsageAction.class);
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            UsageAction action = parseAction(context, entry.getKey());
            try {
                limits.put(action, UsageLimit.parse(entry.getValue()));
            } catch (IllegalArgumentException ex) {
                throw new TierConfigurationException("Invalid limit in " + context + " for action '"
                        + entry.getKey() + "'", ex);
            }
        }
        return limits;
    }

    private static UsageAction parseAction(String context, String code) {
        return UsageAction.fromCode(code)
                .orElseThrow(() -> new TierConfigurationException("Unknown action '" + code + "' in " + context));
    }
}
