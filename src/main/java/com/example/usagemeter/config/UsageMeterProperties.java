package com.example.usagemeter.config;

import com.example.usagemeter.model.RateLimitAlgorithm;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw configuration as bound from {@code usage-meter.*}. Tier data is validated and frozen by
 * {@link TierCatalog}; nothing reads the tier maps from here at request time.
 * <p>
 * Map keys that are tenant ids containing characters other than letters, digits and '-' must be
 * written in bracket notation ({@code "[tenant_42]"}) so they survive relaxed binding.
 */
@Component
@ConfigurationProperties(prefix = "usage-meter")
public class UsageMeterProperties {

    private RateLimiter rateLimiter = new RateLimiter();

    private Tracker tracker = new Tracker();

    /**
     * Tier id to tier configuration.
     */
    private Map<String, Tier> tiers = new LinkedHashMap<>();

    /**
     * How long usage above a lower tier's limit is tolerated after a downgrade. Required.
     */
    private Duration downgradeGracePeriod;

    /**
     * Percent of a quota above which an upgrade is recommended.
     */
    private double upgradeThresholdPercent = 80.0;

    /**
     * Tenant id to features granted on top of the tenant's tier.
     */
    private Map<String, Set<String>> featureOverrides = new LinkedHashMap<>();

    /**
     * Tenant id to action to limit, replacing the tier limit for that tenant.
     */
    private Map<String, Map<String, String>> limitOverrides = new LinkedHashMap<>();

    /**
     * Action to the feature a protected invocation of that action requires.
     */
    private Map<String, String> requiredFeatures = new LinkedHashMap<>();

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public void setRateLimiter(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    public Tracker getTracker() {
        return tracker;
    }

    public void setTracker(Tracker tracker) {
        this.tracker = tracker;
    }

    public Map<String, Tier> getTiers() {
        return tiers;
    }

    public void setTiers(Map<String, Tier> tiers) {
        this.tiers = tiers;
    }

    public Duration getDowngradeGracePeriod() {
        return downgradeGracePeriod;
    }

    public void setDowngradeGracePeriod(Duration downgradeGracePeriod) {
        this.downgradeGracePeriod = downgradeGracePeriod;
    }

    public double getUpgradeThresholdPercent() {
        return upgradeThresholdPercent;
    }

    public void setUpgradeThresholdPercent(double upgradeThresholdPercent) {
        this.upgradeThresholdPercent = upgradeThresholdPercent;
    }

    public Map<String, Set<String>> getFeatureOverrides() {
        return featureOverrides;
    }

    public void setFeatureOverrides(Map<String, Set<String>> featureOverrides) {
        this.featureOverrides = featureOverrides;
    }

    public Map<String, Map<String, String>> getLimitOverrides() {
        return limitOverrides;
    }

    public void setLimitOverrides(Map<String, Map<String, String>> limitOverrides) {
        this.limitOverrides = limitOverrides;
    }

    public Map<String, String> getRequiredFeatures() {
        return requiredFeatures;
    }

    public void setRequiredFeatures(Map<String, String> requiredFeatures) {
        this.requiredFeatures = requiredFeatures;
    }

    public static class RateLimiter {

        /**
         * Prefix of every counter key owned by the rate limiter.
         */
        private String keyPrefix = "rate_limiter";

        /**
         * Actions whose checks are admitted when the counter store is unavailable.
         * Every other action is rejected in that case.
         */
        private Set<String> failOpenActions = new LinkedHashSet<>();

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Set<String> getFailOpenActions() {
            return failOpenActions;
        }

        public void setFailOpenActions(Set<String> failOpenActions) {
            this.failOpenActions = failOpenActions;
        }
    }

    public static class Tracker {

        private long maxQuantityPerEvent = 1_000_000_000L;

        /**
         * Upper bound on the JSON-serialized size of an event's metadata.
         */
        private int maxMetadataBytes = 4096;

        /**
         * String metadata values longer than this are truncated during sanitization.
         */
        private int maxMetadataStringLength = 1000;

        /**
         * Oldest accepted event timestamp, relative to now.
         */
        private Duration maxBacklog = Duration.ofDays(7);

        /**
         * How far in the future an event timestamp may be.
         */
        private Duration clockSkewTolerance = Duration.ofMinutes(5);

        /**
         * Consecutive ledger write failures before the ledger is reported unhealthy.
         */
        private int failureAlertThreshold = 5;

        public long getMaxQuantityPerEvent() {
            return maxQuantityPerEvent;
        }

        public void setMaxQuantityPerEvent(long maxQuantityPerEvent) {
            this.maxQuantityPerEvent = maxQuantityPerEvent;
        }

        public int getMaxMetadataBytes() {
            return maxMetadataBytes;
        }

        public void setMaxMetadataBytes(int maxMetadataBytes) {
            this.maxMetadataBytes = maxMetadataBytes;
        }

        public int getMaxMetadataStringLength() {
            return maxMetadataStringLength;
        }

        public void setMaxMetadataStringLength(int maxMetadataStringLength) {
            this.maxMetadataStringLength = maxMetadataStringLength;
        }

        public Duration getMaxBacklog() {
            return maxBacklog;
        }

        public void setMaxBacklog(Duration maxBacklog) {
            this.maxBacklog = maxBacklog;
        }

        public Duration getClockSkewTolerance() {
            return clockSkewTolerance;
        }

        public void setClockSkewTolerance(Duration clockSkewTolerance) {
            this.clockSkewTolerance = clockSkewTolerance;
        }

        public int getFailureAlertThreshold() {
            return failureAlertThreshold;
        }

        public void setFailureAlertThreshold(int failureAlertThreshold) {
            this.failureAlertThreshold = failureAlertThreshold;
        }
    }

    public static class Tier {

        /**
         * Action to limit: a non-negative integer or {@code unlimited}.
         */
        private Map<String, String> limits = new LinkedHashMap<>();

        private List<String> features = new ArrayList<>();

        /**
         * Action to the windows it is limited by. Every rule applies at once, so a tenant can be held
         * to 30 a minute and 2000 a day.
         */
        private Map<String, List<RateLimitRule>> rateLimits = new LinkedHashMap<>();

        public Map<String, String> getLimits() {
            return limits;
        }

        public void setLimits(Map<String, String> limits) {
            this.limits = limits;
        }

        public List<String> getFeatures() {
            return features;
        }

        public void setFeatures(List<String> features) {
            this.features = features;
        }

        public Map<String, List<RateLimitRule>> getRateLimits() {
            return rateLimits;
        }

        public void setRateLimits(Map<String, List<RateLimitRule>> rateLimits) {
            this.rateLimits = rateLimits;
        }
    }

    public static class RateLimitRule {

        private long limit;

        private Duration window = Duration.ofMinutes(1);

        private RateLimitAlgorithm algorithm = RateLimitAlgorithm.FIXED_WINDOW;

        public long getLimit() {
            return limit;
        }

        public void setLimit(long limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public RateLimitAlgorithm getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(RateLimitAlgorithm algorithm) {
            this.algorithm = algorithm;
        }
    }
}
