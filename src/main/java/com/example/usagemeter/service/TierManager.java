package com.example.usagemeter.service;

import com.example.usagemeter.config.TierCatalog;
import com.example.usagemeter.model.TenantSubscription;
import com.example.usagemeter.model.TierCheckResult;
import com.example.usagemeter.model.TierDefinition;
import com.example.usagemeter.model.TierId;
import com.example.usagemeter.model.TierStatus;
import com.example.usagemeter.model.UpgradeRecommendation;
import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.model.UsageLimit;
import com.example.usagemeter.model.UsageLimitStatus;
import com.example.usagemeter.subscription.SubscriptionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a tenant to its tier and enforces the tier's quotas and feature set.
 * <p>
 * The tier always comes from the {@link SubscriptionSource}. Quotas are evaluated over the
 * subscription's current billing cycle (the UTC calendar month when the source has no cycle),
 * except cumulative actions such as storage, which count every recorded delta.
 */
@Service
public class TierManager {

    private static final Logger log = LoggerFactory.getLogger(TierManager.class);

    /**
     * Upper bound for cumulative windows; covers events stamped slightly in the future.
     */
    private static final Duration CUMULATIVE_LOOKAHEAD = Duration.ofDays(1);

    private final SubscriptionSource subscriptions;
    private final UsageTracker usageTracker;
    private final TierCatalog catalog;
    private final Clock clock;

    @Autowired
    public TierManager(SubscriptionSource subscriptions, UsageTracker usageTracker, TierCatalog catalog, Clock clock) {
        this.subscriptions = subscriptions;
        this.usageTracker = usageTracker;
        this.catalog = catalog;
        this.clock = clock;
    }

    /**
     * Tenants the subscription source does not know are on the free plan.
     */
    public TenantSubscription getSubscription(String tenantId) {
        return subscriptions.getSubscription(tenantId).orElseGet(() -> TenantSubscription.defaultFree(tenantId));
    }

    public TierCheckResult checkUsageLimit(String tenantId, UsageAction action, long requestedQuantity) {
        return checkUsageLimit(getSubscription(tenantId), action, requestedQuantity);
    }

    /**
     * Quota check against an already fetched subscription.
     */
    public TierCheckResult checkUsageLimit(TenantSubscription subscription, UsageAction action, long requestedQuantity) {
        if (requestedQuantity < 0) {
            throw new IllegalArgumentException("requestedQuantity must be >= 0, got " + requestedQuantity);
        }
        String tenantId = subscription.getTenantId();
        TierId tier = subscription.getTier();

        if (!subscription.getStatus().isEntitled()) {
            log.info("Denying {} for tenant {}: subscription is {}", action.getCode(), tenantId, subscription.getStatus());
            return TierCheckResult.inactive(action, tier);
        }

        Instant now = clock.instant();
        Instant[] window = usageWindow(subscription, action, now);
        long current = usageTracker.getCurrentUsage(tenantId, action, window[0], window[1]);
        UsageLimit limit = catalog.getEffectiveLimit(tenantId, tier, action);

        if (limit.isUnlimited()) {
            return TierCheckResult.unlimited(action, tier, current);
        }

        long total = current + requestedQuantity;
        if (limit.permits(total)) {
            return TierCheckResult.withinLimit(action, tier, current, limit);
        }

        Optional<Instant> graceDeadline = graceDeadline(subscription);
        if (graceDeadline.isPresent() && now.isBefore(graceDeadline.get())) {
            UsageLimit previousLimit = catalog.getEffectiveLimit(tenantId, subscription.getPreviousTier(), action);
            if (previousLimit.permits(total)) {
                log.info("Tenant {} over {} limit on {} ({}/{}) within downgrade grace period until {}",
                        tenantId, action.getCode(), tier.getCode(), current, limit, graceDeadline.get());
                return TierCheckResult.inGracePeriod(action, tier, current, limit, graceDeadline.get());
            }
        }

        log.info("Usage limit exceeded for tenant {} on {}: {} + {} > {} ({})",
                tenantId, action.getCode(), current, requestedQuantity, limit, tier.getCode());
        return TierCheckResult.exceeded(action, tier, current, limit);
    }

    public boolean hasFeatureAccess(String tenantId, String feature) {
        return hasFeatureAccess(getSubscription(tenantId), feature);
    }

    /**
     * A feature is available if the tenant's tier grants it or the tenant has an override for it.
     */
    public boolean hasFeatureAccess(TenantSubscription subscription, String feature) {
        if (feature == null || feature.isBlank()) {
            return false;
        }
        return catalog.isFeatureEnabled(subscription.getTenantId(), subscription.getTier(), feature);
    }

    public TierStatus getTierStatus(String tenantId) {
        TenantSubscription subscription = getSubscription(tenantId);
        Instant now = clock.instant();
        Map<UsageAction, UsageLimitStatus> limits = new EnumMap<>(UsageAction.class);
        for (UsageAction action : catalog.getMeteredActions(tenantId, subscription.getTier())) {
            Instant[] window = usageWindow(subscription, action, now);
            long current = usageTracker.getCurrentUsage(tenantId, action, window[0], window[1]);
            UsageLimit limit = catalog.getEffectiveLimit(tenantId, subscription.getTier(), action);
            limits.put(action, new UsageLimitStatus(action, current, limit, action.isCumulative() ? null : window[1]));
        }
        return new TierStatus(subscription, limits, catalog.getEffectiveFeatures(tenantId, subscription.getTier()));
    }

    /**
     * One recommendation per metered action whose usage is above the configured threshold and
     * whose limit is higher on the next tier. Empty for the highest tier.
     */
    public List<UpgradeRecommendation> getUpgradeRecommendations(String tenantId) {
        TenantSubscription subscription = getSubscription(tenantId);
        TierId tier = subscription.getTier();
        Optional<TierId> next = catalog.getNextTier(tier);
        List<UpgradeRecommendation> recommendations = new ArrayList<>();
        if (next.isEmpty()) {
            return recommendations;
        }

        TierDefinition nextDefinition = catalog.getDefinition(next.get());
        Instant now = clock.instant();
        for (UsageAction action : catalog.getMeteredActions(tenantId, tier)) {
            UsageLimit limit = catalog.getEffectiveLimit(tenantId, tier, action);
            if (limit.isUnlimited()) {
                continue;
            }
            Instant[] window = usageWindow(subscription, action, now);
            long current = usageTracker.getCurrentUsage(tenantId, action, window[0], window[1]);
            double percentUsed = limit.percentUsed(current);
            UsageLimit nextLimit = nextDefinition.getLimit(action);
            if (percentUsed <= catalog.getUpgradeThresholdPercent() || !nextLimit.isGreaterThan(limit)) {
                continue;
            }

            List<String> benefits = new ArrayList<>();
            benefits.add("Increase " + action.getCode() + " limit from " + limit + " to " + nextLimit);
            for (String feature : nextDefinition.getFeatures()) {
                if (!catalog.isFeatureEnabled(tenantId, tier, feature)) {
                    benefits.add("Unlock feature " + feature);
                }
            }
            String reason = String.format(Locale.ROOT, "High %s usage: %.1f%% of the %s limit",
                    action.getCode(), percentUsed, tier.getCode());
            recommendations.add(new UpgradeRecommendation(action, reason, current, limit.getValue(), percentUsed,
                    tier, next.get(), nextLimit, benefits));
        }
        return recommendations;
    }

    private Optional<Instant> graceDeadline(TenantSubscription subscription) {
        if (!subscription.isDowngrade()) {
            return Optional.empty();
        }
        return Optional.of(subscription.getTierChangedAt().plus(catalog.getDowngradeGracePeriod()));
    }

    /**
     * Half-open {@code [start, end)} range the quota for {@code action} is measured over.
     */
    Instant[] usageWindow(TenantSubscription subscription, UsageAction action, Instant now) {
        if (action.isCumulative()) {
            return new Instant[] {Instant.EPOCH, now.plus(CUMULATIVE_LOOKAHEAD)};
        }
        Instant start = subscription.getCycleStart();
        Instant end = subscription.getCycleEnd();
        if (start != null && !start.isAfter(now)) {
            if (end == null) {
                return monthlyCycleContaining(start, now);
            }
            if (now.isBefore(end)) {
                return new Instant[] {start, end};
            }
        }
        YearMonth month = YearMonth.from(now.atZone(ZoneOffset.UTC));
        return new Instant[] {
                month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant(),
                month.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant()
        };
    }

    /**
     * An open-ended cycle renews monthly on its anchor day: the period is the whole number of months
     * since {@code anchor} that {@code now} falls into.
     */
    private static Instant[] monthlyCycleContaining(Instant anchor, Instant now) {
        ZonedDateTime anchorUtc = anchor.atZone(ZoneOffset.UTC);
        long elapsed = ChronoUnit.MONTHS.between(anchorUtc, now.atZone(ZoneOffset.UTC));
        return new Instant[] {
                anchorUtc.plusMonths(elapsed).toInstant(),
                anchorUtc.plusMonths(elapsed + 1).toInstant()
        };
    }
}
