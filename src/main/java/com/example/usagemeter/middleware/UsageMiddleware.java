package com.example.usagemeter.middleware;

import com.example.usagemeter.config.TierCatalog;
import com.example.usagemeter.model.RateLimitResult;
import com.example.usagemeter.model.RateLimitRule;
import com.example.usagemeter.model.RateLimitStatus;
import com.example.usagemeter.model.TenantSubscription;
import com.example.usagemeter.model.TierCheckResult;
import com.example.usagemeter.model.TierId;
import com.example.usagemeter.model.TrackResult;
import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.model.UsageEvent;
import com.example.usagemeter.service.RateLimiterService;
import com.example.usagemeter.service.TierManager;
import com.example.usagemeter.service.UsageTracker;
import com.example.usagemeter.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wraps a protected operation with usage controls.
 * <p>
 * Checks run cheapest first: request metadata size and feature gate (in memory), tier quota (one
 * ledger aggregate read), rate limits (one counter-store round trip per configured window). A denial returns an {@link EnforcementResult} and the
 * operation is never invoked. After the operation succeeds its usage is recorded best-effort; if it
 * throws, a zero-quantity failure event is recorded and the original exception is rethrown.
 */
@Component
public class UsageMiddleware {

    private static final Logger log = LoggerFactory.getLogger(UsageMiddleware.class);

    private static final String PROCESSING_TIME_MS = "processingTimeMs";
    private static final String RATE_LIMIT_USED = "rateLimitUsed";

    private final TierManager tierManager;
    private final RateLimiterService rateLimiter;
    private final UsageTracker usageTracker;
    private final TierCatalog catalog;
    private final Clock clock;

    @Autowired
    public UsageMiddleware(TierManager tierManager,
                           RateLimiterService rateLimiter,
                           UsageTracker usageTracker,
                           TierCatalog catalog,
                           Clock clock) {
        this.tierManager = tierManager;
        this.rateLimiter = rateLimiter;
        this.usageTracker = usageTracker;
        this.catalog = catalog;
        this.clock = clock;
    }

    public <T, E extends Exception> EnforcementResult<T> enforceAndRun(String tenantId, UsageAction action, long quantity,
                                                                       ProtectedOperation<T, E> operation) throws E {
        return enforceAndRun(UsageRequest.of(tenantId, action, quantity), operation);
    }

    public <T, E extends Exception> EnforcementResult<T> enforceAndRun(UsageRequest request,
                                                                       ProtectedOperation<T, E> operation) throws E {
        String tenantId = request.getTenantId();
        UsageAction action = request.getAction();
        boolean failOpen = rateLimiter.isFailOpen(action);

        if (!usageTracker.fitsMetadataLimit(largestRecordedMetadata(request))) {
            log.warn("Rejecting {} for tenant {}: request metadata leaves no room in the usage event",
                    action.getCode(), tenantId);
            return EnforcementResult.invalidRequest("Request metadata exceeds the size a usage event can record");
        }

        TenantSubscription subscription;
        try {
            subscription = tierManager.getSubscription(tenantId);
        } catch (StoreUnavailableException ex) {
            if (!failOpen) {
                log.warn("Subscription lookup failed for tenant {}; denying {} (fail-closed)", tenantId, action.getCode(), ex);
                return EnforcementResult.storeUnavailable(null, "Usage enforcement is temporarily unavailable");
            }
            log.warn("Subscription lookup failed for tenant {}; enforcing {} against the free tier (fail-open)",
                    tenantId, action.getCode(), ex);
            subscription = TenantSubscription.defaultFree(tenantId);
        }
        TierId tier = subscription.getTier();

        // 1. feature gate
        Optional<String> requiredFeature = catalog.getRequiredFeature(action);
        if (requiredFeature.isPresent() && !tierManager.hasFeatureAccess(subscription, requiredFeature.get())) {
            log.debug("Tenant {} lacks feature {} required by {}", tenantId, requiredFeature.get(), action.getCode());
            return EnforcementResult.featureNotAvailable(tier, requiredFeature.get());
        }

        // 2. tier quota
        TierCheckResult quota;
        try {
            quota = tierManager.checkUsageLimit(subscription, action, request.getQuantity());
        } catch (StoreUnavailableException ex) {
            if (!failOpen) {
                log.warn("Usage ledger unavailable for quota check of tenant {} action {}; denying (fail-closed)",
                        tenantId, action.getCode(), ex);
                return EnforcementResult.quotaDenied(TierCheckResult.storeUnavailable(action, tier),
                        "Usage enforcement is temporarily unavailable");
            }
            log.warn("Usage ledger unavailable for quota check of tenant {} action {}; skipping (fail-open)",
                    tenantId, action.getCode(), ex);
            quota = null;
        }
        if (quota != null && !quota.isAllowed()) {
            return EnforcementResult.quotaDenied(quota, quotaMessage(quota));
        }

        // 3. rate limits, shortest window first
        List<RateLimitResult> rates = new ArrayList<>();
        for (RateLimitRule rule : catalog.getRateLimitRules(tier, action)) {
            RateLimitResult result = rateLimiter.check(tenantId, action, rule.getLimit(), rule.getWindowSeconds(),
                    rule.getAlgorithm());
            if (!result.isAllowed()) {
                return EnforcementResult.rateLimited(tier, quota, result, rateMessage(action, result));
            }
            rates.add(result);
        }
        RateLimitResult rate = tightest(rates);

        // 4. operation
        long started = clock.millis();
        T value;
        try {
            value = operation.run();
        } catch (Exception ex) {
            recordFailedOperation(request, ex, clock.millis() - started);
            throw ex;
        }

        // 5. best-effort metering
        recordUsage(request, rate, clock.millis() - started);
        return EnforcementResult.completed(value, tier, quota, rate);
    }

    /**
     * Tier status, month-to-date statistics, rate-limit counters and upgrade recommendations.
     * Counter-store problems only drop the rate-limit part.
     */
    public UsageSummary getUsageSummary(String tenantId) {
        TenantSubscription subscription = tierManager.getSubscription(tenantId);
        List<RateLimitStatus> rateLimits = new ArrayList<>();
        try {
            for (Map.Entry<UsageAction, List<RateLimitRule>> entry
                    : catalog.getDefinition(subscription.getTier()).getRateLimits().entrySet()) {
                for (RateLimitRule rule : entry.getValue()) {
                    rateLimits.add(rateLimiter.getStatus(tenantId, entry.getKey(), rule.getLimit(),
                            rule.getWindowSeconds(), rule.getAlgorithm()));
                }
            }
        } catch (StoreUnavailableException ex) {
            log.warn("Counter store unavailable; usage summary for tenant {} omits rate limits", tenantId, ex);
            rateLimits.clear();
        }
        YearMonth month = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        return new UsageSummary(
                tierManager.getTierStatus(tenantId),
                usageTracker.getMonthlyUsage(tenantId, month),
                rateLimits,
                tierManager.getUpgradeRecommendations(tenantId));
    }

    private void recordUsage(UsageRequest request, RateLimitResult rate, long processingTimeMs) {
        UsageEvent.Builder event = baseEvent(request)
                .quantity(request.getQuantity())
                .metadata(request.getMetadata())
                .metadata(PROCESSING_TIME_MS, processingTimeMs)
                .idempotencyKey(request.getIdempotencyKey());
        if (rate != null && !rate.isDegraded()) {
            event.metadata(RATE_LIMIT_USED, rate.getLimit() - rate.getRemaining());
        }
        track(event.build());
    }

    private void recordFailedOperation(UsageRequest request, Exception failure, long processingTimeMs) {
        Map<String, Object> metadata = new LinkedHashMap<>(request.getMetadata());
        metadata.put("failed", true);
        metadata.put(PROCESSING_TIME_MS, processingTimeMs);
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        metadata.put("error", fitErrorMessage(metadata, message));
        UsageEvent event = baseEvent(request)
                .quantity(0L)
                .metadata(metadata)
                .build();
        track(event);
    }

    /**
     * The most metadata the success event for {@code request} can carry. The failure event with an
     * empty {@code error} is smaller, so its message can always be shortened to fit.
     */
    private static Map<String, Object> largestRecordedMetadata(UsageRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>(request.getMetadata());
        metadata.put(PROCESSING_TIME_MS, Long.MAX_VALUE);
        metadata.put(RATE_LIMIT_USED, Long.MAX_VALUE);
        return metadata;
    }

    /**
     * Cuts {@code message} to the metadata string length, then halves it until the event fits.
     */
    private String fitErrorMessage(Map<String, Object> metadata, String message) {
        Map<String, Object> candidate = new LinkedHashMap<>(metadata);
        String error = truncate(message, usageTracker.getMaxMetadataStringLength());
        candidate.put("error", error);
        while (!error.isEmpty() && !usageTracker.fitsMetadataLimit(candidate)) {
            error = truncate(error, error.length() / 2);
            candidate.put("error", error);
        }
        return error;
    }

    private static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        int end = Math.max(0, maxLength);
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * The admitting result with the least headroom. A degraded admission wins, since it means
     * that window was not counted.
     */
    private static RateLimitResult tightest(List<RateLimitResult> rates) {
        RateLimitResult tightest = null;
        for (RateLimitResult rate : rates) {
            if (rate.isDegraded()) {
                return rate;
            }
            if (tightest == null || rate.getRemaining() < tightest.getRemaining()) {
                tightest = rate;
            }
        }
        return tightest;
    }

    private UsageEvent.Builder baseEvent(UsageRequest request) {
        return UsageEvent.builder()
                .tenantId(request.getTenantId())
                .action(request.getAction())
                .resourceType(request.getResourceType())
                .resourceId(request.getResourceId());
    }

    private void track(UsageEvent event) {
        try {
            TrackResult result = usageTracker.trackUsage(event);
            if (!result.isSuccess()) {
                log.warn("Usage event for tenant {} action {} not recorded: {} {}",
                        event.getTenantId(), event.getActionCode(), result.getError(), result.getErrors());
            }
        } catch (RuntimeException ex) {
            log.error("Usage logging failed for tenant {} action {}", event.getTenantId(), event.getActionCode(), ex);
        }
    }

    private static String quotaMessage(TierCheckResult quota) {
        switch (quota.getError()) {
            case SUBSCRIPTION_INACTIVE:
                return "Subscription is not active";
            case USAGE_LIMIT_EXCEEDED:
                return "Usage limit reached for " + quota.getAction().getCode() + ": " + quota.getCurrent()
                        + " of " + quota.getLimit() + " used on the " + quota.getTier().getCode() + " tier";
            default:
                return "Usage enforcement is temporarily unavailable";
        }
    }

    private static String rateMessage(UsageAction action, RateLimitResult rate) {
        if (rate.getRetryAfter() == null) {
            return "Rate limit exceeded for " + action.getCode();
        }
        long seconds = Math.max(1L, (rate.getRetryAfter().toMillis() + 999L) / 1000L);
        return rate.isDegraded()
                ? "Rate limiting is temporarily unavailable; retry in " + seconds + "s"
                : "Rate limit exceeded for " + action.getCode() + "; retry in " + seconds + "s";
    }
}
