package com.example.usagemeter.service;

import com.example.usagemeter.config.TierConfigurationException;
import com.example.usagemeter.config.UsageMeterProperties;
import com.example.usagemeter.model.RateLimitAlgorithm;
import com.example.usagemeter.model.RateLimitResult;
import com.example.usagemeter.model.RateLimitStatus;
import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.store.CounterSnapshot;
import com.example.usagemeter.store.CounterStore;
import com.example.usagemeter.store.SlidingWindowSnapshot;
import com.example.usagemeter.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Stateless service that evaluates per-tenant, per-action rate limits against the shared
 * {@link CounterStore}.
 *
 * All concurrency control lives inside the store's atomic operations. This service is mostly responsible for:
 *  - building the counter key
 *  - picking the fixed or sliding window primitive
 *  - translating the store answer into a domain-level decision
 *  - defining the behavior when the store is unavailable (fail-open vs fail-closed, per action)
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final CounterStore counterStore;
    private final String keyPrefix;
    private final Set<UsageAction> failOpenActions;
    private final Clock clock;

    @Autowired
    public RateLimiterService(CounterStore counterStore, UsageMeterProperties properties, Clock clock) {
        this.counterStore = counterStore;
        this.keyPrefix = properties.getRateLimiter().getKeyPrefix();
        this.failOpenActions = Collections.unmodifiableSet(resolveActions(properties.getRateLimiter().getFailOpenActions()));
        this.clock = clock;
    }

    /**
     * Evaluate whether the tenant may perform one more {@code action} in the current window.
     * A store outage never escapes as an exception; it becomes an allow or deny per the action's policy.
     */
    public RateLimitResult check(String tenantId, UsageAction action, long limit, long windowSeconds,
                                 RateLimitAlgorithm algorithm) {
        if (limit <= 0 || windowSeconds <= 0) {
            throw new IllegalArgumentException("limit and windowSeconds must be positive, got limit="
                    + limit + " windowSeconds=" + windowSeconds);
        }

        String key = buildKey(tenantId, action, windowSeconds, algorithm);
        try {
            RateLimitResult result = algorithm == RateLimitAlgorithm.SLIDING_WINDOW
                    ? checkSlidingWindow(key, limit, windowSeconds)
                    : checkFixedWindow(key, limit, windowSeconds);
            if (!result.isAllowed()) {
                log.warn("Rate limit exceeded for tenant {} action {}: limit {} per {}s ({}), retry after {} ms",
                        tenantId, action.getCode(), limit, windowSeconds, algorithm, result.getRetryAfter().toMillis());
            }
            return result;
        } catch (StoreUnavailableException ex) {
            log.warn("Counter store unavailable while evaluating rate limit for tenant {} action {}. failOpen={}",
                    tenantId, action.getCode(), failOpenActions.contains(action), ex);
            return handleStoreFailure(action, limit, windowSeconds);
        } catch (RuntimeException ex) {
            log.error("Unexpected error while evaluating rate limit for tenant {} action {}. failOpen={}",
                    tenantId, action.getCode(), failOpenActions.contains(action), ex);
            return handleStoreFailure(action, limit, windowSeconds);
        }
    }

    /**
     * Current counter state without consuming capacity.
     *
     * @throws StoreUnavailableException if the store cannot be read
     */
    public RateLimitStatus getStatus(String tenantId, UsageAction action, long limit, long windowSeconds,
                                     RateLimitAlgorithm algorithm) {
        String key = buildKey(tenantId, action, windowSeconds, algorithm);
        long now = clock.millis();
        if (algorithm == RateLimitAlgorithm.SLIDING_WINDOW) {
            long count = counterStore.countSlidingWindow(key, now, windowSeconds * 1000L);
            return new RateLimitStatus(action, windowSeconds, count, limit,
                    Instant.ofEpochMilli(now + windowSeconds * 1000L));
        }
        long count = counterStore.get(key).orElse(0L);
        long ttl = counterStore.ttlMillis(key);
        Instant reset = ttl > 0 ? Instant.ofEpochMilli(now + ttl) : Instant.ofEpochMilli(now + windowSeconds * 1000L);
        return new RateLimitStatus(action, windowSeconds, count, limit, reset);
    }

    /**
     * Administrative reset of one counter.
     */
    public void reset(String tenantId, UsageAction action, long windowSeconds, RateLimitAlgorithm algorithm) {
        String key = buildKey(tenantId, action, windowSeconds, algorithm);
        counterStore.remove(key);
        log.info("Rate limit counter reset for tenant {} action {} window {}s ({})",
                tenantId, action.getCode(), windowSeconds, algorithm);
    }

    public boolean isFailOpen(UsageAction action) {
        return failOpenActions.contains(action);
    }

    String buildKey(String tenantId, UsageAction action, long windowSeconds, RateLimitAlgorithm algorithm) {
        String key = keyPrefix + ":" + tenantId + ":" + action.getCode() + ":" + windowSeconds + "s";
        return algorithm == RateLimitAlgorithm.SLIDING_WINDOW ? key + ":sliding" : key;
    }

    private RateLimitResult checkFixedWindow(String key, long limit, long windowSeconds) {
        CounterSnapshot snapshot = counterStore.incrementWithExpiry(key, windowSeconds);
        long now = clock.millis();
        long ttl = snapshot.getTtlMillis() > 0 ? snapshot.getTtlMillis() : windowSeconds * 1000L;
        Instant resetTime = Instant.ofEpochMilli(now + ttl);

        if (snapshot.getCount() <= limit) {
            return RateLimitResult.allow(limit, limit - snapshot.getCount(), resetTime);
        }
        return RateLimitResult.rejectRateLimited(limit, resetTime, Duration.ofMillis(ttl));
    }

    private RateLimitResult checkSlidingWindow(String key, long limit, long windowSeconds) {
        long now = clock.millis();
        long windowMillis = windowSeconds * 1000L;
        String member = now + ":" + UUID.randomUUID();
        SlidingWindowSnapshot snapshot = counterStore.acquireSlidingWindow(key, now, windowMillis, limit, member);
        Instant resetTime = Instant.ofEpochMilli(snapshot.getOldestMillis() + windowMillis);

        if (snapshot.isAdmitted()) {
            return RateLimitResult.allow(limit, limit - snapshot.getCount(), resetTime);
        }
        long wait = Math.max(1L, snapshot.getOldestMillis() + windowMillis - now);
        return RateLimitResult.rejectRateLimited(limit, resetTime, Duration.ofMillis(wait));
    }

    private RateLimitResult handleStoreFailure(UsageAction action, long limit, long windowSeconds) {
        Instant resetTime = clock.instant().plusSeconds(windowSeconds);
        if (failOpenActions.contains(action)) {
            return RateLimitResult.allowDegraded(limit, resetTime);
        }
        return RateLimitResult.rejectStoreFailure(limit, resetTime, Duration.ofSeconds(windowSeconds));
    }

    private static Set<UsageAction> resolveActions(Set<String> codes) {
        Set<UsageAction> actions = EnumSet.noneOf(UsageAction.class);
        for (String code : codes) {
            actions.add(UsageAction.fromCode(code).orElseThrow(() ->
                    new TierConfigurationException("Unknown action in usage-meter.rate-limiter.fail-open-actions: " + code)));
        }
        return actions;
    }
}
