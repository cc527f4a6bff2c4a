package com.example.usagemeter.service;

import com.example.usagemeter.config.TierCatalog;
import com.example.usagemeter.config.UsageMeterProperties;
import com.example.usagemeter.health.LedgerHealthIndicator;
import com.example.usagemeter.model.ErrorKind;
import com.example.usagemeter.model.SubscriptionStatus;
import com.example.usagemeter.model.TenantSubscription;
import com.example.usagemeter.model.TierCheckResult;
import com.example.usagemeter.model.TierId;
import com.example.usagemeter.model.TierStatus;
import com.example.usagemeter.model.UpgradeRecommendation;
import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.model.UsageEvent;
import com.example.usagemeter.model.UsageLimit;
import com.example.usagemeter.model.UsageLimitStatus;
import com.example.usagemeter.subscription.SubscriptionSource;
import com.example.usagemeter.support.InMemoryUsageLedger;
import com.example.usagemeter.support.MutableClock;
import com.example.usagemeter.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TierManagerTest {

    private static final String TENANT = "tenant-1";
    private static final Instant NOW = TestFixtures.NOW;

    private MutableClock clock;
    private UsageMeterProperties properties;
    private SubscriptionSource subscriptions;
    private UsageTracker usageTracker;
    private TierManager tierManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        properties = TestFixtures.properties();
        subscriptions = mock(SubscriptionSource.class);
        usageTracker = mock(UsageTracker.class);
        when(subscriptions.getSubscription(anyString())).thenReturn(Optional.empty());
        tierManager = newTierManager();
    }

    private TierManager newTierManager() {
        return new TierManager(subscriptions, usageTracker, new TierCatalog(properties), clock);
    }

    private void givenSubscription(TierId tier, TierId previous, SubscriptionStatus status, Instant changedAt) {
        when(subscriptions.getSubscription(TENANT)).thenReturn(Optional.of(
                new TenantSubscription(TENANT, tier, previous, status, null, null, changedAt)));
    }

    private void givenUsage(UsageAction action, long current) {
        when(usageTracker.getCurrentUsage(eq(TENANT), eq(action), any(Instant.class), any(Instant.class)))
                .thenReturn(current);
    }

    // ===== Quota checks =====

    @Test
    void shouldDenyFreeUploadAtLimit() {
        givenUsage(UsageAction.UPLOAD, 10);

        TierCheckResult result = tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 1);

        assertFalse(result.isAllowed());
        assertEquals(ErrorKind.USAGE_LIMIT_EXCEEDED, result.getError());
        assertEquals(10, result.getCurrent());
        assertEquals(10, result.getLimit());
        assertEquals(0, result.getRemaining());
        assertEquals(100.0, result.getPercentUsed());
        assertEquals(TierId.FREE, result.getTier());
    }

    @Test
    void shouldAllowWhenRequestFitsExactly() {
        givenUsage(UsageAction.UPLOAD, 7);

        TierCheckResult result = tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 3);

        assertTrue(result.isAllowed());
        assertEquals(3, result.getRemaining());
        assertEquals(70.0, result.getPercentUsed());
        assertFalse(result.isUnlimited());
    }

    @Test
    void shouldAlwaysAllowUnlimitedQuota() {
        givenSubscription(TierId.PRO_BYOK, null, SubscriptionStatus.ACTIVE, null);
        givenUsage(UsageAction.UPLOAD, 5_000_000);

        TierCheckResult result = tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 1_000_000_000L);

        assertTrue(result.isAllowed());
        assertTrue(result.isUnlimited());
        assertEquals(-1, result.getLimit());
        assertEquals(-1, result.getRemaining());
        assertEquals(0.0, result.getPercentUsed());
    }

    @Test
    void shouldTreatActionsWithoutQuotaAsUnlimited() {
        TierCheckResult result = tierManager.checkUsageLimit(TENANT, UsageAction.SEARCH, 1);

        assertTrue(result.isAllowed());
        assertTrue(result.isUnlimited());
    }

    @Test
    void shouldDenyInactiveSubscriptionWithoutReadingUsage() {
        givenSubscription(TierId.PRO, null, SubscriptionStatus.CANCELLED, null);

        TierCheckResult result = tierManager.checkUsageLimit(TENANT, UsageAction.MESSAGE, 1);

        assertFalse(result.isAllowed());
        assertEquals(ErrorKind.SUBSCRIPTION_INACTIVE, result.getError());
        verify(usageTracker, never()).getCurrentUsage(anyString(), any(), any(), any());
    }

    @Test
    void shouldTreatTrialingAsEntitled() {
        givenSubscription(TierId.PRO, null, SubscriptionStatus.TRIALING, null);
        givenUsage(UsageAction.UPLOAD, 10);

        assertTrue(tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 1).isAllowed());
    }

    @Test
    void shouldPreferTenantLimitOverride() {
        properties.setLimitOverrides(Map.of(TENANT, Map.of("upload", "25")));
        tierManager = newTierManager();
        givenUsage(UsageAction.UPLOAD, 20);

        TierCheckResult result = tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 1);

        assertTrue(result.isAllowed());
        assertEquals(25, result.getLimit());
    }

    @Test
    void shouldRejectNegativeRequestedQuantity() {
        assertThrows(IllegalArgumentException.class,
                () -> tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, -1));
    }

    // ===== Downgrade grace period =====

    @Test
    void shouldAllowOverLimitDuringGracePeriodThenDeny() {
        Instant downgradedAt = NOW.minus(Duration.ofDays(1));
        givenSubscription(TierId.FREE, TierId.PRO, SubscriptionStatus.ACTIVE, downgradedAt);
        givenUsage(UsageAction.UPLOAD, 50);

        TierCheckResult during = tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 1);

        assertTrue(during.isAllowed());
        assertTrue(during.isOverLimit());
        assertEquals(downgradedAt.plus(TestFixtures.GRACE_PERIOD), during.getGraceDeadline());
        assertEquals(10, during.getLimit());

        clock.set(downgradedAt.plus(TestFixtures.GRACE_PERIOD));

        TierCheckResult after = tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 1);

        assertFalse(after.isAllowed());
        assertEquals(ErrorKind.USAGE_LIMIT_EXCEEDED, after.getError());
        assertTrue(after.isOverLimit());
    }

    @Test
    void shouldNotExtendGraceBeyondPreviousTierLimit() {
        givenSubscription(TierId.FREE, TierId.PRO, SubscriptionStatus.ACTIVE, NOW.minus(Duration.ofHours(1)));
        givenUsage(UsageAction.UPLOAD, 1000);

        assertFalse(tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 1).isAllowed());
    }

    @Test
    void shouldNotApplyGraceAfterUpgrade() {
        givenSubscription(TierId.PRO, TierId.FREE, SubscriptionStatus.ACTIVE, NOW.minus(Duration.ofHours(1)));
        givenUsage(UsageAction.UPLOAD, 1000);

        TierCheckResult result = tierManager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 1);

        assertFalse(result.isAllowed());
        assertNull(result.getGraceDeadline());
    }

    // ===== Features =====

    @Test
    void shouldGrantTierFeaturesOnly() {
        assertTrue(tierManager.hasFeatureAccess(TENANT, "document_upload"));
        assertFalse(tierManager.hasFeatureAccess(TENANT, "api_access"));
        assertFalse(tierManager.hasFeatureAccess(TENANT, ""));
    }

    @Test
    void shouldGrantFeatureFromTenantOverride() {
        properties.setFeatureOverrides(Map.of(TENANT, Set.of("api_access")));
        tierManager = newTierManager();

        assertTrue(tierManager.hasFeatureAccess(TENANT, "api_access"));
        assertFalse(tierManager.hasFeatureAccess("tenant-2", "api_access"));
    }

    // ===== Recommendations and status =====

    @Test
    void shouldRecommendNextTierAboveThreshold() {
        givenUsage(UsageAction.UPLOAD, 9);
        givenUsage(UsageAction.MESSAGE, 10);

        List<UpgradeRecommendation> recommendations = tierManager.getUpgradeRecommendations(TENANT);

        assertEquals(1, recommendations.size());
        UpgradeRecommendation recommendation = recommendations.get(0);
        assertEquals(UsageAction.UPLOAD, recommendation.getAction());
        assertEquals(TierId.PRO, recommendation.getRecommendedTier());
        assertEquals(UsageLimit.of(1000), recommendation.getRecommendedLimit());
        assertEquals(90.0, recommendation.getPercentUsed());
        assertTrue(recommendation.getBenefits().contains("Increase upload limit from 10 to 1000"));
        assertTrue(recommendation.getBenefits().contains("Unlock feature api_access"));
    }

    @Test
    void shouldNotRecommendAtThresholdExactly() {
        givenUsage(UsageAction.UPLOAD, 8);

        assertTrue(tierManager.getUpgradeRecommendations(TENANT).isEmpty());
    }

    @Test
    void shouldNotRecommendAnythingOnHighestTier() {
        givenSubscription(TierId.PRO_BYOK, TierId.PRO, SubscriptionStatus.ACTIVE, null);
        givenUsage(UsageAction.STORAGE_DELTA, 53_000_000_000L);

        assertTrue(tierManager.getUpgradeRecommendations(TENANT).isEmpty());
    }

    @Test
    void shouldReportTierStatusPerMeteredAction() {
        givenUsage(UsageAction.UPLOAD, 4);

        TierStatus status = tierManager.getTierStatus(TENANT);

        assertEquals(TierId.FREE, status.getTier());
        assertEquals(SubscriptionStatus.ACTIVE, status.getStatus());
        UsageLimitStatus uploads = status.getLimits().get(UsageAction.UPLOAD);
        assertEquals(4, uploads.getCurrent());
        assertEquals(6, uploads.getRemaining());
        assertEquals(Instant.parse("2024-04-01T00:00:00Z"), uploads.getResetDate());
        assertNull(status.getLimits().get(UsageAction.STORAGE_DELTA).getResetDate());
        assertTrue(status.getFeatures().contains("chat"));
    }

    // ===== Usage windows =====

    @Test
    void shouldMeasureQuotaOverCurrentBillingCycle() {
        Instant cycleStart = Instant.parse("2024-03-05T00:00:00Z");
        Instant cycleEnd = Instant.parse("2024-04-05T00:00:00Z");
        TenantSubscription subscription = new TenantSubscription(TENANT, TierId.PRO, null,
                SubscriptionStatus.ACTIVE, cycleStart, cycleEnd, null);

        Instant[] window = tierManager.usageWindow(subscription, UsageAction.UPLOAD, NOW);

        assertEquals(cycleStart, window[0]);
        assertEquals(cycleEnd, window[1]);
    }

    @Test
    void shouldFallBackToCalendarMonthForStaleCycle() {
        TenantSubscription subscription = new TenantSubscription(TENANT, TierId.PRO, null, SubscriptionStatus.ACTIVE,
                Instant.parse("2024-01-05T00:00:00Z"), Instant.parse("2024-02-05T00:00:00Z"), null);

        Instant[] window = tierManager.usageWindow(subscription, UsageAction.UPLOAD, NOW);

        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), window[0]);
        assertEquals(Instant.parse("2024-04-01T00:00:00Z"), window[1]);
    }

    @Test
    void shouldRollOpenEndedCycleForwardToTheCurrentMonth() {
        TenantSubscription subscription = new TenantSubscription(TENANT, TierId.FREE, null, SubscriptionStatus.ACTIVE,
                Instant.parse("2023-11-05T00:00:00Z"), null, null);

        Instant[] window = tierManager.usageWindow(subscription, UsageAction.UPLOAD, NOW);

        assertEquals(Instant.parse("2024-03-05T00:00:00Z"), window[0]);
        assertEquals(Instant.parse("2024-04-05T00:00:00Z"), window[1]);
    }

    @Test
    void shouldClampOpenEndedCycleAnchoredOnMonthEnd() {
        TenantSubscription subscription = new TenantSubscription(TENANT, TierId.FREE, null, SubscriptionStatus.ACTIVE,
                Instant.parse("2024-01-31T00:00:00Z"), null, null);

        Instant[] window = tierManager.usageWindow(subscription, UsageAction.UPLOAD, NOW);

        assertEquals(Instant.parse("2024-02-29T00:00:00Z"), window[0]);
        assertEquals(Instant.parse("2024-03-31T00:00:00Z"), window[1]);
        assertFalse(NOW.isBefore(window[0]));
        assertTrue(NOW.isBefore(window[1]));
    }

    @Test
    void shouldEnforceQuotaForOpenEndedCycleStartedMonthsAgo() {
        InMemoryUsageLedger ledger = new InMemoryUsageLedger();
        UsageTracker tracker = new UsageTracker(ledger, subscriptions, new TierCatalog(properties),
                new UsageEventSanitizer(properties),
                new LedgerHealthIndicator(new SimpleMeterRegistry(), properties, clock),
                new ObjectMapper(), properties, clock);
        TierManager manager = new TierManager(subscriptions, tracker, new TierCatalog(properties), clock);
        when(subscriptions.getSubscription(TENANT)).thenReturn(Optional.of(new TenantSubscription(TENANT,
                TierId.FREE, null, SubscriptionStatus.ACTIVE, Instant.parse("2023-11-05T00:00:00Z"), null, null)));
        for (int i = 0; i < 10; i++) {
            assertTrue(tracker.trackUsage(UsageEvent.builder()
                    .tenantId(TENANT).action(UsageAction.UPLOAD).quantity(1).build()).isSuccess());
        }

        TierCheckResult result = manager.checkUsageLimit(TENANT, UsageAction.UPLOAD, 1);

        assertFalse(result.isAllowed());
        assertEquals(10, result.getCurrent());
        assertEquals(10, result.getLimit());
    }

    @Test
    void shouldCountStorageOverAllTime() {
        Instant[] window = tierManager.usageWindow(TenantSubscription.defaultFree(TENANT), UsageAction.STORAGE_DELTA, NOW);

        assertEquals(Instant.EPOCH, window[0]);
        assertTrue(window[1].isAfter(NOW));
    }
}
