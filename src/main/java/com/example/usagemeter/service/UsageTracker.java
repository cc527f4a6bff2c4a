package com.example.usagemeter.service;

import com.example.usagemeter.config.TierCatalog;
import com.example.usagemeter.config.UsageMeterProperties;
import com.example.usagemeter.health.LedgerHealthIndicator;
import com.example.usagemeter.ledger.ActionTotal;
import com.example.usagemeter.ledger.DuplicateEventException;
import com.example.usagemeter.ledger.UsageLedger;
import com.example.usagemeter.model.AnalyticsBucket;
import com.example.usagemeter.model.AnalyticsGrouping;
import com.example.usagemeter.model.BillingSegment;
import com.example.usagemeter.model.BillingUsage;
import com.example.usagemeter.model.DailyUsage;
import com.example.usagemeter.model.TenantSubscription;
import com.example.usagemeter.model.TierId;
import com.example.usagemeter.model.TrackResult;
import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.model.UsageEvent;
import com.example.usagemeter.model.UsageLimit;
import com.example.usagemeter.model.UsageStatistics;
import com.example.usagemeter.model.ValidationResult;
import com.example.usagemeter.subscription.SubscriptionSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Validates, sanitizes and records usage events, and computes aggregates from the ledger.
 * <p>
 * Recording is best-effort: {@link #trackUsage(UsageEvent)} never throws for ledger problems.
 * It reports them in the {@link TrackResult} and to {@link LedgerHealthIndicator}. Read-side
 * methods propagate {@link com.example.usagemeter.store.StoreUnavailableException}.
 */
@Service
public class UsageTracker {

    private static final Logger log = LoggerFactory.getLogger(UsageTracker.class);

    private static final Pattern TENANT_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:@-]{0,127}");
    private static final int MAX_IDEMPOTENCY_KEY_LENGTH = 128;
    private static final int MAX_RESOURCE_TYPE_LENGTH = 64;
    private static final int MAX_RESOURCE_ID_LENGTH = 256;
    private static final DateTimeFormatter HOUR_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:00").withZone(ZoneOffset.UTC);

    private final UsageLedger ledger;
    private final SubscriptionSource subscriptions;
    private final TierCatalog catalog;
    private final UsageEventSanitizer sanitizer;
    private final LedgerHealthIndicator ledgerHealth;
    private final ObjectMapper objectMapper;
    private final UsageMeterProperties.Tracker settings;
    private final Clock clock;

    @Autowired
    public UsageTracker(UsageLedger ledger,
                        SubscriptionSource subscriptions,
                        TierCatalog catalog,
                        UsageEventSanitizer sanitizer,
                        LedgerHealthIndicator ledgerHealth,
                        ObjectMapper objectMapper,
                        UsageMeterProperties properties,
                        Clock clock) {
        this.ledger = ledger;
        this.subscriptions = subscriptions;
        this.catalog = catalog;
        this.sanitizer = sanitizer;
        this.ledgerHealth = ledgerHealth;
        this.objectMapper = objectMapper;
        this.settings = properties.getTracker();
        this.clock = clock;
    }

    /**
     * Validate, sanitize and persist one event. Safe to retry: an idempotency key that is already
     * in the ledger, whether found up front or hit as a uniqueness conflict, is reported as success.
     * Events without a timestamp are stamped with the current time; events without an idempotency
     * key get a random one.
     */
    public TrackResult trackUsage(UsageEvent event) {
        if (event == null) {
            return TrackResult.invalid(List.of("event is required"));
        }
        ValidationResult validation = validateUsageData(event);
        if (!validation.isValid()) {
            log.warn("Rejected usage event for tenant {} action {}: {}",
                    event.getTenantId(), event.getActionCode(), validation.getErrors());
            return TrackResult.invalid(validation.getErrors());
        }

        UsageEvent prepared = sanitizer.sanitize(event.toBuilder()
                .timestamp(event.getTimestamp() != null ? event.getTimestamp() : clock.instant())
                .idempotencyKey(event.getIdempotencyKey() != null ? event.getIdempotencyKey() : UUID.randomUUID().toString())
                .build());
        String key = prepared.getIdempotencyKey();

        try {
            if (ledger.findByIdempotencyKey(key).isPresent()) {
                log.debug("Usage event {} already recorded for tenant {}", key, prepared.getTenantId());
                return TrackResult.alreadyRecorded(key);
            }
            ledger.insert(prepared);
            ledgerHealth.recordSuccess();
            log.debug("Usage recorded: tenant={} action={} quantity={} key={}",
                    prepared.getTenantId(), prepared.getActionCode(), prepared.getQuantity(), key);
            return TrackResult.recorded(key);
        } catch (DuplicateEventException ex) {
            log.debug("Concurrent insert of usage event {} for tenant {}; keeping the first", key, prepared.getTenantId());
            return TrackResult.alreadyRecorded(key);
        } catch (RuntimeException ex) {
            // The protected operation already succeeded; metering failures must not undo it.
            log.error("Usage logging failed for tenant {} action {} key {}",
                    prepared.getTenantId(), prepared.getActionCode(), key, ex);
            ledgerHealth.recordFailure(ex);
            return TrackResult.storeUnavailable(key, "usage logging failed: " + ex.getMessage());
        }
    }

    /**
     * Check every rule and report every violation.
     */
    public ValidationResult validateUsageData(UsageEvent event) {
        List<String> errors = new ArrayList<>();
        if (event == null) {
            errors.add("event is required");
            return new ValidationResult(errors);
        }

        String tenantId = event.getTenantId();
        if (tenantId == null || tenantId.isBlank()) {
            errors.add("tenant id is required");
        } else if (!TENANT_ID.matcher(tenantId).matches()) {
            errors.add("tenant id is malformed");
        }

        if (event.getActionCode() == null || event.getActionCode().isBlank()) {
            errors.add("action is required");
        } else if (event.getAction() == null) {
            errors.add("unknown action: " + event.getActionCode());
        }

        if (event.getQuantity() < 0) {
            errors.add("negative values not allowed: quantity=" + event.getQuantity());
        } else if (event.getQuantity() > settings.getMaxQuantityPerEvent()) {
            errors.add("quantity " + event.getQuantity() + " exceeds the per-event maximum of "
                    + settings.getMaxQuantityPerEvent());
        }

        validateMetadata(event.getMetadata(), errors);

        Instant timestamp = event.getTimestamp();
        if (timestamp != null) {
            Instant now = clock.instant();
            if (timestamp.isAfter(now.plus(settings.getClockSkewTolerance()))) {
                errors.add("timestamp " + timestamp + " is in the future");
            } else if (timestamp.isBefore(now.minus(settings.getMaxBacklog()))) {
                errors.add("timestamp " + timestamp + " is older than the accepted backlog of " + settings.getMaxBacklog());
            }
        }

        String key = event.getIdempotencyKey();
        if (key != null && (key.isBlank() || key.length() > MAX_IDEMPOTENCY_KEY_LENGTH)) {
            errors.add("idempotency key must be 1-" + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        if (event.getResourceType() != null && event.getResourceType().length() > MAX_RESOURCE_TYPE_LENGTH) {
            errors.add("resource type exceeds " + MAX_RESOURCE_TYPE_LENGTH + " characters");
        }
        if (event.getResourceId() != null && event.getResourceId().length() > MAX_RESOURCE_ID_LENGTH) {
            errors.add("resource id exceeds " + MAX_RESOURCE_ID_LENGTH + " characters");
        }
        return new ValidationResult(errors);
    }

    /**
     * Whether {@code metadata} is within the serialized size accepted by {@link #validateUsageData}.
     */
    public boolean fitsMetadataLimit(Map<String, ?> metadata) {
        List<String> errors = new ArrayList<>();
        validateMetadata(metadata, errors);
        return errors.isEmpty();
    }

    public int getMaxMetadataStringLength() {
        return settings.getMaxMetadataStringLength();
    }

    /**
     * Per-action totals over {@code [start, end)}.
     */
    public UsageStatistics getUsageStatistics(String tenantId, Instant start, Instant end) {
        return new UsageStatistics(tenantId, start, end, totals(tenantId, start, end));
    }

    public long getCurrentUsage(String tenantId, UsageAction action, Instant start, Instant end) {
        return totals(tenantId, start, end).getOrDefault(action, 0L);
    }

    /**
     * Totals for the UTC calendar month.
     */
    public UsageStatistics getMonthlyUsage(String tenantId, YearMonth month) {
        Instant start = month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end = month.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return getUsageStatistics(tenantId, start, end);
    }

    /**
     * Totals per UTC day. Days without events are omitted.
     */
    public List<DailyUsage> getDailyUsage(String tenantId, Instant start, Instant end) {
        Map<LocalDate, Map<UsageAction, Long>> byDay = new TreeMap<>();
        for (UsageEvent event : ledger.query(tenantId, Collections.emptySet(), start, end)) {
            if (event.getAction() == null) {
                continue;
            }
            LocalDate day = LocalDate.ofInstant(event.getTimestamp(), ZoneOffset.UTC);
            byDay.computeIfAbsent(day, d -> new EnumMap<>(UsageAction.class))
                    .merge(event.getAction(), event.getQuantity(), Long::sum);
        }
        List<DailyUsage> result = new ArrayList<>(byDay.size());
        byDay.forEach((day, totals) -> result.add(new DailyUsage(day, totals)));
        return result;
    }

    /**
     * Usage for a billing period. When the tier changed inside the period the usage is split at
     * the change and each part is measured against the tier that applied to it.
     */
    public BillingUsage calculateBillingUsage(String tenantId, Instant periodStart, Instant periodEnd) {
        TenantSubscription subscription = subscriptions.getSubscription(tenantId)
                .orElseGet(() -> TenantSubscription.defaultFree(tenantId));
        Instant changedAt = subscription.getTierChangedAt();
        TierId previous = subscription.getPreviousTier();

        List<BillingSegment> segments = new ArrayList<>(2);
        if (changedAt != null && previous != null && changedAt.isAfter(periodStart) && changedAt.isBefore(periodEnd)) {
            segments.add(billingSegment(tenantId, previous, periodStart, changedAt));
            segments.add(billingSegment(tenantId, subscription.getTier(), changedAt, periodEnd));
        } else if (changedAt != null && previous != null && !changedAt.isBefore(periodEnd)) {
            segments.add(billingSegment(tenantId, previous, periodStart, periodEnd));
        } else {
            segments.add(billingSegment(tenantId, subscription.getTier(), periodStart, periodEnd));
        }
        return new BillingUsage(tenantId, periodStart, periodEnd, segments);
    }

    /**
     * Cross-tenant rollup for operators, ordered by group key.
     */
    public List<AnalyticsBucket> getUsageAnalytics(Instant start, Instant end, AnalyticsGrouping groupBy) {
        Map<String, Long> quantities = new TreeMap<>();
        Map<String, Set<String>> tenants = new TreeMap<>();
        Map<String, Map<String, Long>> actions = new TreeMap<>();

        for (UsageEvent event : ledger.query(null, Collections.emptySet(), start, end)) {
            String key = groupKey(event, groupBy);
            quantities.merge(key, event.getQuantity(), Long::sum);
            tenants.computeIfAbsent(key, k -> new HashSet<>()).add(event.getTenantId());
            actions.computeIfAbsent(key, k -> new LinkedHashMap<>())
                    .merge(event.getActionCode(), event.getQuantity(), Long::sum);
        }

        List<AnalyticsBucket> buckets = new ArrayList<>(quantities.size());
        for (Map.Entry<String, Long> entry : quantities.entrySet()) {
            String key = entry.getKey();
            buckets.add(new AnalyticsBucket(key, entry.getValue(), tenants.get(key).size(), actions.get(key)));
        }
        return buckets;
    }

    /**
     * Administrative correction: removes one event from the ledger.
     *
     * @return false if no event had that key
     */
    public boolean correctEvent(String idempotencyKey, String reason) {
        boolean removed = ledger.delete(idempotencyKey);
        if (removed) {
            log.info("Usage event {} removed by administrative correction: {}", idempotencyKey, reason);
        } else {
            log.info("Administrative correction found no usage event {}", idempotencyKey);
        }
        return removed;
    }

    private BillingSegment billingSegment(String tenantId, TierId tier, Instant start, Instant end) {
        Map<UsageAction, Long> totals = totals(tenantId, start, end);
        Map<UsageAction, Long> overage = new EnumMap<>(UsageAction.class);
        totals.forEach((action, total) -> {
            UsageLimit limit = catalog.getEffectiveLimit(tenantId, tier, action);
            if (!limit.isUnlimited() && total > limit.getValue()) {
                overage.put(action, total - limit.getValue());
            }
        });
        return new BillingSegment(tier, start, end, totals, overage);
    }

    private Map<UsageAction, Long> totals(String tenantId, Instant start, Instant end) {
        Map<UsageAction, Long> totals = new EnumMap<>(UsageAction.class);
        if (!start.isBefore(end)) {
            return totals;
        }
        for (ActionTotal row : ledger.aggregate(tenantId, start, end)) {
            totals.merge(row.getAction(), row.getQuantity(), Long::sum);
        }
        return totals;
    }

    private void validateMetadata(Map<String, ?> metadata, List<String> errors) {
        if (metadata == null || metadata.isEmpty()) {
            return;
        }
        try {
            int size = objectMapper.writeValueAsBytes(metadata).length;
            if (size > settings.getMaxMetadataBytes()) {
                errors.add("metadata is " + size + " bytes, exceeding the limit of " + settings.getMaxMetadataBytes());
            }
        } catch (JsonProcessingException ex) {
            errors.add("metadata is not serializable: " + ex.getOriginalMessage());
        }
    }

    private static String groupKey(UsageEvent event, AnalyticsGrouping groupBy) {
        switch (groupBy) {
            case DAY:
                return LocalDate.ofInstant(event.getTimestamp(), ZoneOffset.UTC).toString();
            case HOUR:
                return HOUR_KEY.format(event.getTimestamp().truncatedTo(ChronoUnit.HOURS));
            case ACTION:
            default:
                return event.getActionCode();
        }
    }
}
