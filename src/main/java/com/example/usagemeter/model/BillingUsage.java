package com.example.usagemeter.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Usage over a billing period, split at the tier change when one happened inside the period.
 */
public class BillingUsage {

    private final String tenantId;
    private final Instant periodStart;
    private final Instant periodEnd;
    private final List<BillingSegment> segments;

    public BillingUsage(String tenantId, Instant periodStart, Instant periodEnd, List<BillingSegment> segments) {
        this.tenantId = tenantId;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.segments = List.copyOf(segments);
    }

    public String getTenantId() {
        return tenantId;
    }

    public Instant getPeriodStart() {
        return periodStart;
    }

    public Instant getPeriodEnd() {
        return periodEnd;
    }

    public List<BillingSegment> getSegments() {
        return segments;
    }

    public boolean isProrated() {
        return segments.size() > 1;
    }

    public Map<UsageAction, Long> getTotals() {
        Map<UsageAction, Long> totals = new EnumMap<>(UsageAction.class);
        for (BillingSegment segment : segments) {
            segment.getTotals().forEach((action, value) -> totals.merge(action, value, Long::sum));
        }
        return totals;
    }

    public long getTotalOverage(UsageAction action) {
        long sum = 0;
        for (BillingSegment segment : segments) {
            sum += segment.getOverage(action);
        }
        return sum;
    }
}
