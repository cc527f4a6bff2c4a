package com.example.usagemeter.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-action totals for one tenant over a half-open time range {@code [start, end)}.
 */
public class UsageStatistics {

    private final String tenantId;
    private final Instant start;
    private final Instant end;
    private final Map<UsageAction, Long> totals;

    public UsageStatistics(String tenantId, Instant start, Instant end, Map<UsageAction, Long> totals) {
        this.tenantId = tenantId;
        this.start = start;
        this.end = end;
        EnumMap<UsageAction, Long> copy = new EnumMap<>(UsageAction.class);
        copy.putAll(totals);
        this.totals = Collections.unmodifiableMap(copy);
    }

    public String getTenantId() {
        return tenantId;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Map<UsageAction, Long> getTotals() {
        return totals;
    }

    public long getTotal(UsageAction action) {
        return totals.getOrDefault(action, 0L);
    }

    public long getGrandTotal() {
        long sum = 0;
        for (long value : totals.values()) {
            sum += value;
        }
        return sum;
    }
}
