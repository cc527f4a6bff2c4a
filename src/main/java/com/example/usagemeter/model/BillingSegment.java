package com.example.usagemeter.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Part of a billing period during which a single tier applied, with usage measured against
 * that tier's limits.
 */
public class BillingSegment {

    private final TierId tier;
    private final Instant start;
    private final Instant end;
    private final Map<UsageAction, Long> totals;
    private final Map<UsageAction, Long> overage;

    public BillingSegment(TierId tier, Instant start, Instant end,
                          Map<UsageAction, Long> totals, Map<UsageAction, Long> overage) {
        this.tier = tier;
        this.start = start;
        this.end = end;
        EnumMap<UsageAction, Long> totalsCopy = new EnumMap<>(UsageAction.class);
        totalsCopy.putAll(totals);
        this.totals = Collections.unmodifiableMap(totalsCopy);
        EnumMap<UsageAction, Long> overageCopy = new EnumMap<>(UsageAction.class);
        overageCopy.putAll(overage);
        this.overage = Collections.unmodifiableMap(overageCopy);
    }

    public TierId getTier() {
        return tier;
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

    /**
     * @return quantity above the tier's limit, only for actions that went over
     */
    public Map<UsageAction, Long> getOverage() {
        return overage;
    }

    public long getOverage(UsageAction action) {
        return overage.getOrDefault(action, 0L);
    }
}
