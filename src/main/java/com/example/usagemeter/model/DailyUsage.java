package com.example.usagemeter.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Totals for one UTC calendar day.
 */
public class DailyUsage {

    private final LocalDate day;
    private final Map<UsageAction, Long> totals;

    public DailyUsage(LocalDate day, Map<UsageAction, Long> totals) {
        this.day = day;
        EnumMap<UsageAction, Long> copy = new EnumMap<>(UsageAction.class);
        copy.putAll(totals);
        this.totals = Collections.unmodifiableMap(copy);
    }

    public LocalDate getDay() {
        return day;
    }

    public Map<UsageAction, Long> getTotals() {
        return totals;
    }

    public long getTotal(UsageAction action) {
        return totals.getOrDefault(action, 0L);
    }
}
