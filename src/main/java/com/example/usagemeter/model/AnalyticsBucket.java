package com.example.usagemeter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cross-tenant rollup for one group key (a UTC day, a UTC hour or an action code).
 */
public class AnalyticsBucket {

    private final String key;
    private final long totalQuantity;
    private final int uniqueTenants;
    private final Map<String, Long> actions;

    public AnalyticsBucket(String key, long totalQuantity, int uniqueTenants, Map<String, Long> actions) {
        this.key = key;
        this.totalQuantity = totalQuantity;
        this.uniqueTenants = uniqueTenants;
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public String getKey() {
        return key;
    }

    public long getTotalQuantity() {
        return totalQuantity;
    }

    public int getUniqueTenants() {
        return uniqueTenants;
    }

    public Map<String, Long> getActions() {
        return actions;
    }
}
