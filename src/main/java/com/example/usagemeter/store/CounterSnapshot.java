package com.example.usagemeter.store;

/**
 * Counter value right after an atomic increment, with the key's remaining lifetime.
 */
public class CounterSnapshot {

    private final long count;
    private final long ttlMillis;

    public CounterSnapshot(long count, long ttlMillis) {
        this.count = count;
        this.ttlMillis = ttlMillis;
    }

    public long getCount() {
        return count;
    }

    public long getTtlMillis() {
        return ttlMillis;
    }
}
