package com.example.usagemeter.store;

import java.util.OptionalLong;

/**
 * Shared, TTL-capable counter facility. Every mutating operation must be atomic on the store side:
 * callers run in many processes at once and hold no locks of their own.
 * <p>
 * Implementations report connectivity and timeout problems as {@link StoreUnavailableException}.
 */
public interface CounterStore {

    /**
     * Increments the counter and, only when this call created the key, sets its TTL.
     */
    CounterSnapshot incrementWithExpiry(String key, long ttlSeconds);

    OptionalLong get(String key);

    /**
     * @return remaining lifetime in millis, or a negative value if the key does not exist or never expires
     */
    long ttlMillis(String key);

    void remove(String key);

    /**
     * In one atomic step: drop entries at or before {@code nowMillis - windowMillis}, count the rest and,
     * if the count is below {@code limit}, append {@code member} scored at {@code nowMillis}.
     */
    SlidingWindowSnapshot acquireSlidingWindow(String key, long nowMillis, long windowMillis, long limit, String member);

    /**
     * Number of entries newer than {@code nowMillis - windowMillis}, without modifying the set.
     */
    long countSlidingWindow(String key, long nowMillis, long windowMillis);
}
