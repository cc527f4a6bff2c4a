package com.example.usagemeter.ledger;

import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.model.UsageEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable, append-only store of usage events, unique on the idempotency key.
 * <p>
 * Time ranges are half-open: {@code from} inclusive, {@code to} exclusive. Connectivity problems
 * surface as {@link com.example.usagemeter.store.StoreUnavailableException}.
 */
public interface UsageLedger {

    /**
     * @throws DuplicateEventException if an event with the same idempotency key exists
     */
    void insert(UsageEvent event) throws DuplicateEventException;

    Optional<UsageEvent> findByIdempotencyKey(String idempotencyKey);

    /**
     * @param tenantId tenant to read, or null for every tenant
     * @param actions  actions to include; empty means all
     */
    List<UsageEvent> query(String tenantId, Set<UsageAction> actions, Instant from, Instant to);

    List<ActionTotal> aggregate(String tenantId, Instant from, Instant to);

    /**
     * Administrative correction; the only way an event leaves the ledger.
     *
     * @return true if an event was removed
     */
    boolean delete(String idempotencyKey);
}
