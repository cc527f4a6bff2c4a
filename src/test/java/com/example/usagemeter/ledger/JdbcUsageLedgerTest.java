package com.example.usagemeter.ledger;

import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.model.UsageEvent;
import com.example.usagemeter.store.StoreUnavailableException;
import com.example.usagemeter.support.MutableClock;
import com.example.usagemeter.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcUsageLedgerTest {

    private static final Instant T0 = TestFixtures.NOW;

    private EmbeddedDatabase database;
    private JdbcUsageLedger ledger;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        ledger = new JdbcUsageLedger(new JdbcTemplate(database), new ObjectMapper(), new MutableClock(T0));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private static UsageEvent event(String key, String tenant, UsageAction action, long quantity, Instant at) {
        return UsageEvent.builder()
                .idempotencyKey(key)
                .tenantId(tenant)
                .action(action)
                .quantity(quantity)
                .timestamp(at)
                .build();
    }

    // ===== Insert and lookup =====

    @Test
    void shouldRoundTripEventWithMetadata() throws Exception {
        UsageEvent event = event("k1", "t1", UsageAction.UPLOAD, 3, T0).toBuilder()
                .resourceType("file")
                .resourceId("doc-42")
                .metadata("pages", 12)
                .metadata("source", "drive")
                .build();

        ledger.insert(event);
        Optional<UsageEvent> stored = ledger.findByIdempotencyKey("k1");

        assertTrue(stored.isPresent());
        assertEquals("t1", stored.get().getTenantId());
        assertEquals(UsageAction.UPLOAD, stored.get().getAction());
        assertEquals(3, stored.get().getQuantity());
        assertEquals("doc-42", stored.get().getResourceId());
        assertEquals(T0, stored.get().getTimestamp());
        assertEquals(Map.of("pages", 12, "source", "drive"), stored.get().getMetadata());
    }

    @Test
    void shouldReportDuplicateIdempotencyKey() throws Exception {
        ledger.insert(event("k1", "t1", UsageAction.MESSAGE, 1, T0));

        DuplicateEventException ex = assertThrows(DuplicateEventException.class,
                () -> ledger.insert(event("k1", "t1", UsageAction.MESSAGE, 1, T0)));
        assertEquals("k1", ex.getIdempotencyKey());
        assertEquals(1, ledger.aggregate("t1", T0.minusSeconds(1), T0.plusSeconds(1)).get(0).getEvents());
    }

    @Test
    void shouldReturnEmptyForUnknownKey() {
        assertTrue(ledger.findByIdempotencyKey("nope").isEmpty());
    }

    // ===== Query and aggregate =====

    @Test
    void shouldAggregatePerActionWithinHalfOpenRange() throws Exception {
        ledger.insert(event("a", "t1", UsageAction.MESSAGE, 2, T0));
        ledger.insert(event("b", "t1", UsageAction.MESSAGE, 3, T0.plusSeconds(10)));
        ledger.insert(event("c", "t1", UsageAction.UPLOAD, 1, T0.plusSeconds(20)));
        ledger.insert(event("d", "t1", UsageAction.UPLOAD, 5, T0.plusSeconds(30)));
        ledger.insert(event("e", "t2", UsageAction.MESSAGE, 7, T0));

        List<ActionTotal> totals = ledger.aggregate("t1", T0, T0.plusSeconds(30));

        assertEquals(2, totals.size());
        ActionTotal messages = totals.stream().filter(t -> t.getAction() == UsageAction.MESSAGE).findFirst().orElseThrow();
        ActionTotal uploads = totals.stream().filter(t -> t.getAction() == UsageAction.UPLOAD).findFirst().orElseThrow();
        assertEquals(5, messages.getQuantity());
        assertEquals(2, messages.getEvents());
        assertEquals(1, uploads.getQuantity());
    }

    @Test
    void shouldFilterQueryByTenantAndAction() throws Exception {
        ledger.insert(event("a", "t1", UsageAction.MESSAGE, 1, T0.plusSeconds(5)));
        ledger.insert(event("b", "t1", UsageAction.UPLOAD, 1, T0));
        ledger.insert(event("c", "t2", UsageAction.MESSAGE, 1, T0));

        List<UsageEvent> t1Messages = ledger.query("t1", Set.of(UsageAction.MESSAGE), T0, T0.plusSeconds(60));
        List<UsageEvent> everyone = ledger.query(null, Set.of(), T0, T0.plusSeconds(60));

        assertEquals(1, t1Messages.size());
        assertEquals("a", t1Messages.get(0).getIdempotencyKey());
        assertEquals(3, everyone.size());
        assertEquals(T0, everyone.get(0).getTimestamp());
    }

    @Test
    void shouldStoreTimestampsInUtcRegardlessOfInputOffset() throws Exception {
        Instant lateEveningInNewYork = OffsetDateTime.of(2024, 3, 14, 22, 30, 0, 0, ZoneOffset.ofHours(-4)).toInstant();
        ledger.insert(event("ny", "t1", UsageAction.MESSAGE, 1, lateEveningInNewYork));

        List<UsageEvent> marchFifteenthUtc = ledger.query("t1", Set.of(),
                Instant.parse("2024-03-15T00:00:00Z"), Instant.parse("2024-03-16T00:00:00Z"));

        assertEquals(1, marchFifteenthUtc.size());
    }

    // ===== Corrections and failures =====

    @Test
    void shouldDeleteOnlyExistingEvents() throws Exception {
        ledger.insert(event("k1", "t1", UsageAction.MESSAGE, 1, T0));

        assertTrue(ledger.delete("k1"));
        assertFalse(ledger.delete("k1"));
        assertTrue(ledger.findByIdempotencyKey("k1").isEmpty());
    }

    @Test
    void shouldTranslateDatabaseOutage() {
        database.shutdown();

        assertThrows(StoreUnavailableException.class, () -> ledger.findByIdempotencyKey("k1"));
    }
}
