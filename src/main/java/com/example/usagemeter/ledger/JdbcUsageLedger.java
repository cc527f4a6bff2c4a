package com.example.usagemeter.ledger;

import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.model.UsageEvent;
import com.example.usagemeter.store.StoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link UsageLedger} on a relational table. The primary key on {@code idempotency_key} is the
 * uniqueness constraint that makes concurrent duplicate inserts fail instead of double counting.
 */
@Repository
public class JdbcUsageLedger implements UsageLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcUsageLedger.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String COLUMNS =
            "idempotency_key, tenant_id, action, resource_type, resource_id, quantity, metadata, occurred_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final RowMapper<UsageEvent> eventMapper = this::mapEvent;

    @Autowired
    public JdbcUsageLedger(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void insert(UsageEvent event) throws DuplicateEventException {
        String sql = "INSERT INTO usage_events (" + COLUMNS + ", recorded_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try {
            jdbcTemplate.update(sql,
                    event.getIdempotencyKey(),
                    event.getTenantId(),
                    event.getAction().getCode(),
                    event.getResourceType(),
                    event.getResourceId(),
                    event.getQuantity(),
                    writeMetadata(event.getMetadata()),
                    toUtc(event.getTimestamp()),
                    toUtc(clock.instant()));
        } catch (DuplicateKeyException ex) {
            throw new DuplicateEventException(event.getIdempotencyKey(), ex);
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Usage ledger insert failed for " + event.getIdempotencyKey(), ex);
        }
    }

    @Override
    public Optional<UsageEvent> findByIdempotencyKey(String idempotencyKey) {
        String sql = "SELECT " + COLUMNS + " FROM usage_events WHERE idempotency_key = ?";
        try {
            List<UsageEvent> rows = jdbcTemplate.query(sql, eventMapper, idempotencyKey);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Usage ledger lookup failed for " + idempotencyKey, ex);
        }
    }

    @Override
    public List<UsageEvent> query(String tenantId, Set<UsageAction> actions, Instant from, Instant to) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM usage_events WHERE occurred_at >= ? AND occurred_at < ?");
        List<Object> args = new ArrayList<>();
        args.add(toUtc(from));
        args.add(toUtc(to));
        if (tenantId != null) {
            sql.append(" AND tenant_id = ?");
            args.add(tenantId);
        }
        if (actions != null && !actions.isEmpty()) {
            sql.append(" AND action IN (").append(String.join(", ", Collections.nCopies(actions.size(), "?"))).append(')');
            for (UsageAction action : actions) {
                args.add(action.getCode());
            }
        }
        sql.append(" ORDER BY occurred_at");
        try {
            return jdbcTemplate.query(sql.toString(), eventMapper, args.toArray());
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Usage ledger query failed for tenant " + tenantId, ex);
        }
    }

    @Override
    public List<ActionTotal> aggregate(String tenantId, Instant from, Instant to) {
        String sql = "SELECT action, SUM(quantity) AS total, COUNT(*) AS events FROM usage_events "
                + "WHERE tenant_id = ? AND occurred_at >= ? AND occurred_at < ? GROUP BY action";
        try {
            List<ActionTotal> rows = jdbcTemplate.query(sql, (rs, rowNum) -> {
                String code = rs.getString("action");
                Optional<UsageAction> action = UsageAction.fromCode(code);
                if (action.isEmpty()) {
                    log.warn("Skipping ledger rows with unknown action '{}' for tenant {}", code, tenantId);
                    return null;
                }
                return new ActionTotal(action.get(), rs.getLong("total"), rs.getLong("events"));
            }, tenantId, toUtc(from), toUtc(to));
            rows.removeIf(row -> row == null);
            return rows;
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Usage ledger aggregate failed for tenant " + tenantId, ex);
        }
    }

    @Override
    public boolean delete(String idempotencyKey) {
        try {
            return jdbcTemplate.update("DELETE FROM usage_events WHERE idempotency_key = ?", idempotencyKey) > 0;
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Usage ledger delete failed for " + idempotencyKey, ex);
        }
    }

    private UsageEvent mapEvent(ResultSet rs, int rowNum) throws SQLException {
        return UsageEvent.builder()
                .idempotencyKey(rs.getString("idempotency_key"))
                .tenantId(rs.getString("tenant_id"))
                .action(rs.getString("action"))
                .resourceType(rs.getString("resource_type"))
                .resourceId(rs.getString("resource_id"))
                .quantity(rs.getLong("quantity"))
                .metadata(readMetadata(rs.getString("metadata")))
                .timestamp(rs.getObject("occurred_at", OffsetDateTime.class).toInstant())
                .build();
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Usage metadata is not serializable", ex);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isEmpty()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException ex) {
            log.warn("Stored usage metadata is not valid JSON; returning it empty", ex);
            return Collections.emptyMap();
        }
    }

    private static OffsetDateTime toUtc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
