package com.example.usagemeter.subscription;

import com.example.usagemeter.model.SubscriptionStatus;
import com.example.usagemeter.model.TenantSubscription;
import com.example.usagemeter.model.TierId;
import com.example.usagemeter.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code tenant_subscriptions}, the table the billing integration keeps up to date.
 */
@Repository
public class JdbcSubscriptionSource implements SubscriptionSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcSubscriptionSource.class);

    private static final String SELECT_SUBSCRIPTION =
            "SELECT tenant_id, tier_id, previous_tier_id, status, cycle_start, cycle_end, tier_changed_at "
                    + "FROM tenant_subscriptions WHERE tenant_id = ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcSubscriptionSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<TenantSubscription> getSubscription(String tenantId) {
        try {
            List<TenantSubscription> rows = jdbcTemplate.query(SELECT_SUBSCRIPTION, this::mapRow, tenantId);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Subscription lookup failed for tenant " + tenantId, ex);
        }
    }

    private TenantSubscription mapRow(ResultSet rs, int rowNum) throws SQLException {
        String tenantId = rs.getString("tenant_id");
        String tierCode = rs.getString("tier_id");
        TierId tier = TierId.fromCode(tierCode).orElseGet(() -> {
            log.warn("Unknown tier '{}' for tenant {}; treating as free", tierCode, tenantId);
            return TierId.FREE;
        });
        TierId previous = TierId.fromCode(rs.getString("previous_tier_id")).orElse(null);
        String statusCode = rs.getString("status");
        SubscriptionStatus status = SubscriptionStatus.fromCode(statusCode).orElseGet(() -> {
            log.warn("Unknown subscription status '{}' for tenant {}; treating as expired", statusCode, tenantId);
            return SubscriptionStatus.EXPIRED;
        });
        return new TenantSubscription(tenantId, tier, previous, status,
                instant(rs, "cycle_start"), instant(rs, "cycle_end"), instant(rs, "tier_changed_at"));
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
