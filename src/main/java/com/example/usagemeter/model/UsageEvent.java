package com.example.usagemeter.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One metered occurrence. Immutable; the ledger never updates a stored event.
 * <p>
 * The raw action code is kept next to the resolved {@link UsageAction} so that an unknown code
 * can be reported by validation instead of failing at construction.
 */
public final class UsageEvent {

    private final String tenantId;
    private final String actionCode;
    private final UsageAction action;
    private final String resourceType;
    private final String resourceId;
    private final long quantity;
    private final Map<String, Object> metadata;
    private final Instant timestamp;
    private final String idempotencyKey;

    private UsageEvent(Builder builder) {
        this.tenantId = builder.tenantId;
        this.actionCode = builder.actionCode;
        this.action = builder.actionCode == null ? null : UsageAction.fromCode(builder.actionCode).orElse(null);
        this.resourceType = builder.resourceType;
        this.resourceId = builder.resourceId;
        this.quantity = builder.quantity;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.timestamp = builder.timestamp;
        this.idempotencyKey = builder.idempotencyKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .tenantId(tenantId)
                .action(actionCode)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .quantity(quantity)
                .metadata(metadata)
                .timestamp(timestamp)
                .idempotencyKey(idempotencyKey);
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getActionCode() {
        return actionCode;
    }

    /**
     * @return the resolved action, or null if the code is not a known action
     */
    public UsageAction getAction() {
        return action;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public long getQuantity() {
        return quantity;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    @Override
    public String toString() {
        return "UsageEvent{tenantId=" + tenantId + ", action=" + actionCode + ", quantity=" + quantity
                + ", timestamp=" + timestamp + ", idempotencyKey=" + idempotencyKey + "}";
    }

    public static final class Builder {

        private String tenantId;
        private String actionCode;
        private String resourceType;
        private String resourceId;
        private long quantity = 1L;
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant timestamp;
        private String idempotencyKey;

        private Builder() {
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder action(UsageAction action) {
            this.actionCode = action == null ? null : action.getCode();
            return this;
        }

        public Builder action(String actionCode) {
            this.actionCode = actionCode;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder quantity(long quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public UsageEvent build() {
            return new UsageEvent(this);
        }
    }
}
