package com.example.usagemeter.middleware;

import com.example.usagemeter.model.UsageAction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a caller wants to do: one metered action for one tenant, plus the details recorded with it.
 */
public final class UsageRequest {

    private final String tenantId;
    private final UsageAction action;
    private final long quantity;
    private final String resourceType;
    private final String resourceId;
    private final Map<String, Object> metadata;
    private final String idempotencyKey;

    private UsageRequest(Builder builder) {
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId");
        this.action = Objects.requireNonNull(builder.action, "action");
        if (builder.quantity < 0) {
            throw new IllegalArgumentException("quantity must be >= 0, got " + builder.quantity);
        }
        this.quantity = builder.quantity;
        this.resourceType = builder.resourceType;
        this.resourceId = builder.resourceId;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.idempotencyKey = builder.idempotencyKey;
    }

    public static UsageRequest of(String tenantId, UsageAction action, long quantity) {
        return builder().tenantId(tenantId).action(action).quantity(quantity).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTenantId() {
        return tenantId;
    }

    public UsageAction getAction() {
        return action;
    }

    public long getQuantity() {
        return quantity;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return the caller's key for the success event, or null to have one generated
     */
    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public static final class Builder {

        private String tenantId;
        private UsageAction action;
        private long quantity = 1L;
        private String resourceType;
        private String resourceId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String idempotencyKey;

        private Builder() {
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder action(UsageAction action) {
            this.action = action;
            return this;
        }

        public Builder quantity(long quantity) {
            this.quantity = quantity;
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

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, ?> values) {
            if (values != null) {
                this.metadata.putAll(values);
            }
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public UsageRequest build() {
            return new UsageRequest(this);
        }
    }
}
