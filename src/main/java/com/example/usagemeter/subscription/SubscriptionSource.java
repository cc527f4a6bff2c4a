package com.example.usagemeter.subscription;

import com.example.usagemeter.model.TenantSubscription;

import java.util.Optional;

/**
 * Authoritative subscription facts. Tier values supplied by callers are never used instead of this.
 */
public interface SubscriptionSource {

    /**
     * @throws com.example.usagemeter.store.StoreUnavailableException if the source cannot be read
     */
    Optional<TenantSubscription> getSubscription(String tenantId);
}
