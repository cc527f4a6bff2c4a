package com.example.usagemeter.model;

/**
 * Outcome of one rate-limit check for a tenant and action.
 */
public enum RateLimitDecision {
    /**
     * Admitted. A degraded admission from a fail-open action is also ALLOW.
     */
    ALLOW,

    /**
     * Request exceeds the limit for the current window.
     */
    REJECT_RATE_LIMITED,

    /**
     * The counter store could not be reached and the action is configured to fail closed.
     */
    REJECT_STORE_FAILURE
}
