package com.example.usagemeter.config;

/**
 * Thrown at startup when the tier table or its overrides are malformed.
 */
public class TierConfigurationException extends RuntimeException {

    public TierConfigurationException(String message) {
        super(message);
    }

    public TierConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
