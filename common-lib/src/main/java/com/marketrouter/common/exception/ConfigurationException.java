package com.marketrouter.common.exception;

/**
 * Invalid query or configuration: unknown explicit provider, missing required field,
 * out-of-range setting. Surfaced to the caller and never retried.
 */
public class ConfigurationException extends MarketDataException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String providerId, String message) {
        super(providerId, message);
    }
}
