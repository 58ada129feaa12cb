package com.marketrouter.common.exception;

import com.marketrouter.common.breaker.FailureType;

/**
 * One failed extraction attempt against a provider. Carries the classified
 * {@link FailureType} so the caller can record it without re-classifying.
 */
public class ProviderException extends MarketDataException {
    private final FailureType failureType;

    public ProviderException(String providerId, FailureType failureType, String message) {
        super(providerId, message);
        this.failureType = failureType;
    }

    public ProviderException(String providerId, FailureType failureType, String message, Throwable cause) {
        super(providerId, message, cause);
        this.failureType = failureType;
    }

    public FailureType getFailureType() {
        return failureType;
    }
}
