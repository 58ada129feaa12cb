package com.marketrouter.common.exception;

import com.marketrouter.common.model.FailoverResult;

/**
 * Every candidate provider failed or was rejected by its circuit breaker.
 * The attached {@link FailoverResult} lists each provider and its error message.
 */
public class ProvidersExhaustedException extends MarketDataException {
    private final transient FailoverResult failoverResult;

    public ProvidersExhaustedException(String message, FailoverResult failoverResult) {
        super(message + " attempted=" + failoverResult.attemptedProviders()
              + " errors=" + failoverResult.errorMessages());
        this.failoverResult = failoverResult;
    }

    public FailoverResult getFailoverResult() {
        return failoverResult;
    }
}
