package com.marketrouter.common.exception;

import com.marketrouter.common.breaker.DegradationLevel;

public class CircuitOpenException extends MarketDataException {
    private final DegradationLevel degradationLevel;

    public CircuitOpenException(String providerId, DegradationLevel degradationLevel) {
        super(providerId, "circuit open, degradation=" + degradationLevel);
        this.degradationLevel = degradationLevel;
    }

    public DegradationLevel getDegradationLevel() {
        return degradationLevel;
    }
}
