package com.marketrouter.common.breaker;

public enum CircuitState {
    CLOSED,
    HALF_OPEN,
    OPEN
}
