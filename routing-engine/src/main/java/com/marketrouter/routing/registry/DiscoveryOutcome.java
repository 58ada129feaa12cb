package com.marketrouter.routing.registry;

public enum DiscoveryOutcome {
    REGISTERED,
    FAILED,
    SKIPPED_NOT_DATA_SOURCE
}
