package com.marketrouter.routing.registry;

/**
 * Operational status of a registered provider.
 *
 * <p>UNKNOWN until the first health probe or successful call. ERROR after a failed
 * probe. DISABLED only by explicit operator action and never changed by probes.
 */
public enum ProviderStatus {
    UNKNOWN,
    ACTIVE,
    INACTIVE,
    ERROR,
    DISABLED
}
