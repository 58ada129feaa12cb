package com.marketrouter.routing.registry;

import java.time.Duration;

/**
 * @param healthCheckInterval   period of the background health loop
 * @param healthGracePeriod     an ERROR provider whose last probe is older than this is
 *                              offered again so a real call can re-probe it
 * @param ewmaAlpha             smoothing factor for response time, quality and availability
 * @param responseTimeBaselineMs latency at which the health score's latency term reaches 0
 */
public record RegistrySettings(
    Duration healthCheckInterval,
    Duration healthGracePeriod,
    double ewmaAlpha,
    double responseTimeBaselineMs
) {
    public RegistrySettings {
        healthCheckInterval    = healthCheckInterval == null ? Duration.ofSeconds(60) : healthCheckInterval;
        healthGracePeriod      = healthGracePeriod == null ? Duration.ofSeconds(300) : healthGracePeriod;
        ewmaAlpha              = Math.max(0.01, Math.min(1.0, ewmaAlpha));
        responseTimeBaselineMs = responseTimeBaselineMs <= 0 ? 10_000 : responseTimeBaselineMs;
    }

    public static RegistrySettings defaults() {
        return new RegistrySettings(Duration.ofSeconds(60), Duration.ofSeconds(300), 0.1, 10_000);
    }
}
