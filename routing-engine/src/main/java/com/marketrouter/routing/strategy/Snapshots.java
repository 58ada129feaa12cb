package com.marketrouter.routing.strategy;

import com.marketrouter.routing.registry.ProviderSnapshot;

import java.util.Map;

/**
 * Null-safe reads from a snapshot map, shared by the strategies.
 */
final class Snapshots {

    private Snapshots() {}

    static double health(Map<String, ProviderSnapshot> snapshots, String id) {
        ProviderSnapshot s = snapshots.get(id);
        return s == null ? 0.0 : s.healthScore();
    }

    static double successRate(Map<String, ProviderSnapshot> snapshots, String id) {
        ProviderSnapshot s = snapshots.get(id);
        return s == null ? 0.0 : s.successRate();
    }

    static int priority(Map<String, ProviderSnapshot> snapshots, String id) {
        ProviderSnapshot s = snapshots.get(id);
        return s == null ? Integer.MAX_VALUE : s.priority();
    }

    static int load(Map<String, ProviderSnapshot> snapshots, String id) {
        ProviderSnapshot s = snapshots.get(id);
        return s == null ? Integer.MAX_VALUE : s.currentLoad();
    }

    static double latencyMs(Map<String, ProviderSnapshot> snapshots, String id) {
        ProviderSnapshot s = snapshots.get(id);
        return s == null ? Double.MAX_VALUE : s.avgResponseTimeMs();
    }
}
