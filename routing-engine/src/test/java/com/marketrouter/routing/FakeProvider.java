package com.marketrouter.routing;

import com.marketrouter.common.model.AssetType;
import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.DataType;
import com.marketrouter.common.model.HealthCheckResult;
import com.marketrouter.common.model.ProviderCapability;
import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.common.provider.DataSourceProvider;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/** In-test provider with a fixed capability and a switchable health result. */
public class FakeProvider implements DataSourceProvider {

    private final ProviderCapability capability;
    private volatile boolean healthy = true;
    private final AtomicInteger disconnects = new AtomicInteger();

    public FakeProvider(ProviderCapability capability) {
        this.capability = capability;
    }

    public static FakeProvider stockKline(int priority) {
        return new FakeProvider(new ProviderCapability(
            EnumSet.of(AssetType.STOCK), EnumSet.of(DataType.HISTORICAL_KLINE), Set.of("SH", "SZ"),
            priority, 0.8, 0.8));
    }

    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    public int disconnectCount() {
        return disconnects.get();
    }

    @Override
    public ProviderCapability getCapabilities() {
        return capability;
    }

    @Override
    public DataTable extract(RoutingRequest request) {
        return DataTable.fromRows(List.of(Map.of("close", 10.0)));
    }

    @Override
    public HealthCheckResult healthCheck() {
        return healthy ? HealthCheckResult.healthy("ok", 1) : HealthCheckResult.unhealthy("down", 1);
    }

    @Override
    public void disconnect() {
        disconnects.incrementAndGet();
    }
}
