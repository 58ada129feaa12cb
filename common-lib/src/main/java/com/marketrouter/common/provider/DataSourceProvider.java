package com.marketrouter.common.provider;

import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.HealthCheckResult;
import com.marketrouter.common.model.ProviderCapability;
import com.marketrouter.common.model.RoutingRequest;

/**
 * Contract every market data backend implements.
 *
 * <p>Implementations may block on network I/O inside {@link #extract}; the caller enforces
 * a timeout around each call. Errors are signalled by throwing: a
 * {@link com.marketrouter.common.exception.ProviderException} when the provider knows the
 * failure type, any other runtime exception otherwise.
 *
 * <p>Connection management is optional. Providers without a session keep the defaults.
 */
public interface DataSourceProvider {

    ProviderCapability getCapabilities();

    /**
     * Fetches raw data for the request. Column names are whatever the backend uses;
     * the pipeline maps them to canonical fields afterwards.
     */
    DataTable extract(RoutingRequest request);

    default HealthCheckResult healthCheck() {
        return HealthCheckResult.healthy("no health probe implemented", 0L);
    }

    default boolean connect() {
        return true;
    }

    default void disconnect() {
    }

    default boolean isConnected() {
        return true;
    }
}
