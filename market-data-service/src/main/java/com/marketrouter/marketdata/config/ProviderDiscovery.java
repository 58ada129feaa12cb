package com.marketrouter.marketdata.config;

import com.marketrouter.common.provider.DataSourcePlugin;
import com.marketrouter.common.provider.DataSourceProvider;
import com.marketrouter.routing.registry.DiscoveryOutcome;
import com.marketrouter.routing.registry.ProviderHealthMonitor;
import com.marketrouter.routing.registry.ProviderRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registers every provider bean in the application context under its bean name, then
 * starts the background health monitor.
 *
 * <p>Beans implementing {@link DataSourceProvider} and beans annotated with
 * {@link DataSourcePlugin} are both picked up; the registry probes and adapts the latter.
 */
@Component
public class ProviderDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ProviderDiscovery.class);

    private final ApplicationContext context;
    private final ProviderRegistry registry;
    private final ProviderHealthMonitor healthMonitor;
    private final RouterProperties props;

    public ProviderDiscovery(ApplicationContext context, ProviderRegistry registry,
                             ProviderHealthMonitor healthMonitor, RouterProperties props) {
        this.context       = context;
        this.registry      = registry;
        this.healthMonitor = healthMonitor;
        this.props         = props;
    }

    @PostConstruct
    public void discoverProviders() {
        Map<String, Object> candidates = new LinkedHashMap<>(context.getBeansOfType(DataSourceProvider.class));
        context.getBeansWithAnnotation(DataSourcePlugin.class).forEach(candidates::putIfAbsent);

        Map<String, DiscoveryOutcome> outcomes = registry.discover(candidates);
        long registered = outcomes.values().stream().filter(o -> o == DiscoveryOutcome.REGISTERED).count();
        log.info("PROVIDER_DISCOVERY_COMPLETED candidates={} registered={} outcomes={}",
                 candidates.size(), registered, outcomes);

        if (props.getRegistry().isHealthCheckEnabled()) {
            healthMonitor.start();
        }
    }
}
