package com.marketrouter.routing.registry;

import com.marketrouter.common.provider.DataSourcePlugin;
import com.marketrouter.common.provider.DataSourceProvider;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether an arbitrary object is a market data source. Checks run in a fixed
 * order and the first match wins:
 * <pre>
 *   1. implements DataSourceProvider                       → INTERFACE
 *   2. public getSupportedDataTypes() + extraction method  → REQUIRED_METHODS
 *   3. annotated with @DataSourcePlugin                    → DECLARED_TYPE
 *   4. class name contains a data-source indicator         → NAME_HEURISTIC
 * </pre>
 */
public final class ProviderProbe {

    /** Method names accepted as the extraction entry point, in lookup order. */
    static final List<String> EXTRACTION_METHODS = List.of("extract", "fetchData", "getData");

    static final String DATA_TYPES_METHOD   = "getSupportedDataTypes";
    static final String ASSET_TYPES_METHOD  = "getSupportedAssetTypes";
    static final String MARKETS_METHOD      = "getSupportedMarkets";

    private static final List<String> NAME_INDICATORS = List.of(
        "datasource", "data_source", "dataplugin", "data_plugin",
        "dataprovider", "stockplugin", "cryptoplugin", "financeplugin", "marketdata");

    private ProviderProbe() {}

    public static Optional<ProbeMethod> probe(Object candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        if (candidate instanceof DataSourceProvider) {
            return Optional.of(ProbeMethod.INTERFACE);
        }
        Class<?> type = candidate.getClass();
        if (findNoArg(type, DATA_TYPES_METHOD).isPresent() && hasExtractionMethod(type)) {
            return Optional.of(ProbeMethod.REQUIRED_METHODS);
        }
        if (type.isAnnotationPresent(DataSourcePlugin.class)) {
            return Optional.of(ProbeMethod.DECLARED_TYPE);
        }
        String name = type.getSimpleName().toLowerCase(Locale.ROOT);
        if (NAME_INDICATORS.stream().anyMatch(name::contains)) {
            return Optional.of(ProbeMethod.NAME_HEURISTIC);
        }
        return Optional.empty();
    }

    static boolean hasExtractionMethod(Class<?> type) {
        for (Method m : type.getMethods()) {
            if (EXTRACTION_METHODS.contains(m.getName()) && !Modifier.isStatic(m.getModifiers())) {
                return true;
            }
        }
        return false;
    }

    static Optional<Method> findNoArg(Class<?> type, String name) {
        try {
            Method m = type.getMethod(name);
            return Modifier.isStatic(m.getModifiers()) ? Optional.empty() : Optional.of(m);
        } catch (NoSuchMethodException e) {
            return Optional.empty();
        }
    }
}
