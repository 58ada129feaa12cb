package com.marketrouter.routing.registry;

import com.marketrouter.common.breaker.FailureClassifier;
import com.marketrouter.common.breaker.FailureType;
import com.marketrouter.common.exception.ProviderException;
import com.marketrouter.common.model.DataTable;
import com.marketrouter.common.model.HealthCheckResult;
import com.marketrouter.common.model.ProviderCapability;
import com.marketrouter.common.model.RoutingRequest;
import com.marketrouter.common.provider.DataSourcePlugin;
import com.marketrouter.common.provider.DataSourceProvider;
import org.apache.commons.lang3.StringUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Presents a provider that does not implement {@link DataSourceProvider} through that
 * contract. Methods are resolved once, when the adapter is built; calls never re-probe.
 *
 * <h3>Accepted extraction signatures</h3>
 * <pre>
 *   extract|fetchData|getData (RoutingRequest)
 *   extract|fetchData|getData (String symbol, String dataType, Map params)
 *   extract|fetchData|getData (String symbol, Map params)        dataType goes in params
 * </pre>
 *
 * <h3>Accepted reply shapes</h3>
 * <pre>
 *   DataTable                          as is
 *   List&lt;Map&lt;String, ?&gt;&gt;                 one map per row
 *   Map&lt;String, List&lt;?&gt;&gt;                 column-oriented
 *   Map&lt;String, ?&gt;                       a single row
 *   null                               empty table
 * </pre>
 *
 * Optional {@code healthCheck()}, {@code connect()}, {@code disconnect()} and
 * {@code isConnected()} methods are used when present; otherwise the interface defaults apply.
 */
public final class ReflectiveProviderAdapter implements DataSourceProvider {

    private enum Shape { REQUEST, SYMBOL_TYPE_PARAMS, SYMBOL_PARAMS }

    private final String providerId;
    private final Object target;
    private final Method extractMethod;
    private final Shape shape;
    private final ProviderCapability capability;
    private final Method healthMethod;
    private final Method connectMethod;
    private final Method disconnectMethod;
    private final Method connectedMethod;

    private ReflectiveProviderAdapter(String providerId, Object target, Method extractMethod, Shape shape) {
        this.providerId       = providerId;
        this.target           = target;
        this.extractMethod    = extractMethod;
        this.shape            = shape;
        this.healthMethod     = accessible(ProviderProbe.findNoArg(target.getClass(), "healthCheck"));
        this.connectMethod    = accessible(ProviderProbe.findNoArg(target.getClass(), "connect"));
        this.disconnectMethod = accessible(ProviderProbe.findNoArg(target.getClass(), "disconnect"));
        this.connectedMethod  = accessible(ProviderProbe.findNoArg(target.getClass(), "isConnected"));
        this.capability       = resolveCapability();
    }

    /** Empty when the target has no usable extraction method. */
    public static Optional<ReflectiveProviderAdapter> adapt(String providerId, Object target) {
        for (String name : ProviderProbe.EXTRACTION_METHODS) {
            for (Method m : target.getClass().getMethods()) {
                if (!m.getName().equals(name) || Modifier.isStatic(m.getModifiers())) {
                    continue;
                }
                Optional<Shape> shape = shapeOf(m.getParameterTypes());
                if (shape.isPresent()) {
                    m.trySetAccessible();
                    return Optional.of(new ReflectiveProviderAdapter(providerId, target, m, shape.get()));
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Shape> shapeOf(Class<?>[] params) {
        if (params.length == 1 && params[0].isAssignableFrom(RoutingRequest.class)) {
            return Optional.of(Shape.REQUEST);
        }
        if (params.length == 3 && params[0] == String.class && params[1] == String.class
                && Map.class.isAssignableFrom(params[2])) {
            return Optional.of(Shape.SYMBOL_TYPE_PARAMS);
        }
        if (params.length == 2 && params[0] == String.class && Map.class.isAssignableFrom(params[1])) {
            return Optional.of(Shape.SYMBOL_PARAMS);
        }
        return Optional.empty();
    }

    public Object getTarget() {
        return target;
    }

    // ── DataSourceProvider ────────────────────────────────────────────────────

    @Override
    public ProviderCapability getCapabilities() {
        return capability;
    }

    @Override
    public DataTable extract(RoutingRequest request) {
        Object reply = switch (shape) {
            case REQUEST -> invoke(extractMethod, request);
            case SYMBOL_TYPE_PARAMS -> invoke(extractMethod, request.symbol(), dataTypeName(request), params(request));
            case SYMBOL_PARAMS -> {
                Map<String, Object> params = params(request);
                params.put("dataType", dataTypeName(request));
                yield invoke(extractMethod, request.symbol(), params);
            }
        };
        return toTable(providerId, reply);
    }

    @Override
    public HealthCheckResult healthCheck() {
        if (healthMethod == null) {
            return DataSourceProvider.super.healthCheck();
        }
        long start = System.nanoTime();
        Object reply = invoke(healthMethod);
        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        if (reply instanceof HealthCheckResult r) {
            return r;
        }
        if (reply instanceof Boolean b) {
            return b ? HealthCheckResult.healthy("ok", latencyMs)
                     : HealthCheckResult.unhealthy("provider reported unhealthy", latencyMs);
        }
        return HealthCheckResult.healthy(String.valueOf(reply), latencyMs);
    }

    @Override
    public boolean connect() {
        if (connectMethod == null) {
            return true;
        }
        Object reply = invoke(connectMethod);
        return !(reply instanceof Boolean b) || b;
    }

    @Override
    public void disconnect() {
        if (disconnectMethod != null) {
            invoke(disconnectMethod);
        }
    }

    @Override
    public boolean isConnected() {
        if (connectedMethod == null) {
            return true;
        }
        return Boolean.TRUE.equals(invoke(connectedMethod));
    }

    // ── reply conversion ──────────────────────────────────────────────────────

    /**
     * Converts a raw reply into a table.
     *
     * @throws ProviderException with {@link FailureType#DATA_QUALITY} for unsupported shapes
     */
    @SuppressWarnings("unchecked")
    static DataTable toTable(String providerId, Object reply) {
        if (reply == null) {
            return DataTable.empty();
        }
        if (reply instanceof DataTable t) {
            return t;
        }
        if (reply instanceof List<?> list) {
            List<Map<String, ?>> rows = new ArrayList<>(list.size());
            for (Object row : list) {
                if (!(row instanceof Map<?, ?> m)) {
                    throw new ProviderException(providerId, FailureType.DATA_QUALITY,
                        "row is not a map: " + (row == null ? "null" : row.getClass().getSimpleName()));
                }
                rows.add(stringKeys(m));
            }
            return DataTable.fromRows(rows);
        }
        if (reply instanceof Map<?, ?> map) {
            boolean columnar = !map.isEmpty() && map.values().stream().allMatch(v -> v instanceof List<?>);
            return columnar ? fromColumns((Map<?, List<?>>) map) : DataTable.fromRows(List.of(stringKeys(map)));
        }
        throw new ProviderException(providerId, FailureType.DATA_QUALITY,
            "unsupported reply type " + reply.getClass().getName());
    }

    private static DataTable fromColumns(Map<?, List<?>> columns) {
        int length = columns.values().stream().mapToInt(List::size).max().orElse(0);
        List<String> names = new ArrayList<>();
        columns.keySet().forEach(k -> names.add(String.valueOf(k)));
        List<Map<String, Object>> rows = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<?, List<?>> e : columns.entrySet()) {
                List<?> values = e.getValue();
                row.put(String.valueOf(e.getKey()), i < values.size() ? values.get(i) : null);
            }
            rows.add(row);
        }
        return DataTable.of(names, rows);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> m) {
        Map<String, Object> out = new LinkedHashMap<>();
        m.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    // ── capability resolution ─────────────────────────────────────────────────

    private ProviderCapability resolveCapability() {
        DataSourcePlugin plugin = target.getClass().getAnnotation(DataSourcePlugin.class);
        ProviderCapability declared;
        if (plugin != null) {
            declared = new ProviderCapability(
                CapabilityInference.parseAssetTypes(Arrays.asList(plugin.assetTypes())),
                CapabilityInference.parseDataTypes(Arrays.asList(plugin.dataTypes())),
                CapabilityInference.parseMarkets(Arrays.asList(plugin.markets())),
                plugin.priority() >= 0 ? plugin.priority() : ProviderCapability.DEFAULT_PRIORITY,
                0.8, 0.8);
        } else {
            declared = new ProviderCapability(
                CapabilityInference.parseAssetTypes(declaredValues(ProviderProbe.ASSET_TYPES_METHOD)),
                CapabilityInference.parseDataTypes(declaredValues(ProviderProbe.DATA_TYPES_METHOD)),
                CapabilityInference.parseMarkets(declaredValues(ProviderProbe.MARKETS_METHOD)),
                ProviderCapability.DEFAULT_PRIORITY, 0.8, 0.8);
        }
        String name = plugin != null && StringUtils.isNotBlank(plugin.name())
            ? plugin.name() : providerId + " " + target.getClass().getSimpleName();
        return CapabilityInference.complete(name, declared);
    }

    private Collection<?> declaredValues(String methodName) {
        Optional<Method> m = ProviderProbe.findNoArg(target.getClass(), methodName);
        if (m.isEmpty()) {
            return Set.of();
        }
        m.get().trySetAccessible();
        Object reply = invoke(m.get());
        if (reply instanceof Collection<?> c) {
            return c;
        }
        if (reply instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return reply == null ? Set.of() : List.of(reply);
    }

    // ── invocation ────────────────────────────────────────────────────────────

    private Object invoke(Method method, Object... args) {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new ProviderException(providerId, FailureClassifier.classify(cause),
                                        method.getName() + " failed: " + cause.getMessage(), cause);
        } catch (IllegalAccessException e) {
            throw new ProviderException(providerId, FailureType.UNKNOWN,
                                        method.getName() + " is not accessible", e);
        }
    }

    private static Method accessible(Optional<Method> method) {
        method.ifPresent(Method::trySetAccessible);
        return method.orElse(null);
    }

    private static String dataTypeName(RoutingRequest request) {
        return request.dataType().name().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Object> params(RoutingRequest request) {
        Map<String, Object> params = new LinkedHashMap<>(request.extraParams());
        params.put("assetType", request.assetType().name().toLowerCase(Locale.ROOT));
        if (request.market() != null)    params.put("market", request.market());
        if (request.startDate() != null) params.put("startDate", request.startDate().toString());
        if (request.endDate() != null)   params.put("endDate", request.endDate().toString());
        if (request.period() != null)    params.put("period", request.period());
        return params;
    }
}
