package com.marketrouter.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Request trace id propagation.
 *
 * <p>Inside reactive chains the Reactor Context holds the trace id. MDC is written
 * only for the duration of a single log statement, never left populated on a thread:
 * <pre>
 *     TraceContextUtil.withMdc(traceId, () -> log.info("..."));
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId == null ? UNKNOWN : traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
