package com.gymcoach.analysis.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Reactive trace propagation for analysis requests.
 *
 * <p>Reactor Context carries {@code traceId} through the pipeline. MDC is only written
 * while a log statement runs and is cleared straight after, so worker threads on
 * {@code boundedElastic} never inherit a stale trace.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String USER_ID_KEY  = "userId";

    private TraceContextUtil() {}

    /** Returns {@code traceId} if present, otherwise a fresh random id. */
    public static String ensureTraceId(String traceId) {
        return traceId == null || traceId.isBlank() ? UUID.randomUUID().toString() : traceId;
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Never {@code null}; {@code "unknown"} when the context carries no trace. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code traceId} and {@code userId} into MDC for the duration of
     * {@code logAction} only.
     */
    public static void withMdc(String traceId, String userId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        if (userId != null) MDC.put(USER_ID_KEY, userId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(USER_ID_KEY);
        }
    }
}
