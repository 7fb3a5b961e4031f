package com.fermata.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a per-request trace id through Reactor pipelines.
 *
 * <p>The Reactor Context holds the id. MDC is written only for the span of a single log call,
 * through {@link #withMdc}, and cleared straight after.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(generation, TraceContextUtil.newTraceId());
 *     ...
 *     .doOnEach(signal -> flowLogger.log(signal.getContextView(), ...))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Short random id, 12 hex characters. */
    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * Writes {@code traceId} into the pipeline's Reactor Context. {@code contextWrite} applies
     * upstream, so call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    public static <T> Flux<T> withTraceId(Flux<T> flux, String traceId) {
        return flux.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** The trace id in {@code ctx}, or {@value #UNKNOWN}; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Runs {@code logAction} with the trace id in MDC, then removes it. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
