package com.techportfolio.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the request {@code traceId} through reactive pipelines.
 *
 * <p>The Reactor Context is the only store for the traceId inside a pipeline. MDC is
 * written just for the duration of a single log statement via {@link #withMdc}, never
 * left behind on a shared event-loop thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(service.createPortfolio(request), traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Returns the inbound traceId, or a fresh one when the caller sent none.
     */
    public static String resolve(String inboundTraceId) {
        return inboundTraceId == null || inboundTraceId.isBlank()
            ? UUID.randomUUID().toString()
            : inboundTraceId;
    }

    /**
     * Stores {@code traceId} in the Context of {@code mono}. {@code contextWrite}
     * propagates upstream at subscription, so call this at the end of assembly.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    public static <T> Flux<T> withTraceId(Flux<T> flux, String traceId) {
        return flux.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * @return the traceId in {@code ctx}, or {@value #UNKNOWN}; never {@code null}
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges {@code traceId} into MDC while {@code logAction} runs, then removes it.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
