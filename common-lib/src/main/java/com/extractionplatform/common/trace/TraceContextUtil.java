package com.extractionplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Lightweight reactive tracing utility keyed by run id.
 *
 * <p>Reactor Context is the single source of truth for the run id inside reactive
 * pipelines. MDC is only written as a temporary bridge during a log statement, never as a
 * persistent ThreadLocal store; worker threads are pooled and shared across runs.
 *
 * <p>Usage in reactive chains:
 * <pre>
 *     return TraceContextUtil.withRunId(pipeline, run.runId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private TraceContextUtil() {}

    /**
     * Stores {@code runId} in the Reactor Context. {@code contextWrite} propagates upstream
     * during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** Returns {@code "unknown"} if absent, never {@code null}. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code runId} into MDC for the duration of {@code logAction}, then removes it.
     */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
