package com.extractionplatform.orchestrator.logger;

import com.extractionplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the run lifecycle inside the reactive orchestration pipeline.
 *
 * <p>Logs each stage of a run without touching its state. All methods are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #RUN_STARTED}          run accepted, phases planned</li>
 *   <li>{@link #PHASE_STARTED}        a phase begins dispatching workers</li>
 *   <li>{@link #WORKER_SETTLED}       a worker reached success, error or timed_out</li>
 *   <li>{@link #PHASE_BARRIER}        partitions committed and the barrier synthesis ran</li>
 *   <li>{@link #SYNTHESIS_COMPLETED}  final synthesis over the frozen snapshot</li>
 *   <li>{@link #RUN_FINALIZED}        report registered</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads runId from Reactor Context):
 * <pre>
 *     .doOnEach(runFlowLogger.stage(RunFlowLogger.SYNTHESIS_COMPLETED))
 * </pre>
 */
@Component
public class RunFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RunFlowLogger.class);

    public static final String RUN_STARTED         = "RUN_STARTED";
    public static final String PHASE_STARTED       = "PHASE_STARTED";
    public static final String WORKER_SETTLED      = "WORKER_SETTLED";
    public static final String PHASE_BARRIER       = "PHASE_BARRIER";
    public static final String SYNTHESIS_COMPLETED = "SYNTHESIS_COMPLETED";
    public static final String RUN_FINALIZED       = "RUN_FINALIZED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * The run id comes from the Reactor Context, never from MDC.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = TraceContextUtil.getRunId(signal.getContextView());
            TraceContextUtil.withMdc(runId, () ->
                log.info("[RunFlow] stage={} runId={}", stageName, runId)
            );
        };
    }

    /**
     * Logs a stage when the run id is already at hand, with a free-form detail suffix.
     */
    public void log(String stageName, String runId, String detail) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[RunFlow] stage={} runId={} {}", stageName, runId, detail)
        );
    }

    public void warn(String stageName, String runId, String detail) {
        TraceContextUtil.withMdc(runId, () ->
            log.warn("[RunFlow] stage={} runId={} {}", stageName, runId, detail)
        );
    }
}
