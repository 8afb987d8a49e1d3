package com.extractionplatform.orchestrator.service;

import com.extractionplatform.common.accumulator.AccumulatorSnapshot;
import com.extractionplatform.common.accumulator.FindingAccumulator;
import com.extractionplatform.common.accumulator.FindingSink;
import com.extractionplatform.common.exception.InvalidConfigurationException;
import com.extractionplatform.common.exception.ValidationException;
import com.extractionplatform.common.synthesis.SynthesisComponents;
import com.extractionplatform.common.synthesis.SynthesisResult;
import com.extractionplatform.common.trace.TraceContextUtil;
import com.extractionplatform.common.worker.ExtractionWorker;
import com.extractionplatform.common.worker.WorkerContext;
import com.extractionplatform.common.worker.WorkerOutcome;
import com.extractionplatform.common.worker.WorkerStatus;
import com.extractionplatform.orchestrator.config.SynthesisProperties;
import com.extractionplatform.orchestrator.logger.RunFlowLogger;
import com.extractionplatform.orchestrator.phase.PhaseDefinition;
import com.extractionplatform.orchestrator.phase.PhaseMode;
import com.extractionplatform.orchestrator.phase.PhasePlanner;
import com.extractionplatform.orchestrator.phase.PhaseStatus;
import com.extractionplatform.orchestrator.run.PhaseReport;
import com.extractionplatform.orchestrator.run.RunReport;
import com.extractionplatform.orchestrator.run.RunRequest;
import com.extractionplatform.orchestrator.run.RunStatus;
import com.extractionplatform.orchestrator.run.WorkerReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Drives one run through its phase graph.
 *
 * <p>Workers write only into their own accumulator partition. A parallel phase dispatches
 * every worker on {@code boundedElastic} against the snapshot taken when the phase
 * started; a sequential phase runs them one at a time and commits after each, so every
 * worker sees what the previous ones produced. Either way the phase barrier commits the
 * partitions in declaration order and runs a synthesis pass over the frozen snapshot.
 *
 * <p>Each worker is bounded by the earlier of its phase deadline and the run deadline. A
 * worker that overruns is marked {@code timed_out}, its partition sealed and its context
 * cancelled; whatever it emitted before the seal is kept. Exceptions escaping a worker
 * become {@code error} and never fail the phase. Once the run deadline has passed the
 * remaining phases are skipped and the run goes straight to synthesis.
 */
@Service
public class RunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    private final Map<String, ExtractionWorker> workers;
    private final List<PhaseDefinition>         plan;
    private final Duration                      runTimeout;
    private final SynthesisComponents           components;
    private final RunFlowLogger                 flowLogger;
    private final RunRegistry                   registry;
    private final Clock                         clock;

    @Autowired
    public RunOrchestrator(List<ExtractionWorker> workers,
                           SynthesisProperties properties,
                           SynthesisComponents components,
                           RunFlowLogger flowLogger,
                           RunRegistry registry,
                           Clock clock) {
        this(workers, properties.toPhaseDefinitions(), properties.effectiveRunTimeout(),
             components, flowLogger, registry, clock);
    }

    public RunOrchestrator(List<ExtractionWorker> workers,
                           List<PhaseDefinition> phases,
                           Duration runTimeout,
                           SynthesisComponents components,
                           RunFlowLogger flowLogger,
                           RunRegistry registry,
                           Clock clock) {
        Map<String, ExtractionWorker> byId = new LinkedHashMap<>();
        for (ExtractionWorker worker : workers) {
            if (byId.putIfAbsent(worker.workerId(), worker) != null) {
                throw new InvalidConfigurationException("duplicate worker id '" + worker.workerId() + "'");
            }
        }
        if (runTimeout == null || runTimeout.isNegative() || runTimeout.isZero()) {
            throw new InvalidConfigurationException("run timeout must be positive");
        }
        this.workers    = byId;
        this.plan       = PhasePlanner.plan(phases, byId.keySet());
        this.runTimeout = runTimeout;
        this.components = components;
        this.flowLogger = flowLogger;
        this.registry   = registry;
        this.clock      = clock;
        log.info("RunOrchestrator ready. workers={} phases={} runTimeout={}",
                 byId.keySet(), plan.stream().map(PhaseDefinition::name).toList(), runTimeout);
    }

    public List<PhaseDefinition> plan() {
        return plan;
    }

    public Mono<RunReport> execute(RunRequest request) {
        return Mono.defer(() -> {
            if (request == null || request.corpusReference() == null || request.corpusReference().isBlank()) {
                return Mono.error(new ValidationException("corpusReference", "must not be blank"));
            }
            Run run = new Run(UUID.randomUUID().toString(), request.corpusReference(), clock.instant());

            Mono<RunReport> pipeline = Mono.just(run)
                .doOnEach(flowLogger.stage(RunFlowLogger.RUN_STARTED))
                .flatMapMany(r -> Flux.fromIterable(plan))
                .concatMap(phase -> Mono.defer(() -> runPhase(run, phase)))
                .collectList()
                .map(phaseReports -> finalizeRun(run, phaseReports))
                .doOnEach(flowLogger.stage(RunFlowLogger.SYNTHESIS_COMPLETED))
                .doOnNext(report -> {
                    registry.register(report);
                    flowLogger.log(RunFlowLogger.RUN_FINALIZED, report.runId(), String.format(
                        "status=%s truncated=%s overall=%.4f findings=%d",
                        report.status().id(), report.truncated(), report.overallConfidence(),
                        report.accumulator().size()));
                });

            return TraceContextUtil.withRunId(pipeline, run.runId);
        });
    }

    // ── Phases ───────────────────────────────────────────────────────────────

    private Mono<PhaseReport> runPhase(Run run, PhaseDefinition phase) {
        Instant startedAt = clock.instant();
        boolean dependencySkipped = phase.dependsOn().stream()
            .anyMatch(dep -> run.phaseStatuses.get(dep) == PhaseStatus.SKIPPED);

        if (!startedAt.isBefore(run.deadline) || dependencySkipped) {
            run.truncated = true;
            run.phaseStatuses.put(phase.name(), PhaseStatus.SKIPPED);
            flowLogger.warn(RunFlowLogger.PHASE_STARTED, run.runId, String.format(
                "phase=%s skipped reason=%s", phase.name(),
                dependencySkipped ? "dependency skipped" : "run deadline exceeded"));
            return Mono.just(PhaseReport.skipped(phase.name(), phase.mode()));
        }

        run.transition(RunStatus.PHASE_RUNNING);
        run.phaseStatuses.put(phase.name(), PhaseStatus.RUNNING);

        Instant phaseDeadline = startedAt.plus(phase.timeout());
        boolean boundByRun = !phaseDeadline.isBefore(run.deadline);
        Instant deadline = boundByRun ? run.deadline : phaseDeadline;
        int sizeBefore = run.accumulator.snapshot().size();

        flowLogger.log(RunFlowLogger.PHASE_STARTED, run.runId, String.format(
            "phase=%s mode=%s workers=%s deadline=%s", phase.name(), phase.mode().id(), phase.workerIds(), deadline));

        Mono<List<WorkerReport>> settled;
        if (phase.mode() == PhaseMode.PARALLEL) {
            AccumulatorSnapshot prior = run.accumulator.snapshot();
            settled = Flux.fromIterable(phase.workerIds())
                .flatMap(id -> runWorker(run, workers.get(id), prior, deadline))
                .collectList();
        } else {
            settled = Flux.fromIterable(phase.workerIds())
                .concatMap(id -> Mono.defer(() -> runWorker(run, workers.get(id), run.accumulator.snapshot(), deadline))
                    .doOnNext(report -> run.accumulator.commit(id)))
                .collectList();
        }

        return settled.map(reports -> barrier(run, phase, reports, startedAt, sizeBefore, boundByRun));
    }

    private PhaseReport barrier(Run run, PhaseDefinition phase, List<WorkerReport> reports,
                                Instant startedAt, int sizeBefore, boolean boundByRun) {
        for (String id : phase.workerIds()) {
            run.accumulator.seal(id);
            run.accumulator.commit(id);
        }
        AccumulatorSnapshot snapshot = run.accumulator.snapshot();

        List<WorkerReport> ordered = new ArrayList<>(reports);
        ordered.sort(Comparator.comparingInt(r -> phase.workerIds().indexOf(r.workerId())));

        boolean allSucceeded = ordered.stream().allMatch(r -> r.status() == WorkerStatus.SUCCESS);
        PhaseStatus status = allSucceeded ? PhaseStatus.COMPLETE : PhaseStatus.PARTIAL;
        if (boundByRun && ordered.stream().anyMatch(r -> r.status() == WorkerStatus.TIMED_OUT)) {
            run.truncated = true;
        }
        run.phaseStatuses.put(phase.name(), status);

        Double overall = null;
        try {
            overall = components.engine().synthesize(snapshot).confidence().overall();
        } catch (RuntimeException e) {
            // the final pass decides the run status; the barrier pass is informational
            log.warn("Barrier synthesis failed. runId={} phase={}", run.runId, phase.name(), e);
        }

        int committed = snapshot.size() - sizeBefore;
        flowLogger.log(RunFlowLogger.PHASE_BARRIER, run.runId, String.format(
            "phase=%s status=%s committed=%d overall=%s", phase.name(), status.id(), committed,
            overall == null ? "n/a" : String.format("%.4f", overall)));

        return new PhaseReport(phase.name(), phase.mode(), status, ordered, committed, overall,
                               startedAt, clock.instant());
    }

    // ── Workers ──────────────────────────────────────────────────────────────

    private Mono<WorkerReport> runWorker(Run run, ExtractionWorker worker, AccumulatorSnapshot prior, Instant deadline) {
        String id = worker.workerId();
        FindingSink sink = run.accumulator.open(id);
        Duration budget = Duration.between(clock.instant(), deadline);

        if (budget.isNegative() || budget.isZero()) {
            return Mono.just(settle(run, id, WorkerStatus.TIMED_OUT, "deadline passed before the worker started", 0L));
        }

        WorkerContext ctx = new WorkerContext(run.runId, run.corpusReference, prior, deadline, sink,
                                              components.config(), clock);
        long started = System.nanoTime();

        return Mono.fromCallable(() -> worker.execute(ctx))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(budget)
            .map(outcome -> outcome == null
                ? settle(run, id, WorkerStatus.ERROR, "worker returned no outcome", elapsedMs(started))
                : settle(run, id, outcome.status(), outcome.errorDetail(), elapsedMs(started)))
            .onErrorResume(TimeoutException.class, e -> {
                // seal before cancelling so nothing emitted after the deadline is kept
                WorkerReport report = settle(run, id, WorkerStatus.TIMED_OUT,
                    "deadline exceeded after " + budget.toMillis() + "ms", elapsedMs(started));
                ctx.cancel();
                return Mono.just(report);
            })
            .onErrorResume(e -> {
                log.error("Worker={} failed. runId={}", id, run.runId, e);
                String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                return Mono.just(settle(run, id, WorkerStatus.ERROR, detail, elapsedMs(started)));
            });
    }

    private WorkerReport settle(Run run, String workerId, WorkerStatus status, String detail, long durationMs) {
        run.accumulator.seal(workerId);
        int findings = run.accumulator.partitionFindings(workerId).size();
        WorkerReport report = new WorkerReport(workerId, status,
            status == WorkerStatus.SUCCESS ? null : detail, findings, 0, durationMs);
        flowLogger.log(RunFlowLogger.WORKER_SETTLED, run.runId, String.format(
            "worker=%s status=%s findings=%d durationMs=%d", workerId, status.id(), findings, durationMs));
        return report;
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    // ── Synthesis ────────────────────────────────────────────────────────────

    private RunReport finalizeRun(Run run, List<PhaseReport> phaseReports) {
        run.transition(RunStatus.SYNTHESIZING);
        AccumulatorSnapshot snapshot = run.accumulator.snapshot();

        // late arrivals keep accruing after a barrier; count them as of now
        List<PhaseReport> phases = phaseReports.stream()
            .map(p -> p.withWorkers(p.workers().stream()
                .map(w -> w.withLateArrivals(run.accumulator.lateArrivals(w.workerId())))
                .toList()))
            .toList();

        try {
            SynthesisResult result = components.engine().synthesize(snapshot);
            run.transition(RunStatus.COMPLETE);
            return new RunReport(run.runId, run.corpusReference, components.config().version(), RunStatus.COMPLETE,
                run.truncated, run.startedAt, clock.instant(), phases, snapshot,
                result.conflicts(), result.confidence(), null);
        } catch (RuntimeException e) {
            log.error("Synthesis failed. runId={} findings={}", run.runId, snapshot.size(), e);
            run.transition(RunStatus.FAILED);
            return new RunReport(run.runId, run.corpusReference, components.config().version(), RunStatus.FAILED,
                run.truncated, run.startedAt, clock.instant(), phases, snapshot,
                null, null, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /** Mutable run state, touched only by this orchestrator. */
    private final class Run {

        final String             runId;
        final String             corpusReference;
        final Instant            startedAt;
        final Instant            deadline;
        final FindingAccumulator accumulator;
        final Map<String, PhaseStatus> phaseStatuses = new ConcurrentHashMap<>();
        volatile RunStatus status = RunStatus.PENDING;
        volatile boolean   truncated;

        Run(String runId, String corpusReference, Instant startedAt) {
            this.runId           = runId;
            this.corpusReference = corpusReference;
            this.startedAt       = startedAt;
            this.deadline        = startedAt.plus(runTimeout);
            this.accumulator     = new FindingAccumulator(runId, components.findingFactory(), clock);
        }

        void transition(RunStatus next) {
            if (!status.canMoveTo(next)) {
                throw new IllegalStateException("run " + runId + " cannot move from " + status + " to " + next);
            }
            status = next;
        }
    }
}
