package com.extractionplatform.workers;

import com.extractionplatform.common.accumulator.AccumulatorSnapshot;
import com.extractionplatform.common.accumulator.FindingAccumulator;
import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.synthesis.SynthesisComponents;
import com.extractionplatform.common.worker.ExtractionWorker;
import com.extractionplatform.common.worker.WorkerContext;
import com.extractionplatform.common.worker.WorkerOutcome;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Runs a single worker against a directory and commits its partition, the way one phase
 * of the orchestrator would.
 */
public final class WorkerHarness {

    public static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");
    public static final Clock CLOCK = Clock.fixed(T0, ZoneOffset.UTC);

    private final SynthesisComponents components = SynthesisComponents.create(SynthesisConfig.defaults(), CLOCK);
    private final FindingAccumulator accumulator = new FindingAccumulator("run-test", components.findingFactory(), CLOCK);

    private WorkerOutcome lastOutcome;

    public WorkerHarness run(ExtractionWorker worker, Path corpus) {
        WorkerContext ctx = context(worker, corpus);
        lastOutcome = worker.execute(ctx);
        accumulator.seal(worker.workerId());
        accumulator.commit(worker.workerId());
        return this;
    }

    public WorkerContext context(ExtractionWorker worker, Path corpus) {
        return new WorkerContext("run-test", corpus.toString(), accumulator.snapshot(),
            T0.plus(Duration.ofMinutes(1)), accumulator.open(worker.workerId()), components.config(), CLOCK);
    }

    public WorkerOutcome lastOutcome() {
        return lastOutcome;
    }

    public AccumulatorSnapshot snapshot() {
        return accumulator.snapshot();
    }

    public FindingAccumulator accumulator() {
        return accumulator;
    }
}
