package com.extractionplatform.common.worker;

import com.extractionplatform.common.accumulator.AccumulatorSnapshot;
import com.extractionplatform.common.accumulator.FindingSink;
import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.model.Evidence;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything a worker is invoked with: the corpus reference, the committed accumulator
 * state from earlier workers, its deadline and its private sink.
 *
 * <p>Cancellation is cooperative. The orchestrator flips {@link #cancel()} when the worker
 * times out; a worker that keeps running anyway is simply ignored once its partition is
 * sealed.
 */
public final class WorkerContext {

    private final String runId;
    private final String corpusReference;
    private final AccumulatorSnapshot priorSnapshot;
    private final Instant deadline;
    private final FindingSink sink;
    private final SynthesisConfig config;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public WorkerContext(String runId, String corpusReference, AccumulatorSnapshot priorSnapshot,
                         Instant deadline, FindingSink sink, SynthesisConfig config, Clock clock) {
        this.runId           = runId;
        this.corpusReference = corpusReference;
        this.priorSnapshot   = priorSnapshot;
        this.deadline        = deadline;
        this.sink            = sink;
        this.config          = config;
        this.clock           = clock;
    }

    public String runId()                       { return runId; }
    public String corpusReference()             { return corpusReference; }
    public AccumulatorSnapshot priorSnapshot()  { return priorSnapshot; }
    public Instant deadline()                   { return deadline; }
    public FindingSink sink()                   { return sink; }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void cancel() {
        cancelled.set(true);
    }

    /** Time left before the deadline; {@link Duration#ZERO} once it has passed. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /** True once cancelled or past the deadline. */
    public boolean shouldStop() {
        return isCancelled() || remaining().isZero();
    }

    /**
     * Builds Evidence with the configured weight for {@code sourceKind}.
     *
     * @throws com.extractionplatform.common.exception.ValidationException for unknown kinds
     */
    public Evidence evidence(String sourceKind, String locator, String snippet) {
        return Evidence.of(sourceKind, config.weightOf(sourceKind), locator, snippet, clock.instant());
    }
}
