package com.extractionplatform.common.worker;

/**
 * An opaque, replaceable extraction task. How a worker decides its values is its own
 * business; the synthesis core only sees the Findings it emits.
 *
 * <p>Contract:
 * <ul>
 *   <li>emit Findings through {@link WorkerContext#sink()} as they are discovered, so
 *       partial work survives a timeout</li>
 *   <li>read other workers' output only through {@link WorkerContext#priorSnapshot()}</li>
 *   <li>honor {@link WorkerContext#deadline()} and {@link WorkerContext#isCancelled()}</li>
 *   <li>capture internal failures and return {@link WorkerOutcome#error(String)}; anything
 *       thrown anyway is caught by the orchestrator and reported the same way</li>
 * </ul>
 */
public interface ExtractionWorker {

    /** Stable id used in phase plans, partitions and reports. */
    String workerId();

    WorkerOutcome execute(WorkerContext context);
}
