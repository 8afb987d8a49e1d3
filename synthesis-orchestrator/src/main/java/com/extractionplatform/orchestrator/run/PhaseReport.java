package com.extractionplatform.orchestrator.run;

import com.extractionplatform.orchestrator.phase.PhaseMode;
import com.extractionplatform.orchestrator.phase.PhaseStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one phase.
 *
 * @param committedFindings findings merged into the shared store at this phase's barrier
 * @param overallAfterBarrier overall confidence of the synthesis pass run at the barrier;
 *                            null for skipped phases
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhaseReport(
    String             name,
    PhaseMode          mode,
    PhaseStatus        status,
    List<WorkerReport> workers,
    int                committedFindings,
    Double             overallAfterBarrier,
    Instant            startedAt,
    Instant            finishedAt
) {

    public PhaseReport {
        workers = List.copyOf(workers);
    }

    public static PhaseReport skipped(String name, PhaseMode mode) {
        return new PhaseReport(name, mode, PhaseStatus.SKIPPED, List.of(), 0, null, null, null);
    }

    public PhaseReport withWorkers(List<WorkerReport> updated) {
        return new PhaseReport(name, mode, status, updated, committedFindings, overallAfterBarrier, startedAt, finishedAt);
    }
}
