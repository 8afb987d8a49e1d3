package com.extractionplatform.orchestrator.run;

import com.extractionplatform.common.worker.WorkerStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Terminal state of one worker.
 *
 * @param findingCount  findings in the worker's partition when it was sealed
 * @param lateArrivals  emits refused after the seal, counted when the run was finalized
 * @param errorDetail   set for {@code error} and {@code timed_out}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerReport(
    String       workerId,
    WorkerStatus status,
    String       errorDetail,
    int          findingCount,
    int          lateArrivals,
    long         durationMs
) {

    public WorkerReport withLateArrivals(int late) {
        return new WorkerReport(workerId, status, errorDetail, findingCount, late, durationMs);
    }
}
