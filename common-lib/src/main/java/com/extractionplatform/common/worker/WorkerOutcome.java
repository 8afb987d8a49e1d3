package com.extractionplatform.common.worker;

/**
 * Terminal status a worker reports back across the contract boundary. Findings are not
 * carried here; they were already appended through the worker's sink.
 */
public record WorkerOutcome(WorkerStatus status, String errorDetail) {

    public WorkerOutcome {
        if (status != WorkerStatus.SUCCESS && status != WorkerStatus.ERROR) {
            throw new IllegalArgumentException("a worker may only report success or error, not " + status);
        }
    }

    public static WorkerOutcome success() {
        return new WorkerOutcome(WorkerStatus.SUCCESS, null);
    }

    public static WorkerOutcome error(String detail) {
        return new WorkerOutcome(WorkerStatus.ERROR, detail);
    }
}
