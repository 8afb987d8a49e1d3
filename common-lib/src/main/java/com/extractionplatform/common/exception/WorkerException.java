package com.extractionplatform.common.exception;

/**
 * Raised by worker code to signal an internal failure. The orchestrator converts it
 * (and any other exception escaping a worker) into {@code WorkerStatus.ERROR}; it is
 * never fatal to the phase or the run.
 */
public class WorkerException extends RuntimeException {
    private final String workerId;

    public WorkerException(String workerId, String message) {
        super("[" + workerId + "] " + message);
        this.workerId = workerId;
    }

    public WorkerException(String workerId, String message, Throwable cause) {
        super("[" + workerId + "] " + message, cause);
        this.workerId = workerId;
    }

    public String getWorkerId() {
        return workerId;
    }
}
