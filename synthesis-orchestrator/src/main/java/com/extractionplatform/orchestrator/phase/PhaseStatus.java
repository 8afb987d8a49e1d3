package com.extractionplatform.orchestrator.phase;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PhaseStatus {
    PENDING,
    RUNNING,
    /** Every worker reported success. */
    COMPLETE,
    /** At least one worker errored or timed out; whatever it committed is kept. */
    PARTIAL,
    /** Never started because the run deadline had passed. */
    SKIPPED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
