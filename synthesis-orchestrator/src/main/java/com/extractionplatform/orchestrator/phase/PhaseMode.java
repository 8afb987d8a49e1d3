package com.extractionplatform.orchestrator.phase;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PhaseMode {
    /** All workers dispatched at once; the barrier waits for every one to settle. */
    PARALLEL,
    /** One worker at a time, each committing before the next starts. */
    SEQUENTIAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
