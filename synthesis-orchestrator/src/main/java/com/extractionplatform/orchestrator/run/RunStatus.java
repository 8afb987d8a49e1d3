package com.extractionplatform.orchestrator.run;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Run lifecycle: PENDING → PHASE_RUNNING → SYNTHESIZING → COMPLETE | FAILED.
 */
public enum RunStatus {
    PENDING,
    PHASE_RUNNING,
    SYNTHESIZING,
    COMPLETE,
    FAILED;

    /** Whether the lifecycle allows moving from this status to {@code next}. */
    public boolean canMoveTo(RunStatus next) {
        return switch (this) {
            case PENDING       -> next == PHASE_RUNNING || next == SYNTHESIZING;
            case PHASE_RUNNING -> next == PHASE_RUNNING || next == SYNTHESIZING;
            case SYNTHESIZING  -> next == COMPLETE || next == FAILED;
            case COMPLETE, FAILED -> false;
        };
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
