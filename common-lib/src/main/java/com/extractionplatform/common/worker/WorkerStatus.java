package com.extractionplatform.common.worker;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WorkerStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    ERROR,
    TIMED_OUT;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
