package com.extractionplatform.common.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConflictStatus {
    RESOLVED,
    UNRESOLVED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
