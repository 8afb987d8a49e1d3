package com.extractionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Fixed topical groupings of the synthesized report. Declaration order is the report order.
 */
public enum SectionName {
    IDENTITY("identity"),
    DOMAIN_MODEL("domain-model"),
    CAPABILITIES("capabilities"),
    STACK("stack"),
    CONVENTIONS("conventions"),
    CONSTRAINTS("constraints"),
    OPERATIONS("operations");

    private final String id;

    SectionName(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolves a wire id ({@code domain-model}) or constant name ({@code DOMAIN_MODEL}).
     * Returns null for unrecognized input.
     */
    @JsonCreator
    public static SectionName fromId(String value) {
        if (value == null) return null;
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(s -> s.id.equalsIgnoreCase(normalized) || s.name().equalsIgnoreCase(normalized))
            .findFirst()
            .orElse(null);
    }
}
