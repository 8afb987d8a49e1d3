package com.extractionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of claim a Finding makes. Selects the {@code max_possible} constant used by
 * certainty classification and corroboration.
 */
public enum FindingType {
    LANGUAGE,
    FRAMEWORK,
    ENTITY,
    RELATIONSHIP,
    GENERIC;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns null for unrecognized input. */
    @JsonCreator
    public static FindingType fromId(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
