package com.extractionplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a section's confidence was derived.
 * <ul>
 *   <li>{@code SCORED}         — coverage × mean weighted score</li>
 *   <li>{@code NOT_APPLICABLE} — no findings and a documented absence; scored 1.0</li>
 *   <li>{@code EMPTY}          — no findings and no explanation; scored 0.0</li>
 * </ul>
 */
public enum SectionStatus {
    SCORED,
    NOT_APPLICABLE,
    EMPTY;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
