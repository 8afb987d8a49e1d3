package com.extractionplatform.common.model;

import com.extractionplatform.common.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A worker's documented statement that a section is legitimately empty
 * (for example "no database detected"). Only honored while the section holds no
 * effective Findings.
 */
public record SectionAbsence(
    @JsonProperty("section")  SectionName section,
    @JsonProperty("reason")   String reason,
    @JsonProperty("workerId") String workerId
) {

    public SectionAbsence {
        if (section == null) throw new ValidationException("section", "must not be null");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "an absence must document its reason");
        }
    }
}
