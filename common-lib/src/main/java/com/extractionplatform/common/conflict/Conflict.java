package com.extractionplatform.common.conflict;

import com.extractionplatform.common.model.Finding;
import com.extractionplatform.common.model.SectionName;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Two or more Findings sharing {@code (section, key)} with differing values.
 *
 * <p>{@code competing} retains every Finding of the bucket verbatim, in canonical order.
 * {@code resolution} is the winner when {@code status == RESOLVED} and null otherwise.
 */
public record Conflict(
    @JsonProperty("section")    SectionName section,
    @JsonProperty("key")        String key,
    @JsonProperty("competing")  List<Finding> competing,
    @JsonProperty("resolution") Finding resolution,
    @JsonProperty("status")     ConflictStatus status,
    @JsonProperty("resolvedBy") ResolutionRule resolvedBy
) {

    public Conflict {
        competing = List.copyOf(competing);
    }

    public boolean isResolved() {
        return status == ConflictStatus.RESOLVED;
    }

    /** True when this finding competed and lost a resolved conflict. */
    public boolean isLoser(Finding finding) {
        return isResolved()
            && !resolution.id().equals(finding.id())
            && !resolution.value().equals(finding.value())
            && competing.stream().anyMatch(f -> f.id().equals(finding.id()));
    }
}
