package com.extractionplatform.common.confidence;

import com.extractionplatform.common.model.SectionName;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Derived rollup for one section. Recomputed at every barrier, never edited in place.
 */
public record SectionScore(
    @JsonProperty("section")             SectionName section,
    @JsonProperty("status")              SectionStatus status,
    @JsonProperty("findingCount")        int findingCount,
    @JsonProperty("expectedMinCount")    int expectedMinCount,
    @JsonProperty("coverageFactor")      double coverageFactor,
    @JsonProperty("meanWeightedScore")   double meanWeightedScore,
    @JsonProperty("unresolvedConflicts") int unresolvedConflicts,
    @JsonProperty("confidence")          double confidence,
    @JsonProperty("absenceReason")       String absenceReason
) {}
