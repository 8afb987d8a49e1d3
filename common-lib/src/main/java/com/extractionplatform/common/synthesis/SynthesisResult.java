package com.extractionplatform.common.synthesis;

import com.extractionplatform.common.confidence.ConfidenceReport;
import com.extractionplatform.common.conflict.ConflictReport;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scores and conflicts derived from one frozen snapshot.
 *
 * @param findingCount number of committed findings the pass saw
 */
public record SynthesisResult(
    @JsonProperty("findingCount") int findingCount,
    @JsonProperty("conflicts")    ConflictReport conflicts,
    @JsonProperty("confidence")   ConfidenceReport confidence
) {}
