package com.extractionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Record of a draft refused by the evidence model. Kept in the run so no rejected claim
 * disappears without a trace.
 */
public record ValidationRejection(
    @JsonProperty("workerId")   String workerId,
    @JsonProperty("section")    SectionName section,
    @JsonProperty("key")        String key,
    @JsonProperty("field")      String field,
    @JsonProperty("reason")     String reason,
    @JsonProperty("rejectedAt") Instant rejectedAt
) {}
