package com.extractionplatform.common.model;

import com.extractionplatform.common.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One piece of support for a Finding. Immutable once created.
 *
 * <p>Two Evidence entries describe the same observation when they share
 * {@code (sourceKind, locator)}; see {@link EvidenceSets#dedupe}.
 */
public record Evidence(
    @JsonProperty("sourceKind")  String sourceKind,
    @JsonProperty("weight")      double weight,
    @JsonProperty("locator")     String locator,     // file+line or doc+section, opaque
    @JsonProperty("snippet")     String snippet,
    @JsonProperty("collectedAt") Instant collectedAt
) {

    public Evidence {
        if (sourceKind == null || sourceKind.isBlank()) {
            throw new ValidationException("sourceKind", "must not be blank");
        }
        if (locator == null || locator.isBlank()) {
            throw new ValidationException("locator", "must not be blank");
        }
        if (Double.isNaN(weight) || weight <= 0.0 || weight > 1.0) {
            throw new ValidationException("weight", "must be in (0, 1] but was " + weight);
        }
        if (collectedAt == null) {
            throw new ValidationException("collectedAt", "must not be null");
        }
        snippet = snippet == null ? "" : snippet;
    }

    public static Evidence of(String sourceKind, double weight, String locator,
                              String snippet, Instant collectedAt) {
        return new Evidence(sourceKind, weight, locator, snippet, collectedAt);
    }

    /** Dedup identity: {@code sourceKind + locator}. */
    public EvidenceKey key() {
        return new EvidenceKey(sourceKind, locator);
    }

    public record EvidenceKey(String sourceKind, String locator) {}
}
