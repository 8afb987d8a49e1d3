package com.extractionplatform.common.model;

import com.extractionplatform.common.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A single claimed fact about the corpus with its evidence and computed scores.
 *
 * <p>Owned by the worker that created it and immutable after creation. Corrections are
 * new Findings; see {@code FindingFactory#addEvidence}.
 *
 * <p>Invariants enforced here:
 * <ul>
 *   <li>ids, key and value present</li>
 *   <li>{@code certaintyScore} and {@code corroborationScore} in [0, 1]</li>
 *   <li>evidence non-empty unless {@code certaintyClass == UNKNOWN}</li>
 * </ul>
 */
public record Finding(
    @JsonProperty("id")                 String id,
    @JsonProperty("workerId")           String workerId,
    @JsonProperty("section")            SectionName section,
    @JsonProperty("key")                String key,
    @JsonProperty("value")              String value,
    @JsonProperty("findingType")        FindingType findingType,
    @JsonProperty("certaintyClass")     CertaintyClass certaintyClass,
    @JsonProperty("certaintyScore")     double certaintyScore,
    @JsonProperty("evidence")           List<Evidence> evidence,
    @JsonProperty("corroborationScore") double corroborationScore,
    @JsonProperty("createdAt")          Instant createdAt
) {

    public Finding {
        requireText("id", id);
        requireText("workerId", workerId);
        requireText("key", key);
        if (section == null) throw new ValidationException("section", "must not be null");
        if (value == null) throw new ValidationException("value", "must not be null");
        if (findingType == null) throw new ValidationException("findingType", "must not be null");
        if (certaintyClass == null) throw new ValidationException("certaintyClass", "must not be null");
        if (createdAt == null) throw new ValidationException("createdAt", "must not be null");
        requireUnit("certaintyScore", certaintyScore);
        requireUnit("corroborationScore", corroborationScore);

        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        if (evidence.isEmpty() && certaintyClass != CertaintyClass.UNKNOWN) {
            throw new ValidationException("evidence",
                "empty evidence requires certaintyClass=unknown but was " + certaintyClass.id());
        }
    }

    /** Collision bucket used by conflict resolution. */
    public BucketKey bucket() {
        return new BucketKey(section, key);
    }

    public int evidenceCount() {
        return evidence.size();
    }

    public record BucketKey(SectionName section, String key) {}

    private static void requireText(String field, String v) {
        if (v == null || v.isBlank()) throw new ValidationException(field, "must not be blank");
    }

    private static void requireUnit(String field, double v) {
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new ValidationException(field, "must be in [0, 1] but was " + v);
        }
    }
}
