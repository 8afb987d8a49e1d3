package com.extractionplatform.common.accumulator;

import com.extractionplatform.common.model.Finding;
import com.extractionplatform.common.model.SectionAbsence;
import com.extractionplatform.common.model.SectionName;
import com.extractionplatform.common.model.ValidationRejection;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Frozen view of the committed accumulator. Handed to later workers as read-only context
 * and to synthesis as its input.
 */
public record AccumulatorSnapshot(
    @JsonProperty("findings")   List<Finding> findings,
    @JsonProperty("absences")   List<SectionAbsence> absences,
    @JsonProperty("rejections") List<ValidationRejection> rejections
) {

    public AccumulatorSnapshot {
        findings = List.copyOf(findings);
        absences = List.copyOf(absences);
        rejections = List.copyOf(rejections);
    }

    public static AccumulatorSnapshot empty() {
        return new AccumulatorSnapshot(List.of(), List.of(), List.of());
    }

    public List<Finding> findingsIn(SectionName section) {
        return findings.stream().filter(f -> f.section() == section).toList();
    }

    public List<Finding> findingsBy(String workerId) {
        return findings.stream().filter(f -> f.workerId().equals(workerId)).toList();
    }

    public int size() {
        return findings.size();
    }
}
