package com.extractionplatform.common.conflict;

import com.extractionplatform.common.model.Finding;
import com.extractionplatform.common.model.SectionName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one resolution pass: every conflict found plus the state of every bucket.
 */
public record ConflictReport(
    @JsonProperty("conflicts")    List<Conflict> conflicts,
    @JsonIgnore                   Map<Finding.BucketKey, BucketState> bucketStates
) {

    public ConflictReport {
        conflicts = List.copyOf(conflicts);
        bucketStates = Map.copyOf(bucketStates);
    }

    public static ConflictReport empty() {
        return new ConflictReport(List.of(), Map.of());
    }

    public long unresolvedCount() {
        return conflicts.stream().filter(c -> !c.isResolved()).count();
    }

    public long unresolvedIn(SectionName section) {
        return conflicts.stream()
            .filter(c -> c.section() == section && !c.isResolved())
            .count();
    }

    public boolean isLoser(Finding finding) {
        return conflicts.stream().anyMatch(c -> c.isLoser(finding));
    }

    public BucketState stateOf(SectionName section, String key) {
        return bucketStates.get(new Finding.BucketKey(section, key));
    }
}
