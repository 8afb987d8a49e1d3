package com.extractionplatform.common.confidence;

import com.extractionplatform.common.model.SectionName;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Per-section and overall confidence for one synthesis pass.
 *
 * <p>{@code overall = clamp(baseScore × Π penalty.factor, 0, 1)}.
 */
public record ConfidenceReport(
    @JsonProperty("sections")                List<SectionScore> sections,
    @JsonProperty("baseScore")               double baseScore,
    @JsonProperty("penalties")               List<Penalty> penalties,
    @JsonProperty("overall")                 double overall,
    @JsonProperty("unresolvedUncertainties") int unresolvedUncertainties,
    @JsonProperty("unresolvedConflicts")     int unresolvedConflicts
) {

    public ConfidenceReport {
        sections = List.copyOf(sections);
        penalties = List.copyOf(penalties);
    }

    public Optional<SectionScore> section(SectionName name) {
        return sections.stream().filter(s -> s.section() == name).findFirst();
    }
}
