package com.extractionplatform.orchestrator.run;

import com.extractionplatform.common.accumulator.AccumulatorSnapshot;
import com.extractionplatform.common.confidence.ConfidenceReport;
import com.extractionplatform.common.conflict.ConflictReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The finalized, read-only view of a run handed to renderers: every committed finding,
 * every conflict, the per-section scores and the overall score with its penalties.
 *
 * <p>{@code conflicts} and {@code confidence} are null only when synthesis itself failed;
 * the committed findings are still reported in that case.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunReport(
    String              runId,
    String              corpusReference,
    String              configVersion,
    RunStatus           status,
    boolean             truncated,
    Instant             startedAt,
    Instant             finishedAt,
    List<PhaseReport>   phases,
    AccumulatorSnapshot accumulator,
    ConflictReport      conflicts,
    ConfidenceReport    confidence,
    String              failureDetail
) {

    public RunReport {
        phases = List.copyOf(phases);
    }

    @JsonProperty("overallConfidence")
    public double overallConfidence() {
        return confidence == null ? 0.0 : confidence.overall();
    }

    public Optional<PhaseReport> phase(String name) {
        return phases.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
