package com.extractionplatform.common.certainty;

import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.model.CertaintyClass;
import com.extractionplatform.common.model.Evidence;
import com.extractionplatform.common.model.EvidenceSets;
import com.extractionplatform.common.model.FindingType;

import java.util.Collection;
import java.util.List;

/**
 * Maps a Finding's evidence set to a certainty class and score.
 *
 * <h3>Algorithm</h3>
 * <pre>
 *   raw        = min(Σ weight_i over deduped evidence, maxPossible(type))
 *   normalized = min(raw / maxPossible(type), 1.0)
 *   class      = band(normalized)
 * </pre>
 *
 * <p>Summation runs over the deduped list in a canonical order (weight, then source kind,
 * then locator), so the result does not depend on the order evidence was collected in.
 * Adding a non-duplicate item, or raising the weight of a duplicate, never lowers the
 * score.
 *
 * <p>Stateless and thread-safe.
 */
public class CertaintyClassifier {

    private final SynthesisConfig config;

    public CertaintyClassifier(SynthesisConfig config) {
        this.config = config;
    }

    public CertaintyAssessment classify(FindingType type, Collection<Evidence> evidence) {
        double maxPossible = config.maxPossibleFor(type);
        List<Evidence> deduped = EvidenceSets.dedupe(evidence);
        if (deduped.isEmpty()) {
            return CertaintyAssessment.unknown(maxPossible);
        }

        double raw = deduped.stream()
            .sorted(EvidenceOrdering.CANONICAL)
            .mapToDouble(Evidence::weight)
            .sum();
        raw = Math.min(raw, maxPossible);

        double normalized = Math.min(raw / maxPossible, 1.0);
        return new CertaintyAssessment(CertaintyClass.forScore(normalized), normalized, raw, maxPossible);
    }
}
