package com.extractionplatform.common.corroboration;

import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.model.Evidence;
import com.extractionplatform.common.model.EvidenceSets;
import com.extractionplatform.common.model.FindingType;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Measures independent source diversity behind a Finding, as opposed to raw evidence mass.
 *
 * <pre>
 *   corroboration = min(Σ max weight per distinct source kind / maxPossible(type), 1.0)
 * </pre>
 *
 * <p>Each source kind counts once however many items share it, so repeating one signal
 * cannot inflate the score. A Finding backed by a single authoritative file can therefore
 * be certain yet weakly corroborated.
 *
 * <p>Invariant to evidence ordering and to duplicate {@code (sourceKind, locator)} entries.
 * Stateless and thread-safe.
 */
public class CorroborationEngine {

    private final SynthesisConfig config;

    public CorroborationEngine(SynthesisConfig config) {
        this.config = config;
    }

    public double score(FindingType type, Collection<Evidence> evidence) {
        Map<String, Double> perKind = distinctSourceWeights(evidence);
        if (perKind.isEmpty()) return 0.0;

        // TreeMap iteration keeps the sum order stable
        double sum = perKind.values().stream().mapToDouble(Double::doubleValue).sum();
        return Math.min(sum / config.maxPossibleFor(type), 1.0);
    }

    /**
     * Source kind → strongest weight observed for that kind, sorted by kind.
     */
    public static Map<String, Double> distinctSourceWeights(Collection<Evidence> evidence) {
        Map<String, Double> perKind = new TreeMap<>();
        for (Evidence e : EvidenceSets.dedupe(evidence)) {
            perKind.merge(e.sourceKind(), e.weight(), Math::max);
        }
        return perKind;
    }
}
