package com.extractionplatform.common.synthesis;

import com.extractionplatform.common.accumulator.AccumulatorSnapshot;
import com.extractionplatform.common.confidence.ConfidenceAggregator;
import com.extractionplatform.common.confidence.ConfidenceReport;
import com.extractionplatform.common.conflict.ConflictReport;
import com.extractionplatform.common.conflict.ConflictResolver;

/**
 * One synthesis pass over a frozen snapshot: conflict resolution, then confidence
 * aggregation. Runs on the caller's thread; the orchestrator invokes it once per barrier
 * after every partition of the phase has been committed.
 *
 * <p>No logging, no reactive types, no state.
 */
public class SynthesisEngine {

    private final ConflictResolver resolver;
    private final ConfidenceAggregator aggregator;

    public SynthesisEngine(ConflictResolver resolver, ConfidenceAggregator aggregator) {
        this.resolver   = resolver;
        this.aggregator = aggregator;
    }

    public SynthesisResult synthesize(AccumulatorSnapshot snapshot) {
        AccumulatorSnapshot frozen = snapshot != null ? snapshot : AccumulatorSnapshot.empty();
        ConflictReport conflicts = resolver.resolve(frozen.findings());
        ConfidenceReport confidence = aggregator.aggregate(frozen.findings(), conflicts, frozen.absences());
        return new SynthesisResult(frozen.size(), conflicts, confidence);
    }
}
