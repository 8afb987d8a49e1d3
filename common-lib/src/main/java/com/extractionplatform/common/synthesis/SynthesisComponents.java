package com.extractionplatform.common.synthesis;

import com.extractionplatform.common.certainty.CertaintyClassifier;
import com.extractionplatform.common.confidence.ConfidenceAggregator;
import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.conflict.ConflictResolver;
import com.extractionplatform.common.corroboration.CorroborationEngine;

import java.time.Clock;

/**
 * Wires the synthesis functions against one configuration table.
 */
public record SynthesisComponents(
    SynthesisConfig config,
    FindingFactory  findingFactory,
    SynthesisEngine engine,
    Clock           clock
) {

    public static SynthesisComponents create(SynthesisConfig config, Clock clock) {
        CertaintyClassifier classifier = new CertaintyClassifier(config);
        CorroborationEngine corroboration = new CorroborationEngine(config);
        FindingFactory factory = new FindingFactory(config, classifier, corroboration, clock);
        SynthesisEngine engine = new SynthesisEngine(new ConflictResolver(), new ConfidenceAggregator(config));
        return new SynthesisComponents(config, factory, engine, clock);
    }

    public static SynthesisComponents defaults() {
        return create(SynthesisConfig.defaults(), Clock.systemUTC());
    }
}
