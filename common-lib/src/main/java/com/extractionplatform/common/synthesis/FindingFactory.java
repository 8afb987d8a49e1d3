package com.extractionplatform.common.synthesis;

import com.extractionplatform.common.certainty.CertaintyAssessment;
import com.extractionplatform.common.certainty.CertaintyClassifier;
import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.corroboration.CorroborationEngine;
import com.extractionplatform.common.exception.ValidationException;
import com.extractionplatform.common.model.Evidence;
import com.extractionplatform.common.model.EvidenceSets;
import com.extractionplatform.common.model.Finding;
import com.extractionplatform.common.model.FindingDraft;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The only way a {@link Finding} is minted. Scores always come from the evidence; a
 * worker cannot state its own certainty or corroboration.
 *
 * <p>Evidence weights are taken from the configured source-kind table, whatever weight
 * the worker attached. A source kind missing from the table is a {@link ValidationException}.
 */
public class FindingFactory {

    private final SynthesisConfig config;
    private final CertaintyClassifier classifier;
    private final CorroborationEngine corroboration;
    private final Clock clock;

    public FindingFactory(SynthesisConfig config, CertaintyClassifier classifier,
                          CorroborationEngine corroboration, Clock clock) {
        this.config        = config;
        this.classifier    = classifier;
        this.corroboration = corroboration;
        this.clock         = clock;
    }

    /**
     * Validates and scores a draft.
     *
     * @throws ValidationException when the draft breaks an evidence-model invariant
     */
    public Finding create(String workerId, FindingDraft draft) {
        if (draft == null) throw new ValidationException("draft", "must not be null");
        if (draft.section() == null) throw new ValidationException("section", "must not be null");
        if (!draft.declaredUnknown() && draft.evidence().isEmpty()) {
            throw new ValidationException("evidence", "must not be empty unless the finding is declared unknown");
        }
        return score(UUID.randomUUID().toString(), workerId, draft, EvidenceSets.dedupe(weighed(draft.evidence())));
    }

    /**
     * Returns a new Finding carrying the extra evidence, rescored, under a new id. The
     * original is untouched.
     */
    public Finding addEvidence(Finding finding, Evidence evidence) {
        if (evidence == null) throw new ValidationException("evidence", "must not be null");
        List<Evidence> merged = new ArrayList<>(finding.evidence());
        merged.add(evidence);
        FindingDraft draft = FindingDraft.of(finding.section(), finding.key(), finding.value(),
            finding.findingType(), merged);
        return score(UUID.randomUUID().toString(), finding.workerId(), draft, EvidenceSets.dedupe(weighed(merged)));
    }

    private List<Evidence> weighed(List<Evidence> evidence) {
        List<Evidence> out = new ArrayList<>(evidence.size());
        for (Evidence e : evidence) {
            if (e == null) throw new ValidationException("evidence", "must not contain null entries");
            double weight = config.weightOf(e.sourceKind());
            out.add(e.weight() == weight ? e
                : Evidence.of(e.sourceKind(), weight, e.locator(), e.snippet(), e.collectedAt()));
        }
        return out;
    }

    private Finding score(String id, String workerId, FindingDraft draft, List<Evidence> deduped) {
        CertaintyAssessment certainty = classifier.classify(draft.findingType(), deduped);
        double corroborationScore = corroboration.score(draft.findingType(), deduped);
        return new Finding(
            id,
            workerId,
            draft.section(),
            draft.key(),
            draft.value(),
            draft.findingType(),
            certainty.certaintyClass(),
            certainty.score(),
            deduped,
            corroborationScore,
            clock.instant()
        );
    }
}
