package com.extractionplatform.common.confidence;

import com.extractionplatform.common.config.PenaltyPolicy;
import com.extractionplatform.common.config.SectionPolicy;
import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.conflict.ConflictReport;
import com.extractionplatform.common.model.CertaintyClass;
import com.extractionplatform.common.model.Finding;
import com.extractionplatform.common.model.SectionAbsence;
import com.extractionplatform.common.model.SectionName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Rolls per-Finding scores up to section and overall confidence.
 *
 * <h3>Per Finding</h3>
 * <pre>
 *   weighted = certaintyScore × (0.5 + 0.5 × corroborationScore)
 * </pre>
 * Corroboration can at most halve certainty, never dominate it.
 *
 * <h3>Per Section</h3>
 * <pre>
 *   coverage   = min(1.0, findingCount / expectedMinCount)
 *   confidence = coverage × mean(weighted) × unresolvedConflictFactor^unresolvedConflicts
 * </pre>
 * Findings that lost a resolved conflict are excluded. A section with no findings and a
 * documented absence scores 1.0 as {@link SectionStatus#NOT_APPLICABLE}.
 *
 * <h3>Overall</h3>
 * <pre>
 *   base    = Σ confidence_i × weight_i
 *   overall = clamp(base × Π penalties, 0, 1)
 * </pre>
 * Penalties, each applied at most once:
 * <ul>
 *   <li>any section below {@code sectionFloor} → × {@code weakSectionFactor}</li>
 *   <li>more than {@code uncertaintyLimit} speculated/unknown findings → × {@code uncertaintyFactor}</li>
 *   <li>more than {@code conflictLimit} unresolved conflicts → × {@code conflictFactor}</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.
 */
public class ConfidenceAggregator {

    private final SynthesisConfig config;

    public ConfidenceAggregator(SynthesisConfig config) {
        this.config = config;
    }

    public static double weightedScore(Finding finding) {
        double weighted = finding.certaintyScore() * (0.5 + 0.5 * finding.corroborationScore());
        return clamp(weighted);
    }

    public ConfidenceReport aggregate(Collection<Finding> findings,
                                      ConflictReport conflicts,
                                      Collection<SectionAbsence> absences) {
        ConflictReport conflictReport = conflicts != null ? conflicts : ConflictReport.empty();
        List<Finding> effective = findings == null ? List.of() : findings.stream()
            .filter(f -> !conflictReport.isLoser(f))
            .toList();

        List<SectionScore> sections = scoreSections(effective, conflictReport, absences);

        double base = 0.0;
        for (SectionScore s : sections) {
            base += s.confidence() * config.sectionPolicy(s.section()).weight();
        }
        base = clamp(base);

        int uncertainties = (int) effective.stream()
            .filter(f -> f.certaintyClass() == CertaintyClass.SPECULATED
                      || f.certaintyClass() == CertaintyClass.UNKNOWN)
            .count();
        int unresolved = (int) conflictReport.unresolvedCount();

        List<Penalty> penalties = penalties(sections, uncertainties, unresolved);
        double overall = base;
        for (Penalty p : penalties) {
            overall *= p.factor();
        }

        return new ConfidenceReport(sections, base, penalties, clamp(overall), uncertainties, unresolved);
    }

    /**
     * Section rollups in {@link SectionName} order over already-filtered findings.
     */
    public List<SectionScore> scoreSections(Collection<Finding> effective,
                                            ConflictReport conflicts,
                                            Collection<SectionAbsence> absences) {
        List<SectionScore> out = new ArrayList<>();
        for (SectionName name : SectionName.values()) {
            List<Finding> inSection = effective.stream()
                .filter(f -> f.section() == name)
                .toList();
            out.add(scoreSection(name, inSection, conflicts, absenceFor(name, absences)));
        }
        return out;
    }

    private SectionScore scoreSection(SectionName name, List<Finding> findings,
                                      ConflictReport conflicts, SectionAbsence absence) {
        SectionPolicy policy = config.sectionPolicy(name);
        int expected = policy.expectedMinCount();

        if (findings.isEmpty()) {
            if (absence != null) {
                return new SectionScore(name, SectionStatus.NOT_APPLICABLE, 0, expected,
                    1.0, 1.0, 0, 1.0, absence.reason());
            }
            return new SectionScore(name, SectionStatus.EMPTY, 0, expected,
                0.0, 0.0, 0, 0.0, null);
        }

        double coverage = expected <= 0 ? 1.0 : Math.min(1.0, (double) findings.size() / expected);
        double mean = findings.stream()
            .mapToDouble(ConfidenceAggregator::weightedScore)
            .average()
            .orElse(0.0);
        int unresolved = (int) conflicts.unresolvedIn(name);
        double depression = Math.pow(config.penalties().unresolvedConflictSectionFactor(), unresolved);

        double confidence = clamp(coverage * mean * depression);
        return new SectionScore(name, SectionStatus.SCORED, findings.size(), expected,
            coverage, mean, unresolved, confidence, null);
    }

    private List<Penalty> penalties(List<SectionScore> sections, int uncertainties, int unresolved) {
        PenaltyPolicy policy = config.penalties();
        List<Penalty> penalties = new ArrayList<>();

        String weak = sections.stream()
            .filter(s -> s.confidence() < policy.sectionFloor())
            .map(s -> s.section().id())
            .collect(Collectors.joining(", "));
        if (!weak.isEmpty()) {
            penalties.add(new Penalty(Penalty.WEAK_SECTION,
                String.format("sections below %.2f: %s", policy.sectionFloor(), weak),
                policy.weakSectionFactor()));
        }
        if (uncertainties > policy.uncertaintyLimit()) {
            penalties.add(new Penalty(Penalty.UNRESOLVED_UNCERTAINTY,
                String.format("%d unresolved uncertainties > %d", uncertainties, policy.uncertaintyLimit()),
                policy.uncertaintyFactor()));
        }
        if (unresolved > policy.conflictLimit()) {
            penalties.add(new Penalty(Penalty.UNRESOLVED_CONFLICT,
                String.format("%d unresolved conflicts > %d", unresolved, policy.conflictLimit()),
                policy.conflictFactor()));
        }
        return penalties;
    }

    private static SectionAbsence absenceFor(SectionName name, Collection<SectionAbsence> absences) {
        if (absences == null) return null;
        return absences.stream()
            .filter(Objects::nonNull)
            .filter(a -> a.section() == name)
            .min(Comparator.comparing(SectionAbsence::workerId, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(SectionAbsence::reason))
            .orElse(null);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
