package com.extractionplatform.orchestrator.config;

import com.extractionplatform.common.config.PenaltyPolicy;
import com.extractionplatform.common.config.SectionPolicy;
import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.exception.InvalidConfigurationException;
import com.extractionplatform.common.model.FindingType;
import com.extractionplatform.common.model.SectionName;
import com.extractionplatform.orchestrator.phase.PhaseDefinition;
import com.extractionplatform.orchestrator.phase.PhaseMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the {@code synthesis.*} tables from application.yml. Any table left out falls
 * back to {@link SynthesisConfig#defaults()}; a table that is present replaces the default
 * one entirely.
 *
 * <p>Source kinds contain underscores, so their keys must be written in bracket notation
 * ({@code "[config_file]": 1.0}) or Spring strips the underscore.
 */
@ConfigurationProperties(prefix = "synthesis")
public record SynthesisProperties(
    String              version,
    Map<String, Double> sourceKindWeights,
    Map<String, Double> maxPossible,
    Map<String, Section> sections,
    Penalties           penalties,
    Duration            runTimeout,
    Integer             retainedRuns,
    List<Phase>         phases
) {

    static final Duration DEFAULT_RUN_TIMEOUT = Duration.ofMinutes(5);
    static final int DEFAULT_RETAINED_RUNS = 100;

    /**
     * @param expectedMinCount findings needed for full coverage
     * @param weight           share of the overall score
     */
    public record Section(int expectedMinCount, double weight) {}

    /** Unset entries keep the value from {@link PenaltyPolicy#defaults()}. */
    public record Penalties(
        Double  sectionFloor,
        Double  weakSectionFactor,
        Integer uncertaintyLimit,
        Double  uncertaintyFactor,
        Integer conflictLimit,
        Double  conflictFactor,
        Double  unresolvedConflictSectionFactor
    ) {}

    public record Phase(String name, PhaseMode mode, Duration timeout, List<String> workers, List<String> dependsOn) {}

    public SynthesisConfig toConfig() {
        SynthesisConfig defaults = SynthesisConfig.defaults();

        Map<String, Double> weights = sourceKindWeights == null || sourceKindWeights.isEmpty()
            ? defaults.sourceKindWeights()
            : new LinkedHashMap<>(sourceKindWeights);

        Map<FindingType, Double> max = defaults.maxPossible();
        if (maxPossible != null && !maxPossible.isEmpty()) {
            max = new EnumMap<>(FindingType.class);
            for (Map.Entry<String, Double> e : maxPossible.entrySet()) {
                FindingType type = FindingType.fromId(e.getKey());
                if (type == null) throw new InvalidConfigurationException("unknown finding type '" + e.getKey() + "'");
                max.put(type, e.getValue());
            }
        }

        Map<SectionName, SectionPolicy> sectionTable = defaults.sections();
        if (sections != null && !sections.isEmpty()) {
            sectionTable = new EnumMap<>(SectionName.class);
            for (Map.Entry<String, Section> e : sections.entrySet()) {
                SectionName name = SectionName.fromId(e.getKey());
                if (name == null) throw new InvalidConfigurationException("unknown section '" + e.getKey() + "'");
                sectionTable.put(name, new SectionPolicy(e.getValue().expectedMinCount(), e.getValue().weight()));
            }
        }

        return new SynthesisConfig(
            version == null ? defaults.version() : version,
            weights,
            max,
            sectionTable,
            toPenaltyPolicy(penalties)
        );
    }

    public Duration effectiveRunTimeout() {
        return runTimeout == null ? DEFAULT_RUN_TIMEOUT : runTimeout;
    }

    /**
     * How many finalized reports the registry keeps before evicting the oldest.
     *
     * @throws InvalidConfigurationException if the configured value is not positive
     */
    public int effectiveRetainedRuns() {
        if (retainedRuns == null) return DEFAULT_RETAINED_RUNS;
        if (retainedRuns <= 0) {
            throw new InvalidConfigurationException("retained-runs must be > 0 but was " + retainedRuns);
        }
        return retainedRuns;
    }

    public List<PhaseDefinition> toPhaseDefinitions() {
        if (phases == null) return List.of();
        return phases.stream()
            .map(p -> new PhaseDefinition(p.name(), p.mode(), p.timeout(), p.workers(), p.dependsOn()))
            .toList();
    }

    private static PenaltyPolicy toPenaltyPolicy(Penalties p) {
        PenaltyPolicy d = PenaltyPolicy.defaults();
        if (p == null) return d;
        return new PenaltyPolicy(
            p.sectionFloor()                    != null ? p.sectionFloor()                    : d.sectionFloor(),
            p.weakSectionFactor()               != null ? p.weakSectionFactor()               : d.weakSectionFactor(),
            p.uncertaintyLimit()                != null ? p.uncertaintyLimit()                : d.uncertaintyLimit(),
            p.uncertaintyFactor()               != null ? p.uncertaintyFactor()               : d.uncertaintyFactor(),
            p.conflictLimit()                   != null ? p.conflictLimit()                   : d.conflictLimit(),
            p.conflictFactor()                  != null ? p.conflictFactor()                  : d.conflictFactor(),
            p.unresolvedConflictSectionFactor() != null ? p.unresolvedConflictSectionFactor() : d.unresolvedConflictSectionFactor()
        );
    }
}
