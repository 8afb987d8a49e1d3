package com.extractionplatform.common.config;

import com.extractionplatform.common.exception.InvalidConfigurationException;
import com.extractionplatform.common.exception.ValidationException;
import com.extractionplatform.common.model.FindingType;
import com.extractionplatform.common.model.SectionName;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Versioned tuning tables consumed by the synthesis functions. Nothing in the synthesis
 * core hardcodes a weight, threshold or expectation; everything is read from here.
 *
 * <p>Validated on construction:
 * <ul>
 *   <li>every source-kind weight in (0, 1]</li>
 *   <li>every {@code maxPossible} &gt; 0, with an entry for {@link FindingType#GENERIC}</li>
 *   <li>a policy for every {@link SectionName}; weights non-negative and summing to 1.0</li>
 *   <li>penalty factors in (0, 1]</li>
 * </ul>
 */
public record SynthesisConfig(
    String                          version,
    Map<String, Double>             sourceKindWeights,
    Map<FindingType, Double>        maxPossible,
    Map<SectionName, SectionPolicy> sections,
    PenaltyPolicy                   penalties
) {

    private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    public SynthesisConfig {
        if (version == null || version.isBlank()) {
            throw new InvalidConfigurationException("version must not be blank");
        }
        if (sourceKindWeights == null || sourceKindWeights.isEmpty()) {
            throw new InvalidConfigurationException("sourceKindWeights must not be empty");
        }
        sourceKindWeights.forEach((kind, w) -> {
            if (w == null || w <= 0.0 || w > 1.0) {
                throw new InvalidConfigurationException(
                    "source kind '" + kind + "' weight must be in (0, 1] but was " + w);
            }
        });
        if (maxPossible == null || !maxPossible.containsKey(FindingType.GENERIC)) {
            throw new InvalidConfigurationException("maxPossible must define the generic finding type");
        }
        maxPossible.forEach((type, max) -> {
            if (max == null || max <= 0.0) {
                throw new InvalidConfigurationException(
                    "maxPossible for " + type.id() + " must be > 0 but was " + max);
            }
        });
        if (sections == null) {
            throw new InvalidConfigurationException("sections must not be null");
        }
        double weightSum = 0.0;
        for (SectionName name : SectionName.values()) {
            SectionPolicy policy = sections.get(name);
            if (policy == null) {
                throw new InvalidConfigurationException("missing section policy for " + name.id());
            }
            if (policy.weight() < 0.0 || policy.expectedMinCount() < 0) {
                throw new InvalidConfigurationException("negative weight or expected count for " + name.id());
            }
            weightSum += policy.weight();
        }
        if (Math.abs(weightSum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new InvalidConfigurationException("section weights must sum to 1.0 but sum to " + weightSum);
        }
        if (penalties == null) {
            throw new InvalidConfigurationException("penalties must not be null");
        }
        requireFactor("weakSectionFactor", penalties.weakSectionFactor());
        requireFactor("uncertaintyFactor", penalties.uncertaintyFactor());
        requireFactor("conflictFactor", penalties.conflictFactor());
        requireFactor("unresolvedConflictSectionFactor", penalties.unresolvedConflictSectionFactor());

        sourceKindWeights = Map.copyOf(sourceKindWeights);
        maxPossible = Map.copyOf(maxPossible);
        sections = Map.copyOf(sections);
    }

    /**
     * Configured weight for a source kind.
     *
     * @throws ValidationException if the kind is not in the table
     */
    public double weightOf(String sourceKind) {
        Double w = sourceKind == null ? null : sourceKindWeights.get(sourceKind);
        if (w == null) {
            throw new ValidationException("sourceKind", "unknown source kind '" + sourceKind + "'");
        }
        return w;
    }

    /** Falls back to the generic constant for types without their own entry. */
    public double maxPossibleFor(FindingType type) {
        Double max = type == null ? null : maxPossible.get(type);
        return max != null ? max : maxPossible.get(FindingType.GENERIC);
    }

    public SectionPolicy sectionPolicy(SectionName section) {
        return sections.get(section);
    }

    /**
     * Built-in tables, identical to the shipped {@code application.yml}.
     */
    public static SynthesisConfig defaults() {
        Map<String, Double> kinds = new LinkedHashMap<>();
        kinds.put("config_file",          1.0);
        kinds.put("explicit_declaration", 1.0);
        kinds.put("dependency",           0.9);
        kinds.put("file_ext",             0.8);
        kinds.put("code_pattern",         0.7);
        kinds.put("doc",                  0.6);
        kinds.put("directory_layout",     0.5);
        kinds.put("naming",               0.3);
        kinds.put("default_assumption",   0.1);

        Map<FindingType, Double> max = new EnumMap<>(FindingType.class);
        max.put(FindingType.LANGUAGE,     3.0);
        max.put(FindingType.FRAMEWORK,    4.0);
        max.put(FindingType.ENTITY,       2.0);
        max.put(FindingType.RELATIONSHIP, 2.5);
        max.put(FindingType.GENERIC,      2.0);

        Map<SectionName, SectionPolicy> sections = new EnumMap<>(SectionName.class);
        sections.put(SectionName.IDENTITY,     new SectionPolicy(3, 0.20));
        sections.put(SectionName.DOMAIN_MODEL, new SectionPolicy(5, 0.20));
        sections.put(SectionName.STACK,        new SectionPolicy(4, 0.20));
        sections.put(SectionName.CAPABILITIES, new SectionPolicy(4, 0.15));
        sections.put(SectionName.CONVENTIONS,  new SectionPolicy(3, 0.10));
        sections.put(SectionName.CONSTRAINTS,  new SectionPolicy(2, 0.08));
        sections.put(SectionName.OPERATIONS,   new SectionPolicy(2, 0.07));

        return new SynthesisConfig("1.0", kinds, max, sections, PenaltyPolicy.defaults());
    }

    private static void requireFactor(String name, double factor) {
        if (Double.isNaN(factor) || factor <= 0.0 || factor > 1.0) {
            throw new InvalidConfigurationException(name + " must be in (0, 1] but was " + factor);
        }
    }
}
