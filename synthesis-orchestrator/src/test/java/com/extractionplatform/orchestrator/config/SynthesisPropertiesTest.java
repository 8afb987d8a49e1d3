package com.extractionplatform.orchestrator.config;

import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.exception.InvalidConfigurationException;
import com.extractionplatform.common.model.FindingType;
import com.extractionplatform.common.model.SectionName;
import com.extractionplatform.orchestrator.phase.PhaseDefinition;
import com.extractionplatform.orchestrator.phase.PhaseMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SynthesisPropertiesTest {

    private static SynthesisProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
            .bind("synthesis", SynthesisProperties.class)
            .get();
    }

    @Test
    @DisplayName("bound tables convert into the synthesis config")
    void binds() {
        Map<String, String> values = new HashMap<>();
        values.put("synthesis.version", "2.1");
        values.put("synthesis.run-timeout", "90s");
        values.put("synthesis.retained-runs", "25");
        values.put("synthesis.source-kind-weights[config_file]", "1.0");
        values.put("synthesis.source-kind-weights[naming]", "0.25");
        values.put("synthesis.max-possible.language", "3.5");
        values.put("synthesis.max-possible.generic", "2.0");
        values.put("synthesis.penalties.conflict-limit", "3");
        values.put("synthesis.phases[0].name", "discovery");
        values.put("synthesis.phases[0].mode", "sequential");
        values.put("synthesis.phases[0].timeout", "20s");
        values.put("synthesis.phases[0].workers[0]", "build-manifest");
        values.put("synthesis.phases[1].name", "enrichment");
        values.put("synthesis.phases[1].timeout", "5s");
        values.put("synthesis.phases[1].depends-on[0]", "discovery");

        SynthesisProperties properties = bind(values);
        SynthesisConfig config = properties.toConfig();

        assertEquals("2.1", config.version());
        assertEquals(0.25, config.weightOf("naming"));
        assertEquals(1.0, config.weightOf("config_file"));
        assertEquals(3.5, config.maxPossibleFor(FindingType.LANGUAGE));
        assertEquals(2.0, config.maxPossibleFor(FindingType.FRAMEWORK), "unlisted types fall back to generic");
        assertEquals(3, config.penalties().conflictLimit());
        assertEquals(0.95, config.penalties().uncertaintyFactor(), "unset penalties keep their defaults");
        assertEquals(SynthesisConfig.defaults().sections(), config.sections());
        assertEquals(Duration.ofSeconds(90), properties.effectiveRunTimeout());
        assertEquals(25, properties.effectiveRetainedRuns());

        List<PhaseDefinition> phases = properties.toPhaseDefinitions();
        assertEquals(2, phases.size());
        assertEquals(PhaseMode.SEQUENTIAL, phases.get(0).mode());
        assertEquals(List.of("build-manifest"), phases.get(0).workerIds());
        assertEquals(PhaseMode.PARALLEL, phases.get(1).mode());
        assertEquals(List.of("discovery"), phases.get(1).dependsOn());
    }

    @Test
    @DisplayName("hyphenated section ids bind to their sections")
    void sectionIds() {
        Map<String, String> values = new HashMap<>();
        String[][] table = {
            {"identity", "0.2"}, {"domain-model", "0.2"}, {"stack", "0.2"}, {"capabilities", "0.15"},
            {"conventions", "0.1"}, {"constraints", "0.1"}, {"operations", "0.05"}};
        for (String[] row : table) {
            values.put("synthesis.sections." + row[0] + ".expected-min-count", "2");
            values.put("synthesis.sections." + row[0] + ".weight", row[1]);
        }

        SynthesisConfig config = bind(values).toConfig();

        assertEquals(0.2, config.sectionPolicy(SectionName.DOMAIN_MODEL).weight());
        assertEquals(2, config.sectionPolicy(SectionName.OPERATIONS).expectedMinCount());
    }

    @Test
    @DisplayName("unknown section ids and bad weights fail fast")
    void invalid() {
        Map<String, String> unknownSection = Map.of(
            "synthesis.sections.billing.expected-min-count", "1",
            "synthesis.sections.billing.weight", "1.0");
        assertThrows(InvalidConfigurationException.class, () -> bind(unknownSection).toConfig());

        Map<String, String> badWeight = Map.of("synthesis.source-kind-weights[doc]", "1.5");
        assertThrows(InvalidConfigurationException.class, () -> bind(badWeight).toConfig());

        Map<String, String> noRetention = Map.of("synthesis.retained-runs", "0");
        assertThrows(InvalidConfigurationException.class, () -> bind(noRetention).effectiveRetainedRuns());
    }

    @Test
    @DisplayName("an empty binding yields the default tables")
    void defaults() {
        SynthesisProperties properties = new SynthesisProperties(null, null, null, null, null, null, null, null);
        SynthesisConfig config = properties.toConfig();

        assertEquals(SynthesisConfig.defaults().version(), config.version());
        assertEquals(SynthesisConfig.defaults().sourceKindWeights(), config.sourceKindWeights());
        assertEquals(Duration.ofMinutes(5), properties.effectiveRunTimeout());
        assertEquals(100, properties.effectiveRetainedRuns());
        assertTrue(properties.toPhaseDefinitions().isEmpty());
    }
}
