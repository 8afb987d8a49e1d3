package com.extractionplatform.orchestrator.service;

import com.extractionplatform.common.accumulator.AccumulatorSnapshot;
import com.extractionplatform.common.synthesis.SynthesisComponents;
import com.extractionplatform.common.synthesis.SynthesisResult;
import com.extractionplatform.orchestrator.config.SynthesisProperties;
import com.extractionplatform.orchestrator.run.RunReport;
import com.extractionplatform.orchestrator.run.RunStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");
    private static final SynthesisResult EMPTY =
        SynthesisComponents.defaults().engine().synthesize(AccumulatorSnapshot.empty());

    private static RunReport report(String runId) {
        return new RunReport(runId, "/corpus", "1.0", RunStatus.COMPLETE, false, T0, T0.plusSeconds(1),
            List.of(), AccumulatorSnapshot.empty(), EMPTY.conflicts(), EMPTY.confidence(), null);
    }

    @Test
    @DisplayName("the oldest report is evicted once the retention limit is reached")
    void evictsOldest() {
        RunRegistry registry = new RunRegistry(2);
        registry.register(report("run-1"));
        registry.register(report("run-2"));
        registry.register(report("run-3"));

        assertEquals(2, registry.size());
        assertTrue(registry.find("run-1").isEmpty());
        assertTrue(registry.find("run-2").isPresent());
        assertTrue(registry.find("run-3").isPresent());
    }

    @Test
    @DisplayName("re-registering a run refreshes its place instead of growing the registry")
    void reRegisterRefreshes() {
        RunRegistry registry = new RunRegistry(2);
        registry.register(report("run-1"));
        registry.register(report("run-2"));
        registry.register(report("run-1"));
        registry.register(report("run-3"));

        assertEquals(2, registry.size());
        assertTrue(registry.find("run-1").isPresent());
        assertTrue(registry.find("run-2").isEmpty());
    }

    @Test
    @DisplayName("the limit comes from synthesis.retained-runs")
    void limitFromProperties() {
        SynthesisProperties properties = new SynthesisProperties(null, null, null, null, null, null, 1, null);
        RunRegistry registry = new RunRegistry(properties);
        registry.register(report("run-1"));
        registry.register(report("run-2"));

        assertEquals(1, registry.size());
        assertTrue(registry.find("run-2").isPresent());
    }

    @Test
    @DisplayName("a non-positive capacity is refused")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RunRegistry(0));
    }
}
