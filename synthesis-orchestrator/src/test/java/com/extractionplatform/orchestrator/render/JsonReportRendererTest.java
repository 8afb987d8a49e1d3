package com.extractionplatform.orchestrator.render;

import com.extractionplatform.common.accumulator.AccumulatorSnapshot;
import com.extractionplatform.common.synthesis.SynthesisComponents;
import com.extractionplatform.common.synthesis.SynthesisResult;
import com.extractionplatform.common.worker.WorkerStatus;
import com.extractionplatform.orchestrator.config.OrchestratorConfig;
import com.extractionplatform.orchestrator.phase.PhaseMode;
import com.extractionplatform.orchestrator.phase.PhaseStatus;
import com.extractionplatform.orchestrator.run.PhaseReport;
import com.extractionplatform.orchestrator.run.RunReport;
import com.extractionplatform.orchestrator.run.RunStatus;
import com.extractionplatform.orchestrator.run.WorkerReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportRendererTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    private final ObjectMapper mapper = new OrchestratorConfig().objectMapper();
    private final JsonReportRenderer renderer = new JsonReportRenderer(mapper);

    private static RunReport report() {
        SynthesisResult result = SynthesisComponents.defaults().engine().synthesize(AccumulatorSnapshot.empty());
        PhaseReport discovery = new PhaseReport("discovery", PhaseMode.PARALLEL, PhaseStatus.PARTIAL,
            List.of(new WorkerReport("readme-identity", WorkerStatus.TIMED_OUT, "deadline exceeded after 50ms", 0, 1, 50)),
            0, 0.0, T0, T0.plusSeconds(1));
        return new RunReport("run-42", "/corpus", "1.0", RunStatus.COMPLETE, true, T0, T0.plusSeconds(2),
            List.of(discovery, PhaseReport.skipped("enrichment", PhaseMode.SEQUENTIAL)),
            AccumulatorSnapshot.empty(), result.conflicts(), result.confidence(), null);
    }

    @Test
    @DisplayName("renders lower-case statuses and ISO timestamps")
    void rendersJson() throws Exception {
        String json = renderer.render(report());
        JsonNode root = mapper.readTree(json);

        assertEquals("run-42", root.get("runId").asText());
        assertEquals("complete", root.get("status").asText());
        assertTrue(root.get("truncated").asBoolean());
        assertEquals("2026-01-15T10:00:00Z", root.get("startedAt").asText());
        assertEquals(0.0, root.get("overallConfidence").asDouble());

        JsonNode phases = root.get("phases");
        assertEquals("partial", phases.get(0).get("status").asText());
        assertEquals("timed_out", phases.get(0).get("workers").get(0).get("status").asText());
        assertEquals(1, phases.get(0).get("workers").get(0).get("lateArrivals").asInt());
        assertEquals("skipped", phases.get(1).get("status").asText());
        assertFalse(phases.get(1).has("overallAfterBarrier"), "nulls are left out");
        assertFalse(root.has("failureDetail"));
    }

    @Test
    @DisplayName("renders section scores and penalties for auditing")
    void rendersConfidence() throws Exception {
        JsonNode confidence = mapper.readTree(renderer.render(report())).get("confidence");

        assertNotNull(confidence.get("sections"));
        assertNotNull(confidence.get("penalties"));
        assertTrue(renderer.mediaType().contains("json"));
    }
}
