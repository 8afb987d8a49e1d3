package com.extractionplatform.orchestrator.controller;

import com.extractionplatform.orchestrator.render.ReportRenderer;
import com.extractionplatform.orchestrator.run.RunReport;
import com.extractionplatform.orchestrator.run.RunRequest;
import com.extractionplatform.orchestrator.service.RunOrchestrator;
import com.extractionplatform.orchestrator.service.RunRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunOrchestrator orchestrator;
    private final RunRegistry     registry;
    private final ReportRenderer  renderer;

    public RunController(RunOrchestrator orchestrator, RunRegistry registry, ReportRenderer renderer) {
        this.orchestrator = orchestrator;
        this.registry     = registry;
        this.renderer     = renderer;
    }

    @PostMapping
    public Mono<ResponseEntity<RunReport>> start(@RequestBody RunRequest request) {
        log.info("Run requested. corpus={}", request.corpusReference());
        return orchestrator.execute(request)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Run endpoint error. corpus={}", request.corpusReference(), e));
    }

    @GetMapping("/{runId}")
    public Mono<ResponseEntity<RunReport>> get(@PathVariable String runId) {
        return Mono.justOrEmpty(registry.find(runId))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{runId}/rendered")
    public Mono<ResponseEntity<String>> rendered(@PathVariable String runId) {
        return Mono.justOrEmpty(registry.find(runId))
            .map(report -> ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(renderer.mediaType()))
                .body(renderer.render(report)))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
