package com.extractionplatform.orchestrator.controller;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RunControllerTest {

    @TempDir
    static Path corpus;

    @Autowired
    private WebTestClient client;

    @BeforeAll
    static void writeCorpus() throws IOException {
        Files.writeString(corpus.resolve("pom.xml"), String.join("\n",
            "<project>",
            "  <artifactId>ledger</artifactId>",
            "  <dependency><artifactId>spring-boot-starter-web</artifactId></dependency>",
            "  <dependency><artifactId>postgresql</artifactId></dependency>",
            "</project>"));
        Files.writeString(corpus.resolve("README.md"), "# Ledger\n\nDouble-entry bookkeeping service.\n");
        Path src = corpus.resolve("src/main/java/ledger");
        Files.createDirectories(src);
        for (int i = 0; i < 4; i++) Files.writeString(src.resolve("Entry" + i + ".java"), "class Entry" + i + " {}");
    }

    private WebTestClient patient() {
        return client.mutate().responseTimeout(Duration.ofSeconds(30)).build();
    }

    @Test
    @DisplayName("a run over a directory completes and can be fetched again")
    void runAndFetch() {
        byte[] body = patient().post().uri("/api/v1/runs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("corpusReference", corpus.toString()))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("complete")
            .jsonPath("$.phases[0].name").isEqualTo("discovery")
            .jsonPath("$.phases[0].status").isEqualTo("complete")
            .jsonPath("$.phases[1].name").isEqualTo("enrichment")
            .jsonPath("$.accumulator.findings[?(@.key == 'datastore.postgresql')]").exists()
            .jsonPath("$.overallConfidence").isNumber()
            .returnResult()
            .getResponseBody();

        assertNotNull(body);
        String json = new String(body);
        String runId = json.replaceAll("(?s).*\"runId\"\\s*:\\s*\"([^\"]+)\".*", "$1");

        client.get().uri("/api/v1/runs/{id}", runId)
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.runId").isEqualTo(runId);

        client.get().uri("/api/v1/runs/{id}/rendered", runId)
            .exchange()
            .expectStatus().isOk()
            .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON);
    }

    @Test
    @DisplayName("an unreadable corpus still completes with every worker in error")
    void missingCorpus() {
        patient().post().uri("/api/v1/runs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("corpusReference", corpus.resolve("nope").toString()))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("complete")
            .jsonPath("$.phases[0].status").isEqualTo("partial")
            .jsonPath("$.phases[0].workers[0].status").isEqualTo("error");
    }

    @Test
    @DisplayName("unknown run ids are 404")
    void unknownRun() {
        client.get().uri("/api/v1/runs/{id}", "does-not-exist").exchange().expectStatus().isNotFound();
        client.get().uri("/api/v1/runs/{id}/rendered", "does-not-exist").exchange().expectStatus().isNotFound();
    }

    @Test
    @DisplayName("a blank corpus reference is a bad request")
    void blankCorpus() {
        client.post().uri("/api/v1/runs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("corpusReference", ""))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody().jsonPath("$.field").isEqualTo("corpusReference");
    }

    @Test
    @DisplayName("health")
    void health() {
        client.get().uri("/api/v1/runs/health").exchange().expectStatus().isOk();
    }
}
