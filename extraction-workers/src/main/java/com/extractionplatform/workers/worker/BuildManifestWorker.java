package com.extractionplatform.workers.worker;

import com.extractionplatform.common.exception.WorkerException;
import com.extractionplatform.common.accumulator.FindingSink;
import com.extractionplatform.common.model.Evidence;
import com.extractionplatform.common.model.FindingDraft;
import com.extractionplatform.common.model.FindingType;
import com.extractionplatform.common.model.SectionName;
import com.extractionplatform.common.worker.ExtractionWorker;
import com.extractionplatform.common.worker.WorkerContext;
import com.extractionplatform.common.worker.WorkerOutcome;
import com.extractionplatform.workers.corpus.CorpusFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads build manifests at the corpus root and reports the declared language, build tool,
 * frameworks and project name. Every claim cites the manifest line it came from.
 */
@Component
public class BuildManifestWorker implements ExtractionWorker {

    private static final Logger log = LoggerFactory.getLogger(BuildManifestWorker.class);

    public static final String WORKER_ID = "build-manifest";

    /** Manifest file → (language, build tool). */
    private static final Map<String, String[]> MANIFESTS = new LinkedHashMap<>();
    static {
        MANIFESTS.put("pom.xml",          new String[] {"Java",       "maven"});
        MANIFESTS.put("build.gradle.kts", new String[] {"Kotlin",     "gradle"});
        MANIFESTS.put("build.gradle",     new String[] {"Java",       "gradle"});
        MANIFESTS.put("tsconfig.json",    new String[] {"TypeScript", "npm"});
        MANIFESTS.put("package.json",     new String[] {"JavaScript", "npm"});
        MANIFESTS.put("go.mod",           new String[] {"Go",         "go"});
        MANIFESTS.put("Cargo.toml",       new String[] {"Rust",       "cargo"});
        MANIFESTS.put("pyproject.toml",   new String[] {"Python",     "pip"});
    }

    /** Dependency marker → framework display name. */
    private static final Map<String, String> FRAMEWORK_MARKERS = new LinkedHashMap<>();
    static {
        FRAMEWORK_MARKERS.put("spring-boot", "Spring Boot");
        FRAMEWORK_MARKERS.put("quarkus",     "Quarkus");
        FRAMEWORK_MARKERS.put("micronaut",   "Micronaut");
        FRAMEWORK_MARKERS.put("\"react\"",   "React");
        FRAMEWORK_MARKERS.put("\"express\"", "Express");
        FRAMEWORK_MARKERS.put("\"next\"",    "Next.js");
        FRAMEWORK_MARKERS.put("django",      "Django");
        FRAMEWORK_MARKERS.put("fastapi",     "FastAPI");
        FRAMEWORK_MARKERS.put("gin-gonic",   "Gin");
        FRAMEWORK_MARKERS.put("actix-web",   "Actix");
    }

    private static final Pattern POM_ARTIFACT = Pattern.compile("<artifactId>([^<]+)</artifactId>");
    private static final Pattern JSON_NAME    = Pattern.compile("\"name\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern TOML_NAME    = Pattern.compile("(?m)^name\\s*=\\s*\"([^\"]+)\"");
    private static final Pattern GO_MODULE    = Pattern.compile("(?m)^module\\s+(\\S+)");

    @Override
    public String workerId() { return WORKER_ID; }

    @Override
    public WorkerOutcome execute(WorkerContext ctx) {
        try {
            return scan(ctx);
        } catch (WorkerException e) {
            log.warn("[BuildManifestWorker] Scan failed runId={} reason={}", ctx.runId(), e.getMessage());
            return WorkerOutcome.error(e.getMessage());
        }
    }

    private WorkerOutcome scan(WorkerContext ctx) {
        Path root = CorpusFiles.resolveRoot(WORKER_ID, ctx.corpusReference());
        FindingSink sink = ctx.sink();
        log.info("[BuildManifestWorker] Scanning manifests runId={} root={}", ctx.runId(), root);

        Map<String, List<Evidence>> languageEvidence = new LinkedHashMap<>();
        int manifests = 0;
        for (Map.Entry<String, String[]> entry : MANIFESTS.entrySet()) {
            if (ctx.shouldStop()) break;
            Path file = root.resolve(entry.getKey());
            if (!Files.isRegularFile(file)) continue;
            Optional<String> text = CorpusFiles.read(file);
            if (text.isEmpty()) continue;
            manifests++;

            String language = entry.getValue()[0];
            String locator = CorpusFiles.locator(root, file);
            languageEvidence.computeIfAbsent(language, k -> new ArrayList<>())
                .add(ctx.evidence("config_file", locator, entry.getKey()));

            sink.emit(FindingDraft.of(SectionName.STACK, "build_tool", entry.getValue()[1], FindingType.GENERIC,
                List.of(ctx.evidence("config_file", locator, entry.getKey()))));

            emitFrameworks(ctx, root, file, text.get());
            emitProjectName(ctx, root, file, text.get());
        }

        if (languageEvidence.containsKey("JavaScript") && languageEvidence.containsKey("TypeScript")) {
            // a tsconfig next to package.json makes it a TypeScript project
            languageEvidence.get("TypeScript").addAll(languageEvidence.remove("JavaScript"));
        }
        languageEvidence.forEach((language, evidence) ->
            sink.emit(FindingDraft.of(SectionName.STACK, "primary_language", language, FindingType.LANGUAGE, evidence)));

        log.info("[BuildManifestWorker] Done runId={} manifests={} languages={}",
                 ctx.runId(), manifests, languageEvidence.keySet());
        return WorkerOutcome.success();
    }

    private void emitFrameworks(WorkerContext ctx, Path root, Path file, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> marker : FRAMEWORK_MARKERS.entrySet()) {
            int line = CorpusFiles.lineOf(lower, marker.getKey());
            if (line == 0) continue;
            String name = marker.getValue();
            ctx.sink().emit(FindingDraft.of(SectionName.STACK, "framework." + slug(name), name, FindingType.FRAMEWORK,
                List.of(ctx.evidence("dependency", CorpusFiles.locator(root, file, line), marker.getKey()))));
        }
    }

    private void emitProjectName(WorkerContext ctx, Path root, Path file, String text) {
        String fileName = file.getFileName().toString();
        Pattern pattern = switch (fileName) {
            case "pom.xml"                         -> POM_ARTIFACT;
            case "package.json"                    -> JSON_NAME;
            case "Cargo.toml", "pyproject.toml"    -> TOML_NAME;
            case "go.mod"                          -> GO_MODULE;
            default                                -> null;
        };
        if (pattern == null) return;

        // the parent block's artifactId is not the project's own
        String body = pattern == POM_ARTIFACT ? text.replaceAll("(?s)<parent>.*?</parent>", "") : text;
        Matcher m = pattern.matcher(body);
        if (!m.find()) return;
        String name = m.group(1).trim();
        int line = CorpusFiles.lineOf(text, m.group(0));
        ctx.sink().emit(FindingDraft.of(SectionName.IDENTITY, "name", name, FindingType.GENERIC,
            List.of(ctx.evidence("explicit_declaration", CorpusFiles.locator(root, file, line), m.group(0)))));
    }

    private static String slug(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    }
}
