package com.extractionplatform.workers.worker;

import com.extractionplatform.common.exception.WorkerException;
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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Infers languages from source file extensions and the project layout from well-known
 * directories. Weak on its own; meant to corroborate manifest-based findings.
 */
@Component
public class FileExtensionWorker implements ExtractionWorker {

    private static final Logger log = LoggerFactory.getLogger(FileExtensionWorker.class);

    public static final String WORKER_ID = "file-extension";

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
        Map.entry("java",  "Java"),
        Map.entry("kt",    "Kotlin"),
        Map.entry("ts",    "TypeScript"),
        Map.entry("tsx",   "TypeScript"),
        Map.entry("js",    "JavaScript"),
        Map.entry("jsx",   "JavaScript"),
        Map.entry("mjs",   "JavaScript"),
        Map.entry("go",    "Go"),
        Map.entry("rs",    "Rust"),
        Map.entry("py",    "Python"),
        Map.entry("rb",    "Ruby"),
        Map.entry("cs",    "C#"),
        Map.entry("scala", "Scala")
    );

    /** Languages below this share of recognised source files are ignored. */
    private static final double MIN_SHARE = 0.10;

    /** Sample files cited per language. Three file_ext citations top out at inferred. */
    private static final int SAMPLES_PER_LANGUAGE = 3;

    private static final Map<String, String> LAYOUTS = Map.of(
        "src/main/java",   "maven-standard",
        "src/main/kotlin", "maven-standard",
        "cmd",             "go-cmd",
        "packages",        "monorepo-packages",
        "apps",            "monorepo-apps"
    );

    @Override
    public String workerId() { return WORKER_ID; }

    @Override
    public WorkerOutcome execute(WorkerContext ctx) {
        try {
            return scan(ctx);
        } catch (WorkerException e) {
            log.warn("[FileExtensionWorker] Scan failed runId={} reason={}", ctx.runId(), e.getMessage());
            return WorkerOutcome.error(e.getMessage());
        }
    }

    private WorkerOutcome scan(WorkerContext ctx) {
        Path root = CorpusFiles.resolveRoot(WORKER_ID, ctx.corpusReference());
        List<Path> files = CorpusFiles.listFiles(WORKER_ID, root, ctx);
        log.info("[FileExtensionWorker] Scanning runId={} files={}", ctx.runId(), files.size());

        // TreeMap keeps emission order stable across runs
        Map<String, List<Path>> byLanguage = new TreeMap<>();
        int recognised = 0;
        for (Path file : files) {
            String language = EXTENSIONS.get(extension(file));
            if (language == null) continue;
            recognised++;
            byLanguage.computeIfAbsent(language, k -> new ArrayList<>()).add(file);
        }

        for (Map.Entry<String, List<Path>> entry : byLanguage.entrySet()) {
            if (ctx.shouldStop()) break;
            double share = (double) entry.getValue().size() / recognised;
            if (share < MIN_SHARE) {
                log.debug("[FileExtensionWorker] Ignoring language={} share={}", entry.getKey(), share);
                continue;
            }
            List<Evidence> evidence = entry.getValue().stream()
                .sorted()
                .limit(SAMPLES_PER_LANGUAGE)
                .map(f -> ctx.evidence("file_ext", CorpusFiles.locator(root, f), extension(f)))
                .toList();
            ctx.sink().emit(FindingDraft.of(SectionName.STACK, "primary_language", entry.getKey(),
                FindingType.LANGUAGE, evidence));
        }

        LAYOUTS.entrySet().stream()
            .filter(e -> Files.isDirectory(root.resolve(e.getKey())))
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> ctx.sink().emit(FindingDraft.of(SectionName.CONVENTIONS, "source_layout", e.getValue(),
                FindingType.GENERIC, List.of(ctx.evidence("directory_layout", e.getKey(), e.getKey())))));

        log.info("[FileExtensionWorker] Done runId={} recognised={} languages={}",
                 ctx.runId(), recognised, byLanguage.keySet());
        return WorkerOutcome.success();
    }

    static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
