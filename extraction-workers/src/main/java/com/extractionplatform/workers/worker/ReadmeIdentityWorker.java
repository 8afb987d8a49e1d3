package com.extractionplatform.workers.worker;

import com.extractionplatform.common.exception.WorkerException;
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
import java.util.List;
import java.util.Optional;

/**
 * Takes the project name and purpose from the README. Without a README the purpose is
 * reported as unknown instead of guessed.
 */
@Component
public class ReadmeIdentityWorker implements ExtractionWorker {

    private static final Logger log = LoggerFactory.getLogger(ReadmeIdentityWorker.class);

    public static final String WORKER_ID = "readme-identity";

    private static final List<String> CANDIDATES = List.of("README.md", "README.rst", "README.txt", "README");

    private static final int MAX_PURPOSE_LENGTH = 280;

    @Override
    public String workerId() { return WORKER_ID; }

    @Override
    public WorkerOutcome execute(WorkerContext ctx) {
        try {
            return scan(ctx);
        } catch (WorkerException e) {
            log.warn("[ReadmeIdentityWorker] Scan failed runId={} reason={}", ctx.runId(), e.getMessage());
            return WorkerOutcome.error(e.getMessage());
        }
    }

    private WorkerOutcome scan(WorkerContext ctx) {
        Path root = CorpusFiles.resolveRoot(WORKER_ID, ctx.corpusReference());

        Optional<Path> readme = CANDIDATES.stream()
            .map(root::resolve)
            .filter(Files::isRegularFile)
            .findFirst();
        if (readme.isEmpty()) {
            log.info("[ReadmeIdentityWorker] No README runId={}", ctx.runId());
            ctx.sink().emit(FindingDraft.unknown(SectionName.IDENTITY, "purpose", "unknown", FindingType.GENERIC));
            return WorkerOutcome.success();
        }

        Path file = readme.get();
        String text = CorpusFiles.read(file).orElse("");
        String locator = CorpusFiles.locator(root, file);
        String[] lines = text.split("\\R", -1);

        String title = null;
        int titleLine = 0;
        StringBuilder purpose = new StringBuilder();
        int purposeLine = 0;
        for (int i = 0; i < lines.length && !ctx.shouldStop(); i++) {
            String line = lines[i].trim();
            if (title == null && line.startsWith("# ")) {
                title = line.substring(2).trim();
                titleLine = i + 1;
                continue;
            }
            if (line.isEmpty()) {
                if (purpose.length() > 0) break;
                continue;
            }
            // badges, headings, html and code fences are not prose
            if (line.startsWith("#") || line.startsWith("[!") || line.startsWith("<") || line.startsWith("```")
                    || line.startsWith("=") || line.startsWith("-")) {
                if (purpose.length() > 0) break;
                continue;
            }
            if (purposeLine == 0) purposeLine = i + 1;
            if (purpose.length() > 0) purpose.append(' ');
            purpose.append(line);
        }

        if (title != null && !title.isBlank()) {
            ctx.sink().emit(FindingDraft.of(SectionName.IDENTITY, "name", title, FindingType.GENERIC,
                List.of(ctx.evidence("doc", CorpusFiles.locator(root, file, titleLine), lines[titleLine - 1].trim()))));
        }

        if (purpose.length() > 0) {
            String summary = truncate(purpose.toString());
            ctx.sink().emit(FindingDraft.of(SectionName.IDENTITY, "purpose", summary, FindingType.GENERIC,
                List.of(ctx.evidence("doc", CorpusFiles.locator(root, file, purposeLine), summary))));
        } else {
            ctx.sink().emit(FindingDraft.unknown(SectionName.IDENTITY, "purpose", "unknown", FindingType.GENERIC));
        }

        log.info("[ReadmeIdentityWorker] Done runId={} readme={} title={}", ctx.runId(), locator, title);
        return WorkerOutcome.success();
    }

    private static String truncate(String text) {
        return text.length() <= MAX_PURPOSE_LENGTH ? text : text.substring(0, MAX_PURPOSE_LENGTH - 3) + "...";
    }
}
