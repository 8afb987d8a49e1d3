package com.extractionplatform.workers.worker;

import com.extractionplatform.common.exception.WorkerException;
import com.extractionplatform.common.model.Evidence;
import com.extractionplatform.common.model.Finding;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detects datastores from driver dependencies. Runs after the discovery phase and only
 * looks at manifests that earlier workers already cited, so it depends on the committed
 * snapshot rather than walking the corpus again.
 */
@Component
public class DatastoreWorker implements ExtractionWorker {

    private static final Logger log = LoggerFactory.getLogger(DatastoreWorker.class);

    public static final String WORKER_ID = "datastore";

    static final String NO_DATABASE = "no database detected";

    /** Driver marker (lower-case) → datastore name. First match per datastore wins. */
    private static final Map<String, String> DRIVERS = new LinkedHashMap<>();
    static {
        DRIVERS.put("postgresql",       "postgresql");
        DRIVERS.put("\"pg\"",           "postgresql");
        DRIVERS.put("psycopg",          "postgresql");
        DRIVERS.put("mysql",            "mysql");
        DRIVERS.put("mariadb",          "mariadb");
        DRIVERS.put("mongodb",          "mongodb");
        DRIVERS.put("mongoose",         "mongodb");
        DRIVERS.put("redis",            "redis");
        DRIVERS.put("jedis",            "redis");
        DRIVERS.put("lettuce",          "redis");
        DRIVERS.put("cassandra",        "cassandra");
        DRIVERS.put("sqlite",           "sqlite");
        DRIVERS.put("com.h2database",   "h2");
        DRIVERS.put("elasticsearch",    "elasticsearch");
    }

    @Override
    public String workerId() { return WORKER_ID; }

    @Override
    public WorkerOutcome execute(WorkerContext ctx) {
        try {
            return scan(ctx);
        } catch (WorkerException e) {
            log.warn("[DatastoreWorker] Scan failed runId={} reason={}", ctx.runId(), e.getMessage());
            return WorkerOutcome.error(e.getMessage());
        }
    }

    private WorkerOutcome scan(WorkerContext ctx) {
        Path root = CorpusFiles.resolveRoot(WORKER_ID, ctx.corpusReference());
        Set<String> manifests = citedManifests(ctx);
        log.info("[DatastoreWorker] Checking runId={} manifests={}", ctx.runId(), manifests);

        Map<String, Evidence> detected = new LinkedHashMap<>();
        for (String manifest : manifests) {
            if (ctx.shouldStop()) break;
            Path file = root.resolve(manifest).normalize();
            if (!file.startsWith(root) || !Files.isRegularFile(file)) continue;
            Optional<String> text = CorpusFiles.read(file);
            if (text.isEmpty()) continue;

            String lower = text.get().toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> driver : DRIVERS.entrySet()) {
                if (detected.containsKey(driver.getValue())) continue;
                int line = CorpusFiles.lineOf(lower, driver.getKey());
                if (line == 0) continue;
                detected.put(driver.getValue(),
                    ctx.evidence("dependency", CorpusFiles.locator(root, file, line), driver.getKey()));
            }
        }

        if (detected.isEmpty()) {
            ctx.sink().declareAbsent(SectionName.OPERATIONS, NO_DATABASE);
        } else {
            detected.forEach((name, evidence) ->
                ctx.sink().emit(FindingDraft.of(SectionName.OPERATIONS, "datastore." + name, name,
                    FindingType.GENERIC, List.of(evidence))));
        }

        log.info("[DatastoreWorker] Done runId={} datastores={}", ctx.runId(), detected.keySet());
        return WorkerOutcome.success();
    }

    /** Files cited as config_file or dependency evidence by earlier workers, without line anchors. */
    private static Set<String> citedManifests(WorkerContext ctx) {
        Set<String> out = new TreeSet<>();
        for (Finding finding : ctx.priorSnapshot().findings()) {
            for (Evidence evidence : finding.evidence()) {
                String kind = evidence.sourceKind();
                if (!"config_file".equals(kind) && !"dependency".equals(kind)) continue;
                String locator = evidence.locator();
                int anchor = locator.indexOf('#');
                out.add(anchor < 0 ? locator : locator.substring(0, anchor));
            }
        }
        return out;
    }
}
