package com.extractionplatform.orchestrator.service;

import com.extractionplatform.orchestrator.config.SynthesisProperties;
import com.extractionplatform.orchestrator.run.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory store of finalized run reports. Runs never share state, so this is the only
 * cross-run structure and it holds immutable reports only.
 *
 * <p>Bounded by {@code synthesis.retained-runs}: once full, registering a new report
 * evicts the oldest one.
 */
@Component
public class RunRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunRegistry.class);

    private final int capacity;

    // guarded by this, insertion order
    private final Map<String, RunReport> reports = new LinkedHashMap<>();

    @Autowired
    public RunRegistry(SynthesisProperties properties) {
        this(properties.effectiveRetainedRuns());
    }

    public RunRegistry(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0 but was " + capacity);
        this.capacity = capacity;
    }

    public synchronized void register(RunReport report) {
        reports.remove(report.runId());
        reports.put(report.runId(), report);
        Iterator<String> oldest = reports.keySet().iterator();
        while (reports.size() > capacity) {
            String evicted = oldest.next();
            oldest.remove();
            log.debug("Run report evicted. runId={} retained={}", evicted, capacity);
        }
    }

    public synchronized Optional<RunReport> find(String runId) {
        return Optional.ofNullable(reports.get(runId));
    }

    public synchronized int size() {
        return reports.size();
    }
}
