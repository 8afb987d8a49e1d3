package com.extractionplatform.common.accumulator;

import com.extractionplatform.common.exception.ValidationException;
import com.extractionplatform.common.model.Finding;
import com.extractionplatform.common.model.FindingDraft;
import com.extractionplatform.common.model.SectionAbsence;
import com.extractionplatform.common.model.SectionName;
import com.extractionplatform.common.model.ValidationRejection;
import com.extractionplatform.common.synthesis.FindingFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, per-worker-partitioned store of Findings for one run.
 *
 * <p><strong>Write path:</strong> each worker receives a {@link FindingSink} bound to its
 * own {@link WorkerPartition}. Drafts are scored by {@link FindingFactory} on append;
 * drafts that break an evidence-model invariant are refused, logged and kept as a
 * {@link ValidationRejection}.
 *
 * <p><strong>Barrier:</strong> {@link #commit(String)} seals a partition and merges it into
 * the committed log in commit order. {@link #seal(String)} closes a partition without
 * merging; anything a worker appends afterwards is counted and dropped.
 *
 * <p><strong>Read path:</strong> {@link #snapshot()} returns only committed data, so no
 * reader ever observes another worker's in-flight state.
 */
public class FindingAccumulator {

    private static final Logger log = LoggerFactory.getLogger(FindingAccumulator.class);

    private final String runId;
    private final FindingFactory factory;
    private final Clock clock;

    private final Map<String, WorkerPartition> partitions = new ConcurrentHashMap<>();
    private final List<ValidationRejection> rejections = new CopyOnWriteArrayList<>();

    // guarded by this
    private final List<Finding> committed = new ArrayList<>();
    private final List<SectionAbsence> committedAbsences = new ArrayList<>();

    public FindingAccumulator(String runId, FindingFactory factory, Clock clock) {
        this.runId   = runId;
        this.factory = factory;
        this.clock   = clock;
    }

    /**
     * Opens the partition for {@code workerId} and returns its sink.
     *
     * @throws IllegalStateException if the worker already has a partition in this run
     */
    public FindingSink open(String workerId) {
        WorkerPartition partition = new WorkerPartition(workerId);
        if (partitions.putIfAbsent(workerId, partition) != null) {
            throw new IllegalStateException("worker '" + workerId + "' already has a partition in run " + runId);
        }
        return new PartitionSink(partition);
    }

    /** Closes a partition to further appends. Already appended findings stay. */
    public void seal(String workerId) {
        WorkerPartition partition = partitions.get(workerId);
        if (partition != null) partition.seal();
    }

    /**
     * Seals the worker's partition and merges it into the committed log. Idempotent.
     *
     * @return number of findings merged by this call
     */
    public synchronized int commit(String workerId) {
        WorkerPartition partition = partitions.get(workerId);
        if (partition == null || !partition.markCommitted()) return 0;
        List<Finding> findings = partition.findings();
        committed.addAll(findings);
        committedAbsences.addAll(partition.absences());
        return findings.size();
    }

    public synchronized AccumulatorSnapshot snapshot() {
        return new AccumulatorSnapshot(committed, committedAbsences, rejections);
    }

    /** Findings appended by one worker so far, committed or not. */
    public List<Finding> partitionFindings(String workerId) {
        WorkerPartition partition = partitions.get(workerId);
        return partition == null ? List.of() : partition.findings();
    }

    public int lateArrivals(String workerId) {
        WorkerPartition partition = partitions.get(workerId);
        return partition == null ? 0 : partition.lateArrivals();
    }

    public String runId() {
        return runId;
    }

    private void reject(String workerId, FindingDraft draft, ValidationException e) {
        SectionName section = draft != null ? draft.section() : null;
        String key = draft != null ? draft.key() : null;
        rejections.add(new ValidationRejection(workerId, section, key, e.getField(), e.getMessage(), clock.instant()));
        log.warn("Finding rejected. runId={} workerId={} section={} key={} reason={}",
                 runId, workerId, section != null ? section.id() : null, key, e.getMessage());
    }

    private final class PartitionSink implements FindingSink {

        private final WorkerPartition partition;

        private PartitionSink(WorkerPartition partition) {
            this.partition = partition;
        }

        @Override
        public boolean emit(FindingDraft draft) {
            if (partition.isSealed()) {
                partition.recordLate();
                return lateArrival();
            }
            Finding finding;
            try {
                finding = factory.create(partition.workerId(), draft);
            } catch (ValidationException e) {
                reject(partition.workerId(), draft, e);
                return false;
            }
            return partition.append(finding) || lateArrival();
        }

        @Override
        public boolean declareAbsent(SectionName section, String reason) {
            if (partition.isSealed()) {
                partition.recordLate();
                return lateArrival();
            }
            SectionAbsence absence;
            try {
                absence = new SectionAbsence(section, reason, partition.workerId());
            } catch (ValidationException e) {
                reject(partition.workerId(), null, e);
                return false;
            }
            return partition.append(absence) || lateArrival();
        }

        private boolean lateArrival() {
            log.debug("Late append ignored after barrier. runId={} workerId={}", runId, partition.workerId());
            return false;
        }
    }
}
