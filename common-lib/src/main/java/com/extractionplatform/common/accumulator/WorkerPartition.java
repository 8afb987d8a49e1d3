package com.extractionplatform.common.accumulator;

import com.extractionplatform.common.model.Finding;
import com.extractionplatform.common.model.SectionAbsence;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only log owned by one worker. Written by that worker's thread, read by the
 * orchestrator once sealed. All access is synchronized on the partition itself so the
 * only contention is between a worker and the barrier that closes it.
 */
final class WorkerPartition {

    private final String workerId;
    private final List<Finding> findings = new ArrayList<>();
    private final List<SectionAbsence> absences = new ArrayList<>();
    private boolean sealed;
    private boolean committed;
    private int lateArrivals;

    WorkerPartition(String workerId) {
        this.workerId = workerId;
    }

    String workerId() {
        return workerId;
    }

    synchronized boolean append(Finding finding) {
        if (sealed) {
            lateArrivals++;
            return false;
        }
        findings.add(finding);
        return true;
    }

    synchronized boolean append(SectionAbsence absence) {
        if (sealed) {
            lateArrivals++;
            return false;
        }
        absences.add(absence);
        return true;
    }

    synchronized void recordLate() {
        lateArrivals++;
    }

    synchronized boolean isSealed() {
        return sealed;
    }

    synchronized void seal() {
        sealed = true;
    }

    /** Seals and marks committed; returns false if it was already committed. */
    synchronized boolean markCommitted() {
        sealed = true;
        if (committed) return false;
        committed = true;
        return true;
    }

    synchronized List<Finding> findings() {
        return List.copyOf(findings);
    }

    synchronized List<SectionAbsence> absences() {
        return List.copyOf(absences);
    }

    synchronized int lateArrivals() {
        return lateArrivals;
    }
}
