package com.extractionplatform.common.conflict;

import com.extractionplatform.common.model.Finding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Detects Findings that collide on {@code (section, key)} with differing values and
 * applies a deterministic resolution policy.
 *
 * <h3>Resolution order</h3>
 * <ol>
 *   <li>strictly higher {@code corroborationScore}</li>
 *   <li>higher {@code certaintyClass} (certain &gt; inferred &gt; speculated &gt; unknown)</li>
 *   <li>more evidence items</li>
 *   <li>otherwise UNRESOLVED; arrival order is never consulted</li>
 * </ol>
 *
 * <p>The rules compare the strongest Finding of the leading value against the strongest
 * Finding of any other value. Findings agreeing on a value never conflict with each other.
 *
 * <p>Output depends only on the set of Findings, not on their order, so re-resolving an
 * unchanged set yields the same statuses and winners. Stateless and thread-safe.
 */
public class ConflictResolver {

    /** Corroboration is compared on a 1e-9 grid so float noise cannot decide a conflict. */
    private static final double SCORE_GRID = 1e9;

    static final Comparator<Finding> CANONICAL = Comparator
        .comparing(Finding::workerId)
        .thenComparing(Finding::createdAt)
        .thenComparing(Finding::id);

    private static final Comparator<Finding> STRENGTH = Comparator
        .<Finding>comparingLong(ConflictResolver::corroborationKey).reversed()
        .thenComparing(Comparator.comparingInt((Finding f) -> f.certaintyClass().rank()).reversed())
        .thenComparing(Comparator.comparingInt(Finding::evidenceCount).reversed())
        .thenComparing(CANONICAL);

    private static final Comparator<Finding.BucketKey> BUCKET_ORDER = Comparator
        .comparing(Finding.BucketKey::section)
        .thenComparing(Finding.BucketKey::key);

    public ConflictReport resolve(Collection<Finding> findings) {
        if (findings == null || findings.isEmpty()) return ConflictReport.empty();

        Map<Finding.BucketKey, List<Finding>> buckets = new TreeMap<>(BUCKET_ORDER);
        for (Finding f : findings) {
            buckets.computeIfAbsent(f.bucket(), k -> new ArrayList<>()).add(f);
        }

        List<Conflict> conflicts = new ArrayList<>();
        Map<Finding.BucketKey, BucketState> states = new LinkedHashMap<>();
        for (Map.Entry<Finding.BucketKey, List<Finding>> entry : buckets.entrySet()) {
            List<Finding> bucket = entry.getValue();
            if (bucket.stream().map(Finding::value).distinct().count() < 2) {
                states.put(entry.getKey(), BucketState.OPEN);
                continue;
            }
            Conflict conflict = resolveBucket(entry.getKey(), bucket);
            conflicts.add(conflict);
            states.put(entry.getKey(),
                conflict.isResolved() ? BucketState.RESOLVED : BucketState.UNRESOLVED);
        }
        return new ConflictReport(conflicts, states);
    }

    private Conflict resolveBucket(Finding.BucketKey key, List<Finding> bucket) {
        List<Finding> competing = bucket.stream().sorted(CANONICAL).toList();
        List<Finding> ranked = bucket.stream().sorted(STRENGTH).toList();

        Finding leader = ranked.get(0);
        Finding rival = ranked.stream()
            .filter(f -> !Objects.equals(f.value(), leader.value()))
            .findFirst()
            .orElseThrow();

        ResolutionRule rule = discriminate(leader, rival);
        if (rule == ResolutionRule.NONE) {
            return new Conflict(key.section(), key.key(), competing, null, ConflictStatus.UNRESOLVED, rule);
        }
        return new Conflict(key.section(), key.key(), competing, leader, ConflictStatus.RESOLVED, rule);
    }

    private ResolutionRule discriminate(Finding leader, Finding rival) {
        if (corroborationKey(leader) != corroborationKey(rival)) return ResolutionRule.CORROBORATION;
        if (leader.certaintyClass().rank() != rival.certaintyClass().rank()) return ResolutionRule.CERTAINTY_CLASS;
        if (leader.evidenceCount() != rival.evidenceCount()) return ResolutionRule.EVIDENCE_COUNT;
        return ResolutionRule.NONE;
    }

    private static long corroborationKey(Finding f) {
        return Math.round(f.corroborationScore() * SCORE_GRID);
    }
}
