package com.extractionplatform.common.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure helpers over evidence collections. Stateless and thread-safe.
 */
public final class EvidenceSets {

    private EvidenceSets() {}

    /**
     * Collapses entries sharing {@code (sourceKind, locator)} into one, keeping the highest
     * weight. The surviving entry takes the position of the first occurrence; on equal
     * weights the first occurrence wins.
     *
     * @param evidence may be null or empty
     * @return a new immutable list, never null
     */
    public static List<Evidence> dedupe(Collection<Evidence> evidence) {
        if (evidence == null || evidence.isEmpty()) return List.of();

        Map<Evidence.EvidenceKey, Evidence> byKey = new LinkedHashMap<>();
        for (Evidence e : evidence) {
            if (e == null) continue;
            byKey.merge(e.key(), e, (kept, candidate) ->
                candidate.weight() > kept.weight() ? candidate : kept);
        }
        return List.copyOf(new ArrayList<>(byKey.values()));
    }
}
