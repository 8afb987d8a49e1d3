package com.extractionplatform.common.certainty;

import com.extractionplatform.common.model.Evidence;

import java.util.Comparator;

/**
 * Canonical evidence ordering for order-independent floating-point sums.
 */
public final class EvidenceOrdering {

    public static final Comparator<Evidence> CANONICAL = Comparator
        .<Evidence>comparingDouble(Evidence::weight).reversed()
        .thenComparing(Evidence::sourceKind)
        .thenComparing(Evidence::locator);

    private EvidenceOrdering() {}
}
