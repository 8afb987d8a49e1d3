package com.extractionplatform.common.config;

/**
 * Thresholds and multipliers for the post-hoc penalties applied to the overall score,
 * plus the per-section factor for each unresolved conflict.
 */
public record PenaltyPolicy(
    double sectionFloor,
    double weakSectionFactor,
    int    uncertaintyLimit,
    double uncertaintyFactor,
    int    conflictLimit,
    double conflictFactor,
    double unresolvedConflictSectionFactor
) {

    public static PenaltyPolicy defaults() {
        return new PenaltyPolicy(0.5, 0.9, 10, 0.95, 5, 0.9, 0.9);
    }
}
