package com.extractionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse confidence band derived from normalized evidence mass.
 *
 * <pre>
 *   CERTAIN    [0.95, 1.00]
 *   INFERRED   [0.80, 0.95)
 *   SPECULATED [0.60, 0.80)
 *   UNKNOWN    [0.00, 0.60)
 * </pre>
 */
public enum CertaintyClass {
    CERTAIN(0.95, 3),
    INFERRED(0.80, 2),
    SPECULATED(0.60, 1),
    UNKNOWN(0.0, 0);

    /** Absorbs floating-point drift in weight sums landing exactly on a band boundary. */
    private static final double BOUNDARY_TOLERANCE = 1e-9;

    private final double lowerBound;
    private final int rank;

    CertaintyClass(double lowerBound, int rank) {
        this.lowerBound = lowerBound;
        this.rank = rank;
    }

    /** Higher rank means stronger certainty. */
    public int rank() {
        return rank;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Band lookup for a normalized score. Values outside [0, 1] are clamped first.
     */
    public static CertaintyClass forScore(double normalized) {
        double score = Math.max(0.0, Math.min(1.0, normalized));
        for (CertaintyClass c : values()) {
            if (score + BOUNDARY_TOLERANCE >= c.lowerBound) return c;
        }
        return UNKNOWN;
    }
}
