package com.extractionplatform.common.certainty;

import com.extractionplatform.common.model.CertaintyClass;

/**
 * Output of {@link CertaintyClassifier}.
 *
 * <ul>
 *   <li>{@code certaintyClass} — band of {@code score}</li>
 *   <li>{@code score}          — {@code min(rawWeight / maxPossible, 1.0)}</li>
 *   <li>{@code rawWeight}      — deduped weight sum, capped at {@code maxPossible}</li>
 *   <li>{@code maxPossible}    — constant for the finding type</li>
 * </ul>
 */
public record CertaintyAssessment(
    CertaintyClass certaintyClass,
    double         score,
    double         rawWeight,
    double         maxPossible
) {

    public static CertaintyAssessment unknown(double maxPossible) {
        return new CertaintyAssessment(CertaintyClass.UNKNOWN, 0.0, 0.0, maxPossible);
    }
}
