package com.extractionplatform.common.conflict;

/**
 * Rule that discriminated a conflict, in the order they are tried.
 * {@link #NONE} means every rule tied and the conflict is unresolved.
 */
public enum ResolutionRule {
    CORROBORATION,
    CERTAINTY_CLASS,
    EVIDENCE_COUNT,
    NONE
}
